package com.quichat.terminal;

import com.quichat.latency.ProbeTracker;
import com.quichat.messaging.EnvelopeCodec;
import com.quichat.messaging.model.Envelope;
import com.quichat.messaging.model.LocalIdentity;
import com.quichat.p2p.PubSubTopic;
import com.quichat.session.CancellationToken;
import com.quichat.session.SenderLoop;
import org.jline.terminal.TerminalBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Drives {@link ConsoleTerminal} through a JLine terminal attached to piped streams, so
 * keystrokes (Ctrl+C included) go through the same line discipline as on a real console.
 */
class ConsoleTerminalTest {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleTerminalTest.class);
    private static final byte CTRL_C = 3;

    private PipedOutputStream keyboard;
    private ByteArrayOutputStream screen;
    private ConsoleTerminal terminal;
    private ExecutorService executor;

    @BeforeEach
    void setUp() throws IOException {
        keyboard = new PipedOutputStream();
        PipedInputStream in = new PipedInputStream(keyboard);
        screen = new ByteArrayOutputStream();
        terminal = new ConsoleTerminal(TerminalBuilder.builder()
                .system(false)
                .type("xterm")
                .encoding(StandardCharsets.UTF_8)
                .streams(in, screen)
                .build());
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() throws IOException {
        executor.shutdownNow();
        terminal.close();
        keyboard.close();
    }

    @Test
    void testReadLine_ReturnsTypedLine() throws Exception {
        Future<String> read = executor.submit(terminal::readLine);
        awaitReading();

        type("hello there\n");

        assertEquals("hello there", read.get(5, TimeUnit.SECONDS));
        assertTrue(screen.toString(StandardCharsets.UTF_8).contains(Terminal.DEFAULT_PROMPT));
    }

    @Test
    void testCtrlC_ThrowsUserInterrupt() throws Exception {
        Future<String> read = executor.submit(terminal::readLine);
        awaitReading();

        type("half typed");
        keyboard.write(CTRL_C);
        keyboard.flush();

        Exception e = assertThrows(Exception.class, () -> read.get(5, TimeUnit.SECONDS));
        assertInstanceOf(UserInterruptException.class, e.getCause());
    }

    @Test
    void testCtrlC_SenderLoopPromptsAgainAndKeepsGoing() throws Exception {
        PubSubTopic topic = mock(PubSubTopic.class);
        CancellationToken token = new CancellationToken();
        EnvelopeCodec codec = new EnvelopeCodec();
        SenderLoop sender = new SenderLoop(terminal, new TerminalPrinter(terminal, ZoneOffset.UTC), topic, codec,
                new ProbeTracker(Duration.ZERO), new LocalIdentity("alice", "sid-alice"), Clock.systemUTC(), token);
        Future<Void> running = executor.submit(sender);
        awaitReading();

        type("discard me");
        keyboard.write(CTRL_C);
        keyboard.flush();
        awaitReading();
        type("kept\n");

        ArgumentCaptor<byte[]> published = ArgumentCaptor.forClass(byte[].class);
        verify(topic, timeout(5000)).publish(published.capture());
        Envelope chat = codec.decode(published.getValue()).orElseThrow();
        assertEquals("kept", chat.getText());
        assertFalse(running.isDone());
        assertFalse(token.isCancelled());

        awaitReading();
        type("/quit\n");

        assertNull(running.get(5, TimeUnit.SECONDS));
        assertTrue(token.isCancelled());
        verify(topic, times(1)).publish(any());
    }

    @Test
    void testPrintAbove_WritesBlock() throws Exception {
        terminal.printAbove("*** bob joined the chat ***");

        assertTrue(screen.toString(StandardCharsets.UTF_8).contains("*** bob joined the chat ***"));
    }

    @Test
    void testReadLine_AfterCloseIsEndOfInput() {
        terminal.close();

        assertThrows(EndOfInputException.class, terminal::readLine);
    }

    private void type(String keys) throws IOException {
        keyboard.write(keys.getBytes(StandardCharsets.UTF_8));
        keyboard.flush();
    }

    /**
     * Waits for a read to be in progress so that keystrokes reach the line reader.
     */
    private void awaitReading() throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!terminal.isReading()) {
            if (System.nanoTime() > deadline) {
                fail("Terminal never started reading");
            }
            Thread.sleep(10);
        }
        logger.debug("Terminal is reading.");
    }
}
