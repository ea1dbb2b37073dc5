package com.quichat.session;

import com.quichat.latency.ProbeTracker;
import com.quichat.messaging.ControlClassifier;
import com.quichat.messaging.EnvelopeCodec;
import com.quichat.messaging.model.LocalIdentity;
import com.quichat.p2p.PubSubTopic;
import com.quichat.presence.PresenceAnnouncer;
import com.quichat.terminal.Terminal;
import com.quichat.terminal.TerminalPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One interactive chat session: a receiver loop, a sender loop and a presence announcer
 * running on their own threads and sharing a single {@link CancellationToken}.
 * <p>
 * The first task to fail cancels the token, as does {@code /quit} or {@link #cancel()}.
 * Cancellation interrupts every task, and {@link #run()} returns only after all three
 * have exited (or the shutdown timeout has passed).
 */
public class ChatSession {

    private static final Logger logger = LoggerFactory.getLogger(ChatSession.class);

    private final LocalIdentity identity;
    private final PubSubTopic topic;
    private final Terminal terminal;
    private final TerminalPrinter printer;
    private final EnvelopeCodec codec;
    private final ControlClassifier classifier;
    private final ProbeTracker probeTracker;
    private final Clock clock;
    private final Duration presencePollInterval;
    private final Duration presenceTimeout;
    private final Duration shutdownTimeout;

    private final CancellationToken token = new CancellationToken();
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.IDLE);
    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private final CountDownLatch terminated = new CountDownLatch(1);

    public ChatSession(LocalIdentity identity, PubSubTopic topic, Terminal terminal, TerminalPrinter printer,
                       EnvelopeCodec codec, ControlClassifier classifier, ProbeTracker probeTracker, Clock clock,
                       Duration presencePollInterval, Duration presenceTimeout, Duration shutdownTimeout) {
        this.identity = identity;
        this.topic = topic;
        this.terminal = terminal;
        this.printer = printer;
        this.codec = codec;
        this.classifier = classifier;
        this.probeTracker = probeTracker;
        this.clock = clock;
        this.presencePollInterval = presencePollInterval;
        this.presenceTimeout = presenceTimeout;
        this.shutdownTimeout = shutdownTimeout;
    }

    /**
     * Runs the session until it is quit, cancelled or fails.
     *
     * @throws SessionException     if a task failed; the cause is the first failure
     * @throws IllegalStateException if the session has already been started
     */
    public void run() throws SessionException {
        if (!state.compareAndSet(SessionState.IDLE, SessionState.ANNOUNCING)) {
            throw new IllegalStateException("Session already started, state: " + state.get());
        }
        logger.info("Starting chat session for {}", identity);

        AtomicInteger threadCount = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(3, r -> {
            Thread t = new Thread(r, "ChatSession-" + identity.getNick() + "-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        CountDownLatch finished = new CountDownLatch(3);

        printer.printJoined(identity.getNick());

        PresenceAnnouncer announcer = new PresenceAnnouncer(topic, codec, identity, clock, presencePollInterval,
                presenceTimeout, token,
                () -> state.compareAndSet(SessionState.ANNOUNCING, SessionState.ACTIVE));
        ReceiverLoop receiver = new ReceiverLoop(topic, codec, classifier, probeTracker, printer, identity, clock, token);
        SenderLoop sender = new SenderLoop(terminal, printer, topic, codec, probeTracker, identity, clock, token);

        executor.execute(supervise("announcer", announcer, finished));
        executor.execute(supervise("receiver", receiver, finished));
        executor.execute(supervise("sender", sender, finished));
        token.onCancel(() -> {
            state.getAndUpdate(s -> s == SessionState.TERMINATED ? s : SessionState.CLOSING);
            executor.shutdownNow();
        });

        boolean interrupted = false;
        try {
            token.await();
        } catch (InterruptedException e) {
            interrupted = true;
            token.cancel();
        }
        try {
            if (!finished.await(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Session tasks did not exit within {}; {} still running.", shutdownTimeout, finished.getCount());
            }
        } catch (InterruptedException e) {
            interrupted = true;
        } finally {
            executor.shutdownNow();
            state.set(SessionState.TERMINATED);
            terminated.countDown();
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        Throwable cause = failure.get();
        if (cause != null) {
            logger.error("Chat session for '{}' ended with an error: {}", identity.getNick(), cause.getMessage());
            throw new SessionException("Chat session failed: " + cause.getMessage(), cause);
        }
        logger.info("Chat session for '{}' ended.", identity.getNick());
    }

    /**
     * Requests shutdown. Safe to call from any thread, any number of times.
     */
    public void cancel() {
        if (token.cancel()) {
            logger.info("Chat session for '{}' cancelled.", identity.getNick());
        }
    }

    /**
     * Waits for {@link #run()} to finish tearing the session down.
     *
     * @return true if the session terminated within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public SessionState getState() {
        return state.get();
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    private Runnable supervise(String name, Callable<Void> task, CountDownLatch finished) {
        return () -> {
            try {
                task.call();
                logger.debug("Session task '{}' finished.", name);
            } catch (Exception | Error e) {
                if (token.isCancelled()) {
                    logger.debug("Session task '{}' stopped during shutdown: {}", name, e.toString());
                } else if (failure.compareAndSet(null, e)) {
                    logger.error("Session task '{}' failed: {}", name, e.getMessage(), e);
                }
                token.cancel();
            } finally {
                finished.countDown();
            }
        };
    }
}
