package com.quichat.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation signal shared by every task of a session.
 * Waiting on the token doubles as an interruptible timer that ends early on cancellation.
 */
public final class CancellationToken {

    private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /**
     * Cancels the token and runs the registered callbacks.
     *
     * @return true if this call cancelled the token, false if it was already cancelled
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        latch.countDown();
        for (Runnable callback : callbacks) {
            runOnce(callback);
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Runs the callback when the token is cancelled, or right away if it already is.
     * Each callback runs exactly once.
     */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get()) {
            runOnce(callback);
        }
    }

    /**
     * Waits up to {@code timeout} for cancellation.
     *
     * @return true if the token is cancelled
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public void await() throws InterruptedException {
        latch.await();
    }

    private void runOnce(Runnable callback) {
        if (!callbacks.remove(callback)) {
            return; // claimed by a concurrent caller
        }
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.error("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }
}
