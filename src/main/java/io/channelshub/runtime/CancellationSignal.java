package io.channelshub.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation flag with callbacks. Cancelling a signal cancels all of its children;
 * cancelling a child leaves the parent untouched.
 */
public final class CancellationSignal {
    private static final Logger LOG = LoggerFactory.getLogger(CancellationSignal.class);

    private final CountDownLatch latch = new CountDownLatch(1);
    private final Set<Runnable> callbacks = new LinkedHashSet<>();
    private boolean cancelled;

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    public CancellationSignal child() {
        CancellationSignal child = new CancellationSignal();
        Registration link = onCancel(child::cancel);
        child.onCancel(link::close);
        return child;
    }

    public void cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        latch.countDown();
        for (Runnable callback : toRun) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                LOG.debug("cancellation callback failed: {}", e.getMessage());
            }
        }
    }

    public boolean isCancelled() {
        return latch.getCount() == 0L;
    }

    /**
     * Registers {@code callback} to run on cancellation, or runs it right away when the signal
     * is already cancelled. Closing the returned registration unregisters it.
     */
    public Registration onCancel(Runnable callback) {
        synchronized (this) {
            if (!cancelled) {
                callbacks.add(callback);
                return () -> {
                    synchronized (CancellationSignal.this) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        callback.run();
        return () -> {
        };
    }

    /**
     * Waits up to {@code timeout} for cancellation.
     *
     * @return true when the signal was cancelled
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
