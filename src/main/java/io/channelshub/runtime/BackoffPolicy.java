package io.channelshub.runtime;

import io.channelshub.config.ReconnectionSettings;

import java.time.Duration;
import java.util.Optional;

/**
 * Delay schedule for one supervision cycle. A cycle allows {@code 1 + maxRetries} attempts
 * ({@code maxRetries == 0} means no ceiling); the runner builds a new policy for every cycle,
 * so the budget only limits bursts and never stops a channel for good.
 */
public final class BackoffPolicy {
    private final boolean exponential;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final int maxRetries;
    private int retries;

    public BackoffPolicy(boolean exponential, Duration initialDelay, Duration maxDelay, int maxRetries) {
        this.exponential = exponential;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay.compareTo(initialDelay) < 0 ? initialDelay : maxDelay;
        this.maxRetries = Math.max(0, maxRetries);
    }

    public static BackoffPolicy from(ReconnectionSettings settings) {
        return new BackoffPolicy(
                settings.exponential(),
                settings.initialDelay(),
                settings.maxDelay(),
                settings.maxRetries()
        );
    }

    /**
     * Delay before the next retry, or empty once this cycle's budget is spent.
     */
    public Optional<Duration> nextDelay() {
        if (maxRetries > 0 && retries >= maxRetries) {
            return Optional.empty();
        }
        retries++;
        return Optional.of(delayFor(retries));
    }

    /**
     * Delay before retry number {@code retry} (1-based).
     */
    public Duration delayFor(int retry) {
        if (!exponential) {
            return initialDelay;
        }
        long base = initialDelay.toMillis();
        long max = maxDelay.toMillis();
        long delay = base;
        for (int i = 1; i < retry; i++) {
            if (delay >= max / 2L) {
                delay = max;
                break;
            }
            delay *= 2L;
        }
        return Duration.ofMillis(Math.min(delay, max));
    }

    public int retries() {
        return retries;
    }

    public boolean unlimited() {
        return maxRetries == 0;
    }

    public int maxAttempts() {
        return unlimited() ? 0 : maxRetries + 1;
    }
}
