package io.channelshub.config;

import java.time.Duration;

/**
 * Retry settings from the {@code [reconnection]} table.
 *
 * @param maxRetries retries after the first attempt of a cycle, 0 for unlimited
 */
public record ReconnectionSettings(int maxRetries, Duration initialDelay, Duration maxDelay, boolean exponential) {
    public static final int DEFAULT_MAX_RETRIES = 0;
    public static final long DEFAULT_INITIAL_DELAY_SECS = 1L;
    public static final long DEFAULT_MAX_DELAY_SECS = 30L;

    public static ReconnectionSettings defaults() {
        return new ReconnectionSettings(
                DEFAULT_MAX_RETRIES,
                Duration.ofSeconds(DEFAULT_INITIAL_DELAY_SECS),
                Duration.ofSeconds(DEFAULT_MAX_DELAY_SECS),
                true
        );
    }
}
