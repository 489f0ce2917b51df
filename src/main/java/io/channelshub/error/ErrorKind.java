package io.channelshub.error;

/**
 * Failure classification shared by the runtime and the control plane.
 *
 * <p>The supervision loop asks {@link #retryable()} and nothing else, so a stricter
 * policy (for example giving up on {@link #AUTHENTICATION}) only needs to change here.
 */
public enum ErrorKind {
    CONFIGURATION(false),
    CONNECTION(true),
    AUTHENTICATION(true),
    CHANNEL(true),
    SERVICE(false),
    CONTROL_PLANE(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
