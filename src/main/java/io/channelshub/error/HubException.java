package io.channelshub.error;

/**
 * Base exception for all hub failures. Carries an {@link ErrorKind} so callers can
 * branch on the failure class without parsing messages.
 */
public class HubException extends RuntimeException {

    private final ErrorKind kind;

    public HubException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public HubException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public boolean retryable() {
        return kind.retryable();
    }

    public static HubException connection(String message, Throwable cause) {
        return new HubException(ErrorKind.CONNECTION, message, cause);
    }

    public static HubException authentication(String message, Throwable cause) {
        return new HubException(ErrorKind.AUTHENTICATION, message, cause);
    }

    public static HubException channel(String message, Throwable cause) {
        return new HubException(ErrorKind.CHANNEL, message, cause);
    }
}
