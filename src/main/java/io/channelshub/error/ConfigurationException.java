package io.channelshub.error;

/**
 * Invalid or unresolvable configuration. Never retried.
 */
public class ConfigurationException extends HubException {

    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION, message, cause);
    }
}
