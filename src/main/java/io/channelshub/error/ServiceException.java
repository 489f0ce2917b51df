package io.channelshub.error;

/**
 * Orchestrator misuse (start while not stopped, stop while not running) or a start
 * that brought up no channel at all.
 */
public class ServiceException extends HubException {

    public ServiceException(String message) {
        super(ErrorKind.SERVICE, message);
    }
}
