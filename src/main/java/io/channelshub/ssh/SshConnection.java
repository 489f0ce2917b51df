package io.channelshub.ssh;

import io.channelshub.model.AuthMethod;

/**
 * One SSH transport session. Methods that talk to the server block the calling thread and
 * report failures as {@link io.channelshub.error.HubException}.
 */
public interface SshConnection extends AutoCloseable {

    void authenticate(AuthMethod auth);

    SessionChannel openSession();

    /**
     * Opens a {@code direct-tcpip} channel to {@code destHost:destPort} on the server side.
     */
    ForwardStream openForwardChannel(String destHost, int destPort, String originatorHost, int originatorPort);

    /**
     * Asks the server to listen on {@code bindAddress:bindPort} and deliver each inbound
     * connection to {@code handler}.
     *
     * @return the port the server actually bound, which may differ from {@code bindPort}
     */
    int requestRemoteForward(String bindAddress, int bindPort, InboundForwardHandler handler);

    boolean isOpen();

    /**
     * Runs {@code action} once the session is closed; immediately when it already is.
     */
    void whenClosed(Runnable action);

    @Override
    void close();
}
