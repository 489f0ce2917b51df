package io.channelshub.ssh;

/**
 * Opens SSH connections. One connector is shared by every channel runner of a daemon.
 */
public interface SshConnector extends AutoCloseable {

    /**
     * Opens the transport to {@code host:port}; the session is not yet authenticated.
     *
     * @throws io.channelshub.error.HubException with kind {@code CONNECTION}
     */
    SshConnection connect(String host, int port, String username);

    @Override
    default void close() {
    }
}
