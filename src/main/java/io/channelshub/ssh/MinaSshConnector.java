package io.channelshub.ssh;

import io.channelshub.error.HubException;
import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.config.hosts.HostConfigEntryResolver;
import org.apache.sshd.client.keyverifier.AcceptAllServerKeyVerifier;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.common.keyprovider.KeyIdentityProvider;
import org.apache.sshd.core.CoreModuleProperties;
import org.apache.sshd.server.forward.AcceptAllForwardingFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

/**
 * {@link SshConnector} backed by an Apache MINA SSHD {@link SshClient}.
 *
 * <p>Host keys are accepted without verification and {@code ~/.ssh/config} is not consulted;
 * every connection parameter comes from the hub configuration.
 */
public final class MinaSshConnector implements SshConnector {
    private static final Logger LOG = LoggerFactory.getLogger(MinaSshConnector.class);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_AUTH_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_OPEN_TIMEOUT = Duration.ofSeconds(15);
    private static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(30);

    private final SshClient client;
    private final Timeouts timeouts;

    public MinaSshConnector() {
        this(new Timeouts(DEFAULT_CONNECT_TIMEOUT, DEFAULT_AUTH_TIMEOUT, DEFAULT_OPEN_TIMEOUT));
    }

    public MinaSshConnector(Timeouts timeouts) {
        this.timeouts = timeouts;
        this.client = SshClient.setUpDefaultClient();
        client.setServerKeyVerifier(AcceptAllServerKeyVerifier.INSTANCE);
        client.setHostConfigEntryResolver(HostConfigEntryResolver.EMPTY);
        client.setKeyIdentityProvider(KeyIdentityProvider.EMPTY_KEYS_PROVIDER);
        client.setForwardingFilter(AcceptAllForwardingFilter.INSTANCE);
        CoreModuleProperties.HEARTBEAT_INTERVAL.set(client, HEARTBEAT_INTERVAL);
        client.start();
    }

    @Override
    public SshConnection connect(String host, int port, String username) {
        LOG.debug("connecting to {}@{}:{}", username, host, port);
        try {
            ClientSession session = client.connect(username, host, port)
                    .verify(timeouts.connect().toMillis())
                    .getSession();
            return new MinaSshConnection(session, timeouts);
        } catch (IOException e) {
            throw HubException.connection("Failed to connect to " + host + ":" + port + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        try {
            client.stop();
        } catch (RuntimeException e) {
            LOG.warn("stopping SSH client failed: {}", e.getMessage());
        }
    }

    public record Timeouts(Duration connect, Duration auth, Duration open) {
    }
}
