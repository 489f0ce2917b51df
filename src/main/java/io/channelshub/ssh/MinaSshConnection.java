package io.channelshub.ssh;

import io.channelshub.error.HubException;
import io.channelshub.model.AuthMethod;
import org.apache.sshd.client.channel.ChannelDirectTcpip;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.common.config.keys.FilePasswordProvider;
import org.apache.sshd.common.keyprovider.FileKeyPairProvider;
import org.apache.sshd.common.util.net.SshdSocketAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.file.Files;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.util.ArrayList;
import java.util.List;

final class MinaSshConnection implements SshConnection {
    private static final Logger LOG = LoggerFactory.getLogger(MinaSshConnection.class);

    private final ClientSession session;
    private final MinaSshConnector.Timeouts timeouts;

    MinaSshConnection(ClientSession session, MinaSshConnector.Timeouts timeouts) {
        this.session = session;
        this.timeouts = timeouts;
    }

    @Override
    public void authenticate(AuthMethod auth) {
        if (auth instanceof AuthMethod.Password password) {
            session.addPasswordIdentity(password.secret());
        } else if (auth instanceof AuthMethod.PrivateKey key) {
            addKeyIdentities(key);
        } else {
            throw HubException.authentication("Unsupported auth method: " + auth.describe(), null);
        }
        try {
            session.auth().verify(timeouts.auth().toMillis());
        } catch (IOException e) {
            throw HubException.authentication("Authentication failed (" + auth.describe() + "): " + e.getMessage(), e);
        }
    }

    private void addKeyIdentities(AuthMethod.PrivateKey key) {
        for (KeyPair pair : loadKeyPairs(key)) {
            session.addPublicKeyIdentity(pair);
        }
    }

    /**
     * Decodes the key file up front. The provider decodes lazily while iterating, skips
     * resources it cannot decode and reports other failures unchecked; all of them end
     * up as authentication errors here.
     */
    static List<KeyPair> loadKeyPairs(AuthMethod.PrivateKey key) {
        if (!Files.isReadable(key.keyPath())) {
            throw HubException.authentication("Private key not readable: " + key.keyPath(), null);
        }
        FileKeyPairProvider provider = new FileKeyPairProvider(key.keyPath());
        key.passphraseValue().ifPresent(p -> provider.setPasswordFinder(FilePasswordProvider.of(p)));
        List<KeyPair> pairs = new ArrayList<>();
        try {
            for (KeyPair pair : provider.loadKeys(null)) {
                pairs.add(pair);
            }
        } catch (RuntimeException e) {
            Throwable cause = e.getCause() instanceof IOException || e.getCause() instanceof GeneralSecurityException
                    ? e.getCause()
                    : e;
            throw HubException.authentication(
                    "Failed to load private key " + key.keyPath() + ": " + cause.getMessage(), cause);
        }
        if (pairs.isEmpty()) {
            throw HubException.authentication("No usable key found in " + key.keyPath()
                    + " (unsupported format or wrong passphrase)", null);
        }
        return pairs;
    }

    @Override
    public SessionChannel openSession() {
        return new MinaSessionChannel(session, timeouts.open());
    }

    @Override
    public ForwardStream openForwardChannel(String destHost, int destPort, String originatorHost, int originatorPort) {
        try {
            ChannelDirectTcpip channel = session.createDirectTcpipChannel(
                    new SshdSocketAddress(originatorHost, originatorPort),
                    new SshdSocketAddress(destHost, destPort));
            channel.open().verify(timeouts.open().toMillis());
            return new ChannelStream(channel, destHost + ":" + destPort);
        } catch (IOException e) {
            throw HubException.channel(
                    "Failed to open direct-tcpip channel to " + destHost + ":" + destPort + ": " + e.getMessage(), e);
        }
    }

    /**
     * The server's forwarded connections land on a loopback bridge listener owned by this
     * connection; each accepted socket is handed to {@code handler} on its own thread. The
     * bridge closes with the session.
     */
    @Override
    public int requestRemoteForward(String bindAddress, int bindPort, InboundForwardHandler handler) {
        ServerSocket bridge;
        try {
            bridge = new ServerSocket();
            bridge.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
        } catch (IOException e) {
            throw HubException.channel("Failed to bind remote forward bridge: " + e.getMessage(), e);
        }
        SshdSocketAddress bound;
        try {
            bound = session.startRemotePortForwarding(
                    new SshdSocketAddress(bindAddress, bindPort),
                    new SshdSocketAddress(InetAddress.getLoopbackAddress().getHostAddress(), bridge.getLocalPort()));
        } catch (IOException e) {
            closeQuietly(bridge);
            throw HubException.channel(
                    "Remote forward request for " + bindAddress + ":" + bindPort + " failed: " + e.getMessage(), e);
        }
        int granted = bound == null ? bindPort : bound.getPort();
        whenClosed(() -> closeQuietly(bridge));
        Thread acceptor = new Thread(() -> bridgeLoop(bridge, handler), "remote-forward-bridge-" + granted);
        acceptor.setDaemon(true);
        acceptor.start();
        return granted;
    }

    private void bridgeLoop(ServerSocket bridge, InboundForwardHandler handler) {
        while (!bridge.isClosed()) {
            Socket socket;
            try {
                socket = bridge.accept();
            } catch (IOException e) {
                if (!bridge.isClosed()) {
                    LOG.debug("remote forward bridge accept failed: {}", e.getMessage());
                }
                return;
            }
            ForwardStream inbound = ForwardStream.ofSocket(socket);
            Thread worker = new Thread(() -> {
                try {
                    handler.accept(inbound);
                } catch (RuntimeException e) {
                    LOG.warn("inbound forward handler failed: {}", e.getMessage());
                    inbound.close();
                }
            }, "remote-forward-inbound");
            worker.setDaemon(true);
            worker.start();
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void whenClosed(Runnable action) {
        session.addCloseFutureListener(future -> action.run());
    }

    @Override
    public void close() {
        session.close(true);
    }

    private static void closeQuietly(ServerSocket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            LOG.debug("closing bridge listener failed: {}", e.getMessage());
        }
    }

    private static final class ChannelStream implements ForwardStream {
        private final ChannelDirectTcpip channel;
        private final String target;

        private ChannelStream(ChannelDirectTcpip channel, String target) {
            this.channel = channel;
            this.target = target;
        }

        @Override
        public InputStream input() {
            return channel.getInvertedOut();
        }

        @Override
        public OutputStream output() {
            return channel.getInvertedIn();
        }

        @Override
        public String describe() {
            return "direct-tcpip " + target;
        }

        @Override
        public void close() {
            channel.close(false);
        }
    }
}
