package io.channelshub.runtime;

import io.channelshub.error.HubException;
import io.channelshub.model.AuthMethod;
import io.channelshub.ssh.ForwardStream;
import io.channelshub.ssh.InboundForwardHandler;
import io.channelshub.ssh.SessionChannel;
import io.channelshub.ssh.SshConnection;
import io.channelshub.ssh.SshConnector;

import java.io.IOException;
import java.io.InputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory SSH connector. Forward channels are plain loopback sockets to the destination,
 * so relays can be exercised end to end without an SSH server.
 */
public final class FakeSshConnector implements SshConnector {
    private final AtomicInteger connectCalls = new AtomicInteger();
    private final AtomicInteger failuresLeft = new AtomicInteger();
    private final AtomicInteger forwardFailuresLeft = new AtomicInteger();
    private final Set<String> failingHosts = ConcurrentHashMap.newKeySet();
    private final List<FakeConnection> connections = new CopyOnWriteArrayList<>();
    private volatile Integer grantedPort;

    public FakeSshConnector failFirst(int attempts) {
        failuresLeft.set(attempts);
        return this;
    }

    /**
     * The next {@code opens} forward-channel opens fail as if the destination refused.
     */
    public FakeSshConnector failForwardOpens(int opens) {
        forwardFailuresLeft.set(opens);
        return this;
    }

    public FakeSshConnector failHost(String host) {
        failingHosts.add(host);
        return this;
    }

    /**
     * Port reported for every remote forward instead of the requested one.
     */
    public FakeSshConnector grantPort(int port) {
        grantedPort = port;
        return this;
    }

    public int connectCalls() {
        return connectCalls.get();
    }

    public List<FakeConnection> connections() {
        return connections;
    }

    public FakeConnection lastConnection() {
        return connections.get(connections.size() - 1);
    }

    @Override
    public SshConnection connect(String host, int port, String username) {
        connectCalls.incrementAndGet();
        if (failingHosts.contains(host)) {
            throw HubException.connection("Connection refused: " + host + ":" + port, null);
        }
        if (failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw HubException.connection("Simulated failure connecting to " + host + ":" + port, null);
        }
        FakeConnection connection = new FakeConnection();
        connections.add(connection);
        return connection;
    }

    public final class FakeConnection implements SshConnection {
        private final List<Runnable> closeActions = new ArrayList<>();
        private volatile boolean open = true;
        private volatile AuthMethod auth;
        private volatile InboundForwardHandler inboundHandler;
        private volatile int requestedRemotePort = -1;
        private volatile FakeSessionChannel session;
        private final AtomicInteger forwardOpens = new AtomicInteger();

        @Override
        public void authenticate(AuthMethod auth) {
            this.auth = auth;
        }

        @Override
        public SessionChannel openSession() {
            session = new FakeSessionChannel();
            return session;
        }

        @Override
        public ForwardStream openForwardChannel(String destHost, int destPort, String originatorHost, int originatorPort) {
            forwardOpens.incrementAndGet();
            if (forwardFailuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw HubException.channel("Connect failed: administratively prohibited", null);
            }
            Socket socket = new Socket();
            try {
                socket.connect(new InetSocketAddress(destHost, destPort), 2_000);
            } catch (IOException e) {
                throw HubException.channel("open failed: " + e.getMessage(), e);
            }
            return ForwardStream.ofSocket(socket);
        }

        @Override
        public int requestRemoteForward(String bindAddress, int bindPort, InboundForwardHandler handler) {
            requestedRemotePort = bindPort;
            inboundHandler = handler;
            return grantedPort == null ? bindPort : grantedPort;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void whenClosed(Runnable action) {
            synchronized (closeActions) {
                if (open) {
                    closeActions.add(action);
                    return;
                }
            }
            action.run();
        }

        /**
         * Simulates the server dropping the session.
         */
        public void drop() {
            close();
        }

        @Override
        public void close() {
            List<Runnable> toRun;
            synchronized (closeActions) {
                if (!open) {
                    return;
                }
                open = false;
                toRun = new ArrayList<>(closeActions);
                closeActions.clear();
            }
            toRun.forEach(Runnable::run);
        }

        public AuthMethod auth() {
            return auth;
        }

        public InboundForwardHandler inboundHandler() {
            return inboundHandler;
        }

        public int requestedRemotePort() {
            return requestedRemotePort;
        }

        public int forwardOpens() {
            return forwardOpens.get();
        }

        public FakeSessionChannel session() {
            return session;
        }
    }

    public static final class FakeSessionChannel implements SessionChannel {
        private final PipedOutputStream remote = new PipedOutputStream();
        private final PipedInputStream output;
        private volatile boolean open;
        private volatile String command;
        private volatile boolean pty;
        private volatile boolean shell;

        FakeSessionChannel() {
            try {
                output = new PipedInputStream(remote);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        @Override
        public void requestPty() {
            pty = true;
        }

        @Override
        public void exec(String command) {
            this.command = command;
            open = true;
        }

        @Override
        public void shell() {
            shell = true;
            open = true;
        }

        public String command() {
            return command;
        }

        public boolean ptyRequested() {
            return pty;
        }

        public boolean shellStarted() {
            return shell;
        }

        @Override
        public InputStream output() {
            return output;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            open = false;
            try {
                remote.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
