package io.channelshub.runtime;

import io.channelshub.config.ReconnectionSettings;
import io.channelshub.error.ErrorKind;
import io.channelshub.error.HubException;
import io.channelshub.model.ChannelKind;
import io.channelshub.model.ChannelSpec;
import io.channelshub.ssh.ForwardStream;
import io.channelshub.ssh.SessionChannel;
import io.channelshub.ssh.SshConnection;
import io.channelshub.ssh.SshConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Keeps one channel alive: connect, authenticate, open the kind-specific channel, run its
 * duty loop, and reconnect with backoff when anything fails.
 *
 * <p>A supervision cycle builds a fresh {@link BackoffPolicy} and retries until an attempt
 * reaches its duty loop or the cycle's budget is spent. After the cycle ends the runner waits
 * {@link #CYCLE_PAUSE} and starts over. Only cancellation stops it.
 */
public final class ChannelRunner {
    private static final Logger LOG = LoggerFactory.getLogger(ChannelRunner.class);
    public static final Duration CYCLE_PAUSE = Duration.ofSeconds(1);
    static final Duration SESSION_TICK = Duration.ofSeconds(1);
    static final Duration STOP_JOIN = Duration.ofSeconds(5);
    static final Duration LOCAL_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    static final String REMOTE_BIND_ADDRESS = "localhost";

    private final ChannelSpec spec;
    private final SshConnector connector;
    private final ReconnectionSettings reconnection;
    private final CancellationSignal signal;
    private final CompletableFuture<Void> firstAttempt = new CompletableFuture<>();
    private volatile ChannelPhase phase = ChannelPhase.IDLE;
    private volatile String lastError;
    private volatile int boundPort = -1;
    private Thread supervisor;

    public ChannelRunner(
            ChannelSpec spec,
            SshConnector connector,
            ReconnectionSettings reconnection,
            CancellationSignal signal
    ) {
        this.spec = spec;
        this.connector = connector;
        this.reconnection = reconnection;
        this.signal = signal;
    }

    /**
     * Launches supervision and waits up to {@code window} for the first attempt.
     *
     * @throws HubException when the first attempt failed or did not finish in time; the
     *                      runner keeps supervising either way
     */
    public void start(Duration window) {
        launch();
        awaitFirstAttempt(window);
    }

    public synchronized void launch() {
        if (supervisor != null) {
            throw new IllegalStateException("runner " + spec.name() + " already started");
        }
        supervisor = new Thread(this::supervise, "channel-" + spec.name());
        supervisor.setDaemon(true);
        supervisor.start();
    }

    public void awaitFirstAttempt(Duration window) {
        try {
            firstAttempt.get(Math.max(0L, window.toMillis()), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof HubException hub) {
                throw hub;
            }
            throw new HubException(ErrorKind.CHANNEL, String.valueOf(cause.getMessage()), cause);
        } catch (TimeoutException e) {
            throw new HubException(ErrorKind.CHANNEL,
                    "Channel '" + spec.name() + "' did not become active within " + window.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HubException(ErrorKind.CHANNEL, "Interrupted while starting channel '" + spec.name() + "'", e);
        }
    }

    public void stop() {
        signal.cancel();
        Thread t;
        synchronized (this) {
            t = supervisor;
        }
        if (t == null || t == Thread.currentThread()) {
            phase = ChannelPhase.STOPPED;
            return;
        }
        try {
            t.join(STOP_JOIN.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            LOG.warn("[{}] supervisor still busy after {}s; leaving it to exit on its own", spec.name(), STOP_JOIN.toSeconds());
        }
    }

    public ChannelView view() {
        return new ChannelView(spec.name(), spec.kind().summary(), phase, boundPort, lastError);
    }

    public ChannelSpec spec() {
        return spec;
    }

    public ChannelPhase phase() {
        return phase;
    }

    /**
     * Port granted by the server for a remote forward; {@code -1} until one is granted.
     */
    public int boundPort() {
        return boundPort;
    }

    public Optional<String> lastError() {
        return Optional.ofNullable(lastError);
    }

    private void supervise() {
        try {
            while (!signal.isCancelled()) {
                runCycle();
                if (signal.isCancelled()) {
                    break;
                }
                phase = ChannelPhase.BACKOFF_WAIT;
                LOG.info("[{}] cycle ended; starting a new one in {}s", spec.name(), CYCLE_PAUSE.toSeconds());
                if (signal.await(CYCLE_PAUSE)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            phase = ChannelPhase.STOPPED;
            completeFirst(new HubException(ErrorKind.CHANNEL, "Channel '" + spec.name() + "' stopped before it became active"));
            LOG.info("[{}] stopped", spec.name());
        }
    }

    private void runCycle() throws InterruptedException {
        BackoffPolicy policy = BackoffPolicy.from(reconnection);
        while (!signal.isCancelled()) {
            try {
                attempt();
                return;
            } catch (RuntimeException failure) {
                HubException e = failure instanceof HubException hub
                        ? hub
                        : new HubException(ErrorKind.CHANNEL, String.valueOf(failure.getMessage()), failure);
                if (signal.isCancelled()) {
                    return;
                }
                lastError = e.getMessage();
                completeFirst(e);
                Optional<Duration> delay = policy.nextDelay();
                if (delay.isEmpty()) {
                    LOG.error("[{}] giving up this cycle after {} attempts: {}",
                            spec.name(), policy.retries() + 1, e.getMessage());
                    return;
                }
                phase = ChannelPhase.BACKOFF_WAIT;
                LOG.warn("[{}] {} error: {}; retry {} in {}ms",
                        spec.name(), e.kind(), e.getMessage(), policy.retries(), delay.get().toMillis());
                if (signal.await(delay.get())) {
                    return;
                }
            }
        }
    }

    private void attempt() throws InterruptedException {
        phase = ChannelPhase.CONNECTING;
        LOG.debug("[{}] connecting to {}", spec.name(), spec.endpoint());
        SshConnection connection = connector.connect(spec.address(), spec.port(), spec.username());
        try (CancellationSignal.Registration ignored = signal.onCancel(connection::close)) {
            phase = ChannelPhase.AUTHENTICATING;
            connection.authenticate(spec.auth());
            LOG.debug("[{}] authenticated as {}", spec.name(), spec.username());
            ChannelKind kind = spec.kind();
            DutyLoop duty = switch (kind.type()) {
                case LOCAL_FORWARD -> () -> runLocalForward(connection, (ChannelKind.LocalForward) kind);
                case REMOTE_FORWARD -> () -> runRemoteForward(connection, (ChannelKind.RemoteForward) kind);
                case SESSION -> () -> runSession(connection, (ChannelKind.Session) kind);
            };
            duty.run();
        } finally {
            connection.close();
        }
    }

    @FunctionalInterface
    private interface DutyLoop {
        void run() throws InterruptedException;
    }

    private void markActive() {
        phase = ChannelPhase.CHANNEL_ACTIVE;
        lastError = null;
        completeFirst(null);
    }

    private void completeFirst(HubException failure) {
        if (failure == null) {
            firstAttempt.complete(null);
        } else {
            firstAttempt.completeExceptionally(failure);
        }
    }

    private void runLocalForward(SshConnection connection, ChannelKind.LocalForward local) {
        ServerSocket listener;
        try {
            listener = new ServerSocket();
            listener.bind(new InetSocketAddress(local.listenHost(), local.listenPort()));
        } catch (IOException e) {
            throw HubException.channel("Failed to bind " + local.listenHost() + ":" + local.listenPort()
                    + ": " + e.getMessage(), e);
        }
        try (CancellationSignal.Registration ignored = signal.onCancel(() -> closeQuietly(listener))) {
            connection.whenClosed(() -> closeQuietly(listener));
            markActive();
            LOG.info("[{}] listening on {}:{} -> {}:{}", spec.name(),
                    local.listenHost(), local.listenPort(), local.destHost(), local.destPort());
            while (!signal.isCancelled() && connection.isOpen()) {
                Socket client;
                try {
                    client = listener.accept();
                } catch (IOException e) {
                    if (!listener.isClosed()) {
                        LOG.warn("[{}] accept failed: {}", spec.name(), e.getMessage());
                    }
                    break;
                }
                forwardLocal(connection, local, client);
            }
        } finally {
            closeQuietly(listener);
        }
    }

    private void forwardLocal(SshConnection connection, ChannelKind.LocalForward local, Socket client) {
        InetSocketAddress peer = (InetSocketAddress) client.getRemoteSocketAddress();
        ForwardStream inbound = ForwardStream.ofSocket(client);
        try {
            ForwardStream channel = connection.openForwardChannel(
                    local.destHost(), local.destPort(), peer.getAddress().getHostAddress(), peer.getPort());
            RelayEngine.start(spec.name(), inbound, channel);
        } catch (HubException e) {
            LOG.warn("[{}] could not open channel for {}: {}", spec.name(), peer, e.getMessage());
            inbound.close();
        }
    }

    private void runRemoteForward(SshConnection connection, ChannelKind.RemoteForward remote)
            throws InterruptedException {
        CountDownLatch ended = new CountDownLatch(1);
        int granted = connection.requestRemoteForward(
                REMOTE_BIND_ADDRESS, remote.remoteBindPort(), inbound -> forwardRemote(remote, inbound));
        boundPort = granted;
        markActive();
        LOG.info("[{}] remote {}:{} -> {}:{} (requested port {})", spec.name(),
                REMOTE_BIND_ADDRESS, granted, remote.localHost(), remote.localPort(), remote.remoteBindPort());
        connection.whenClosed(ended::countDown);
        try (CancellationSignal.Registration ignored = signal.onCancel(ended::countDown)) {
            ended.await();
        }
    }

    private void forwardRemote(ChannelKind.RemoteForward remote, ForwardStream inbound) {
        Socket target = new Socket();
        try {
            target.connect(new InetSocketAddress(remote.localHost(), remote.localPort()),
                    (int) LOCAL_CONNECT_TIMEOUT.toMillis());
        } catch (IOException e) {
            LOG.warn("[{}] could not reach {}:{}: {}", spec.name(), remote.localHost(), remote.localPort(), e.getMessage());
            closeQuietly(target);
            inbound.close();
            return;
        }
        RelayEngine.start(spec.name(), ForwardStream.ofSocket(target), inbound);
    }

    private void runSession(SshConnection connection, ChannelKind.Session session) throws InterruptedException {
        SessionChannel channel = connection.openSession();
        try {
            Optional<String> command = session.commandValue();
            if (command.isPresent()) {
                channel.exec(command.get());
            } else {
                channel.requestPty();
                channel.shell();
            }
            markActive();
            LOG.info("[{}] session open{}", spec.name(), command.map(c -> ": " + c).orElse(" (shell)"));
            Thread drain = new Thread(() -> drain(channel.output()), "session-drain-" + spec.name());
            drain.setDaemon(true);
            drain.start();
            while (!signal.isCancelled() && drain.isAlive() && connection.isOpen()) {
                signal.await(SESSION_TICK);
            }
        } finally {
            channel.close();
        }
    }

    private void drain(InputStream output) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(output, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                LOG.debug("[{}] {}", spec.name(), line);
            }
        } catch (IOException e) {
            LOG.debug("[{}] session output closed: {}", spec.name(), e.getMessage());
        }
    }

    private void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            LOG.debug("[{}] close failed: {}", spec.name(), e.getMessage());
        }
    }
}
