package io.channelshub.control;

import io.channelshub.error.ErrorKind;
import io.channelshub.error.HubException;
import io.channelshub.model.ServiceSnapshot;
import io.channelshub.runtime.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Loopback listener that lets other invocations query or stop the daemon.
 *
 * <p>Each connection sends one line. {@code stop} fires the daemon's shutdown signal and is
 * answered with {@code ok}; anything else gets a {@link StatusRecord}. The run files are
 * written once the listener is bound and removed on every exit of the accept loop, at the
 * latest {@link #SHUTDOWN_WINDOW} after a {@code stop} request.
 */
public final class ControlPlaneServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ControlPlaneServer.class);
    public static final Duration SHUTDOWN_WINDOW = Duration.ofSeconds(2);
    static final Duration READ_TIMEOUT = Duration.ofSeconds(5);
    static final String STOP_REPLY = "ok\n";

    private final RunFiles runFiles;
    private final Supplier<ServiceSnapshot> status;
    private final CancellationSignal shutdown;
    private final CountDownLatch terminated = new CountDownLatch(1);
    private ServerSocket server;

    public ControlPlaneServer(RunFiles runFiles, Supplier<ServiceSnapshot> status, CancellationSignal shutdown) {
        this.runFiles = runFiles;
        this.status = status;
        this.shutdown = shutdown;
    }

    /**
     * Binds an ephemeral loopback port, writes the run files and starts accepting.
     *
     * @return the bound port
     */
    public synchronized int start() {
        if (server != null) {
            throw new IllegalStateException("control plane already started");
        }
        try {
            server = new ServerSocket();
            server.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
        } catch (IOException e) {
            throw new HubException(ErrorKind.CONTROL_PLANE, "Failed to bind control plane: " + e.getMessage(), e);
        }
        int port = server.getLocalPort();
        try {
            runFiles.writePort(port);
            runFiles.writePid(ProcessHandle.current().pid());
        } catch (HubException e) {
            closeServer();
            runFiles.remove();
            throw e;
        }
        shutdown.onCancel(this::closeServer);
        Thread acceptor = new Thread(this::acceptLoop, "control-plane");
        acceptor.setDaemon(true);
        acceptor.start();
        LOG.info("control plane listening on 127.0.0.1:{}", port);
        return port;
    }

    private void acceptLoop() {
        ServerSocket socket;
        synchronized (this) {
            socket = server;
        }
        try {
            while (!socket.isClosed()) {
                Socket client;
                try {
                    client = socket.accept();
                } catch (IOException e) {
                    if (!socket.isClosed()) {
                        LOG.warn("control plane accept failed: {}", e.getMessage());
                    }
                    break;
                }
                Thread handler = new Thread(() -> handle(client), "control-plane-conn");
                handler.setDaemon(true);
                handler.start();
            }
        } finally {
            closeServer();
            runFiles.remove();
            terminated.countDown();
            LOG.debug("control plane closed");
        }
    }

    private void handle(Socket client) {
        try (Socket c = client) {
            c.setSoTimeout((int) READ_TIMEOUT.toMillis());
            BufferedReader reader = new BufferedReader(new InputStreamReader(c.getInputStream(), StandardCharsets.UTF_8));
            String line = reader.readLine();
            String request = line == null ? "" : line.trim().toLowerCase(Locale.ROOT);
            OutputStream out = c.getOutputStream();
            if ("stop".equals(request)) {
                LOG.info("stop requested over control plane");
                shutdown.cancel();
                out.write(STOP_REPLY.getBytes(StandardCharsets.UTF_8));
            } else {
                out.write(StatusRecord.encode(status.get()).getBytes(StandardCharsets.UTF_8));
            }
            out.flush();
        } catch (IOException | RuntimeException e) {
            LOG.debug("control plane request failed: {}", e.getMessage());
        }
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        closeServer();
        runFiles.remove();
    }

    private void closeServer() {
        ServerSocket socket;
        synchronized (this) {
            socket = server;
        }
        if (socket == null) {
            return;
        }
        try {
            socket.close();
        } catch (IOException e) {
            LOG.debug("closing control plane listener failed: {}", e.getMessage());
        }
    }
}
