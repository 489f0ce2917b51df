package io.channelshub.control;

import io.channelshub.model.ServiceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Talks to a running daemon through its PORT file. Any failure (no file, refused connection,
 * garbled reply) reads as "no daemon running".
 */
public final class ControlPlaneClient {
    private static final Logger LOG = LoggerFactory.getLogger(ControlPlaneClient.class);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(3);

    private final RunFiles runFiles;
    private final Duration timeout;

    public ControlPlaneClient(RunFiles runFiles) {
        this(runFiles, DEFAULT_TIMEOUT);
    }

    public ControlPlaneClient(RunFiles runFiles, Duration timeout) {
        this.runFiles = runFiles;
        this.timeout = timeout;
    }

    public Optional<ServiceSnapshot> status() {
        return exchange("status").flatMap(body -> {
            try {
                return Optional.of(StatusRecord.decode(body));
            } catch (RuntimeException e) {
                LOG.debug("bad status reply: {}", e.getMessage());
                return Optional.empty();
            }
        });
    }

    /**
     * @return true when the daemon acknowledged the stop request
     */
    public boolean stop() {
        return exchange("stop").map(body -> "ok".equals(body.trim())).orElse(false);
    }

    public boolean isRunning() {
        return status().isPresent();
    }

    private Optional<String> exchange(String request) {
        Optional<Integer> port = runFiles.readPort();
        if (port.isEmpty()) {
            return Optional.empty();
        }
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(InetAddress.getLoopbackAddress(), port.get()), (int) timeout.toMillis());
            socket.setSoTimeout((int) timeout.toMillis());
            OutputStream out = socket.getOutputStream();
            out.write((request + "\n").getBytes(StandardCharsets.UTF_8));
            out.flush();
            InputStream in = socket.getInputStream();
            return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            LOG.debug("control plane {} on port {} failed: {}", request, port.get(), e.getMessage());
            return Optional.empty();
        }
    }
}
