package io.channelshub.control;

import io.channelshub.config.HubPaths;
import io.channelshub.error.ErrorKind;
import io.channelshub.error.HubException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * The PID and PORT files that mark a running daemon. Both hold plain decimal text.
 */
public final class RunFiles {
    private static final Logger LOG = LoggerFactory.getLogger(RunFiles.class);

    private final Path pidFile;
    private final Path portFile;

    public RunFiles(Path pidFile, Path portFile) {
        this.pidFile = pidFile;
        this.portFile = portFile;
    }

    public static RunFiles of(HubPaths paths) {
        return new RunFiles(paths.pidFile(), paths.portFile());
    }

    public Path pidFile() {
        return pidFile;
    }

    public Path portFile() {
        return portFile;
    }

    public void writePort(int port) {
        write(portFile, Integer.toString(port));
    }

    public void writePid(long pid) {
        write(pidFile, Long.toString(pid));
    }

    public Optional<Integer> readPort() {
        return read(portFile).map(Long::intValue);
    }

    public Optional<Long> readPid() {
        return read(pidFile);
    }

    public boolean exists() {
        return Files.exists(pidFile) || Files.exists(portFile);
    }

    public void remove() {
        delete(portFile);
        delete(pidFile);
    }

    private static void write(Path file, String value) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, value, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new HubException(ErrorKind.CONTROL_PLANE, "Failed to write " + file + ": " + e.getMessage(), e);
        }
    }

    private static Optional<Long> read(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(Files.readString(file, StandardCharsets.UTF_8).trim()));
        } catch (IOException | NumberFormatException e) {
            LOG.debug("unreadable run file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private static void delete(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("failed to remove {}: {}", file, e.getMessage());
        }
    }
}
