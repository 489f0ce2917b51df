package io.channelshub.cli;

import io.channelshub.Main;
import io.channelshub.error.ErrorKind;
import io.channelshub.error.HubException;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Starts {@code start} in a detached JVM with the same class path and returns without
 * waiting for it.
 */
final class DaemonLauncher {
    static final Duration SETTLE_TIME = Duration.ofMillis(800);

    private DaemonLauncher() {
    }

    static List<String> command(Path configFile, boolean debug) {
        List<String> cmd = new ArrayList<>();
        cmd.add(javaBinary());
        cmd.add("-cp");
        cmd.add(System.getProperty("java.class.path"));
        cmd.add(Main.class.getName());
        cmd.add("start");
        cmd.add("--config");
        cmd.add(configFile.toString());
        if (debug) {
            cmd.add("--debug");
        }
        return cmd;
    }

    static void launch(Path configFile, boolean debug) {
        ProcessBuilder builder = new ProcessBuilder(command(configFile, debug))
                .redirectInput(ProcessBuilder.Redirect.from(nullDevice()))
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD);
        try {
            builder.start();
        } catch (IOException e) {
            throw new HubException(ErrorKind.SERVICE, "Failed to spawn daemon process: " + e.getMessage(), e);
        }
        try {
            Thread.sleep(SETTLE_TIME.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String javaBinary() {
        return Paths.get(System.getProperty("java.home"), "bin", windows() ? "java.exe" : "java").toString();
    }

    private static File nullDevice() {
        return new File(windows() ? "NUL" : "/dev/null");
    }

    private static boolean windows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
    }
}
