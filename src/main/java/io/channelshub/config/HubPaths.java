package io.channelshub.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class HubPaths {
    public static final String APP_NAME = "ssh-channels-hub";
    public static final String LOCAL_CONFIG_FILE = "configs.toml";
    public static final String USER_CONFIG_FILE = "config.toml";
    public static final String PID_FILE = APP_NAME + ".pid";
    public static final String PORT_FILE = APP_NAME + ".port";

    private final Path configFile;

    public HubPaths(Path configFile) {
        this.configFile = configFile.toAbsolutePath().normalize();
    }

    /**
     * Resolves the {@code --config} option; blank means the first existing default candidate.
     */
    public static HubPaths fromOption(String raw) {
        if (raw == null || raw.isBlank()) {
            return new HubPaths(defaultConfigPath());
        }
        return new HubPaths(expandHome(raw.trim()));
    }

    public static List<Path> defaultPathCandidates(Path workingDir, Path userConfigDir) {
        List<Path> out = new ArrayList<>();
        out.add(workingDir.resolve(LOCAL_CONFIG_FILE));
        if (userConfigDir != null) {
            out.add(userConfigDir.resolve(APP_NAME).resolve(USER_CONFIG_FILE));
        }
        return out;
    }

    public static Path defaultConfigPath() {
        List<Path> candidates = defaultPathCandidates(Paths.get("").toAbsolutePath(), userConfigDir());
        for (Path candidate : candidates) {
            if (candidate.toFile().exists()) {
                return candidate;
            }
        }
        return candidates.get(0);
    }

    static Path userConfigDir() {
        String home = System.getProperty("user.home", "");
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            return appData == null || appData.isBlank() ? null : Paths.get(appData);
        }
        if (os.contains("mac")) {
            return home.isBlank() ? null : Paths.get(home, "Library", "Application Support");
        }
        String xdg = System.getenv("XDG_CONFIG_HOME");
        if (xdg != null && !xdg.isBlank()) {
            return Paths.get(xdg);
        }
        return home.isBlank() ? null : Paths.get(home, ".config");
    }

    /**
     * Expands a leading {@code ~} or {@code ~/} against {@code user.home}.
     */
    public static Path expandHome(String raw) {
        String home = System.getProperty("user.home", "");
        if ("~".equals(raw) && !home.isBlank()) {
            return Paths.get(home);
        }
        if ((raw.startsWith("~/") || raw.startsWith("~\\")) && !home.isBlank()) {
            return Paths.get(home, raw.substring(2));
        }
        return Paths.get(raw);
    }

    public Path configFile() {
        return configFile;
    }

    public Path runDir() {
        Path parent = configFile.getParent();
        return parent == null ? Paths.get(".").toAbsolutePath().normalize() : parent;
    }

    public Path pidFile() {
        return runDir().resolve(PID_FILE);
    }

    public Path portFile() {
        return runDir().resolve(PORT_FILE);
    }
}
