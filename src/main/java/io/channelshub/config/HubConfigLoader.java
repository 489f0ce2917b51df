package io.channelshub.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.channelshub.error.ConfigurationException;
import io.channelshub.model.AuthMethod;
import io.channelshub.util.Tomls;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads the TOML configuration file into a {@link HubConfig}.
 *
 * <p>The file is first bound to nullable "file" records, then sanitized into the model
 * with defaults applied. Structural problems (unreadable file, bad TOML, a host without
 * address or credential) fail the whole load; channel-level problems are left for
 * {@link ChannelResolver} so that one bad channel does not block the others.
 */
public final class HubConfigLoader {
    private HubConfigLoader() {
    }

    public static HubConfig load(Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read config file " + file + ": " + e.getMessage(), e);
        }
        return parse(content);
    }

    public static HubConfig parse(String toml) {
        ConfigFile file;
        try {
            file = Tomls.mapper().readValue(toml, ConfigFile.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Failed to parse config: " + e.getOriginalMessage(), e);
        }
        if (file == null) {
            return new HubConfig(List.of(), List.of(), ReconnectionSettings.defaults());
        }
        List<HostConfig> hosts = new ArrayList<>();
        if (file.hosts() != null) {
            for (HostFile host : file.hosts()) {
                hosts.add(toHost(host));
            }
        }
        List<ChannelDefinition> channels = new ArrayList<>();
        if (file.channels() != null) {
            for (ChannelFile channel : file.channels()) {
                channels.add(toChannel(channel, channels.size()));
            }
        }
        Duration startupTimeout = HubConfig.DEFAULT_STARTUP_TIMEOUT;
        if (file.daemon() != null && file.daemon().startupTimeoutSecs() != null) {
            startupTimeout = Duration.ofSeconds(Math.max(1L, file.daemon().startupTimeoutSecs()));
        }
        return new HubConfig(hosts, channels, toReconnection(file.reconnection()), startupTimeout);
    }

    private static HostConfig toHost(HostFile host) {
        String name = required(host.name(), "hosts.name");
        String address = required(host.host(), "host '" + name + "': host");
        String username = required(host.username(), "host '" + name + "': username");
        int port = host.port() == null ? HostConfig.DEFAULT_SSH_PORT : host.port();
        if (port < 1 || port > 65_535) {
            throw new ConfigurationException("host '" + name + "': invalid port " + port);
        }
        if (host.auth() == null) {
            throw new ConfigurationException("host '" + name + "': missing [hosts.auth] table");
        }
        return new HostConfig(name, address, port, username, toAuth(name, host.auth()));
    }

    private static AuthMethod toAuth(String hostName, AuthFile auth) {
        String type = auth.type() == null ? "" : auth.type().trim().toLowerCase(Locale.ROOT);
        return switch (type) {
            case "password" -> new AuthMethod.Password(
                    required(auth.password(), "host '" + hostName + "': auth.password"));
            case "key" -> new AuthMethod.PrivateKey(
                    HubPaths.expandHome(required(auth.keyPath(), "host '" + hostName + "': auth.key_path")),
                    auth.passphrase());
            default -> throw new ConfigurationException(
                    "host '" + hostName + "': unknown auth type '" + auth.type() + "' (expected password or key)");
        };
    }

    private static ChannelDefinition toChannel(ChannelFile channel, int index) {
        String name = channel.name() == null || channel.name().isBlank()
                ? "channel-" + (index + 1)
                : channel.name().trim();
        return new ChannelDefinition(
                name,
                channel.hostname() == null ? "" : channel.hostname().trim(),
                channel.channelType(),
                channel.ports(),
                orDefault(channel.destHost(), ChannelDefinition.DEFAULT_HOST),
                orDefault(channel.listenHost(), ChannelDefinition.DEFAULT_HOST),
                channel.command()
        );
    }

    private static ReconnectionSettings toReconnection(ReconnectionFile file) {
        ReconnectionSettings defaults = ReconnectionSettings.defaults();
        if (file == null) {
            return defaults;
        }
        int maxRetries = file.maxRetries() == null ? defaults.maxRetries() : Math.max(0, file.maxRetries());
        long initial = file.initialDelaySecs() == null
                ? defaults.initialDelay().toSeconds()
                : Math.max(0L, file.initialDelaySecs());
        long max = file.maxDelaySecs() == null ? defaults.maxDelay().toSeconds() : Math.max(0L, file.maxDelaySecs());
        if (max < initial) {
            max = initial;
        }
        boolean exponential = file.useExponentialBackoff() == null
                ? defaults.exponential()
                : file.useExponentialBackoff();
        return new ReconnectionSettings(maxRetries, Duration.ofSeconds(initial), Duration.ofSeconds(max), exponential);
    }

    private static String required(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("Missing required field: " + field);
        }
        return raw.trim();
    }

    private static String orDefault(String raw, String fallback) {
        return raw == null || raw.isBlank() ? fallback : raw.trim();
    }

    record ConfigFile(
            List<HostFile> hosts,
            List<ChannelFile> channels,
            ReconnectionFile reconnection,
            DaemonFile daemon
    ) {
    }

    record HostFile(String name, String host, Integer port, String username, AuthFile auth) {
    }

    record AuthFile(String type, String password, String keyPath, String passphrase) {
    }

    record ChannelFile(
            String name,
            String hostname,
            String channelType,
            String ports,
            String destHost,
            String listenHost,
            String command
    ) {
    }

    record ReconnectionFile(
            Integer maxRetries,
            Long initialDelaySecs,
            Long maxDelaySecs,
            Boolean useExponentialBackoff
    ) {
    }

    record DaemonFile(Long startupTimeoutSecs) {
    }
}
