package io.channelshub.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.channelshub.error.ConfigurationException;
import io.channelshub.model.AuthMethod;
import io.channelshub.util.Tomls;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders a {@link HubConfig} back to the TOML layout {@link HubConfigLoader} reads.
 *
 * <p>Table bodies are serialized from the loader's own file records; this class only adds
 * the table headers and a {@code # Host: name (address)} comment above each host.
 */
public final class ConfigWriter {
    private ConfigWriter() {
    }

    public static void write(Path target, HubConfig config) {
        String content = render(config);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to write config file " + target + ": " + e.getMessage(), e);
        }
    }

    public static String render(HubConfig config) {
        StringBuilder out = new StringBuilder();
        for (HostConfig host : config.hosts()) {
            out.append("# Host: ").append(host.name()).append(" (").append(host.address()).append(")\n");
            table(out, "[[hosts]]", toFile(host));
        }
        for (ChannelDefinition channel : config.channels()) {
            table(out, "[[channels]]", toFile(channel));
        }
        table(out, "[reconnection]", toFile(config.reconnection()));
        if (!HubConfig.DEFAULT_STARTUP_TIMEOUT.equals(config.startupTimeout())) {
            table(out, "[daemon]", new HubConfigLoader.DaemonFile(config.startupTimeout().toSeconds()));
        }
        return out.toString().stripTrailing() + "\n";
    }

    private static void table(StringBuilder out, String header, Object body) {
        String rendered;
        try {
            rendered = Tomls.writer().writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Failed to serialize config: " + e.getOriginalMessage(), e);
        }
        out.append(header).append('\n').append(rendered);
        if (!rendered.endsWith("\n")) {
            out.append('\n');
        }
        out.append('\n');
    }

    private static HubConfigLoader.HostFile toFile(HostConfig host) {
        HubConfigLoader.AuthFile auth;
        if (host.auth() instanceof AuthMethod.Password password) {
            auth = new HubConfigLoader.AuthFile("password", password.secret(), null, null);
        } else if (host.auth() instanceof AuthMethod.PrivateKey key) {
            auth = new HubConfigLoader.AuthFile(
                    "key", null, key.keyPath().toString(), key.passphraseValue().orElse(null));
        } else {
            throw new ConfigurationException("host '" + host.name() + "': cannot write auth " + host.auth().describe());
        }
        return new HubConfigLoader.HostFile(host.name(), host.address(), host.port(), host.username(), auth);
    }

    private static HubConfigLoader.ChannelFile toFile(ChannelDefinition channel) {
        return new HubConfigLoader.ChannelFile(
                channel.name(),
                channel.hostRef(),
                channel.effectiveType(),
                channel.ports(),
                nonDefault(channel.destHost()),
                nonDefault(channel.listenHost()),
                channel.command()
        );
    }

    private static HubConfigLoader.ReconnectionFile toFile(ReconnectionSettings reconnection) {
        return new HubConfigLoader.ReconnectionFile(
                reconnection.maxRetries(),
                reconnection.initialDelay().toSeconds(),
                reconnection.maxDelay().toSeconds(),
                reconnection.exponential()
        );
    }

    private static String nonDefault(String host) {
        return ChannelDefinition.DEFAULT_HOST.equals(host) ? null : host;
    }
}
