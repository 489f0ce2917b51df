package io.channelshub.config;

import io.channelshub.error.ConfigurationException;
import io.channelshub.model.AuthMethod;
import org.apache.sshd.client.config.hosts.HostConfigEntry;
import org.apache.sshd.client.config.hosts.HostPatternsHolder;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Imports hosts from an OpenSSH client config ({@code ~/.ssh/config}).
 *
 * <p>Blocks are read with MINA's {@link HostConfigEntry} reader; only {@code HostName},
 * {@code Port}, {@code User} and {@code IdentityFile} are used. A {@code Host *} block (or
 * settings before the first {@code Host}) supplies defaults to the blocks that follow it.
 * Blocks without a {@code HostName} are patterns and are skipped. When a {@code Host} line
 * lists several aliases, the first one names the entry. {@code Match} sections are rejected
 * by the reader.
 */
public final class SshConfigImporter {
    public static final String PASSWORD_PLACEHOLDER = "CHANGE_ME";

    private SshConfigImporter() {
    }

    public static Path defaultSshConfigPath() {
        return HubPaths.expandHome("~/.ssh/config");
    }

    public static List<SshConfigEntry> read(Path file) {
        Path resolved = HubPaths.expandHome(file.toString());
        try {
            return fromEntries(HostConfigEntry.readHostConfigEntries(resolved));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read SSH config file " + resolved + ": " + e.getMessage(), e);
        }
    }

    public static List<SshConfigEntry> parse(String content) {
        try {
            return fromEntries(HostConfigEntry.readHostConfigEntries(new StringReader(content), true));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to parse SSH config: " + e.getMessage(), e);
        }
    }

    static List<SshConfigEntry> fromEntries(List<HostConfigEntry> blocks) {
        List<SshConfigEntry> entries = new ArrayList<>();
        HostConfigEntry defaults = null;
        for (HostConfigEntry block : blocks) {
            String alias = block.getHost().trim().split("[,\\s]+")[0];
            if (HostPatternsHolder.ALL_HOSTS_PATTERN.equals(alias)) {
                defaults = block;
                continue;
            }
            String hostName = block.getHostName();
            if (hostName == null || hostName.isBlank()) {
                continue;
            }
            Integer port = parsePort(property(block, defaults, HostConfigEntry.PORT_CONFIG_PROP));
            String identity = firstIdentity(block);
            if (identity == null && defaults != null) {
                identity = firstIdentity(defaults);
            }
            entries.add(new SshConfigEntry(
                    alias,
                    hostName,
                    port,
                    property(block, defaults, HostConfigEntry.USER_CONFIG_PROP),
                    identity == null ? null : HubPaths.expandHome(identity)
            ));
        }
        return entries;
    }

    /**
     * Builds host entries for the generated config. Entries without a user are dropped;
     * entries without an identity file get a placeholder password.
     */
    public static List<HostConfig> toHosts(List<SshConfigEntry> entries) {
        List<HostConfig> hosts = new ArrayList<>();
        for (SshConfigEntry entry : entries) {
            if (entry.hostName() == null || entry.user() == null) {
                continue;
            }
            AuthMethod auth = entry.identity()
                    .<AuthMethod>map(path -> new AuthMethod.PrivateKey(path, null))
                    .orElseGet(() -> new AuthMethod.Password(PASSWORD_PLACEHOLDER));
            int port = entry.port() == null ? HostConfig.DEFAULT_SSH_PORT : entry.port();
            hosts.add(new HostConfig(entry.alias(), entry.hostName(), port, entry.user(), auth));
        }
        return hosts;
    }

    private static String property(HostConfigEntry block, HostConfigEntry defaults, String name) {
        String value = block.getProperty(name);
        if (value == null && defaults != null) {
            value = defaults.getProperty(name);
        }
        return value;
    }

    private static String firstIdentity(HostConfigEntry block) {
        return block.getIdentities().stream().findFirst().orElse(null);
    }

    private static Integer parsePort(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            int port = Integer.parseInt(raw.trim());
            return port >= 0 && port <= 65_535 ? port : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
