package io.channelshub.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Validated in-memory configuration handed to the orchestrator.
 */
public record HubConfig(
        List<HostConfig> hosts,
        List<ChannelDefinition> channels,
        ReconnectionSettings reconnection,
        Duration startupTimeout
) {
    public static final Duration DEFAULT_STARTUP_TIMEOUT = Duration.ofSeconds(15);

    public HubConfig {
        hosts = hosts == null ? List.of() : List.copyOf(hosts);
        channels = channels == null ? List.of() : List.copyOf(channels);
        reconnection = reconnection == null ? ReconnectionSettings.defaults() : reconnection;
        startupTimeout = startupTimeout == null ? DEFAULT_STARTUP_TIMEOUT : startupTimeout;
    }

    public HubConfig(List<HostConfig> hosts, List<ChannelDefinition> channels, ReconnectionSettings reconnection) {
        this(hosts, channels, reconnection, DEFAULT_STARTUP_TIMEOUT);
    }

    public Optional<HostConfig> host(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return hosts.stream().filter(h -> name.equals(h.name())).findFirst();
    }
}
