package io.channelshub.config;

import io.channelshub.error.ConfigurationException;
import io.channelshub.model.ChannelKind;
import io.channelshub.model.ChannelSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns {@link ChannelDefinition}s into runtime {@link ChannelSpec}s. Pure: no sockets are
 * opened here, so configuration errors always surface before any network I/O.
 */
public final class ChannelResolver {
    private static final Logger LOG = LoggerFactory.getLogger(ChannelResolver.class);

    private ChannelResolver() {
    }

    public static Resolution resolveAll(HubConfig config) {
        List<ChannelSpec> resolved = new ArrayList<>();
        List<Failure> failures = new ArrayList<>();
        for (ChannelDefinition definition : config.channels()) {
            try {
                resolved.add(resolve(config, definition));
            } catch (ConfigurationException e) {
                failures.add(new Failure(definition.name(), e.getMessage()));
            }
        }
        return new Resolution(resolved, failures);
    }

    public static ChannelSpec resolve(HubConfig config, ChannelDefinition definition) {
        HostConfig host = config.host(definition.hostRef()).orElseThrow(() -> new ConfigurationException(
                "Channel '" + definition.name() + "' references unknown host '" + definition.hostRef() + "'"));
        return new ChannelSpec(
                definition.name(),
                host.name(),
                host.address(),
                host.port(),
                host.username(),
                host.auth(),
                kindOf(definition)
        );
    }

    static ChannelKind kindOf(ChannelDefinition definition) {
        switch (definition.effectiveType()) {
            case "direct-tcpip" -> {
                PortPair ports = requirePorts(definition, "direct-tcpip requires ports local:remote (e.g. 8080:80)");
                return new ChannelKind.LocalForward(
                        definition.listenHost(), ports.first(), definition.destHost(), ports.second());
            }
            case "forwarded-tcpip" -> {
                // first = local connect port, second = remote bind port
                PortPair ports = requirePorts(definition, "forwarded-tcpip requires ports local:remote (e.g. 80:8022)");
                return new ChannelKind.RemoteForward(ports.second(), definition.destHost(), ports.first());
            }
            case "session" -> {
                return new ChannelKind.Session(definition.command());
            }
            default -> throw new ConfigurationException("Channel '" + definition.name()
                    + "': unknown channel_type '" + definition.channelType()
                    + "' (expected direct-tcpip, forwarded-tcpip or session)");
        }
    }

    /**
     * Listen addresses of every local-forward channel whose ports parse, regardless of
     * whether its host resolves. Used by the start-up port check.
     */
    public static List<ListenAddress> localListenAddresses(HubConfig config) {
        List<ListenAddress> out = new ArrayList<>();
        for (ChannelDefinition definition : config.channels()) {
            if (!definition.isLocalForward()) {
                continue;
            }
            try {
                PortPair ports = PortPair.parse(definition.name(), definition.ports());
                out.add(new ListenAddress(definition.name(), definition.listenHost(), ports.first()));
            } catch (ConfigurationException e) {
                LOG.debug("Skipping port check for channel '{}': {}", definition.name(), e.getMessage());
            }
        }
        return out;
    }

    private static PortPair requirePorts(ChannelDefinition definition, String hint) {
        try {
            return PortPair.parse(definition.name(), definition.ports());
        } catch (ConfigurationException e) {
            throw new ConfigurationException("Channel '" + definition.name() + "': " + hint + ": " + e.getMessage(), e);
        }
    }

    public record Resolution(List<ChannelSpec> channels, List<Failure> failures) {
    }

    public record Failure(String channelName, String message) {
    }

    public record ListenAddress(String channelName, String host, int port) {
        @Override
        public String toString() {
            return host + ":" + port;
        }
    }
}
