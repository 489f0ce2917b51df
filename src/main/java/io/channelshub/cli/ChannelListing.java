package io.channelshub.cli;

import io.channelshub.config.ChannelDefinition;
import io.channelshub.config.HostConfig;
import io.channelshub.model.ServiceSnapshot;
import io.channelshub.model.ServiceState;

import java.util.ArrayList;
import java.util.List;

/**
 * Text rendering shared by {@code status} and {@code validate}.
 */
final class ChannelListing {
    private ChannelListing() {
    }

    static String stateLabel(ServiceState state) {
        return switch (state.phase()) {
            case RUNNING -> "[+] Running";
            case STOPPED -> "[-] Stopped";
            case STARTING -> "[~] Starting";
            case STOPPING -> "[~] Stopping";
            case FAILED -> "[x] Error";
        };
    }

    static List<String> statusLines(ServiceSnapshot snapshot, String configFile) {
        List<String> out = new ArrayList<>();
        out.add("Service Status:");
        out.add("  State: " + stateLabel(snapshot.state()));
        out.add("  Active Channels: " + snapshot.activeChannels() + "/" + snapshot.totalChannels());
        out.add("  Config: " + configFile);
        return out;
    }

    static List<String> channelLines(List<ChannelDefinition> channels) {
        List<String> out = new ArrayList<>();
        if (channels.isEmpty()) {
            return out;
        }
        out.add("  Channels:");
        for (ChannelDefinition channel : channels) {
            out.add("    - " + describe(channel));
        }
        return out;
    }

    static String describe(ChannelDefinition channel) {
        String first = portSide(channel.ports(), 0);
        String second = portSide(channel.ports(), 1);
        String type = channel.effectiveType();
        if (channel.isRemoteForward()) {
            return String.format("%s \tremote %5s -> local %s:%s (host: %s)",
                    channel.name(), second, channel.destHost(), first, channel.hostRef());
        }
        if ("session".equals(type)) {
            String command = channel.command() == null ? "shell" : channel.command();
            return String.format("%s \tsession %s (host: %s)", channel.name(), command, channel.hostRef());
        }
        return String.format("%s \tlisten %5s -> %s:%s (host: %s)",
                channel.name(), first, channel.destHost(), second, channel.hostRef());
    }

    // raw text of one side of "a:b", "?" when absent
    private static String portSide(String ports, int index) {
        if (ports == null) {
            return "?";
        }
        String[] parts = ports.trim().split(":", -1);
        if (parts.length != 2 || parts[index].isBlank()) {
            return "?";
        }
        return parts[index].trim();
    }

    static String describe(HostConfig host) {
        return host.name() + " (" + host.address() + ")";
    }
}
