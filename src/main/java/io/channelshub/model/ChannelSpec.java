package io.channelshub.model;

/**
 * Flattened runtime descriptor: host fields merged with the channel kind.
 */
public record ChannelSpec(
        String name,
        String hostName,
        String address,
        int port,
        String username,
        AuthMethod auth,
        ChannelKind kind
) {
    public String endpoint() {
        return username + "@" + address + ":" + port;
    }
}
