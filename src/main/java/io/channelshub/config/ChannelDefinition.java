package io.channelshub.config;

import java.util.Locale;

/**
 * A channel as written in the configuration file, before it is resolved against its host.
 * {@code channelType} and {@code ports} are kept raw; {@link ChannelResolver} interprets them.
 */
public record ChannelDefinition(
        String name,
        String hostRef,
        String channelType,
        String ports,
        String destHost,
        String listenHost,
        String command
) {
    public static final String DEFAULT_CHANNEL_TYPE = "direct-tcpip";
    public static final String DEFAULT_HOST = "127.0.0.1";

    /**
     * Channel type trimmed and lower-cased, {@code direct-tcpip} when unset.
     */
    public String effectiveType() {
        return channelType == null || channelType.isBlank()
                ? DEFAULT_CHANNEL_TYPE
                : channelType.trim().toLowerCase(Locale.ROOT);
    }

    public boolean isRemoteForward() {
        return "forwarded-tcpip".equals(effectiveType());
    }

    public boolean isLocalForward() {
        return DEFAULT_CHANNEL_TYPE.equals(effectiveType());
    }
}
