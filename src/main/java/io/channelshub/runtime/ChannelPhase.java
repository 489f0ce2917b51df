package io.channelshub.runtime;

public enum ChannelPhase {
    IDLE,
    CONNECTING,
    AUTHENTICATING,
    CHANNEL_ACTIVE,
    BACKOFF_WAIT,
    STOPPED
}
