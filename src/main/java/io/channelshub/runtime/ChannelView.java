package io.channelshub.runtime;

/**
 * Point-in-time view of one channel runner. {@code boundPort} is the port granted by the
 * server for remote forwards and {@code -1} otherwise.
 */
public record ChannelView(String name, String summary, ChannelPhase phase, int boundPort, String lastError) {
}
