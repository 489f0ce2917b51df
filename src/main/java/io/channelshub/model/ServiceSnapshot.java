package io.channelshub.model;

/**
 * Point-in-time copy of the orchestrator state.
 */
public record ServiceSnapshot(ServiceState state, int activeChannels, int totalChannels) {
    public ServiceSnapshot {
        if (state == null) {
            throw new IllegalArgumentException("state is required");
        }
        if (activeChannels < 0 || totalChannels < 0) {
            throw new IllegalArgumentException("channel counts must be non-negative");
        }
    }
}
