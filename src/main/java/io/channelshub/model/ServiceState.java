package io.channelshub.model;

/**
 * Orchestrator state. {@code reason} is only set for {@link Phase#FAILED}.
 */
public record ServiceState(Phase phase, String reason) {
    public static final ServiceState STOPPED = new ServiceState(Phase.STOPPED, null);
    public static final ServiceState STARTING = new ServiceState(Phase.STARTING, null);
    public static final ServiceState RUNNING = new ServiceState(Phase.RUNNING, null);
    public static final ServiceState STOPPING = new ServiceState(Phase.STOPPING, null);

    public enum Phase {
        STOPPED("Stopped"),
        STARTING("Starting"),
        RUNNING("Running"),
        STOPPING("Stopping"),
        FAILED("Error");

        private final String wireName;

        Phase(String wireName) {
            this.wireName = wireName;
        }

        /**
         * Name used on the control-plane wire. {@code FAILED} travels as {@code Error}.
         */
        public String wireName() {
            return wireName;
        }

        public static Phase fromWireName(String raw) {
            if (raw != null) {
                for (Phase phase : values()) {
                    if (phase.wireName.equals(raw.trim())) {
                        return phase;
                    }
                }
            }
            throw new IllegalArgumentException("Unknown state: " + raw);
        }
    }

    public static ServiceState failed(String reason) {
        return new ServiceState(Phase.FAILED, reason == null ? "" : reason);
    }

    public static ServiceState of(Phase phase) {
        return switch (phase) {
            case STOPPED -> STOPPED;
            case STARTING -> STARTING;
            case RUNNING -> RUNNING;
            case STOPPING -> STOPPING;
            case FAILED -> failed("");
        };
    }

    public boolean is(Phase expected) {
        return phase == expected;
    }

    public String display() {
        if (phase == Phase.FAILED && reason != null && !reason.isBlank()) {
            return phase.wireName() + " (" + reason + ")";
        }
        return phase.wireName();
    }
}
