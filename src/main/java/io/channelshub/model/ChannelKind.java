package io.channelshub.model;

import java.util.Optional;

/**
 * Kind-specific part of a resolved channel. Decided once when the channel is resolved;
 * consumers switch on {@link #type()}, and each type maps to exactly one record.
 */
public sealed interface ChannelKind
        permits ChannelKind.LocalForward, ChannelKind.RemoteForward, ChannelKind.Session {

    Type type();

    /**
     * One-line human description, e.g. {@code listen 127.0.0.1:8080 -> db:5432}.
     */
    String summary();

    enum Type {
        LOCAL_FORWARD("direct-tcpip"),
        REMOTE_FORWARD("forwarded-tcpip"),
        SESSION("session");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    record LocalForward(String listenHost, int listenPort, String destHost, int destPort) implements ChannelKind {
        @Override
        public Type type() {
            return Type.LOCAL_FORWARD;
        }

        @Override
        public String summary() {
            return "listen " + listenHost + ":" + listenPort + " -> " + destHost + ":" + destPort;
        }
    }

    record RemoteForward(int remoteBindPort, String localHost, int localPort) implements ChannelKind {
        @Override
        public Type type() {
            return Type.REMOTE_FORWARD;
        }

        @Override
        public String summary() {
            return "remote " + remoteBindPort + " -> local " + localHost + ":" + localPort;
        }
    }

    record Session(String command) implements ChannelKind {
        @Override
        public Type type() {
            return Type.SESSION;
        }

        public Optional<String> commandValue() {
            return command == null || command.isBlank() ? Optional.empty() : Optional.of(command);
        }

        @Override
        public String summary() {
            return commandValue().map(c -> "exec '" + c + "'").orElse("shell");
        }
    }
}
