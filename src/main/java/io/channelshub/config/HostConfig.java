package io.channelshub.config;

import io.channelshub.model.AuthMethod;

public record HostConfig(String name, String address, int port, String username, AuthMethod auth) {
    public static final int DEFAULT_SSH_PORT = 22;
}
