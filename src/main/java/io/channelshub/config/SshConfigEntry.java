package io.channelshub.config;

import java.nio.file.Path;
import java.util.Optional;

/**
 * One concrete {@code Host} block of an OpenSSH client config, with {@code Host *}
 * defaults already folded in.
 */
public record SshConfigEntry(String alias, String hostName, Integer port, String user, Path identityFile) {

    public Optional<Path> identity() {
        return Optional.ofNullable(identityFile);
    }
}
