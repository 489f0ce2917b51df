package io.channelshub.runtime;

import io.channelshub.config.HubConfig;
import io.channelshub.ssh.SshConnector;

import java.util.Objects;

/**
 * Everything one daemon run shares: its configuration, the SSH connector and the shutdown
 * signal that the control plane fires on {@code stop}.
 */
public record DaemonContext(HubConfig config, SshConnector connector, CancellationSignal shutdown) {
    public DaemonContext {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(connector, "connector");
        Objects.requireNonNull(shutdown, "shutdown");
    }

    public DaemonContext(HubConfig config, SshConnector connector) {
        this(config, connector, CancellationSignal.create());
    }
}
