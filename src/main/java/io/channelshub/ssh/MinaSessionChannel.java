package io.channelshub.ssh;

import io.channelshub.error.HubException;
import org.apache.sshd.client.channel.ChannelExec;
import org.apache.sshd.client.channel.ChannelShell;
import org.apache.sshd.client.channel.ClientChannel;
import org.apache.sshd.client.session.ClientSession;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;

final class MinaSessionChannel implements SessionChannel {
    static final String PTY_TYPE = "xterm";

    private final ClientSession session;
    private final Duration openTimeout;
    private boolean pty;
    private ClientChannel channel;

    MinaSessionChannel(ClientSession session, Duration openTimeout) {
        this.session = session;
        this.openTimeout = openTimeout;
    }

    @Override
    public void requestPty() {
        pty = true;
    }

    @Override
    public void exec(String command) {
        try {
            ChannelExec exec = session.createExecChannel(command);
            exec.setRedirectErrorStream(true);
            open(exec);
        } catch (IOException e) {
            throw HubException.channel("Failed to exec '" + command + "': " + e.getMessage(), e);
        }
    }

    @Override
    public void shell() {
        try {
            ChannelShell shell = session.createShellChannel();
            shell.setUsePty(pty);
            if (pty) {
                shell.setPtyType(PTY_TYPE);
            }
            shell.setRedirectErrorStream(true);
            open(shell);
        } catch (IOException e) {
            throw HubException.channel("Failed to open shell: " + e.getMessage(), e);
        }
    }

    private void open(ClientChannel opened) throws IOException {
        if (channel != null) {
            throw new IllegalStateException("session channel already opened");
        }
        channel = opened;
        opened.open().verify(openTimeout.toMillis());
    }

    @Override
    public InputStream output() {
        if (channel == null) {
            throw new IllegalStateException("session channel not opened");
        }
        return channel.getInvertedOut();
    }

    @Override
    public boolean isOpen() {
        return channel != null && channel.isOpen();
    }

    @Override
    public void close() {
        if (channel != null) {
            channel.close(false);
        }
    }
}
