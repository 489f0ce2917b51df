package io.channelshub.ssh;

import java.io.InputStream;

/**
 * A {@code session} channel. Call {@link #requestPty()} before {@link #shell()} to get a
 * terminal; {@link #exec(String)} runs a single command instead.
 */
public interface SessionChannel extends AutoCloseable {

    void requestPty();

    void exec(String command);

    void shell();

    /**
     * Combined stdout/stderr of the remote side. Reaches end-of-stream when the channel closes.
     */
    InputStream output();

    boolean isOpen();

    @Override
    void close();
}
