package io.channelshub.ssh;

/**
 * Receives connections the server forwards back over a remote port forward. Called on a
 * dedicated thread per connection; the handler owns the stream.
 */
@FunctionalInterface
public interface InboundForwardHandler {
    void accept(ForwardStream inbound);
}
