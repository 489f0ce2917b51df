package io.channelshub.ssh;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;

/**
 * A bidirectional byte stream: a TCP socket or an SSH forwarding channel.
 */
public interface ForwardStream extends AutoCloseable {

    InputStream input() throws IOException;

    OutputStream output() throws IOException;

    /**
     * Signals end-of-stream to the peer while still allowing reads.
     */
    default void shutdownOutput() throws IOException {
        output().close();
    }

    String describe();

    @Override
    void close();

    static ForwardStream ofSocket(Socket socket) {
        return new SocketStream(socket);
    }

    final class SocketStream implements ForwardStream {
        private static final Logger LOG = LoggerFactory.getLogger(SocketStream.class);
        private final Socket socket;

        private SocketStream(Socket socket) {
            this.socket = socket;
        }

        @Override
        public InputStream input() throws IOException {
            return socket.getInputStream();
        }

        @Override
        public OutputStream output() throws IOException {
            return socket.getOutputStream();
        }

        @Override
        public void shutdownOutput() throws IOException {
            if (!socket.isClosed() && !socket.isOutputShutdown()) {
                socket.shutdownOutput();
            }
        }

        @Override
        public String describe() {
            return String.valueOf(socket.getRemoteSocketAddress());
        }

        @Override
        public void close() {
            try {
                socket.close();
            } catch (IOException e) {
                LOG.debug("close {} failed: {}", describe(), e.getMessage());
            }
        }
    }
}
