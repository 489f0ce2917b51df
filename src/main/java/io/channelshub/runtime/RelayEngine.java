package io.channelshub.runtime;

import io.channelshub.ssh.ForwardStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Copies bytes between two streams on two daemon threads. When either direction reaches
 * end-of-stream or fails, both streams are closed. Failures stay local to the pair.
 */
public final class RelayEngine {
    private static final Logger LOG = LoggerFactory.getLogger(RelayEngine.class);
    static final int BUFFER_SIZE = 16 * 1024;

    private RelayEngine() {
    }

    public static Relay start(String label, ForwardStream local, ForwardStream remote) {
        Relay relay = new Relay(label, local, remote);
        relay.spawn("relay-" + label + "-out", local, remote, relay.bytesOut);
        relay.spawn("relay-" + label + "-in", remote, local, relay.bytesIn);
        return relay;
    }

    public static final class Relay {
        private final String label;
        private final ForwardStream local;
        private final ForwardStream remote;
        private final AtomicLong bytesOut = new AtomicLong();
        private final AtomicLong bytesIn = new AtomicLong();
        private final AtomicBoolean closed = new AtomicBoolean();
        private final CountDownLatch pumps = new CountDownLatch(2);

        private Relay(String label, ForwardStream local, ForwardStream remote) {
            this.label = label;
            this.local = local;
            this.remote = remote;
        }

        private void spawn(String name, ForwardStream from, ForwardStream to, AtomicLong counter) {
            Thread t = new Thread(() -> pump(from, to, counter), name);
            t.setDaemon(true);
            t.start();
        }

        private void pump(ForwardStream from, ForwardStream to, AtomicLong counter) {
            byte[] buffer = new byte[BUFFER_SIZE];
            try {
                InputStream in = from.input();
                OutputStream out = to.output();
                int n;
                while ((n = in.read(buffer)) >= 0) {
                    if (n == 0) {
                        continue;
                    }
                    out.write(buffer, 0, n);
                    out.flush();
                    counter.addAndGet(n);
                }
            } catch (IOException | RuntimeException e) {
                if (!closed.get()) {
                    LOG.debug("relay {} {} -> {} ended: {}", label, from.describe(), to.describe(), e.getMessage());
                }
            } finally {
                closeBoth();
                pumps.countDown();
            }
        }

        private void closeBoth() {
            if (closed.compareAndSet(false, true)) {
                local.close();
                remote.close();
                LOG.debug("relay {} closed ({} bytes out, {} bytes in)", label, bytesOut.get(), bytesIn.get());
            }
        }

        /** Bytes copied from the local side to the remote side. */
        public long bytesOut() {
            return bytesOut.get();
        }

        /** Bytes copied from the remote side to the local side. */
        public long bytesIn() {
            return bytesIn.get();
        }

        public boolean isClosed() {
            return closed.get();
        }

        public boolean awaitClosed(Duration timeout) throws InterruptedException {
            return pumps.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
    }
}
