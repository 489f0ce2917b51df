package io.channelshub.runtime;

import io.channelshub.ssh.ForwardStream;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RelayEngineTest {
    @Test
    void relayShouldCopyBothWaysAndCountBytes() throws Exception {
        try (ServerSocket echo = TestSockets.echoServer();
             ServerSocket front = new ServerSocket()) {
            front.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
            try (Socket client = new Socket(InetAddress.getLoopbackAddress(), front.getLocalPort())) {
                Socket accepted = front.accept();
                Socket upstream = new Socket(InetAddress.getLoopbackAddress(), echo.getLocalPort());
                RelayEngine.Relay relay = RelayEngine.start("test",
                        ForwardStream.ofSocket(accepted), ForwardStream.ofSocket(upstream));

                byte[] payload = "ping through the relay".getBytes(StandardCharsets.UTF_8);
                OutputStream out = client.getOutputStream();
                out.write(payload);
                out.flush();
                InputStream in = client.getInputStream();
                assertArrayEquals(payload, TestSockets.readExactly(in, payload.length));

                client.close();
                assertTrue(relay.awaitClosed(Duration.ofSeconds(5)));
                assertTrue(relay.isClosed());
                assertEquals(payload.length, relay.bytesOut());
                assertEquals(payload.length, relay.bytesIn());
            }
        }
    }

    @Test
    void upstreamClosingShouldCloseClientSide() throws Exception {
        try (ServerSocket upstreamServer = new ServerSocket();
             ServerSocket front = new ServerSocket()) {
            upstreamServer.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
            front.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
            try (Socket client = new Socket(InetAddress.getLoopbackAddress(), front.getLocalPort())) {
                Socket accepted = front.accept();
                Socket upstream = new Socket(InetAddress.getLoopbackAddress(), upstreamServer.getLocalPort());
                Socket upstreamPeer = upstreamServer.accept();
                RelayEngine.Relay relay = RelayEngine.start("test",
                        ForwardStream.ofSocket(accepted), ForwardStream.ofSocket(upstream));

                upstreamPeer.close();

                assertTrue(relay.awaitClosed(Duration.ofSeconds(5)));
                client.setSoTimeout(5_000);
                assertEquals(-1, client.getInputStream().read());
            }
        }
    }
}
