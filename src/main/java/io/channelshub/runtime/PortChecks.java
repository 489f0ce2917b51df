package io.channelshub.runtime;

import io.channelshub.config.ChannelResolver;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Local port checks: a bind attempt for the start-up pre-flight and a connect attempt for
 * {@code test}.
 */
public final class PortChecks {
    private PortChecks() {
    }

    public static boolean isAvailable(String host, int port) {
        try (ServerSocket socket = new ServerSocket()) {
            socket.bind(new InetSocketAddress(host, port));
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static List<ChannelResolver.ListenAddress> occupied(List<ChannelResolver.ListenAddress> addresses) {
        List<ChannelResolver.ListenAddress> out = new ArrayList<>();
        for (ChannelResolver.ListenAddress address : addresses) {
            if (!isAvailable(address.host(), address.port())) {
                out.add(address);
            }
        }
        return out;
    }

    public static boolean canConnect(String host, int port, Duration timeout) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}
