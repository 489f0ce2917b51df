package io.channelshub.runtime;

import io.channelshub.config.ChannelDefinition;
import io.channelshub.config.HostConfig;
import io.channelshub.config.HubConfig;
import io.channelshub.config.ReconnectionSettings;
import io.channelshub.error.ServiceException;
import io.channelshub.model.AuthMethod;
import io.channelshub.model.ServiceSnapshot;
import io.channelshub.model.ServiceState;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServiceOrchestratorTest {
    private static final ReconnectionSettings FAST =
            new ReconnectionSettings(0, Duration.ofMillis(50), Duration.ofMillis(200), true);

    private static HostConfig host(String name, String address) {
        return new HostConfig(name, address, 22, "deploy", new AuthMethod.Password("secret"));
    }

    private static ChannelDefinition localForward(String name, String hostRef, int listenPort, int destPort) {
        return new ChannelDefinition(name, hostRef, "direct-tcpip", listenPort + ":" + destPort,
                "127.0.0.1", "127.0.0.1", null);
    }

    private static ChannelDefinition session(String name, String hostRef) {
        return new ChannelDefinition(name, hostRef, "session", null, "127.0.0.1", "127.0.0.1", "uptime");
    }

    private static HubConfig config(List<HostConfig> hosts, List<ChannelDefinition> channels) {
        return new HubConfig(hosts, channels, FAST, Duration.ofSeconds(5));
    }

    @Test
    void unknownHostShouldFailOnlyThatChannel() throws Exception {
        HubConfig config = config(
                List.of(host("web", "web.example.test")),
                List.of(localForward("app", "web", TestSockets.freePort(), 80),
                        localForward("orphan", "missing", TestSockets.freePort(), 80)));
        ServiceOrchestrator orchestrator = new ServiceOrchestrator(new DaemonContext(config, new FakeSshConnector()));

        StartReport report = orchestrator.start();
        try {
            ServiceSnapshot status = orchestrator.status();
            assertEquals(ServiceState.RUNNING, status.state());
            assertEquals(1, status.activeChannels());
            assertEquals(2, status.totalChannels());
            assertEquals(1, report.failed().size());
            assertEquals("orphan", report.failed().get(0).channelName());
            assertTrue(report.failed().get(0).detail().contains("unknown host 'missing'"));
            assertEquals(List.of("app"), orchestrator.channels().stream().map(ChannelView::name).toList());
        } finally {
            orchestrator.stop();
        }
    }

    @Test
    void occupiedListenPortShouldStartNothing() throws Exception {
        FakeSshConnector connector = new FakeSshConnector();
        try (ServerSocket busy = new ServerSocket()) {
            busy.bind(new InetSocketAddress(InetAddress.getByName("127.0.0.1"), 0));
            HubConfig config = config(
                    List.of(host("web", "web.example.test")),
                    List.of(localForward("free", "web", TestSockets.freePort(), 80),
                            localForward("taken", "web", busy.getLocalPort(), 80),
                            session("shell", "web")));
            ServiceOrchestrator orchestrator = new ServiceOrchestrator(new DaemonContext(config, connector));

            ServiceException error = assertThrows(ServiceException.class, orchestrator::start);

            assertTrue(error.getMessage().contains(Integer.toString(busy.getLocalPort())));
            assertTrue(orchestrator.state().is(ServiceState.Phase.FAILED));
            assertEquals(0, orchestrator.status().activeChannels());
            assertEquals(0, connector.connectCalls());
            assertTrue(orchestrator.channels().isEmpty());
        }
    }

    @Test
    void mixedCaseChannelTypeShouldStillBePortChecked() throws Exception {
        FakeSshConnector connector = new FakeSshConnector();
        try (ServerSocket busy = new ServerSocket()) {
            busy.bind(new InetSocketAddress(InetAddress.getByName("127.0.0.1"), 0));
            HubConfig config = config(
                    List.of(host("web", "web.example.test")),
                    List.of(localForward("free", "web", TestSockets.freePort(), 80),
                            new ChannelDefinition("taken", "web", "Direct-TCPIP", busy.getLocalPort() + ":80",
                                    "127.0.0.1", "127.0.0.1", null)));
            ServiceOrchestrator orchestrator = new ServiceOrchestrator(new DaemonContext(config, connector));

            assertThrows(ServiceException.class, orchestrator::start);

            assertTrue(orchestrator.state().is(ServiceState.Phase.FAILED));
            assertEquals(0, connector.connectCalls());
        }
    }

    @Test
    void statusShouldBeStableBetweenMutations() {
        HubConfig config = config(List.of(host("web", "web.example.test")), List.of(session("shell", "web")));
        ServiceOrchestrator orchestrator = new ServiceOrchestrator(new DaemonContext(config, new FakeSshConnector()));
        assertEquals(orchestrator.status(), orchestrator.status());

        orchestrator.start();
        try {
            assertEquals(orchestrator.status(), orchestrator.status());
        } finally {
            orchestrator.stop();
        }
        assertEquals(new ServiceSnapshot(ServiceState.STOPPED, 0, 1), orchestrator.status());
    }

    @Test
    void stopShouldRejectNonRunningStates() {
        HubConfig config = config(List.of(), List.of(session("shell", "nowhere")));
        ServiceOrchestrator orchestrator = new ServiceOrchestrator(new DaemonContext(config, new FakeSshConnector()));

        assertThrows(ServiceException.class, orchestrator::stop);
        assertEquals(ServiceState.STOPPED, orchestrator.state());

        assertThrows(ServiceException.class, orchestrator::start);
        ServiceState failed = orchestrator.state();
        assertTrue(failed.is(ServiceState.Phase.FAILED));
        assertThrows(ServiceException.class, orchestrator::stop);
        assertEquals(failed, orchestrator.state());
    }

    @Test
    void activeCountShouldMatchSuccessfulFirstAttempts() {
        FakeSshConnector connector = new FakeSshConnector().failHost("down.example.test");
        HubConfig config = config(
                List.of(host("up", "up.example.test"), host("down", "down.example.test")),
                List.of(session("a", "up"), session("b", "down"), session("c", "up")));
        ServiceOrchestrator orchestrator = new ServiceOrchestrator(new DaemonContext(config, connector));

        StartReport report = orchestrator.start();
        try {
            ServiceSnapshot status = orchestrator.status();
            assertEquals(2, status.activeChannels());
            assertEquals(3, status.totalChannels());
            assertTrue(status.activeChannels() <= status.totalChannels());
            assertEquals(2, report.started().size());
            assertEquals("b", report.failed().get(0).channelName());
            assertEquals(3, orchestrator.channels().size());
        } finally {
            orchestrator.stop();
        }
    }

    @Test
    void allChannelsFailingShouldLeaveFailedStateThatCanBeReset() {
        FakeSshConnector connector = new FakeSshConnector();
        HubConfig broken = config(List.of(), List.of(session("a", "ghost"), session("b", "ghost")));
        ServiceOrchestrator orchestrator = new ServiceOrchestrator(new DaemonContext(broken, connector));

        ServiceException error = assertThrows(ServiceException.class, orchestrator::start);
        assertTrue(error.getMessage().contains("a:"));
        assertTrue(error.getMessage().contains("b:"));
        assertEquals(0, connector.connectCalls());

        assertThrows(ServiceException.class, orchestrator::start);
        orchestrator.reset();
        assertEquals(ServiceState.STOPPED, orchestrator.state());
        assertThrows(ServiceException.class, orchestrator::reset);
    }

    @Test
    void restartShouldBringChannelsBack() {
        FakeSshConnector connector = new FakeSshConnector();
        HubConfig config = config(List.of(host("web", "web.example.test")), List.of(session("shell", "web")));
        DaemonContext context = new DaemonContext(config, connector);
        ServiceOrchestrator orchestrator = new ServiceOrchestrator(context);

        orchestrator.start();
        orchestrator.restart();
        try {
            assertEquals(ServiceState.RUNNING, orchestrator.state());
            assertEquals(1, orchestrator.status().activeChannels());
            assertEquals(2, connector.connectCalls());
            assertFalse(connector.connections().get(0).isOpen());
        } finally {
            orchestrator.stop();
        }
        assertTrue(connector.connections().stream().noneMatch(FakeSshConnector.FakeConnection::isOpen));
    }
}
