package io.channelshub.config;

import io.channelshub.error.ConfigurationException;
import io.channelshub.model.AuthMethod;
import io.channelshub.model.ChannelKind;
import io.channelshub.model.ChannelSpec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChannelResolverTest {
    private static final HostConfig WEB =
            new HostConfig("web", "web.example.com", 2200, "deploy", new AuthMethod.Password("pw"));

    private static ChannelDefinition channel(String name, String host, String type, String ports) {
        return new ChannelDefinition(name, host, type, ports, "10.0.0.5", "0.0.0.0", null);
    }

    private static HubConfig config(ChannelDefinition... channels) {
        return new HubConfig(List.of(WEB), List.of(channels), ReconnectionSettings.defaults());
    }

    @Test
    void localForwardShouldUseListenThenDestinationPort() {
        HubConfig config = config(channel("db", "web", "direct-tcpip", "15432:5432"));
        ChannelSpec spec = ChannelResolver.resolve(config, config.channels().get(0));

        assertEquals("deploy@web.example.com:2200", spec.endpoint());
        ChannelKind.LocalForward kind = assertInstanceOf(ChannelKind.LocalForward.class, spec.kind());
        assertEquals(new ChannelKind.LocalForward("0.0.0.0", 15432, "10.0.0.5", 5432), kind);
    }

    @Test
    void remoteForwardShouldUseLocalConnectThenRemoteBindPort() {
        HubConfig config = config(channel("expose", "web", "forwarded-tcpip", "80:8022"));
        ChannelSpec spec = ChannelResolver.resolve(config, config.channels().get(0));

        assertEquals(new ChannelKind.RemoteForward(8022, "10.0.0.5", 80), spec.kind());
    }

    @Test
    void sessionShouldNotNeedPorts() {
        HubConfig config = config(new ChannelDefinition("sh", "web", "session", null, "127.0.0.1", "127.0.0.1", "top"));
        ChannelSpec spec = ChannelResolver.resolve(config, config.channels().get(0));
        assertEquals(new ChannelKind.Session("top"), spec.kind());
        assertEquals(ChannelKind.Type.SESSION, spec.kind().type());
    }

    @Test
    void forwardsShouldRequireBothPorts() {
        for (String type : List.of("direct-tcpip", "forwarded-tcpip")) {
            for (String ports : new String[]{null, "8080", ":80", "8080:"}) {
                HubConfig config = config(channel("bad", "web", type, ports));
                ConfigurationException error = assertThrows(ConfigurationException.class,
                        () -> ChannelResolver.resolve(config, config.channels().get(0)));
                assertTrue(error.getMessage().startsWith("Channel 'bad'"), error.getMessage());
            }
        }
    }

    @Test
    void channelTypeShouldBeCaseInsensitiveEverywhere() {
        HubConfig config = config(
                channel("upper", "web", " Direct-TCPIP ", "9100:80"),
                channel("remote", "web", "FORWARDED-TCPIP", "80:9022"));

        assertEquals(ChannelKind.Type.LOCAL_FORWARD,
                ChannelResolver.resolve(config, config.channels().get(0)).kind().type());
        assertEquals(ChannelKind.Type.REMOTE_FORWARD,
                ChannelResolver.resolve(config, config.channels().get(1)).kind().type());
        assertEquals(List.of(new ChannelResolver.ListenAddress("upper", "0.0.0.0", 9100)),
                ChannelResolver.localListenAddresses(config));
    }

    @Test
    void unknownChannelTypeShouldBeRejected() {
        HubConfig config = config(channel("odd", "web", "x11", "1:2"));
        ConfigurationException error = assertThrows(ConfigurationException.class,
                () -> ChannelResolver.resolve(config, config.channels().get(0)));
        assertTrue(error.getMessage().contains("unknown channel_type 'x11'"));
    }

    @Test
    void resolveAllShouldCollectFailuresPerChannel() {
        HubConfig config = config(
                channel("ok", "web", null, "8080:80"),
                channel("ghost", "missing", null, "8081:80"),
                channel("broken", "web", "direct-tcpip", "8082"));

        ChannelResolver.Resolution resolution = ChannelResolver.resolveAll(config);

        assertEquals(List.of("ok"), resolution.channels().stream().map(ChannelSpec::name).toList());
        assertEquals(2, resolution.failures().size());
        assertEquals("ghost", resolution.failures().get(0).channelName());
        assertEquals("Channel 'ghost' references unknown host 'missing'", resolution.failures().get(0).message());
        assertEquals("broken", resolution.failures().get(1).channelName());
    }

    @Test
    void listenAddressesShouldCoverParseableLocalForwardsOnly() {
        HubConfig config = config(
                channel("a", "web", null, "8080:80"),
                channel("b", "missing", "direct-tcpip", "8081:80"),
                channel("c", "web", "direct-tcpip", "oops"),
                channel("d", "web", "forwarded-tcpip", "80:8022"));

        List<ChannelResolver.ListenAddress> addresses = ChannelResolver.localListenAddresses(config);

        assertEquals(List.of(
                new ChannelResolver.ListenAddress("a", "0.0.0.0", 8080),
                new ChannelResolver.ListenAddress("b", "0.0.0.0", 8081)), addresses);
    }
}
