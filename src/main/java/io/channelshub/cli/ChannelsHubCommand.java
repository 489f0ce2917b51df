package io.channelshub.cli;

import io.channelshub.config.ChannelDefinition;
import io.channelshub.config.ChannelResolver;
import io.channelshub.config.ConfigWriter;
import io.channelshub.config.HostConfig;
import io.channelshub.config.HubConfig;
import io.channelshub.config.HubConfigLoader;
import io.channelshub.config.HubPaths;
import io.channelshub.config.PortPair;
import io.channelshub.config.ReconnectionSettings;
import io.channelshub.config.SshConfigEntry;
import io.channelshub.config.SshConfigImporter;
import io.channelshub.control.ControlPlaneClient;
import io.channelshub.control.ControlPlaneServer;
import io.channelshub.control.RunFiles;
import io.channelshub.error.HubException;
import io.channelshub.model.AuthMethod;
import io.channelshub.model.ServiceSnapshot;
import io.channelshub.model.ServiceState;
import io.channelshub.runtime.DaemonContext;
import io.channelshub.runtime.PortChecks;
import io.channelshub.runtime.ServiceOrchestrator;
import io.channelshub.runtime.StartReport;
import io.channelshub.security.SecretMasker;
import io.channelshub.ssh.MinaSshConnector;
import io.channelshub.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.ScopeType;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Command(
        name = "ssh-channels-hub",
        mixinStandardHelpOptions = true,
        description = "Create and manage long-lived SSH channels",
        subcommands = {
                ChannelsHubCommand.StartCommand.class,
                ChannelsHubCommand.StopCommand.class,
                ChannelsHubCommand.RestartCommand.class,
                ChannelsHubCommand.StatusCommand.class,
                ChannelsHubCommand.ValidateCommand.class,
                ChannelsHubCommand.GenerateCommand.class,
                ChannelsHubCommand.TestCommand.class
        }
)
public final class ChannelsHubCommand implements Runnable {
    static final Duration TEST_CONNECT_TIMEOUT = Duration.ofSeconds(2);
    static final Duration STOP_SETTLE_TIME = Duration.ofMillis(600);
    static final Duration SHUTDOWN_HOOK_WAIT = Duration.ofSeconds(10);

    @Option(names = {"-c", "--config"}, scope = ScopeType.INHERIT, description = "Configuration file path")
    String config;

    boolean debug;

    @Option(names = {"-d", "--debug"}, scope = ScopeType.INHERIT, description = "Enable debug logging")
    void setDebug(boolean debug) {
        this.debug = debug;
        if (debug) {
            Logging.enableDebug();
        }
    }

    @Override
    public void run() {
        System.out.println("Use subcommands: start | stop | restart | status | validate | generate | test");
    }

    HubPaths paths() {
        return HubPaths.fromOption(config);
    }

    static int fail(String message) {
        System.err.println("Error: " + message);
        return 1;
    }

    private static void pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Command(name = "start", description = "Start the service")
    static final class StartCommand implements Callable<Integer> {
        @ParentCommand
        ChannelsHubCommand parent;

        @Option(names = {"-D", "--daemon"}, description = "Run in the background as a detached process")
        boolean daemon;

        @Override
        public Integer call() {
            HubPaths paths = parent.paths();
            if (daemon) {
                try {
                    DaemonLauncher.launch(paths.configFile(), parent.debug);
                } catch (HubException e) {
                    return fail(e.getMessage());
                }
                System.out.println("Service started in daemon mode. Use 'ssh-channels-hub status' to check.");
                return 0;
            }
            RunFiles runFiles = RunFiles.of(paths);
            if (new ControlPlaneClient(runFiles).isRunning()) {
                return fail("Service already running for " + paths.configFile());
            }
            HubConfig config;
            try {
                config = HubConfigLoader.load(paths.configFile());
            } catch (HubException e) {
                return fail(e.getMessage());
            }
            try (MinaSshConnector connector = new MinaSshConnector()) {
                return runForeground(config, connector, runFiles);
            }
        }

        private int runForeground(HubConfig config, MinaSshConnector connector, RunFiles runFiles) {
            DaemonContext context = new DaemonContext(config, connector);
            ServiceOrchestrator orchestrator = new ServiceOrchestrator(context);
            StartReport report;
            try {
                report = orchestrator.start();
            } catch (HubException e) {
                return fail(e.getMessage());
            }
            System.out.println("Service started: " + report.started().size() + "/" + config.channels().size()
                    + " channel(s) active");
            for (StartReport.Outcome failed : report.failed()) {
                System.out.println("  Warning: channel '" + failed.channelName() + "' failed: " + failed.detail());
            }
            CountDownLatch finished = new CountDownLatch(1);
            Thread hook = new Thread(() -> {
                context.shutdown().cancel();
                try {
                    finished.await(SHUTDOWN_HOOK_WAIT.toMillis(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "shutdown-hook");
            Runtime.getRuntime().addShutdownHook(hook);
            int exitCode = 0;
            try (ControlPlaneServer controlPlane =
                         new ControlPlaneServer(runFiles, orchestrator::status, context.shutdown())) {
                controlPlane.start();
                System.out.println("Service running in foreground. Press Ctrl+C to stop.");
                while (!context.shutdown().await(Duration.ofSeconds(1))) {
                    // woken by Ctrl+C or a control-plane stop
                }
                System.out.println("Shutdown signal received, stopping service...");
            } catch (HubException e) {
                exitCode = fail(e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                if (orchestrator.state().is(ServiceState.Phase.RUNNING)) {
                    orchestrator.stop();
                }
                finished.countDown();
            }
            return exitCode;
        }
    }

    @Command(name = "stop", description = "Stop the running service")
    static final class StopCommand implements Callable<Integer> {
        @ParentCommand
        ChannelsHubCommand parent;

        @Override
        public Integer call() {
            RunFiles runFiles = RunFiles.of(parent.paths());
            if (Files.exists(runFiles.portFile())) {
                if (new ControlPlaneClient(runFiles).stop()) {
                    System.out.println("Sent stop signal to service.");
                    pause(STOP_SETTLE_TIME);
                } else {
                    System.out.println("Warning: could not reach service via control plane");
                }
            }
            runFiles.remove();
            System.out.println("Service stopped (run files removed).");
            return 0;
        }
    }

    @Command(name = "restart", description = "Stop the running service and start it again in the background")
    static final class RestartCommand implements Callable<Integer> {
        @ParentCommand
        ChannelsHubCommand parent;

        @Override
        public Integer call() {
            HubPaths paths = parent.paths();
            RunFiles runFiles = RunFiles.of(paths);
            if (Files.exists(runFiles.portFile())) {
                if (new ControlPlaneClient(runFiles).stop()) {
                    System.out.println("Sent stop signal to running service.");
                    pause(STOP_SETTLE_TIME);
                }
                runFiles.remove();
            }
            System.out.println("Starting service (daemon mode)...");
            try {
                DaemonLauncher.launch(paths.configFile(), parent.debug);
            } catch (HubException e) {
                return fail("Failed to start service after restart: " + e.getMessage());
            }
            System.out.println("Service restarted.");
            return 0;
        }
    }

    @Command(name = "status", description = "Show service status")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        ChannelsHubCommand parent;

        @Option(names = {"--json"}, description = "Print status as JSON")
        boolean json;

        @Override
        public Integer call() {
            HubPaths paths = parent.paths();
            RunFiles runFiles = RunFiles.of(paths);
            Optional<ServiceSnapshot> live = new ControlPlaneClient(runFiles).status();
            Optional<HubConfig> config = Optional.empty();
            String configError = null;
            if (Files.exists(paths.configFile())) {
                try {
                    config = Optional.of(HubConfigLoader.load(paths.configFile()));
                } catch (HubException e) {
                    configError = e.getMessage();
                }
            }
            if (live.isEmpty() && !Files.exists(paths.configFile())) {
                System.out.println("Service not configured (config file not found)");
                return 0;
            }
            if (live.isEmpty() && configError != null) {
                return fail("Failed to load configuration: " + configError);
            }
            int configured = config.map(c -> c.channels().size()).orElse(0);
            ServiceSnapshot snapshot = live.orElseGet(() -> new ServiceSnapshot(ServiceState.STOPPED, 0, configured));
            Optional<Long> pid = live.isPresent() ? runFiles.readPid() : Optional.empty();
            if (json) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("state", snapshot.state().phase().wireName());
                out.put("activeChannels", snapshot.activeChannels());
                out.put("totalChannels", snapshot.totalChannels());
                out.put("running", live.isPresent());
                out.put("config", paths.configFile().toString());
                out.put("pid", pid.orElse(null));
                System.out.println(Jsons.toJson(out));
                return 0;
            }
            ChannelListing.statusLines(snapshot, paths.configFile().toString()).forEach(System.out::println);
            pid.ifPresent(p -> System.out.println("  PID: " + p));
            if (live.isEmpty()) {
                System.out.println("  Note: Service is not running. Start with: ssh-channels-hub start");
            }
            config.ifPresent(c -> ChannelListing.channelLines(c.channels()).forEach(System.out::println));
            return 0;
        }
    }

    @Command(name = "validate", description = "Validate a configuration file")
    static final class ValidateCommand implements Callable<Integer> {
        @ParentCommand
        ChannelsHubCommand parent;

        @Parameters(index = "0", arity = "0..1", description = "Configuration file to validate")
        String file;

        @Option(names = {"--json"}, description = "Print the parsed configuration as JSON with secrets masked")
        boolean json;

        @Override
        public Integer call() {
            Path path = file == null ? parent.paths().configFile() : HubPaths.expandHome(file);
            HubConfig config;
            try {
                config = HubConfigLoader.load(path);
            } catch (HubException e) {
                return fail("Invalid configuration: " + e.getMessage());
            }
            ChannelResolver.Resolution resolution = ChannelResolver.resolveAll(config);
            if (json) {
                System.out.println(Jsons.toJson(SecretMasker.masked(describe(config, resolution))));
                return resolution.failures().isEmpty() ? 0 : 1;
            }
            if (!resolution.failures().isEmpty()) {
                for (ChannelResolver.Failure failure : resolution.failures()) {
                    System.err.println("  " + failure.channelName() + ": " + failure.message());
                }
                return fail("Invalid configuration: " + resolution.failures().size() + " channel(s) failed to resolve");
            }
            System.out.println("Configuration is valid");
            System.out.println("  Hosts configured: " + config.hosts().size());
            for (HostConfig host : config.hosts()) {
                System.out.println("    - " + ChannelListing.describe(host));
            }
            System.out.println("  Channels configured: " + config.channels().size());
            for (ChannelDefinition channel : config.channels()) {
                System.out.println("    - " + ChannelListing.describe(channel));
            }
            return 0;
        }

        static Map<String, Object> describe(HubConfig config, ChannelResolver.Resolution resolution) {
            List<Map<String, Object>> hosts = new ArrayList<>();
            for (HostConfig host : config.hosts()) {
                Map<String, Object> h = new LinkedHashMap<>();
                h.put("name", host.name());
                h.put("host", host.address());
                h.put("port", host.port());
                h.put("username", host.username());
                Map<String, Object> auth = new LinkedHashMap<>();
                if (host.auth() instanceof AuthMethod.Password password) {
                    auth.put("type", "password");
                    auth.put("password", password.secret());
                } else if (host.auth() instanceof AuthMethod.PrivateKey key) {
                    auth.put("type", "key");
                    auth.put("key_path", key.keyPath().toString());
                    auth.put("passphrase", key.passphrase());
                }
                h.put("auth", auth);
                hosts.add(h);
            }
            List<Map<String, Object>> channels = new ArrayList<>();
            for (ChannelDefinition channel : config.channels()) {
                Map<String, Object> c = new LinkedHashMap<>();
                c.put("name", channel.name());
                c.put("hostname", channel.hostRef());
                c.put("channel_type", channel.effectiveType());
                c.put("ports", channel.ports());
                c.put("dest_host", channel.destHost());
                c.put("listen_host", channel.listenHost());
                c.put("command", channel.command());
                channels.add(c);
            }
            ReconnectionSettings r = config.reconnection();
            Map<String, Object> reconnection = new LinkedHashMap<>();
            reconnection.put("max_retries", r.maxRetries());
            reconnection.put("initial_delay_secs", r.initialDelay().toSeconds());
            reconnection.put("max_delay_secs", r.maxDelay().toSeconds());
            reconnection.put("use_exponential_backoff", r.exponential());
            List<Map<String, String>> errors = new ArrayList<>();
            for (ChannelResolver.Failure failure : resolution.failures()) {
                errors.add(Map.of("channel", failure.channelName(), "message", failure.message()));
            }
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("valid", resolution.failures().isEmpty());
            out.put("hosts", hosts);
            out.put("channels", channels);
            out.put("reconnection", reconnection);
            out.put("errors", errors);
            return out;
        }
    }

    @Command(name = "generate", description = "Generate a configuration from an OpenSSH client config")
    static final class GenerateCommand implements Callable<Integer> {
        @ParentCommand
        ChannelsHubCommand parent;

        @Option(names = {"-s", "--ssh-config"}, description = "SSH config file (default: ~/.ssh/config)")
        String sshConfig;

        @Option(names = {"-o", "--output"}, description = "Output TOML file (default: ./configs.toml)")
        String output;

        @Override
        public Integer call() {
            Path source = sshConfig == null
                    ? SshConfigImporter.defaultSshConfigPath()
                    : HubPaths.expandHome(sshConfig);
            List<SshConfigEntry> entries;
            try {
                entries = SshConfigImporter.read(source);
            } catch (HubException e) {
                return fail("Failed to parse SSH config file: " + e.getMessage());
            }
            if (entries.isEmpty()) {
                System.out.println("Warning: no valid SSH config entries found");
                return 0;
            }
            List<HostConfig> hosts = SshConfigImporter.toHosts(entries);
            HubConfig generated = new HubConfig(hosts, List.of(), ReconnectionSettings.defaults());
            Path target = output == null
                    ? Paths.get("").toAbsolutePath().resolve(HubPaths.LOCAL_CONFIG_FILE)
                    : HubPaths.expandHome(output);
            try {
                ConfigWriter.write(target, generated);
            } catch (HubException e) {
                return fail(e.getMessage());
            }
            System.out.println("Configuration generated successfully");
            System.out.println("  Output file: " + target);
            System.out.println("  Hosts generated: " + hosts.size());
            for (HostConfig host : hosts) {
                System.out.println("    - " + ChannelListing.describe(host));
            }
            long placeholders = hosts.stream().filter(h -> h.auth() instanceof AuthMethod.Password).count();
            if (placeholders > 0) {
                System.out.println();
                System.out.println("Warning: " + placeholders + " host(s) use password authentication with placeholder '"
                        + SshConfigImporter.PASSWORD_PLACEHOLDER + "'");
                System.out.println("  Please update the password in the generated config file.");
            }
            System.out.println();
            System.out.println("Note: add [[channels]] sections to define port forwarding.");
            return 0;
        }
    }

    @Command(name = "test", description = "Check that every local forward accepts connections")
    static final class TestCommand implements Callable<Integer> {
        @ParentCommand
        ChannelsHubCommand parent;

        @Override
        public Integer call() {
            HubPaths paths = parent.paths();
            HubConfig config;
            try {
                config = HubConfigLoader.load(paths.configFile());
            } catch (HubException e) {
                return fail("Failed to load configuration: " + e.getMessage());
            }
            if (config.channels().isEmpty()) {
                System.out.println("No channels configured");
                return 0;
            }
            System.out.println("Testing " + config.channels().size() + " channel(s)...");
            System.out.println();
            boolean allPassed = true;
            for (ChannelDefinition channel : config.channels()) {
                if (!channel.isLocalForward()) {
                    System.out.println("Channel '" + channel.name() + "' (" + channel.effectiveType()
                            + ")... skipped (only local listeners can be tested from here)");
                    continue;
                }
                PortPair ports;
                try {
                    ports = PortPair.parse(channel.name(), channel.ports());
                } catch (HubException e) {
                    System.out.println("Channel '" + channel.name() + "'... error: " + e.getMessage());
                    allPassed = false;
                    continue;
                }
                System.out.print("Testing channel '" + channel.name() + "' (local:" + ports.first() + " -> "
                        + channel.destHost() + ":" + ports.second() + ")... ");
                if (PortChecks.canConnect(channel.listenHost(), ports.first(), TEST_CONNECT_TIMEOUT)) {
                    System.out.println("connected");
                } else {
                    System.out.println("failed to connect");
                    allPassed = false;
                }
            }
            System.out.println();
            if (allPassed) {
                System.out.println("All channels are working correctly!");
                return 0;
            }
            System.out.println("Some channels failed the connection test");
            System.out.println();
            System.out.println("Troubleshooting tips:");
            System.out.println("1. Make sure the service is running: ssh-channels-hub start -c " + paths.configFile());
            System.out.println("2. Check that the ports are listening");
            System.out.println("3. Verify the SSH connection is established (check logs with --debug)");
            System.out.println("4. Ensure the remote service is reachable from the SSH server");
            return 1;
        }
    }
}
