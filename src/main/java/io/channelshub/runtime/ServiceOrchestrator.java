package io.channelshub.runtime;

import io.channelshub.config.ChannelResolver;
import io.channelshub.config.HubConfig;
import io.channelshub.error.HubException;
import io.channelshub.error.ServiceException;
import io.channelshub.model.ChannelSpec;
import io.channelshub.model.ServiceSnapshot;
import io.channelshub.model.ServiceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Owns the channel runners of one daemon and the service state machine
 * {@code Stopped -> Starting -> Running -> Stopping -> Stopped}, with {@code Failed}
 * reachable from {@code Starting}.
 *
 * <p>State and the runner list are guarded by one monitor that is never held across I/O,
 * so {@link #status()} stays cheap while a start or stop is in progress.
 */
public final class ServiceOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(ServiceOrchestrator.class);

    private final DaemonContext context;
    private final Object lock = new Object();
    private ServiceState state = ServiceState.STOPPED;
    private final List<ChannelRunner> runners = new ArrayList<>();
    private int activeChannels;
    private CancellationSignal runSignal;

    public ServiceOrchestrator(DaemonContext context) {
        this.context = context;
    }

    public StartReport start() {
        HubConfig config = context.config();
        synchronized (lock) {
            if (!state.is(ServiceState.Phase.STOPPED)) {
                throw new ServiceException("Service is not stopped (state: " + state.display() + ")");
            }
            state = ServiceState.STARTING;
        }
        LOG.info("starting {} channel(s)", config.channels().size());

        List<ChannelResolver.ListenAddress> occupied =
                PortChecks.occupied(ChannelResolver.localListenAddresses(config));
        if (!occupied.isEmpty()) {
            String ports = occupied.stream()
                    .map(a -> a + " (" + a.channelName() + ")")
                    .collect(Collectors.joining(", "));
            String reason = "Local ports already in use: " + ports;
            LOG.error(reason);
            synchronized (lock) {
                state = ServiceState.failed(reason);
            }
            throw new ServiceException(reason);
        }

        List<StartReport.Outcome> outcomes = new ArrayList<>();
        ChannelResolver.Resolution resolution = ChannelResolver.resolveAll(config);
        for (ChannelResolver.Failure failure : resolution.failures()) {
            LOG.error("channel '{}' failed: {}", failure.channelName(), failure.message());
            outcomes.add(StartReport.Outcome.failed(failure.channelName(), failure.message()));
        }

        CancellationSignal signal = context.shutdown().child();
        List<ChannelRunner> launched = new ArrayList<>();
        for (ChannelSpec spec : resolution.channels()) {
            ChannelRunner runner = new ChannelRunner(spec, context.connector(), config.reconnection(), signal.child());
            runner.launch();
            launched.add(runner);
        }
        Instant deadline = Instant.now().plus(config.startupTimeout());
        int started = 0;
        for (ChannelRunner runner : launched) {
            String name = runner.spec().name();
            try {
                Duration remaining = Duration.between(Instant.now(), deadline);
                runner.awaitFirstAttempt(remaining.isNegative() ? Duration.ZERO : remaining);
                started++;
                outcomes.add(StartReport.Outcome.started(name, runner.spec().kind().summary()));
                LOG.info("channel '{}' started: {}", name, runner.spec().kind().summary());
            } catch (HubException e) {
                outcomes.add(StartReport.Outcome.failed(name, e.getMessage()));
                LOG.error("channel '{}' failed: {}", name, e.getMessage());
            }
        }
        StartReport report = new StartReport(outcomes);

        if (started == 0) {
            signal.cancel();
            launched.forEach(ChannelRunner::stop);
            String reason = config.channels().isEmpty()
                    ? "No channels configured"
                    : "No channels started: " + report.failureSummary();
            synchronized (lock) {
                state = ServiceState.failed(reason);
            }
            throw new ServiceException(reason);
        }
        synchronized (lock) {
            runners.addAll(launched);
            activeChannels = started;
            runSignal = signal;
            state = ServiceState.RUNNING;
        }
        if (report.failed().isEmpty()) {
            LOG.info("all {} channel(s) started", started);
        } else {
            LOG.warn("{} of {} channel(s) started; failed: {}",
                    started, config.channels().size(), report.failureSummary());
        }
        return report;
    }

    public void stop() {
        List<ChannelRunner> toStop;
        CancellationSignal signal;
        synchronized (lock) {
            if (!state.is(ServiceState.Phase.RUNNING)) {
                throw new ServiceException("Service is not running (state: " + state.display() + ")");
            }
            state = ServiceState.STOPPING;
            toStop = new ArrayList<>(runners);
            signal = runSignal;
        }
        LOG.info("stopping {} channel(s)", toStop.size());
        if (signal != null) {
            signal.cancel();
        }
        List<String> errors = new ArrayList<>();
        for (ChannelRunner runner : toStop) {
            try {
                runner.stop();
            } catch (RuntimeException e) {
                errors.add(runner.spec().name() + ": " + e.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            LOG.warn("errors while stopping channels: {}", String.join("; ", errors));
        }
        synchronized (lock) {
            runners.clear();
            activeChannels = 0;
            runSignal = null;
            state = ServiceState.STOPPED;
        }
        LOG.info("service stopped");
    }

    public StartReport restart() {
        stop();
        return start();
    }

    /**
     * Clears a {@code Failed} state so that {@link #start()} can be attempted again.
     */
    public void reset() {
        synchronized (lock) {
            if (!state.is(ServiceState.Phase.FAILED)) {
                throw new ServiceException("Service is not failed (state: " + state.display() + ")");
            }
            state = ServiceState.STOPPED;
        }
    }

    public ServiceSnapshot status() {
        synchronized (lock) {
            return new ServiceSnapshot(state, activeChannels, context.config().channels().size());
        }
    }

    public ServiceState state() {
        synchronized (lock) {
            return state;
        }
    }

    public List<ChannelView> channels() {
        synchronized (lock) {
            return runners.stream().map(ChannelRunner::view).collect(Collectors.toList());
        }
    }
}
