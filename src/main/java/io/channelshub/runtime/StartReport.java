package io.channelshub.runtime;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Per-channel outcome of {@link ServiceOrchestrator#start()}.
 */
public record StartReport(List<Outcome> outcomes) {
    public StartReport {
        outcomes = List.copyOf(outcomes);
    }

    public List<Outcome> started() {
        return outcomes.stream().filter(Outcome::started).collect(Collectors.toList());
    }

    public List<Outcome> failed() {
        return outcomes.stream().filter(o -> !o.started()).collect(Collectors.toList());
    }

    public String failureSummary() {
        return failed().stream()
                .map(o -> o.channelName() + ": " + o.detail())
                .collect(Collectors.joining("; "));
    }

    public record Outcome(String channelName, boolean started, String detail) {
        public static Outcome started(String channelName, String summary) {
            return new Outcome(channelName, true, summary);
        }

        public static Outcome failed(String channelName, String message) {
            return new Outcome(channelName, false, message);
        }
    }
}
