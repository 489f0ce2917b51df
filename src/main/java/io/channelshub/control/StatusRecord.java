package io.channelshub.control;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.channelshub.error.ErrorKind;
import io.channelshub.error.HubException;
import io.channelshub.model.ServiceSnapshot;
import io.channelshub.model.ServiceState;
import io.channelshub.util.Tomls;

/**
 * The three-line status body exchanged over the control plane:
 * <pre>
 * state = "Running"
 * active_channels = 2
 * total_channels = 3</pre>
 * Written without a trailing newline; a trailing newline is accepted when reading.
 */
public final class StatusRecord {
    private StatusRecord() {
    }

    public static String encode(ServiceSnapshot snapshot) {
        return "state = \"" + snapshot.state().phase().wireName() + "\"\n"
                + "active_channels = " + snapshot.activeChannels() + "\n"
                + "total_channels = " + snapshot.totalChannels();
    }

    public static ServiceSnapshot decode(String body) {
        StatusFile file;
        try {
            file = Tomls.mapper().readValue(body, StatusFile.class);
        } catch (JsonProcessingException e) {
            throw new HubException(ErrorKind.CONTROL_PLANE, "Malformed status record: " + e.getOriginalMessage(), e);
        }
        if (file == null || file.state() == null || file.activeChannels() == null || file.totalChannels() == null) {
            throw new HubException(ErrorKind.CONTROL_PLANE, "Incomplete status record");
        }
        try {
            ServiceState state = ServiceState.of(ServiceState.Phase.fromWireName(file.state()));
            return new ServiceSnapshot(state, file.activeChannels(), file.totalChannels());
        } catch (IllegalArgumentException e) {
            throw new HubException(ErrorKind.CONTROL_PLANE, "Invalid status record: " + e.getMessage(), e);
        }
    }

    record StatusFile(String state, Integer activeChannels, Integer totalChannels) {
    }
}
