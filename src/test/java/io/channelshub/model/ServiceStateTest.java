package io.channelshub.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServiceStateTest {
    @Test
    void failedShouldTravelAsError() {
        assertEquals("Error", ServiceState.Phase.FAILED.wireName());
        assertEquals(ServiceState.Phase.FAILED, ServiceState.Phase.fromWireName(" Error "));
        assertEquals(ServiceState.Phase.RUNNING, ServiceState.Phase.fromWireName("Running"));
        assertThrows(IllegalArgumentException.class, () -> ServiceState.Phase.fromWireName("Failed"));
        assertThrows(IllegalArgumentException.class, () -> ServiceState.Phase.fromWireName(null));
    }

    @Test
    void displayShouldIncludeFailureReasonOnly() {
        assertEquals("Error (No channels configured)", ServiceState.failed("No channels configured").display());
        assertEquals("Error", ServiceState.failed(null).display());
        assertEquals("Running", ServiceState.RUNNING.display());
        assertTrue(ServiceState.of(ServiceState.Phase.STOPPED).is(ServiceState.Phase.STOPPED));
    }

    @Test
    void snapshotShouldRejectNegativeCounts() {
        assertThrows(IllegalArgumentException.class, () -> new ServiceSnapshot(ServiceState.RUNNING, -1, 0));
        assertThrows(IllegalArgumentException.class, () -> new ServiceSnapshot(null, 0, 0));
    }
}
