package io.channelshub.runtime;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CancellationSignalTest {
    @Test
    void cancellingParentShouldCancelChildren() throws Exception {
        CancellationSignal parent = CancellationSignal.create();
        CancellationSignal child = parent.child();
        CancellationSignal grandChild = child.child();

        parent.cancel();

        assertTrue(child.isCancelled());
        assertTrue(grandChild.await(Duration.ofMillis(100)));
    }

    @Test
    void cancellingChildShouldLeaveParentRunning() {
        CancellationSignal parent = CancellationSignal.create();
        CancellationSignal child = parent.child();
        CancellationSignal sibling = parent.child();

        child.cancel();

        assertTrue(child.isCancelled());
        assertFalse(parent.isCancelled());
        assertFalse(sibling.isCancelled());
    }

    @Test
    void callbacksShouldRunOnceAndLateRegistrationsImmediately() {
        CancellationSignal signal = CancellationSignal.create();
        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(calls::incrementAndGet);
        CancellationSignal.Registration removed = signal.onCancel(() -> calls.addAndGet(100));
        removed.close();

        signal.cancel();
        signal.cancel();
        assertEquals(1, calls.get());

        signal.onCancel(calls::incrementAndGet);
        assertEquals(2, calls.get());
    }

    @Test
    void awaitShouldTimeOutWhenNotCancelled() throws Exception {
        assertFalse(CancellationSignal.create().await(Duration.ofMillis(20)));
    }
}
