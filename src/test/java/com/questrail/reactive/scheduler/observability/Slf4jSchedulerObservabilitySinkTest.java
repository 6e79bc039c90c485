package com.questrail.reactive.scheduler.observability;

import com.questrail.reactive.scheduler.observability.TaskLifecycleEvent.Kind;
import com.questrail.reactive.scheduler.subscription.SubscriptionId;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Smoke test: every event kind can be logged without failing.
 */
class Slf4jSchedulerObservabilitySinkTest {

    private final Slf4jSchedulerObservabilitySink sink = new Slf4jSchedulerObservabilitySink();

    @Test
    void logsEveryLifecycleKind() {
        SubscriptionId id = SubscriptionId.next();
        for (Kind kind : Kind.values()) {
            TaskLifecycleEvent event = new TaskLifecycleEvent(Instant.now(), "sink-test", id, kind);
            assertDoesNotThrow(() -> sink.onTaskEvent(event));
        }
    }

    @Test
    void logsErrorWithCause() {
        SchedulerErrorEvent event = new SchedulerErrorEvent(
            Instant.now(), "sink-test", SubscriptionId.next(), "Task body threw IllegalStateException",
            new IllegalStateException("expected by test"));

        assertDoesNotThrow(() -> sink.onError(event));
    }

    @Test
    void terminalKinds() {
        SubscriptionId id = SubscriptionId.next();
        assertFalse(new TaskLifecycleEvent(Instant.now(), "s", id, Kind.SUBMITTED).isTerminal());
        assertFalse(new TaskLifecycleEvent(Instant.now(), "s", id, Kind.STARTED).isTerminal());
        assertTrue(new TaskLifecycleEvent(Instant.now(), "s", id, Kind.COMPLETED).isTerminal());
        assertTrue(new TaskLifecycleEvent(Instant.now(), "s", id, Kind.REJECTED).isTerminal());
        assertTrue(new TaskLifecycleEvent(Instant.now(), "s", id, Kind.ABORTED).isTerminal());
    }
}
