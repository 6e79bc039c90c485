package com.questrail.reactive.scheduler.observability;

import com.questrail.reactive.scheduler.subscription.SubscriptionId;

import java.time.Instant;
import java.util.Objects;

/**
 * Record of one step in the life of a scheduled task.
 */
public record TaskLifecycleEvent(
    Instant timestamp,
    String scheduler,
    SubscriptionId subscription,
    Kind kind
) {
    public enum Kind {
        /** Handed to the backend. */
        SUBMITTED,
        /** Backend refused the task; the body will never run. */
        REJECTED,
        /** Body is about to run. */
        STARTED,
        COMPLETED,
        /** Body threw; see the matching {@link SchedulerErrorEvent}. */
        FAILED,
        /** Subscription was closed before the body could start. */
        SKIPPED,
        /** Backend dropped the task before it started. */
        ABORTED
    }

    public TaskLifecycleEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(subscription, "subscription");
        Objects.requireNonNull(kind, "kind");
    }

    /**
     * @return {@code true} for kinds after which the task will not run again
     */
    public boolean isTerminal() {
        return kind != Kind.SUBMITTED && kind != Kind.STARTED;
    }
}
