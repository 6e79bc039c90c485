package com.questrail.reactive.scheduler.internal.task;

import com.questrail.reactive.scheduler.TaskRejectedException;
import com.questrail.reactive.scheduler.config.SchedulerConfig;
import com.questrail.reactive.scheduler.observability.SchedulerErrorEvent;
import com.questrail.reactive.scheduler.observability.SchedulerObservabilitySink;
import com.questrail.reactive.scheduler.observability.TaskLifecycleEvent;
import com.questrail.reactive.scheduler.observability.TaskLifecycleEvent.Kind;
import com.questrail.reactive.scheduler.subscription.Subscription;
import com.questrail.reactive.scheduler.subscription.SubscriptionId;

import java.util.Objects;

/**
 * TaskReporter
 * =============================================================================
 * Turns task lifecycle steps into observability events for one adapter.
 *
 * <p>Each adapter owns one reporter built from its {@link SchedulerConfig}, so
 * every event carries the adapter name and a timestamp from the configured
 * wall clock.</p>
 */
public final class TaskReporter {

    private final String scheduler;
    private final SchedulerConfig config;
    private final SchedulerObservabilitySink sink;

    public TaskReporter(SchedulerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.scheduler = config.name();
        this.sink = config.observabilitySink();
    }

    public String scheduler() {
        return scheduler;
    }

    public void submitted(SubscriptionId id) {
        emit(id, Kind.SUBMITTED);
    }

    public void started(SubscriptionId id) {
        emit(id, Kind.STARTED);
    }

    public void completed(SubscriptionId id) {
        emit(id, Kind.COMPLETED);
    }

    public void skipped(SubscriptionId id) {
        emit(id, Kind.SKIPPED);
    }

    public void aborted(SubscriptionId id) {
        emit(id, Kind.ABORTED);
    }

    public void failed(SubscriptionId id, RuntimeException cause) {
        emit(id, Kind.FAILED);
        sink.onError(new SchedulerErrorEvent(
            config.wallClock().now(),
            scheduler,
            id,
            "Task body threw " + cause.getClass().getSimpleName(),
            cause
        ));
    }

    /**
     * Record a refused submission: closes the subscription so the body can
     * never run, emits {@code REJECTED}, and returns the exception the adapter
     * should throw.
     */
    public TaskRejectedException rejected(Subscription subscription, Throwable cause) {
        subscription.unsubscribe();
        emit(subscription.identity(), Kind.REJECTED);
        return new TaskRejectedException(subscription.identity(), scheduler, cause);
    }

    /**
     * Variant of {@link #rejected(Subscription, Throwable)} for adapters that
     * refuse work themselves rather than through a backend exception.
     */
    public TaskRejectedException rejected(Subscription subscription, String reason) {
        subscription.unsubscribe();
        emit(subscription.identity(), Kind.REJECTED);
        return new TaskRejectedException(subscription.identity(), scheduler, reason);
    }

    private void emit(SubscriptionId id, Kind kind) {
        sink.onTaskEvent(new TaskLifecycleEvent(config.wallClock().now(), scheduler, id, kind));
    }
}
