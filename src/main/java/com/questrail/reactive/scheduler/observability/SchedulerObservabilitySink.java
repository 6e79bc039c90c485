package com.questrail.reactive.scheduler.observability;

/**
 * Port receiving scheduler observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive on whatever thread produced the event (caller thread for
 * submissions, worker threads for execution) and must not block.</p>
 */
public interface SchedulerObservabilitySink {
    /**
     * Called for every lifecycle step of a scheduled task.
     * @param event the lifecycle event
     */
    void onTaskEvent(TaskLifecycleEvent event);

    /**
     * Called when a task body throws. Rejections only produce a lifecycle event.
     * @param event the error event
     */
    void onError(SchedulerErrorEvent event);
}
