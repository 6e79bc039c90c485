package com.questrail.reactive.scheduler.observability;

/**
 * No-op implementation of SchedulerObservabilitySink.
 */
public final class NullObservabilitySink implements SchedulerObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTaskEvent(TaskLifecycleEvent event) {}

    @Override
    public void onError(SchedulerErrorEvent event) {}
}
