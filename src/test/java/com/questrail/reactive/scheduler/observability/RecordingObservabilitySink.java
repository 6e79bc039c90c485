package com.questrail.reactive.scheduler.observability;

import com.questrail.reactive.scheduler.subscription.SubscriptionId;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements SchedulerObservabilitySink {
    private final List<TaskLifecycleEvent> taskEvents = new ArrayList<>();
    private final List<SchedulerErrorEvent> errors = new ArrayList<>();

    @Override
    public synchronized void onTaskEvent(TaskLifecycleEvent event) {
        taskEvents.add(event);
    }

    @Override
    public synchronized void onError(SchedulerErrorEvent event) {
        errors.add(event);
    }

    public synchronized List<TaskLifecycleEvent> taskEvents() {
        return new ArrayList<>(taskEvents);
    }

    public synchronized List<SchedulerErrorEvent> errors() {
        return new ArrayList<>(errors);
    }

    public synchronized List<TaskLifecycleEvent.Kind> kindsFor(SubscriptionId id) {
        return taskEvents.stream()
            .filter(e -> e.subscription().equals(id))
            .map(TaskLifecycleEvent::kind)
            .collect(Collectors.toList());
    }

    public synchronized long count(TaskLifecycleEvent.Kind kind) {
        return taskEvents.stream().filter(e -> e.kind() == kind).count();
    }
}
