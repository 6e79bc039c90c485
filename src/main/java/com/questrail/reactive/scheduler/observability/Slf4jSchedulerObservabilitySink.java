package com.questrail.reactive.scheduler.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SchedulerObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSchedulerObservabilitySink implements SchedulerObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSchedulerObservabilitySink.class);

    @Override
    public void onTaskEvent(TaskLifecycleEvent event) {
        switch (event.kind()) {
            case REJECTED -> log.warn("[{}] Task {} rejected", event.scheduler(), event.subscription());
            case FAILED -> log.debug("[{}] Task {} failed", event.scheduler(), event.subscription());
            default -> {
                if (log.isTraceEnabled()) {
                    log.trace("[{}] Task {}: {}", event.scheduler(), event.subscription(), event.kind());
                }
            }
        }
    }

    @Override
    public void onError(SchedulerErrorEvent event) {
        log.error("[{}] {} ({})", event.scheduler(), event.message(), event.subscription(), event.cause());
    }
}
