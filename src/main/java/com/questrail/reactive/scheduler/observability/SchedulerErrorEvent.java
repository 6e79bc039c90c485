package com.questrail.reactive.scheduler.observability;

import com.questrail.reactive.scheduler.subscription.SubscriptionId;

import java.time.Instant;

/**
 * Record representing a task body that threw. Rejected submissions surface as
 * {@code TaskRejectedException} and a {@code REJECTED} lifecycle event instead.
 */
public record SchedulerErrorEvent(
    Instant timestamp,
    String scheduler,
    SubscriptionId subscription,
    String message,
    Throwable cause
) {
}
