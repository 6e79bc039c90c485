package com.questrail.reactive.scheduler;

import com.questrail.reactive.scheduler.subscription.SubscriptionId;

import java.util.Objects;

/**
 * Thrown by {@code spawn}/{@code schedule} when a backend refuses new work,
 * typically because it has been shut down or is saturated.
 *
 * <p>The failure is recoverable: the caller may retry on another scheduler.
 * By the time this is thrown the task's subscription has been closed, so the
 * body can never run.</p>
 */
public final class TaskRejectedException extends RuntimeException
{
    private final SubscriptionId subscription;
    private final String scheduler;

    public TaskRejectedException(SubscriptionId subscription, String scheduler, Throwable cause) {
        super("Scheduler '" + scheduler + "' rejected task " + subscription, cause);
        this.subscription = Objects.requireNonNull(subscription, "subscription");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    public TaskRejectedException(SubscriptionId subscription, String scheduler, String reason) {
        super("Scheduler '" + scheduler + "' rejected task " + subscription + ": " + reason);
        this.subscription = Objects.requireNonNull(subscription, "subscription");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    public SubscriptionId subscription() {
        return subscription;
    }

    public String scheduler() {
        return scheduler;
    }
}
