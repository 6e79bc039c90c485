package com.questrail.reactive.scheduler.subscription;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-unique identity of a leaf {@link Subscription}.
 *
 * <p>Two ids are equal only if they were handed out by the same
 * {@link #next()} call, so equality of ids is identity of subscriptions.</p>
 */
public record SubscriptionId(long value) {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    public static SubscriptionId next() {
        return new SubscriptionId(SEQUENCE.incrementAndGet());
    }

    @Override
    public String toString() {
        return "sub-" + value;
    }
}
