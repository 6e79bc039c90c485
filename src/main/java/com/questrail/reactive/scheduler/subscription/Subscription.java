package com.questrail.reactive.scheduler.subscription;

/**
 * Subscription
 * =============================================================================
 * Leaf cancellation handle for a single unit of scheduled work.
 *
 * <h2>States</h2>
 * A subscription starts open and moves to closed exactly once. Closed is
 * terminal. A scheduled task body only runs if its subscription is still open
 * at the moment the backend is about to invoke it.
 *
 * <h2>Composition</h2>
 * Aggregates holding several subscriptions must key them by
 * {@link #identity()}, never by {@code equals}.
 */
public interface Subscription
{
    /**
     * Close this subscription and ask the backend to abort the associated work.
     *
     * <p>Work that has not started is prevented. Work already running is only
     * interrupted if the backend supports it; otherwise it runs to completion.
     * Calling this more than once has the same effect as calling it once.</p>
     */
    void unsubscribe();

    /**
     * @return {@code true} once {@link #unsubscribe()} has been called
     */
    boolean isClosed();

    /**
     * Stable identity of this leaf, usable as a map key.
     */
    SubscriptionId identity();
}
