package com.questrail.reactive.scheduler.subscription;

import java.util.Objects;

/**
 * Leaf {@link Subscription} for {@code LocalScheduler}s.
 *
 * <p>Confined to the single execution context that drives the local loop, so
 * it carries no synchronization. Sharing an instance across threads is not
 * supported; use {@link SharedSubscription} for that.</p>
 */
public final class LocalSubscription implements Subscription {

    private final SubscriptionId id = SubscriptionId.next();
    private boolean closed;
    private AbortHandle handle;

    /**
     * Attach the abort capability of the spawned work. Aborts it at once if
     * this subscription is already closed.
     *
     * @throws IllegalStateException if a handle was already attached
     */
    public void attach(AbortHandle abortHandle) {
        Objects.requireNonNull(abortHandle, "abortHandle");
        if (handle != null) {
            throw new IllegalStateException(id + " already has an abort handle");
        }
        handle = abortHandle;
        if (closed) {
            abortHandle.abort();
        }
    }

    public boolean isAttached() {
        return handle != null;
    }

    @Override
    public void unsubscribe() {
        if (closed) {
            return;
        }
        closed = true;
        if (handle != null) {
            handle.abort();
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public SubscriptionId identity() {
        return id;
    }

    @Override
    public String toString() {
        return "LocalSubscription[" + id + (closed ? ", closed]" : ", open]");
    }
}
