package com.questrail.reactive.scheduler.subscription;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * SharedSubscription
 * =============================================================================
 * Thread-safe leaf {@link Subscription} used by {@code SharedScheduler}s.
 *
 * <h2>Ownership</h2>
 * A subscription owns at most one {@link AbortHandle}. The handle is attached
 * once, by the scheduler adapter, while spawning; a second attach is a bug in
 * the adapter and fails fast.
 *
 * <h2>Thread Safety</h2>
 * {@link #unsubscribe()} and {@link #isClosed()} may race freely from any
 * thread. {@link #attach(AbortHandle)} may race with {@link #unsubscribe()}:
 * whichever runs second sees the other's write, so the handle is aborted
 * exactly once whenever the subscription was closed.
 */
public final class SharedSubscription implements Subscription {

    private final SubscriptionId id = SubscriptionId.next();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean abortRequested = new AtomicBoolean(false);
    private final AtomicReference<AbortHandle> handle = new AtomicReference<>();

    /**
     * Attach the backend abort capability for the spawned work.
     *
     * <p>If the subscription is already closed the handle is aborted before
     * this method returns.</p>
     *
     * @throws IllegalStateException if a handle was already attached
     */
    public void attach(AbortHandle abortHandle) {
        Objects.requireNonNull(abortHandle, "abortHandle");
        if (!handle.compareAndSet(null, abortHandle)) {
            throw new IllegalStateException(id + " already has an abort handle");
        }
        if (closed.get()) {
            abortOnce(abortHandle);
        }
    }

    /**
     * @return {@code true} once an abort handle has been attached
     */
    public boolean isAttached() {
        return handle.get() != null;
    }

    @Override
    public void unsubscribe() {
        if (closed.compareAndSet(false, true)) {
            AbortHandle h = handle.get();
            if (h != null) {
                abortOnce(h);
            }
        }
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public SubscriptionId identity() {
        return id;
    }

    private void abortOnce(AbortHandle h) {
        if (abortRequested.compareAndSet(false, true)) {
            h.abort();
        }
    }

    @Override
    public String toString() {
        return "SharedSubscription[" + id + (closed.get() ? ", closed]" : ", open]");
    }
}
