package com.questrail.reactive.scheduler;

import com.questrail.reactive.scheduler.subscription.LocalSubscription;

import java.time.Duration;
import java.util.Objects;

/**
 * LocalScheduler
 * =============================================================================
 * Scheduling capability for a single-threaded cooperative execution context.
 *
 * <p>Every task runs on the thread that drives the context, so captured state
 * needs no synchronization and subscriptions are the unsynchronized
 * {@link LocalSubscription}. Same contract as {@link SharedScheduler}
 * otherwise.</p>
 */
public interface LocalScheduler
{
    /**
     * Submit a deferred task and attach the backend's abort capability to its
     * subscription before returning.
     *
     * @throws TaskRejectedException if the context no longer accepts work
     */
    void spawn(DeferredTask<LocalSubscription> task);

    default <S> LocalSubscription schedule(TaskBody<? super LocalSubscription, ? super S> body,
                                           Duration delay,
                                           S state)
    {
        Objects.requireNonNull(delay, "delay");
        DeferredTask<LocalSubscription> task = DeferredTask.local(body, delay, state);
        spawn(task);
        return task.subscription();
    }

    default <S> LocalSubscription schedule(TaskBody<? super LocalSubscription, ? super S> body, S state)
    {
        return schedule(body, Duration.ZERO, state);
    }
}
