package com.questrail.reactive.scheduler;

import com.questrail.reactive.scheduler.subscription.SharedSubscription;

import java.time.Duration;
import java.util.Objects;

/**
 * SharedScheduler
 * =============================================================================
 * Scheduling capability for backends that may run a task on a thread other
 * than the caller's (thread pools, managed async runtimes).
 *
 * <h2>Threading</h2>
 * Tasks, their captured state and their subscriptions cross threads. Captured
 * state must be safe to publish to another thread; the subscription handed to
 * the body is a thread-safe {@link SharedSubscription}.
 *
 * <h2>Backend selection</h2>
 * Each adapter binds one concrete backend, passed in at construction. There is
 * no global default backend.
 */
public interface SharedScheduler
{
    /**
     * Submit a deferred task to the backend.
     *
     * <p>The backend's abort capability is attached to
     * {@code task.subscription()} before this method returns, so an
     * {@code unsubscribe()} issued right after {@code spawn} prevents the body
     * from starting (subject to the race window documented on the adapter).</p>
     *
     * @throws TaskRejectedException if the backend refuses the task; the
     *         subscription has been closed when this is thrown
     */
    void spawn(DeferredTask<SharedSubscription> task);

    /**
     * Build a deferred task and spawn it.
     *
     * @param body  work to run at most once
     * @param delay minimum delay before the body may start; zero for none
     * @param state state handed to the body
     * @return the task's subscription, returned without waiting for the task
     * @throws TaskRejectedException if the backend refuses the task
     */
    default <S> SharedSubscription schedule(TaskBody<? super SharedSubscription, ? super S> body,
                                            Duration delay,
                                            S state)
    {
        Objects.requireNonNull(delay, "delay");
        DeferredTask<SharedSubscription> task = DeferredTask.shared(body, delay, state);
        spawn(task);
        return task.subscription();
    }

    /**
     * Schedule with no delay.
     */
    default <S> SharedSubscription schedule(TaskBody<? super SharedSubscription, ? super S> body, S state)
    {
        return schedule(body, Duration.ZERO, state);
    }
}
