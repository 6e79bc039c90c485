package com.questrail.reactive.scheduler;

import com.questrail.reactive.scheduler.subscription.Subscription;

/**
 * The work carried by a scheduled task.
 *
 * <p>The body receives the subscription guarding it (so it can close itself or
 * hand the handle on) and the state captured at schedule time. It is invoked
 * at most once.</p>
 *
 * @param <T> subscription type of the scheduler variant
 * @param <S> captured state
 */
@FunctionalInterface
public interface TaskBody<T extends Subscription, S>
{
    void run(T subscription, S state);
}
