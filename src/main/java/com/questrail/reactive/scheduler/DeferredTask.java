package com.questrail.reactive.scheduler;

import com.questrail.reactive.scheduler.internal.task.TaskReporter;
import com.questrail.reactive.scheduler.subscription.LocalSubscription;
import com.questrail.reactive.scheduler.subscription.SharedSubscription;
import com.questrail.reactive.scheduler.subscription.Subscription;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * DeferredTask
 * =============================================================================
 * A not-yet-executed task body bundled with its captured state, a minimum
 * delay and the subscription that guards it.
 *
 * <h2>Execution contract</h2>
 * When a backend drives {@link #run(TaskReporter)}:
 * <ol>
 *   <li>the backend has already waited at least {@link #delay()};</li>
 *   <li>if the subscription is closed, the body is skipped;</li>
 *   <li>otherwise the body runs once with {@code (subscription, state)}.</li>
 * </ol>
 * A second call to {@code run} never re-invokes the body. Nothing runs until a
 * scheduler hands the task to its backend.
 *
 * <h2>Abort claim</h2>
 * Backends race {@link #run(TaskReporter)} against {@link #abortIfNotStarted()}
 * through one atomic state. Exactly one side wins: either the body's run emits
 * {@code SKIPPED}, {@code COMPLETED} or {@code FAILED}, or the abort wins and the
 * adapter emits {@code ABORTED}. Never both.
 *
 * <h2>Failures</h2>
 * A {@link RuntimeException} thrown by the body is reported through the
 * {@link TaskReporter} and does not propagate into the backend thread.
 *
 * @param <T> subscription type of the scheduler variant
 */
public final class DeferredTask<T extends Subscription> {

    /**
     * What a call to {@link #run(TaskReporter)} did.
     */
    public enum Outcome {
        COMPLETED,
        SKIPPED,
        FAILED,
        /** An abort claimed the task first; nothing happened. */
        ABORTED,
        /** {@code run} had already been called; nothing happened. */
        ALREADY_RUN
    }

    private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

    private static final int STATE_NEW = 0;
    private static final int STATE_STARTED = 1;
    private static final int STATE_ABORTED = 2;

    private final T subscription;
    private final Duration delay;
    private final long delayNanos;
    private final Runnable invocation;
    private final AtomicInteger state = new AtomicInteger(STATE_NEW);

    private DeferredTask(T subscription, Duration delay, Runnable invocation) {
        this.subscription = subscription;
        this.delay = delay;
        // Saturate: delays beyond ~292 years do not fit in a long.
        this.delayNanos = delay.compareTo(MAX_NANOS) > 0 ? Long.MAX_VALUE : delay.toNanos();
        this.invocation = invocation;
    }

    /**
     * Bind a body and its state to an existing subscription.
     *
     * @param delay minimum delay before the body may run; {@code null} or zero means none
     * @throws IllegalArgumentException if {@code delay} is negative
     */
    public static <T extends Subscription, S> DeferredTask<T> create(
            TaskBody<? super T, ? super S> body,
            S state,
            Duration delay,
            T subscription)
    {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(subscription, "subscription");
        Duration effectiveDelay = delay == null ? Duration.ZERO : delay;
        if (effectiveDelay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        return new DeferredTask<>(subscription, effectiveDelay, () -> body.run(subscription, state));
    }

    /**
     * Build a task guarded by a fresh {@link SharedSubscription}.
     */
    public static <S> DeferredTask<SharedSubscription> shared(
            TaskBody<? super SharedSubscription, ? super S> body, Duration delay, S state)
    {
        return create(body, state, delay, new SharedSubscription());
    }

    /**
     * Build a task guarded by a fresh {@link LocalSubscription}.
     */
    public static <S> DeferredTask<LocalSubscription> local(
            TaskBody<? super LocalSubscription, ? super S> body, Duration delay, S state)
    {
        return create(body, state, delay, new LocalSubscription());
    }

    public T subscription() {
        return subscription;
    }

    public Duration delay() {
        return delay;
    }

    /**
     * @return the delay in nanoseconds, {@link Long#MAX_VALUE} if it does not fit
     */
    public long delayNanos() {
        return delayNanos;
    }

    /**
     * @return {@code true} once a backend has entered {@link #run(TaskReporter)}
     */
    public boolean hasStarted() {
        return state.get() == STATE_STARTED;
    }

    /**
     * Claim this task for an abort. Succeeds only if {@link #run(TaskReporter)}
     * has not been entered; a later {@code run} then does nothing.
     *
     * @return {@code true} if the caller now owns reporting the abort
     */
    public boolean abortIfNotStarted() {
        return state.compareAndSet(STATE_NEW, STATE_ABORTED);
    }

    /**
     * Drive this task. Called by backend adapters only.
     */
    public Outcome run(TaskReporter reporter) {
        Objects.requireNonNull(reporter, "reporter");
        if (!state.compareAndSet(STATE_NEW, STATE_STARTED)) {
            return state.get() == STATE_ABORTED ? Outcome.ABORTED : Outcome.ALREADY_RUN;
        }
        if (subscription.isClosed()) {
            reporter.skipped(subscription.identity());
            return Outcome.SKIPPED;
        }

        reporter.started(subscription.identity());
        try {
            invocation.run();
        } catch (RuntimeException e) {
            reporter.failed(subscription.identity(), e);
            return Outcome.FAILED;
        }
        reporter.completed(subscription.identity());
        return Outcome.COMPLETED;
    }
}
