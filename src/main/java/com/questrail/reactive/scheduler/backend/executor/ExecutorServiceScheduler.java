package com.questrail.reactive.scheduler.backend.executor;

import com.questrail.reactive.scheduler.DeferredTask;
import com.questrail.reactive.scheduler.Drainable;
import com.questrail.reactive.scheduler.SharedScheduler;
import com.questrail.reactive.scheduler.config.SchedulerConfig;
import com.questrail.reactive.scheduler.internal.task.TaskReporter;
import com.questrail.reactive.scheduler.internal.task.TaskTracker;
import com.questrail.reactive.scheduler.subscription.AbortHandle;
import com.questrail.reactive.scheduler.subscription.SharedSubscription;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ExecutorServiceScheduler
 * =============================================================================
 * {@link SharedScheduler} backed by a JVM {@link ScheduledExecutorService}
 * (the thread-pool backend).
 *
 * <h2>Submission order</h2>
 * <p>Submit first, then wrap the returned {@link ScheduledFuture} into the
 * subscription. A pool thread may therefore pick the task up before the abort
 * handle is attached. That window is harmless: the caller does not hold the
 * subscription yet, the body's own pre-execution guard still runs, and an
 * {@code unsubscribe()} issued by the body itself is replayed onto the handle
 * as soon as it is attached.</p>
 *
 * <h2>Cancellation</h2>
 * <p>Cooperative by default: aborting only drops tasks that have not started.
 * The abort and the pool thread race on {@link DeferredTask#abortIfNotStarted()};
 * whichever side claims the task first emits its single terminal event
 * ({@code ABORTED} for the abort).
 * With {@link SchedulerConfig#interruptOnAbort()} the pool thread running the
 * body is interrupted, so bodies that block or poll
 * {@link Thread#interrupted()} stop at those points. A body that ignores
 * interrupts always runs to completion.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>This class does <strong>not</strong> own or manage the lifecycle of the
 * provided executor. Callers are responsible for shutdown, typically after
 * {@link #awaitIdle(Duration)}.</p>
 *
 * <h2>Precision</h2>
 * <p>Delayed tasks may start slightly after their delay, never before.</p>
 */
public final class ExecutorServiceScheduler implements SharedScheduler, Drainable {

    private final ScheduledExecutorService executor;
    private final boolean interruptOnAbort;
    private final TaskReporter reporter;
    private final TaskTracker tracker = new TaskTracker();

    /**
     * Creates a scheduler backed by the given executor.
     *
     * @param executor the underlying scheduled executor service
     * @param config   adapter name, abort mode and observability sink
     */
    public ExecutorServiceScheduler(ScheduledExecutorService executor, SchedulerConfig config) {
        this.executor = Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(config, "config");
        this.interruptOnAbort = config.interruptOnAbort();
        this.reporter = new TaskReporter(config);
    }

    public ExecutorServiceScheduler(ScheduledExecutorService executor) {
        this(executor, SchedulerConfig.defaults("thread-pool"));
    }

    @Override
    public void spawn(DeferredTask<SharedSubscription> task) {
        Objects.requireNonNull(task, "task");
        SharedSubscription subscription = task.subscription();

        long delayNanos = task.delayNanos();
        TaskTracker.Ticket ticket = tracker.open();
        reporter.submitted(subscription.identity());

        ScheduledFuture<?> future;
        try {
            future = executor.schedule(() -> {
                try {
                    task.run(reporter);
                } finally {
                    ticket.close();
                }
            }, delayNanos, TimeUnit.NANOSECONDS);
        } catch (RuntimeException e) {
            // RejectedExecutionException in practice; any refusal leaves nothing in flight.
            ticket.close();
            throw reporter.rejected(subscription, e);
        }

        subscription.attach(new ScheduledFutureAbortHandle(future, task, ticket));
    }

    @Override
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        return tracker.awaitIdle(timeout);
    }

    @Override
    public int inFlight() {
        return tracker.inFlight();
    }

    public String name() {
        return reporter.scheduler();
    }

    /**
     * Adapter from {@link ScheduledFuture} to {@link AbortHandle}.
     */
    private final class ScheduledFutureAbortHandle implements AbortHandle {
        private final ScheduledFuture<?> future;
        private final DeferredTask<SharedSubscription> task;
        private final TaskTracker.Ticket ticket;

        private ScheduledFutureAbortHandle(ScheduledFuture<?> future,
                                           DeferredTask<SharedSubscription> task,
                                           TaskTracker.Ticket ticket) {
            this.future = future;
            this.task = task;
            this.ticket = ticket;
        }

        @Override
        public boolean abort() {
            boolean claimed = task.abortIfNotStarted();
            // Interrupting only makes sense for a body that is already running.
            boolean cancelled = future.cancel(!claimed && interruptOnAbort);
            if (claimed) {
                ticket.close();
                reporter.aborted(task.subscription().identity());
            }
            return claimed || cancelled;
        }
    }
}
