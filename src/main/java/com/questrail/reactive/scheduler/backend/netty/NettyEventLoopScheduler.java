package com.questrail.reactive.scheduler.backend.netty;

import com.questrail.reactive.scheduler.DeferredTask;
import com.questrail.reactive.scheduler.Drainable;
import com.questrail.reactive.scheduler.SharedScheduler;
import com.questrail.reactive.scheduler.config.SchedulerConfig;
import com.questrail.reactive.scheduler.internal.task.TaskReporter;
import com.questrail.reactive.scheduler.internal.task.TaskTracker;
import com.questrail.reactive.scheduler.subscription.AbortHandle;
import com.questrail.reactive.scheduler.subscription.SharedSubscription;

import io.netty.channel.EventLoop;
import io.netty.channel.EventLoopGroup;
import io.netty.util.concurrent.Future;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * NettyEventLoopScheduler
 * =============================================================================
 * {@link SharedScheduler} backed by a Netty {@link EventLoopGroup}, the managed
 * async runtime backend.
 *
 * <h2>Runtime handle</h2>
 * The group is passed in explicitly. This adapter never creates or looks up a
 * global group, and it never shuts the group down.
 *
 * <h2>Submission order</h2>
 * <p>The abort handle is built and attached <em>before</em> the task is handed
 * to an event loop; the Netty future is bound to the handle right after
 * submission. An {@code unsubscribe()} that lands between attach and bind
 * claims the task through {@link DeferredTask#abortIfNotStarted()} at once and
 * cancels the future as soon as it is bound, so there is no window in which
 * the backend can start a body the caller already aborted.</p>
 *
 * <h2>Cancellation</h2>
 * <p>Cooperative only. Netty marks a task uncancellable once it starts running
 * and never interrupts its event-loop thread, so {@code unsubscribe()} after
 * the body has started lets the body complete. Pending delayed tasks are
 * removed from the loop's schedule queue when aborted.</p>
 *
 * <h2>Netty containment rule</h2>
 * Netty types do not escape this package except for the group handed to the
 * constructor.
 */
public final class NettyEventLoopScheduler implements SharedScheduler, Drainable
{
    private final EventLoopGroup group;
    private final TaskReporter reporter;
    private final TaskTracker tracker = new TaskTracker();

    public NettyEventLoopScheduler(EventLoopGroup group, SchedulerConfig config)
    {
        this.group = Objects.requireNonNull(group, "group");
        this.reporter = new TaskReporter(Objects.requireNonNull(config, "config"));
    }

    public NettyEventLoopScheduler(EventLoopGroup group)
    {
        this(group, SchedulerConfig.defaults("event-loop"));
    }

    @Override
    public void spawn(DeferredTask<SharedSubscription> task)
    {
        Objects.requireNonNull(task, "task");
        SharedSubscription subscription = task.subscription();

        long delayNanos = task.delayNanos();
        TaskTracker.Ticket ticket = tracker.open();
        DeferredAbortHandle handle = new DeferredAbortHandle(task, ticket);
        subscription.attach(handle);
        reporter.submitted(subscription.identity());

        Runnable runnable = () -> {
            try {
                task.run(reporter);
            } finally {
                ticket.close();
            }
        };

        Future<?> future;
        try {
            EventLoop loop = group.next();
            future = delayNanos > 0
                    ? loop.schedule(runnable, delayNanos, TimeUnit.NANOSECONDS)
                    : loop.submit(runnable);
        } catch (RuntimeException e) {
            // RejectedExecutionException in practice; any refusal leaves nothing in flight.
            // Claimed here so the abort triggered by the rejection reports nothing.
            task.abortIfNotStarted();
            ticket.close();
            throw reporter.rejected(subscription, e);
        }
        handle.bind(future);
    }

    @Override
    public boolean awaitIdle(Duration timeout) throws InterruptedException
    {
        return tracker.awaitIdle(timeout);
    }

    @Override
    public int inFlight()
    {
        return tracker.inFlight();
    }

    public String name()
    {
        return reporter.scheduler();
    }

    /**
     * Abort handle that exists before the Netty future does.
     */
    private final class DeferredAbortHandle implements AbortHandle
    {
        private final DeferredTask<SharedSubscription> task;
        private final TaskTracker.Ticket ticket;
        private final AtomicBoolean abortRequested = new AtomicBoolean(false);
        private final AtomicReference<Future<?>> future = new AtomicReference<>();

        private DeferredAbortHandle(DeferredTask<SharedSubscription> task, TaskTracker.Ticket ticket)
        {
            this.task = task;
            this.ticket = ticket;
        }

        void bind(Future<?> submitted)
        {
            future.set(submitted);
            if (abortRequested.get()) {
                submitted.cancel(false);
            }
        }

        @Override
        public boolean abort()
        {
            if (!abortRequested.compareAndSet(false, true)) {
                return false;
            }
            boolean claimed = task.abortIfNotStarted();
            if (claimed) {
                ticket.close();
                reporter.aborted(task.subscription().identity());
            }
            // Not bound yet: bind() cancels it. Cancelling only frees the loop's queue slot.
            Future<?> f = future.get();
            if (f != null) {
                f.cancel(false);
            }
            return claimed;
        }
    }
}
