package com.questrail.reactive.scheduler.backend.local;

import com.questrail.reactive.scheduler.DeferredTask;
import com.questrail.reactive.scheduler.LocalScheduler;
import com.questrail.reactive.scheduler.config.SchedulerConfig;
import com.questrail.reactive.scheduler.internal.task.TaskReporter;
import com.questrail.reactive.scheduler.internal.time.MonotonicClock;
import com.questrail.reactive.scheduler.internal.time.SystemMonotonicClock;
import com.questrail.reactive.scheduler.subscription.AbortHandle;
import com.questrail.reactive.scheduler.subscription.LocalSubscription;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.locks.LockSupport;

/**
 * LocalTaskPool
 * =============================================================================
 * Single-threaded cooperative loop: the backend behind {@link LocalScheduler}.
 *
 * <h2>Threading Model</h2>
 * The pool owns no thread. Whoever calls {@link #run()},
 * {@link #runUntilStalled()} or {@link #runDueTasks()} becomes the execution
 * context, and every body runs on that thread. Spawning is expected from the
 * same thread (including from inside running bodies). The pool is not
 * thread-safe; driving it from two threads at once fails fast with
 * {@link IllegalStateException}.
 *
 * <h2>Ordering</h2>
 * Due tasks run in deadline order, FIFO among equal deadlines. Deadlines are
 * clock readings and are only ever compared by difference.
 *
 * <h2>Submission order</h2>
 * Each task's queue entry doubles as its abort handle. The entry is queued and
 * attached within the same {@code spawn} call, and nothing runs until the loop
 * is driven from this thread, so there is no race window.
 *
 * <h2>Cancellation</h2>
 * Cooperative only. Aborting removes a pending entry from the queue; a body
 * that is already running always completes.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   pool.spawner().schedule(...)  → queue work
 *   pool.run()                    → drive until no live task remains
 *   pool.close()                  → abort pending work, refuse new work
 * </pre>
 */
public final class LocalTaskPool implements AutoCloseable {

    /** About 146 years; longer delays never come due in practice. */
    static final long MAX_DELAY_NANOS = Long.MAX_VALUE >> 1;

    private final MonotonicClock clock;
    private final TaskReporter reporter;
    private final PriorityQueue<Entry> queue = new PriorityQueue<>();
    private final LocalScheduler spawner = this::spawn;

    private long sequence;
    private boolean closed;
    private Thread driver;

    public LocalTaskPool(MonotonicClock clock, SchedulerConfig config) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.reporter = new TaskReporter(Objects.requireNonNull(config, "config"));
    }

    public LocalTaskPool() {
        this(SystemMonotonicClock.INSTANCE, SchedulerConfig.defaults("local-pool"));
    }

    /**
     * @return the {@link LocalScheduler} view of this pool
     */
    public LocalScheduler spawner() {
        return spawner;
    }

    private void spawn(DeferredTask<LocalSubscription> task) {
        Objects.requireNonNull(task, "task");
        LocalSubscription subscription = task.subscription();
        if (closed) {
            throw reporter.rejected(subscription, "pool is closed");
        }

        Entry entry = new Entry(deadlineAfter(task.delayNanos()), sequence++, task);
        entry.queued = true;
        queue.add(entry);
        reporter.submitted(subscription.identity());
        // Attaching to a closed subscription aborts the entry straight away.
        subscription.attach(entry);
    }

    /**
     * Deadline {@code delayNanos} from now. Delays are capped at
     * {@link #MAX_DELAY_NANOS} so deadlines stay comparable by difference.
     */
    private long deadlineAfter(long delayNanos) {
        return clock.nowNanos() + Math.min(delayNanos, MAX_DELAY_NANOS);
    }

    /**
     * Run every task whose deadline has passed, including tasks those bodies
     * spawn with no delay. Never blocks.
     *
     * @return number of entries taken off the queue (run or skipped)
     */
    public int runDueTasks() {
        enter();
        try {
            return drainDue();
        } finally {
            exit();
        }
    }

    /**
     * Run due tasks until none are due.
     *
     * @return {@code true} if delayed tasks are still pending
     */
    public boolean runUntilStalled() {
        runDueTasks();
        return !queue.isEmpty();
    }

    /**
     * Drive the loop until no task remains, parking the calling thread until
     * the next deadline whenever nothing is due. Returns early, with the
     * interrupt flag set, if the driving thread is interrupted.
     *
     * <p>Deadlines are read from this pool's {@link MonotonicClock}; with a
     * manually stepped clock use {@link #runDueTasks()} instead.</p>
     */
    public void run() {
        enter();
        try {
            while (true) {
                drainDue();
                Entry next = queue.peek();
                if (next == null) {
                    return;
                }
                long waitNanos = next.deadlineNanos - clock.nowNanos();
                if (waitNanos > 0) {
                    LockSupport.parkNanos(this, waitNanos);
                }
                if (Thread.currentThread().isInterrupted()) {
                    return;
                }
            }
        } finally {
            exit();
        }
    }

    private int drainDue() {
        int ran = 0;
        while (!queue.isEmpty() && queue.peek().deadlineNanos - clock.nowNanos() <= 0) {
            Entry next = queue.poll();
            next.queued = false;
            next.task.run(reporter);
            ran++;
        }
        return ran;
    }

    /**
     * @return number of queued entries that have not run or been aborted
     */
    public int pendingCount() {
        return queue.size();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Refuse further work and abort every pending task. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        List<Entry> pending = new ArrayList<>(queue);
        for (Entry entry : pending) {
            entry.task.subscription().unsubscribe();
        }
        queue.clear();
    }

    private void enter() {
        Thread current = Thread.currentThread();
        if (driver == current) {
            throw new IllegalStateException("LocalTaskPool cannot be driven re-entrantly");
        }
        if (driver != null) {
            throw new IllegalStateException("LocalTaskPool is already driven by " + driver.getName());
        }
        driver = current;
    }

    private void exit() {
        driver = null;
    }

    /**
     * Queue entry; also the abort handle of its task.
     */
    private final class Entry implements Comparable<Entry>, AbortHandle {
        private final long deadlineNanos;
        private final long seq;
        private final DeferredTask<LocalSubscription> task;
        private boolean queued;

        private Entry(long deadlineNanos, long seq, DeferredTask<LocalSubscription> task) {
            this.deadlineNanos = deadlineNanos;
            this.seq = seq;
            this.task = task;
        }

        @Override
        public boolean abort() {
            if (!queued) {
                return false;
            }
            queued = false;
            queue.remove(this);
            reporter.aborted(task.subscription().identity());
            return true;
        }

        @Override
        public int compareTo(Entry o) {
            int byDeadline = Long.compare(this.deadlineNanos - o.deadlineNanos, 0);
            return byDeadline != 0 ? byDeadline : Long.compare(this.seq, o.seq);
        }
    }
}
