package com.questrail.reactive.scheduler.internal.task;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * TaskTracker
 * =============================================================================
 * Counts tasks an adapter has spawned but that have not settled yet, and lets
 * callers wait for that count to reach zero.
 *
 * <h2>Usage Pattern</h2>
 * <pre>
 *   1. Adapter calls open() before submitting to its backend
 *   2. The task wrapper closes the ticket when the deferred task returns
 *   3. The abort handle closes the ticket when it drops a task that never started
 *   4. A rejected submission closes the ticket immediately
 * </pre>
 *
 * <p>{@link Ticket#close()} is idempotent, so steps 2 and 3 may both fire for
 * the same task.</p>
 */
public final class TaskTracker {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition idle = lock.newCondition();
    private int inFlight;

    public Ticket open() {
        lock.lock();
        try {
            inFlight++;
        } finally {
            lock.unlock();
        }
        return new Ticket();
    }

    public int inFlight() {
        lock.lock();
        try {
            return inFlight;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until no ticket is open.
     *
     * @return {@code false} if {@code timeout} elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0");
        }
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (inFlight > 0) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = idle.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void release() {
        lock.lock();
        try {
            inFlight--;
            if (inFlight == 0) {
                idle.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * One tracked task.
     */
    public final class Ticket {
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private Ticket() {
        }

        public void close() {
            if (closed.compareAndSet(false, true)) {
                release();
            }
        }

        public boolean isClosed() {
            return closed.get();
        }
    }
}
