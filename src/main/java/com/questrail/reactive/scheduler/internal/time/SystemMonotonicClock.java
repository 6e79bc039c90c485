package com.questrail.reactive.scheduler.internal.time;

/**
 * Production {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <p>Unaffected by NTP or manual clock changes. Tests that need to step time
 * use a manual clock together with {@code LocalTaskPool#runDueTasks()}.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
