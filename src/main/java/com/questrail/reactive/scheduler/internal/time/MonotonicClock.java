package com.questrail.reactive.scheduler.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for task deadlines.
 *
 * <h2>Binding invariant</h2>
 * Delays and deadlines MUST be computed from a monotonic source. Wall-clock
 * time ({@code Instant.now()}) is only used to timestamp observability events.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only
     * differences between two readings are meaningful.
     */
    long nowNanos();
}
