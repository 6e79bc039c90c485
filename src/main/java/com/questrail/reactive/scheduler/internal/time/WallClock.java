package com.questrail.reactive.scheduler.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used to timestamp scheduler events.
 *
 * <p>May jump with NTP or DST adjustments, so it MUST NOT drive delays.</p>
 */
@FunctionalInterface
public interface WallClock
{
    Instant now();
}
