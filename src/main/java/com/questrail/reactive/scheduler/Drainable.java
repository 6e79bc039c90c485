package com.questrail.reactive.scheduler;

import java.time.Duration;

/**
 * Implemented by schedulers that can report when all work they spawned has
 * settled (completed, skipped, failed or been aborted before starting).
 *
 * <p>Draining does not stop the backend or refuse new work. It is the join
 * half of a clean shutdown; the owner of the backend does the rest.</p>
 */
public interface Drainable
{
    /**
     * Block until no task spawned through this scheduler is pending or running.
     *
     * @param timeout maximum time to wait; must not be negative
     * @return {@code true} if idle, {@code false} if the timeout elapsed first
     */
    boolean awaitIdle(Duration timeout) throws InterruptedException;

    /**
     * @return number of spawned tasks that have not settled yet
     */
    int inFlight();
}
