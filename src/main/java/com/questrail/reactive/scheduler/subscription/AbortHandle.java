package com.questrail.reactive.scheduler.subscription;

/**
 * AbortHandle
 * =============================================================================
 * Backend-specific capability to cancel one submitted unit of work.
 *
 * <p>
 * This interface is kept tiny so each backend adapter can implement it over
 * whatever its executor hands back:
 * <ul>
 *   <li>a {@code ScheduledFuture} from a JVM thread pool</li>
 *   <li>a queue entry of the cooperative local pool</li>
 *   <li>a Netty {@code ScheduledFuture} bound after submission</li>
 * </ul>
 * </p>
 *
 * <p>Whether {@code abort()} can interrupt work that is already running is a
 * property of the backend and is documented on each adapter.</p>
 */
@FunctionalInterface
public interface AbortHandle
{
    /**
     * Attempt to abort the submitted work.
     *
     * @return {@code true} if this call prevented (or interrupted) the work;
     *         {@code false} if it had already completed or been aborted.
     */
    boolean abort();
}
