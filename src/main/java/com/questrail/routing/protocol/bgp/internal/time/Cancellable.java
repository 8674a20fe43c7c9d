package com.questrail.routing.protocol.bgp.internal.time;

/**
 * Cancellation handle for a task registered with a {@link MonotonicScheduler}.
 *
 * <p>Session timers are cancelled far more often than they fire (the hold timer
 * is re-armed on every received message), so implementations must make
 * cancellation cheap and idempotent.</p>
 */
public interface Cancellable
{
    /**
     * @return {@code true} if the task will now never run; {@code false} if it
     *         already ran or was cancelled earlier
     */
    boolean cancel();
}
