package com.questrail.routing.protocol.bgp.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for session timers.
 *
 * <p>Connect-retry, hold and keepalive deadlines are computed from this clock
 * only. Wall-clock time is reserved for timestamps shown to operators.</p>
 */
public interface MonotonicClock
{
    /**
     * Monotonic tick in nanoseconds. Only differences between two readings are
     * meaningful.
     */
    long nowNanos();
}
