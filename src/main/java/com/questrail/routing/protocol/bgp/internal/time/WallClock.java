package com.questrail.routing.protocol.bgp.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for state-change timestamps reported to operators.
 *
 * <p>Never used to drive timers; see {@link MonotonicClock}.</p>
 */
public interface WallClock
{
    Instant now();
}
