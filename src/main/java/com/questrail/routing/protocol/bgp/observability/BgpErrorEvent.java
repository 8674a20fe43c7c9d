package com.questrail.routing.protocol.bgp.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the BGP stack.
 */
public record BgpErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
