package com.questrail.routing.protocol.bgp.observability;

import com.questrail.routing.protocol.bgp.model.Ipv4Address;

import java.time.Instant;

/**
 * Protocol-level occurrence on one peer session.
 */
public record BgpProtocolObservabilityEvent(
    Instant timestamp,
    Ipv4Address peer,
    Kind kind,
    String detail
) {
    public enum Kind {
        OPEN_SENT,
        NOTIFICATION_SENT,
        UPDATES_SENT,
        SESSION_ESTABLISHED,
        SESSION_DOWN,
        REFRESH_REQUESTED
    }
}
