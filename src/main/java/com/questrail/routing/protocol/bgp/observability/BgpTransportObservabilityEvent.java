package com.questrail.routing.protocol.bgp.observability;

import com.questrail.routing.protocol.bgp.model.Ipv4Address;

import java.time.Instant;

/**
 * Connection-level occurrence on one peer session.
 */
public record BgpTransportObservabilityEvent(
    Instant timestamp,
    Ipv4Address peer,
    Kind kind,
    String detail
) {
    public enum Kind {
        CONNECTING,
        CONNECTED,
        CONNECT_FAILED,
        DISCONNECTED,
        CLOSED
    }
}
