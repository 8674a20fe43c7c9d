package com.questrail.routing.api;

import com.questrail.routing.protocol.bgp.model.Ipv4Address;

import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of one neighbor for management queries.
 *
 * @param peerRouterId  the peer's BGP identifier, {@code null} until an OPEN is accepted
 * @param holdTimeSeconds negotiated hold time, 0 when no session
 * @param lastError     description of the last session-ending error, or {@code null}
 * @param lastTransition wall-clock time of the last FSM state change
 */
public record PeerStatus(Ipv4Address peerAddress,
                         long remoteAs,
                         long localAs,
                         PeerFsmState state,
                         boolean adminEnabled,
                         Ipv4Address peerRouterId,
                         int holdTimeSeconds,
                         long messagesReceived,
                         long messagesSent,
                         long updatesReceived,
                         long updatesSent,
                         long establishedTransitions,
                         String lastError,
                         Instant lastTransition)
{
    public PeerStatus {
        Objects.requireNonNull(peerAddress, "peerAddress");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(lastTransition, "lastTransition");
    }
}
