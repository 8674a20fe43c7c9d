package com.questrail.routing.protocol.bgp.observability;

import com.questrail.routing.protocol.bgp.internal.events.BgpEvent;
import com.questrail.routing.protocol.bgp.internal.state.PeerSessionState;
import com.questrail.routing.protocol.bgp.internal.state.SessionIntents;

import java.time.Instant;

/**
 * Record representing one reducer step of a peer session.
 */
public record SessionStateTransitionEvent(
    Instant timestamp,
    PeerSessionState oldState,
    PeerSessionState newState,
    BgpEvent triggeringEvent,
    SessionIntents resultingIntents
) {
    /**
     * Checks if the FSM state changed during this step.
     */
    public boolean isFsmStateChange() {
        return oldState.fsmState() != newState.fsmState();
    }
}
