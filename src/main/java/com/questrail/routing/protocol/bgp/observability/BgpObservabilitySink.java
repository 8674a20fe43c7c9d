package com.questrail.routing.protocol.bgp.observability;

import com.questrail.routing.rib.RibDiagnostic;

/**
 * Main interface for receiving BGP observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface BgpObservabilitySink {
    /**
     * Called after every reducer step of a peer session.
     * @param event the transition event details
     */
    void onStateTransition(SessionStateTransitionEvent event);

    /**
     * Called when a protocol-level event occurs (e.g., NOTIFICATION sent).
     * @param event the protocol event
     */
    void onProtocolEvent(BgpProtocolObservabilityEvent event);

    /**
     * Called when a connection-level event occurs (e.g., connect failed).
     * @param event the transport event
     */
    void onTransportEvent(BgpTransportObservabilityEvent event);

    /**
     * Called when the RIB rejects a received route.
     * @param diagnostic what was rejected and why
     */
    void onRibDiagnostic(RibDiagnostic diagnostic);

    /**
     * Called when an error or anomaly occurs in the stack.
     * @param event the error event
     */
    void onError(BgpErrorEvent event);
}
