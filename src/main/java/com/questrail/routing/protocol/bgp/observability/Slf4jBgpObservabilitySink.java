package com.questrail.routing.protocol.bgp.observability;

import com.questrail.routing.rib.RibDiagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BgpObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jBgpObservabilitySink implements BgpObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBgpObservabilitySink.class);

    @Override
    public void onStateTransition(SessionStateTransitionEvent event) {
        if (event.isFsmStateChange()) {
            log.info("Peer {}: {} -> {} on {}",
                event.newState().config().peerAddress(),
                event.oldState().fsmState(),
                event.newState().fsmState(),
                event.triggeringEvent());
        } else if (log.isTraceEnabled()) {
            log.trace("Peer {}: {} handled in {} -> {}",
                event.newState().config().peerAddress(),
                event.triggeringEvent(),
                event.newState().fsmState(),
                event.resultingIntents());
        }
    }

    @Override
    public void onProtocolEvent(BgpProtocolObservabilityEvent event) {
        if (event.kind() == BgpProtocolObservabilityEvent.Kind.NOTIFICATION_SENT
                || event.kind() == BgpProtocolObservabilityEvent.Kind.SESSION_DOWN) {
            log.warn("Peer {}: {} {}", event.peer(), event.kind(), event.detail());
        } else {
            log.debug("Peer {}: {} {}", event.peer(), event.kind(), event.detail());
        }
    }

    @Override
    public void onTransportEvent(BgpTransportObservabilityEvent event) {
        log.info("Peer {}: transport {} {}", event.peer(), event.kind(), event.detail());
    }

    @Override
    public void onRibDiagnostic(RibDiagnostic diagnostic) {
        log.warn("Peer {}: rejected {} ({}): {}",
            diagnostic.peer(), diagnostic.prefix(), diagnostic.reason(), diagnostic.detail());
    }

    @Override
    public void onError(BgpErrorEvent event) {
        log.error("BGP Error: {}", event.message(), event.cause());
    }
}
