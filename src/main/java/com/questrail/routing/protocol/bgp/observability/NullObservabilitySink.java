package com.questrail.routing.protocol.bgp.observability;

import com.questrail.routing.rib.RibDiagnostic;

/**
 * No-op implementation of BgpObservabilitySink.
 */
public final class NullObservabilitySink implements BgpObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(SessionStateTransitionEvent event) {}

    @Override
    public void onProtocolEvent(BgpProtocolObservabilityEvent event) {}

    @Override
    public void onTransportEvent(BgpTransportObservabilityEvent event) {}

    @Override
    public void onRibDiagnostic(RibDiagnostic diagnostic) {}

    @Override
    public void onError(BgpErrorEvent event) {}
}
