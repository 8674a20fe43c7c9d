package com.questrail.routing.protocol.bgp.observability;

import com.questrail.routing.rib.RibDiagnostic;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements BgpObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onStateTransition(SessionStateTransitionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onProtocolEvent(BgpProtocolObservabilityEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onTransportEvent(BgpTransportObservabilityEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onRibDiagnostic(RibDiagnostic diagnostic) {
        events.add(diagnostic);
    }

    @Override
    public synchronized void onError(BgpErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
