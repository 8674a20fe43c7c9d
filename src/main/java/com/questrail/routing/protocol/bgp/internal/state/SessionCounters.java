package com.questrail.routing.protocol.bgp.internal.state;

/**
 * Per-session message counters. Survive session resets; reset only when the
 * peer is removed.
 */
public record SessionCounters(long messagesReceived,
                              long messagesSent,
                              long updatesReceived,
                              long updatesSent,
                              long establishedTransitions)
{
    public static final SessionCounters ZERO = new SessionCounters(0, 0, 0, 0, 0);

    public SessionCounters received() {
        return new SessionCounters(messagesReceived + 1, messagesSent, updatesReceived,
                updatesSent, establishedTransitions);
    }

    public SessionCounters updateReceived() {
        return new SessionCounters(messagesReceived, messagesSent, updatesReceived + 1,
                updatesSent, establishedTransitions);
    }

    public SessionCounters sent(int messages) {
        return new SessionCounters(messagesReceived, messagesSent + messages, updatesReceived,
                updatesSent, establishedTransitions);
    }

    public SessionCounters updatesSent(int updates) {
        return new SessionCounters(messagesReceived, messagesSent + updates, updatesReceived,
                updatesSent + updates, establishedTransitions);
    }

    public SessionCounters established() {
        return new SessionCounters(messagesReceived, messagesSent, updatesReceived,
                updatesSent, establishedTransitions + 1);
    }
}
