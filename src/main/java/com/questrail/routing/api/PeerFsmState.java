package com.questrail.routing.api;

/**
 * PeerFsmState
 * -----------------------------------------------------------------------------
 * The six states of a BGP peer session (RFC 4271 section 8).
 *
 * <p>Only {@link #ESTABLISHED} exchanges routes. Every session-ending event
 * returns the session to {@link #IDLE}; whether it leaves IDLE again on its
 * own depends on whether the peer is administratively enabled.</p>
 */
public enum PeerFsmState
{
    /** No connection; refusing inbound connections. */
    IDLE,

    /** Outbound connection attempt in progress. */
    CONNECT,

    /** Waiting for an inbound connection or for the next connection attempt. */
    ACTIVE,

    /** Our OPEN has been sent; waiting for the peer's. */
    OPEN_SENT,

    /** OPENs exchanged; waiting for the peer's first KEEPALIVE. */
    OPEN_CONFIRM,

    /** Session is up and exchanging UPDATEs. */
    ESTABLISHED;

    /**
     * True for states in which a TCP connection is open.
     */
    public boolean hasTransport() {
        return this == OPEN_SENT || this == OPEN_CONFIRM || this == ESTABLISHED;
    }
}
