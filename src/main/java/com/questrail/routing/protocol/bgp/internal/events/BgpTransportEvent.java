package com.questrail.routing.protocol.bgp.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * BgpTransportEvent
 * -----------------------------------------------------------------------------
 * Changes in the availability of the peer's TCP connection.
 *
 * These events say nothing about protocol correctness.
 */
public sealed interface BgpTransportEvent extends BgpEvent
        permits BgpTransportEvent.TransportUp,
                BgpTransportEvent.ConnectFailed,
                BgpTransportEvent.TransportDown
{
    /** A connection to the peer is open (outbound or accepted inbound). */
    final class TransportUp extends BgpEvent.Base implements BgpTransportEvent {
        public TransportUp(Instant timestamp) {
            super(timestamp);
        }
    }

    /** An outbound connection attempt failed. */
    final class ConnectFailed extends BgpEvent.Base implements BgpTransportEvent {
        private final String cause;

        public ConnectFailed(Instant timestamp, String cause) {
            super(timestamp);
            this.cause = Objects.requireNonNull(cause, "cause");
        }

        public String cause() {
            return cause;
        }
    }

    /** The open connection was closed or failed. */
    final class TransportDown extends BgpEvent.Base implements BgpTransportEvent {
        private final String cause;

        public TransportDown(Instant timestamp, String cause) {
            super(timestamp);
            this.cause = Objects.requireNonNull(cause, "cause");
        }

        public String cause() {
            return cause;
        }
    }
}
