package com.questrail.routing.protocol.bgp.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * BgpEvent
 * -----------------------------------------------------------------------------
 * Marker interface for every event processed by a peer session state machine.
 *
 * <h2>Role in the architecture</h2>
 * Each peer session is an actor. Its state changes only in response to
 * {@link BgpEvent}s, which are queued and handled one at a time by the
 * session's driver thread. Information enters a session only as an event:
 * <ul>
 *   <li>administrative start and stop</li>
 *   <li>transport connect, failure and loss</li>
 *   <li>decoded messages and decode failures</li>
 *   <li>timer expiries</li>
 *   <li>routes handed down by the coordinator for advertisement</li>
 * </ul>
 *
 * <p>Events are immutable and carry only what is needed to advance state.</p>
 */
public interface BgpEvent
{
    /**
     * Time at which the event was generated. Observational only.
     */
    Instant timestamp();

    /**
     * Convenience base class for simple events.
     */
    abstract class Base implements BgpEvent {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }

        @Override
        public String toString() {
            return getClass().getSimpleName();
        }
    }
}
