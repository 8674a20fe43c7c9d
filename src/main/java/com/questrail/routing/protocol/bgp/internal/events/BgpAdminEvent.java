package com.questrail.routing.protocol.bgp.internal.events;

import java.time.Instant;

/**
 * Operator-initiated session control.
 */
public sealed interface BgpAdminEvent extends BgpEvent
        permits BgpAdminEvent.Start, BgpAdminEvent.Stop
{
    /** Enable the session and begin connecting. */
    final class Start extends BgpEvent.Base implements BgpAdminEvent {
        public Start(Instant timestamp) {
            super(timestamp);
        }
    }

    /**
     * Disable the session. The session is closed with the given Cease subcode
     * and is not restarted automatically.
     */
    final class Stop extends BgpEvent.Base implements BgpAdminEvent {
        private final int ceaseSubcode;

        public Stop(Instant timestamp, int ceaseSubcode) {
            super(timestamp);
            this.ceaseSubcode = ceaseSubcode;
        }

        public int ceaseSubcode() {
            return ceaseSubcode;
        }
    }
}
