package com.questrail.routing.protocol.bgp.internal.events;

import com.questrail.routing.protocol.bgp.model.UpdateMessage;

import java.time.Instant;
import java.util.List;

/**
 * Routes the coordinator wants sent to this peer.
 */
public sealed interface BgpRouteEvent extends BgpEvent
        permits BgpRouteEvent.AdvertiseRoutes
{
    /**
     * UPDATEs derived from an Adj-RIB-Out change, addressed to one
     * Established session. Dropped unless that session is still the current
     * one; the coordinator learns of any session loss separately.
     */
    final class AdvertiseRoutes extends BgpEvent.Base implements BgpRouteEvent {
        private final long session;
        private final List<UpdateMessage> updates;

        public AdvertiseRoutes(Instant timestamp, long session, List<UpdateMessage> updates) {
            super(timestamp);
            this.session = session;
            this.updates = List.copyOf(updates);
        }

        public long session() {
            return session;
        }

        public List<UpdateMessage> updates() {
            return updates;
        }

        @Override
        public String toString() {
            return "AdvertiseRoutes[" + updates.size() + " updates]";
        }
    }
}
