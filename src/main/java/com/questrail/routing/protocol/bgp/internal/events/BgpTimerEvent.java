package com.questrail.routing.protocol.bgp.internal.events;

import java.time.Instant;

/**
 * BgpTimerEvent
 * -----------------------------------------------------------------------------
 * Session timer expiries.
 *
 * <p>Each event carries the generation the timer was armed with. A timer that
 * fires after it has been re-armed or cancelled carries an old generation and
 * the reducer ignores it, so a late expiry can never tear down a healthy
 * session.</p>
 */
public sealed interface BgpTimerEvent extends BgpEvent
        permits BgpTimerEvent.ConnectRetryExpired,
                BgpTimerEvent.HoldTimerExpired,
                BgpTimerEvent.KeepaliveTimerExpired
{
    long generation();

    final class ConnectRetryExpired extends BgpEvent.Base implements BgpTimerEvent {
        private final long generation;

        public ConnectRetryExpired(Instant timestamp, long generation) {
            super(timestamp);
            this.generation = generation;
        }

        @Override
        public long generation() {
            return generation;
        }
    }

    final class HoldTimerExpired extends BgpEvent.Base implements BgpTimerEvent {
        private final long generation;

        public HoldTimerExpired(Instant timestamp, long generation) {
            super(timestamp);
            this.generation = generation;
        }

        @Override
        public long generation() {
            return generation;
        }
    }

    final class KeepaliveTimerExpired extends BgpEvent.Base implements BgpTimerEvent {
        private final long generation;

        public KeepaliveTimerExpired(Instant timestamp, long generation) {
            super(timestamp);
            this.generation = generation;
        }

        @Override
        public long generation() {
            return generation;
        }
    }
}
