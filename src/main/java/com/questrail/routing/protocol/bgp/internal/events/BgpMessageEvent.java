package com.questrail.routing.protocol.bgp.internal.events;

import com.questrail.routing.protocol.bgp.model.BgpMessage;
import com.questrail.routing.protocol.bgp.model.NotificationMessage;

import java.time.Instant;
import java.util.Objects;

/**
 * BgpMessageEvent
 * -----------------------------------------------------------------------------
 * Events for messages received from the peer.
 *
 * <p>Decoding happens before the event is created. The reducer sees either a
 * semantic {@link BgpMessage} or the NOTIFICATION that a decode failure
 * requires; it never sees bytes.</p>
 */
public sealed interface BgpMessageEvent extends BgpEvent
        permits BgpMessageEvent.MessageReceived, BgpMessageEvent.MessageInvalid
{
    /** A well-formed message was received. */
    final class MessageReceived extends BgpEvent.Base implements BgpMessageEvent
    {
        private final BgpMessage message;

        public MessageReceived(Instant timestamp, BgpMessage message) {
            super(timestamp);
            this.message = Objects.requireNonNull(message, "message");
        }

        public BgpMessage message() {
            return message;
        }

        @Override
        public String toString() {
            return "MessageReceived[" + message.type() + ']';
        }
    }

    /**
     * Received bytes could not be decoded. The session must send
     * {@code notification} and close.
     */
    final class MessageInvalid extends BgpEvent.Base implements BgpMessageEvent
    {
        private final NotificationMessage notification;
        private final String reason;

        public MessageInvalid(Instant timestamp, NotificationMessage notification, String reason) {
            super(timestamp);
            this.notification = Objects.requireNonNull(notification, "notification");
            this.reason = Objects.requireNonNull(reason, "reason");
        }

        public NotificationMessage notification() {
            return notification;
        }

        public String reason() {
            return reason;
        }

        @Override
        public String toString() {
            return "MessageInvalid[" + notification.describe() + ": " + reason + ']';
        }
    }
}
