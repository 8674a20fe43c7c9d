package com.questrail.routing.protocol.bgp.model;

/**
 * Canonical semantic representation of a BGP message.
 *
 * <p>{@code BgpMessage} is the only form of message that the session state
 * machine reasons about. Marker bytes, length fields and attribute encodings
 * are resolved below this layer, before a message instance exists.</p>
 */
public sealed interface BgpMessage
        permits OpenMessage, UpdateMessage, NotificationMessage, KeepaliveMessage, RouteRefreshMessage {

    BgpMessageType type();
}
