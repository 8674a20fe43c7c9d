package com.questrail.routing.protocol.bgp.codec.impl;

import com.questrail.routing.protocol.bgp.model.BgpMessageType;

/**
 * BgpFraming
 * -----------------------------------------------------------------------------
 * Constants of the BGP message header (RFC 4271 section 4.1).
 *
 * <pre>
 *   0                   1                   2                   3
 *   +-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+
 *   |                           Marker (16)                         |
 *   +-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+
 *   |          Length               |      Type     |
 *   +-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+
 * </pre>
 */
public final class BgpFraming
{
    public static final int MARKER_LENGTH = 16;

    /** Offset of the two-byte length field. */
    public static final int LENGTH_OFFSET = MARKER_LENGTH;

    public static final int LENGTH_FIELD_SIZE = 2;

    public static final int HEADER_LENGTH = 19;

    public static final int MAX_MESSAGE_LENGTH = 4096;

    private BgpFraming() {}

    /**
     * Smallest legal total length for a message of the given type.
     */
    static int minimumLength(BgpMessageType type) {
        return switch (type) {
            case OPEN -> 29;
            case UPDATE -> 23;
            case NOTIFICATION -> 21;
            case KEEPALIVE -> HEADER_LENGTH;
            case ROUTE_REFRESH -> 23;
        };
    }

    /**
     * Largest legal total length; only KEEPALIVE and ROUTE-REFRESH are fixed size.
     */
    static int maximumLength(BgpMessageType type) {
        return switch (type) {
            case KEEPALIVE -> HEADER_LENGTH;
            case ROUTE_REFRESH -> 23;
            default -> MAX_MESSAGE_LENGTH;
        };
    }
}
