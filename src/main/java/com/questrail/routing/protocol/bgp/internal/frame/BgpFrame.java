package com.questrail.routing.protocol.bgp.internal.frame;

import java.util.Objects;

/**
 * BgpFrame
 * -----------------------------------------------------------------------------
 * One BGP message after header validation: the type code and the body that
 * follows the 19-byte header.
 *
 * <p>A frame is still not a semantic message. The session state machine never
 * sees frames; they are turned into {@code BgpMessage} instances by the
 * message decoder.</p>
 *
 * <p>Immutability is enforced via defensive copying.</p>
 */
public final class BgpFrame
{
    private final int type;
    private final byte[] body;

    public BgpFrame(int type, byte[] body) {
        this.type = type & 0xFF;
        this.body = Objects.requireNonNull(body, "body").clone();
    }

    /**
     * Message type code from the header (1..5 once validated).
     */
    public int type() {
        return type;
    }

    /**
     * Returns a copy of the body bytes.
     */
    public byte[] body() {
        return body.clone();
    }

    public int bodyLength() {
        return body.length;
    }

    @Override
    public String toString() {
        return "BgpFrame[type=" + type + ", bodyLength=" + body.length + ']';
    }
}
