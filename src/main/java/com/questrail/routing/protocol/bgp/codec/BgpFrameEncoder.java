package com.questrail.routing.protocol.bgp.codec;

import com.questrail.routing.protocol.bgp.internal.frame.BgpFrame;

/**
 * BgpFrameEncoder
 * -----------------------------------------------------------------------------
 * Prepends the 19-byte BGP header (marker, length, type) to a frame body.
 *
 * <p>The semantic step (message to frame) is performed by
 * {@code com.questrail.routing.protocol.bgp.internal.encode.BgpMessageEncoder}.</p>
 */
public interface BgpFrameEncoder
{
    /**
     * @return wire bytes ready for the transport
     * @throws IllegalArgumentException if the message would exceed the maximum
     *         BGP message size
     */
    byte[] encode(BgpFrame frame);
}
