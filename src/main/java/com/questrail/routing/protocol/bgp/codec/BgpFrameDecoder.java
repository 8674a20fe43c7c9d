package com.questrail.routing.protocol.bgp.codec;

import com.questrail.routing.protocol.bgp.internal.decode.BgpDecodeException;
import com.questrail.routing.protocol.bgp.internal.frame.BgpFrame;

/**
 * BgpFrameDecoder
 * -----------------------------------------------------------------------------
 * Header-level decoder for BGP messages.
 *
 * <p>The input is exactly one message as delimited by the transport's length
 * field framing. The decoder validates the marker, the length field and the
 * type code and returns the body as a {@link BgpFrame}.</p>
 *
 * <p>It does not interpret bodies. Unlike a datagram protocol, a broken BGP
 * header cannot be dropped: the stream is out of sync and the session must
 * end with a Message Header Error, so failures are thrown rather than
 * swallowed.</p>
 */
public interface BgpFrameDecoder
{
    /**
     * @param message one complete message, header included
     * @return the validated frame
     * @throws BgpDecodeException carrying the Message Header Error to report
     */
    BgpFrame decode(byte[] message);
}
