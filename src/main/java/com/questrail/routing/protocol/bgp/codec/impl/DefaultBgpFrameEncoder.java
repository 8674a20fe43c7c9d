package com.questrail.routing.protocol.bgp.codec.impl;

import com.questrail.routing.protocol.bgp.codec.BgpFrameEncoder;
import com.questrail.routing.protocol.bgp.internal.frame.BgpFrame;

import java.util.Arrays;
import java.util.Objects;

/**
 * DefaultBgpFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link BgpFrameEncoder}.
 */
public final class DefaultBgpFrameEncoder implements BgpFrameEncoder
{
    @Override
    public byte[] encode(BgpFrame frame)
    {
        Objects.requireNonNull(frame, "frame");

        final int length = BgpFraming.HEADER_LENGTH + frame.bodyLength();
        if (length > BgpFraming.MAX_MESSAGE_LENGTH) {
            throw new IllegalArgumentException(
                    "Message of " + length + " bytes exceeds " + BgpFraming.MAX_MESSAGE_LENGTH);
        }

        final byte[] out = new byte[length];
        Arrays.fill(out, 0, BgpFraming.MARKER_LENGTH, (byte) 0xFF);
        out[BgpFraming.LENGTH_OFFSET] = (byte) (length >>> 8);
        out[BgpFraming.LENGTH_OFFSET + 1] = (byte) length;
        out[BgpFraming.HEADER_LENGTH - 1] = (byte) frame.type();
        System.arraycopy(frame.body(), 0, out, BgpFraming.HEADER_LENGTH, frame.bodyLength());
        return out;
    }
}
