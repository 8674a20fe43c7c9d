package com.questrail.routing.protocol.bgp.codec.impl;

import com.questrail.routing.protocol.bgp.internal.decode.BgpDecodeException;
import com.questrail.routing.protocol.bgp.internal.frame.BgpFrame;
import com.questrail.routing.protocol.bgp.model.NotificationMessage;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultBgpFrameDecoderTest
 * -----------------------------------------------------------------------------
 * Header validation: marker, length bounds, type, and per-type length. Every
 * failure must surface as a {@link BgpDecodeException} carrying the Message
 * Header Error subcode that the session sends back.
 */
final class DefaultBgpFrameDecoderTest
{
    private final DefaultBgpFrameDecoder decoder = new DefaultBgpFrameDecoder();

    @Test
    void decodesKeepalive()
    {
        BgpFrame frame = decoder.decode(message(4, new byte[0]));

        assertEquals(4, frame.type());
        assertEquals(0, frame.bodyLength());
    }

    @Test
    void extractsBody()
    {
        byte[] body = new byte[] { 0, 1, 0, 1 };
        BgpFrame frame = decoder.decode(message(5, body));

        assertEquals(5, frame.type());
        assertArrayEquals(body, frame.body());
    }

    @Test
    void rejectsBrokenMarker()
    {
        byte[] msg = message(4, new byte[0]);
        msg[3] = 0x00;

        BgpDecodeException e = assertThrows(BgpDecodeException.class, () -> decoder.decode(msg));
        assertEquals(NotificationMessage.MESSAGE_HEADER_ERROR, e.errorCode());
        assertEquals(NotificationMessage.CONNECTION_NOT_SYNCHRONIZED, e.errorSubcode());
    }

    @Test
    void rejectsLengthFieldDisagreeingWithReceivedBytes()
    {
        byte[] msg = message(4, new byte[0]);
        msg[17] = 20;

        BgpDecodeException e = assertThrows(BgpDecodeException.class, () -> decoder.decode(msg));
        assertEquals(NotificationMessage.BAD_MESSAGE_LENGTH, e.errorSubcode());
        assertArrayEquals(new byte[] { 0, 20 }, e.toNotification().data());
    }

    @Test
    void rejectsTruncatedHeader()
    {
        byte[] msg = Arrays.copyOf(message(4, new byte[0]), 18);

        BgpDecodeException e = assertThrows(BgpDecodeException.class, () -> decoder.decode(msg));
        assertEquals(NotificationMessage.BAD_MESSAGE_LENGTH, e.errorSubcode());
    }

    @Test
    void rejectsUnknownType()
    {
        BgpDecodeException e = assertThrows(BgpDecodeException.class,
                () -> decoder.decode(message(9, new byte[0])));
        assertEquals(NotificationMessage.BAD_MESSAGE_TYPE, e.errorSubcode());
        assertArrayEquals(new byte[] { 9 }, e.toNotification().data());
    }

    @Test
    void rejectsKeepaliveWithBody()
    {
        BgpDecodeException e = assertThrows(BgpDecodeException.class,
                () -> decoder.decode(message(4, new byte[] { 1 })));
        assertEquals(NotificationMessage.BAD_MESSAGE_LENGTH, e.errorSubcode());
    }

    @Test
    void rejectsOpenShorterThanMinimum()
    {
        BgpDecodeException e = assertThrows(BgpDecodeException.class,
                () -> decoder.decode(message(1, new byte[5])));
        assertEquals(NotificationMessage.BAD_MESSAGE_LENGTH, e.errorSubcode());
    }

    @Test
    void acceptsMaximumLengthUpdate()
    {
        BgpFrame frame = decoder.decode(message(2, new byte[BgpFraming.MAX_MESSAGE_LENGTH - BgpFraming.HEADER_LENGTH]));
        assertEquals(BgpFraming.MAX_MESSAGE_LENGTH - BgpFraming.HEADER_LENGTH, frame.bodyLength());
    }

    static byte[] message(int type, byte[] body)
    {
        int length = BgpFraming.HEADER_LENGTH + body.length;
        byte[] out = new byte[length];
        Arrays.fill(out, 0, 16, (byte) 0xFF);
        out[16] = (byte) (length >>> 8);
        out[17] = (byte) length;
        out[18] = (byte) type;
        System.arraycopy(body, 0, out, BgpFraming.HEADER_LENGTH, body.length);
        return out;
    }
}
