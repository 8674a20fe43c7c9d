package com.questrail.routing.protocol.bgp.codec.impl;

import com.questrail.routing.protocol.bgp.internal.frame.BgpFrame;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultBgpFrameEncoderTest
{
    private final DefaultBgpFrameEncoder encoder = new DefaultBgpFrameEncoder();

    @Test
    void writesMarkerLengthAndType()
    {
        byte[] out = encoder.encode(new BgpFrame(5, new byte[] { 0, 1, 0, 1 }));

        assertEquals(23, out.length);
        for (int i = 0; i < 16; i++) {
            assertEquals((byte) 0xFF, out[i], "marker byte " + i);
        }
        assertEquals(0, out[16]);
        assertEquals(23, out[17]);
        assertEquals(5, out[18]);
        assertEquals(1, out[22]);
    }

    @Test
    void outputIsAcceptedByDecoder()
    {
        byte[] body = new byte[] { 0, 0, 0, 0 };
        byte[] out = encoder.encode(new BgpFrame(2, body));

        BgpFrame decoded = new DefaultBgpFrameDecoder().decode(out);
        assertEquals(2, decoded.type());
        assertArrayEquals(body, decoded.body());
    }

    @Test
    void rejectsOversizedFrame()
    {
        BgpFrame frame = new BgpFrame(2, new byte[BgpFraming.MAX_MESSAGE_LENGTH]);
        assertThrows(IllegalArgumentException.class, () -> encoder.encode(frame));
    }
}
