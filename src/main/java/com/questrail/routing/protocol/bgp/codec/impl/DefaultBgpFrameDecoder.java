package com.questrail.routing.protocol.bgp.codec.impl;

import com.questrail.routing.protocol.bgp.codec.BgpFrameDecoder;
import com.questrail.routing.protocol.bgp.internal.decode.BgpDecodeException;
import com.questrail.routing.protocol.bgp.internal.frame.BgpFrame;
import com.questrail.routing.protocol.bgp.model.BgpMessageType;

import java.util.Arrays;

import static com.questrail.routing.protocol.bgp.model.NotificationMessage.*;

/**
 * DefaultBgpFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link BgpFrameDecoder}.
 *
 * <p>Checks, in order:</p>
 * <ol>
 *   <li>Marker is all ones (Connection Not Synchronized)</li>
 *   <li>Length field agrees with the bytes supplied and lies in 19..4096
 *       (Bad Message Length)</li>
 *   <li>Type code is defined (Bad Message Type)</li>
 *   <li>Length is legal for the type (Bad Message Length)</li>
 * </ol>
 */
public final class DefaultBgpFrameDecoder implements BgpFrameDecoder
{
    @Override
    public BgpFrame decode(byte[] message)
    {
        if (message == null || message.length < BgpFraming.HEADER_LENGTH) {
            throw new BgpDecodeException(MESSAGE_HEADER_ERROR, BAD_MESSAGE_LENGTH,
                    "Message shorter than the BGP header");
        }

        for (int i = 0; i < BgpFraming.MARKER_LENGTH; i++) {
            if (message[i] != (byte) 0xFF) {
                throw new BgpDecodeException(MESSAGE_HEADER_ERROR, CONNECTION_NOT_SYNCHRONIZED,
                        "Marker is not all ones");
            }
        }

        final byte[] lengthField = Arrays.copyOfRange(message, BgpFraming.LENGTH_OFFSET,
                BgpFraming.LENGTH_OFFSET + BgpFraming.LENGTH_FIELD_SIZE);
        final int length = ((lengthField[0] & 0xFF) << 8) | (lengthField[1] & 0xFF);

        if (length < BgpFraming.HEADER_LENGTH
                || length > BgpFraming.MAX_MESSAGE_LENGTH
                || length != message.length) {
            throw new BgpDecodeException(MESSAGE_HEADER_ERROR, BAD_MESSAGE_LENGTH, lengthField,
                    "Bad message length " + length + " (received " + message.length + " bytes)");
        }

        final int typeCode = message[BgpFraming.HEADER_LENGTH - 1] & 0xFF;
        final BgpMessageType type = BgpMessageType.fromCode(typeCode);
        if (type == null) {
            throw new BgpDecodeException(MESSAGE_HEADER_ERROR, BAD_MESSAGE_TYPE,
                    new byte[] { (byte) typeCode }, "Unknown message type " + typeCode);
        }

        if (length < BgpFraming.minimumLength(type) || length > BgpFraming.maximumLength(type)) {
            throw new BgpDecodeException(MESSAGE_HEADER_ERROR, BAD_MESSAGE_LENGTH, lengthField,
                    "Length " + length + " is not valid for " + type);
        }

        return new BgpFrame(typeCode, Arrays.copyOfRange(message, BgpFraming.HEADER_LENGTH, length));
    }
}
