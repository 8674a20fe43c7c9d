package com.questrail.routing.protocol.bgp.internal.decode;

import com.questrail.routing.protocol.bgp.model.NotificationMessage;

/**
 * Raised when received bytes violate the BGP wire format.
 *
 * <p>Every decode failure is fatal to the session, so the exception carries
 * the NOTIFICATION error code, subcode and data that must be sent to the peer
 * before the connection is closed.</p>
 */
public final class BgpDecodeException extends RuntimeException
{
    private final int errorCode;
    private final int errorSubcode;
    private final byte[] data;

    public BgpDecodeException(int errorCode, int errorSubcode, String message) {
        this(errorCode, errorSubcode, new byte[0], message);
    }

    public BgpDecodeException(int errorCode, int errorSubcode, byte[] data, String message) {
        super(message);
        this.errorCode = errorCode;
        this.errorSubcode = errorSubcode;
        this.data = data == null ? new byte[0] : data.clone();
    }

    public int errorCode() {
        return errorCode;
    }

    public int errorSubcode() {
        return errorSubcode;
    }

    /**
     * The NOTIFICATION that reports this failure to the peer.
     */
    public NotificationMessage toNotification() {
        return new NotificationMessage(errorCode, errorSubcode, data);
    }
}
