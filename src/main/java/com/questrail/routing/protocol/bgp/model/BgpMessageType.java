package com.questrail.routing.protocol.bgp.model;

/**
 * Message type codes carried in the fixed BGP header.
 */
public enum BgpMessageType {
    OPEN(1),
    UPDATE(2),
    NOTIFICATION(3),
    KEEPALIVE(4),
    ROUTE_REFRESH(5);

    private final int code;

    BgpMessageType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @return the type for {@code code}, or {@code null} when the code is not defined
     */
    public static BgpMessageType fromCode(int code) {
        for (BgpMessageType t : values()) {
            if (t.code == code) {
                return t;
            }
        }
        return null;
    }
}
