package com.questrail.routing.protocol.bgp.model;

/**
 * ORIGIN path attribute values.
 *
 * <p>Declaration order is the decision-process preference order:
 * IGP is preferred over EGP, which is preferred over INCOMPLETE.</p>
 */
public enum Origin {
    IGP(0),
    EGP(1),
    INCOMPLETE(2);

    private final int code;

    Origin(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @throws IllegalArgumentException for codes outside 0-2
     */
    public static Origin fromCode(int code) {
        for (Origin o : values()) {
            if (o.code == code) {
                return o;
            }
        }
        throw new IllegalArgumentException("Unknown ORIGIN code: " + code);
    }
}
