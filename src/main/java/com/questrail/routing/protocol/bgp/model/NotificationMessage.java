package com.questrail.routing.protocol.bgp.model;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * NOTIFICATION: announces that the sender is closing the session, and why.
 */
public final class NotificationMessage implements BgpMessage
{
    // Error codes
    public static final int MESSAGE_HEADER_ERROR = 1;
    public static final int OPEN_MESSAGE_ERROR = 2;
    public static final int UPDATE_MESSAGE_ERROR = 3;
    public static final int HOLD_TIMER_EXPIRED = 4;
    public static final int FSM_ERROR = 5;
    public static final int CEASE = 6;

    // MESSAGE_HEADER_ERROR subcodes
    public static final int CONNECTION_NOT_SYNCHRONIZED = 1;
    public static final int BAD_MESSAGE_LENGTH = 2;
    public static final int BAD_MESSAGE_TYPE = 3;

    // OPEN_MESSAGE_ERROR subcodes
    public static final int UNSUPPORTED_VERSION_NUMBER = 1;
    public static final int BAD_PEER_AS = 2;
    public static final int BAD_BGP_IDENTIFIER = 3;
    public static final int UNSUPPORTED_OPTIONAL_PARAMETER = 4;
    public static final int UNACCEPTABLE_HOLD_TIME = 6;
    public static final int UNSUPPORTED_CAPABILITY = 7;

    // UPDATE_MESSAGE_ERROR subcodes
    public static final int MALFORMED_ATTRIBUTE_LIST = 1;
    public static final int UNRECOGNIZED_WELL_KNOWN_ATTRIBUTE = 2;
    public static final int ATTRIBUTE_FLAGS_ERROR = 4;
    public static final int ATTRIBUTE_LENGTH_ERROR = 5;
    public static final int INVALID_ORIGIN_ATTRIBUTE = 6;
    public static final int INVALID_NEXT_HOP_ATTRIBUTE = 8;
    public static final int INVALID_NETWORK_FIELD = 10;
    public static final int MALFORMED_AS_PATH = 11;

    // CEASE subcodes
    public static final int ADMINISTRATIVE_SHUTDOWN = 2;
    public static final int PEER_DECONFIGURED = 3;
    public static final int ADMINISTRATIVE_RESET = 4;

    private final int errorCode;
    private final int errorSubcode;
    private final byte[] data;

    public NotificationMessage(int errorCode, int errorSubcode, byte[] data) {
        this.errorCode = errorCode & 0xFF;
        this.errorSubcode = errorSubcode & 0xFF;
        this.data = Objects.requireNonNull(data, "data").clone();
    }

    public NotificationMessage(int errorCode, int errorSubcode) {
        this(errorCode, errorSubcode, new byte[0]);
    }

    public static NotificationMessage holdTimerExpired() {
        return new NotificationMessage(HOLD_TIMER_EXPIRED, 0);
    }

    public static NotificationMessage fsmError() {
        return new NotificationMessage(FSM_ERROR, 0);
    }

    public static NotificationMessage cease(int subcode) {
        return new NotificationMessage(CEASE, subcode);
    }

    public static NotificationMessage openError(int subcode) {
        return new NotificationMessage(OPEN_MESSAGE_ERROR, subcode);
    }

    public int errorCode() {
        return errorCode;
    }

    public int errorSubcode() {
        return errorSubcode;
    }

    public byte[] data() {
        return data.clone();
    }

    /**
     * Short human-readable reason, e.g. {@code "Hold Timer Expired (4/0)"}.
     */
    public String describe() {
        String name = switch (errorCode) {
            case MESSAGE_HEADER_ERROR -> "Message Header Error";
            case OPEN_MESSAGE_ERROR -> "OPEN Message Error";
            case UPDATE_MESSAGE_ERROR -> "UPDATE Message Error";
            case HOLD_TIMER_EXPIRED -> "Hold Timer Expired";
            case FSM_ERROR -> "Finite State Machine Error";
            case CEASE -> "Cease";
            default -> "Unknown Error";
        };
        return name + " (" + errorCode + "/" + errorSubcode + ")";
    }

    @Override
    public BgpMessageType type() {
        return BgpMessageType.NOTIFICATION;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NotificationMessage other)) {
            return false;
        }
        return errorCode == other.errorCode && errorSubcode == other.errorSubcode
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * errorCode + errorSubcode) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "NOTIFICATION[" + describe()
                + (data.length == 0 ? "" : ", data=" + HexFormat.of().formatHex(data)) + ']';
    }
}
