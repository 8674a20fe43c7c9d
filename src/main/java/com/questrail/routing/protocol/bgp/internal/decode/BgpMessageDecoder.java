package com.questrail.routing.protocol.bgp.internal.decode;

import com.questrail.routing.protocol.bgp.internal.frame.BgpFrame;
import com.questrail.routing.protocol.bgp.model.*;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import static com.questrail.routing.protocol.bgp.model.NotificationMessage.*;

/**
 * BgpMessageDecoder
 * ============================================================================
 * Converts a header-validated {@link BgpFrame} into a semantic
 * {@link BgpMessage}.
 *
 * <h2>Architectural Role</h2>
 * This class is the boundary between wire layout and protocol meaning. The
 * session reducer and the RIB operate on {@link BgpMessage} only and never on
 * attribute flags, length fields or AS number widths.
 *
 * <h2>What this decoder checks</h2>
 * <ul>
 *   <li>OPEN optional parameter syntax (OPEN Message Error)</li>
 *   <li>UPDATE field lengths, attribute flags and lengths, ORIGIN values,
 *       NEXT_HOP syntax, AS_PATH well-formedness, prefix lengths and duplicate
 *       attributes (UPDATE Message Error)</li>
 * </ul>
 *
 * <h2>What this decoder does NOT check</h2>
 * <ul>
 *   <li>OPEN field values such as version, AS or hold time; those are
 *       session policy and belong to the reducer</li>
 *   <li>Presence of mandatory attributes; the RIB rejects incomplete routes
 *       without ending the session</li>
 * </ul>
 *
 * <p>Every failure is a {@link BgpDecodeException} carrying the
 * NOTIFICATION code and subcode.</p>
 */
public final class BgpMessageDecoder
{
    static final int ATTR_ORIGIN = 1;
    static final int ATTR_AS_PATH = 2;
    static final int ATTR_NEXT_HOP = 3;
    static final int ATTR_MED = 4;
    static final int ATTR_LOCAL_PREF = 5;
    static final int ATTR_ATOMIC_AGGREGATE = 6;

    private static final int OPEN_PARAM_CAPABILITIES = 2;

    /**
     * Decodes {@code frame}.
     *
     * @param frame       validated frame
     * @param fourOctetAs whether AS_PATH carries 4-octet AS numbers on this
     *                    session (both sides advertised the capability)
     * @throws BgpDecodeException if the body is malformed
     */
    public BgpMessage decode(BgpFrame frame, boolean fourOctetAs) {
        Objects.requireNonNull(frame, "frame");

        BgpMessageType type = BgpMessageType.fromCode(frame.type());
        if (type == null) {
            throw new BgpDecodeException(MESSAGE_HEADER_ERROR, BAD_MESSAGE_TYPE,
                    new byte[] { (byte) frame.type() }, "Unknown message type " + frame.type());
        }

        ByteBuffer body = ByteBuffer.wrap(frame.body());
        return switch (type) {
            case OPEN -> decodeOpen(body);
            case UPDATE -> decodeUpdate(body, fourOctetAs);
            case NOTIFICATION -> decodeNotification(body);
            case KEEPALIVE -> decodeKeepalive(body);
            case ROUTE_REFRESH -> decodeRouteRefresh(body);
        };
    }

    // ========================================================================
    // OPEN
    // ========================================================================

    private OpenMessage decodeOpen(ByteBuffer body) {
        try {
            int version = body.get() & 0xFF;
            int myAs = body.getShort() & 0xFFFF;
            int holdTime = body.getShort() & 0xFFFF;
            Ipv4Address bgpId = new Ipv4Address(body.getInt());
            int paramsLength = body.get() & 0xFF;

            if (paramsLength != body.remaining()) {
                throw new BgpDecodeException(OPEN_MESSAGE_ERROR, 0,
                        "Optional parameters length " + paramsLength
                                + " does not match remaining " + body.remaining());
            }

            List<Capability> capabilities = new ArrayList<>();
            while (body.hasRemaining()) {
                int paramType = body.get() & 0xFF;
                int paramLength = body.get() & 0xFF;
                if (paramLength > body.remaining()) {
                    throw new BgpDecodeException(OPEN_MESSAGE_ERROR, 0,
                            "Optional parameter overruns the message");
                }
                if (paramType != OPEN_PARAM_CAPABILITIES) {
                    throw new BgpDecodeException(OPEN_MESSAGE_ERROR, UNSUPPORTED_OPTIONAL_PARAMETER,
                            "Unsupported optional parameter " + paramType);
                }
                ByteBuffer param = slice(body, paramLength);
                while (param.hasRemaining()) {
                    int code = param.get() & 0xFF;
                    int length = param.get() & 0xFF;
                    if (length > param.remaining()) {
                        throw new BgpDecodeException(OPEN_MESSAGE_ERROR, 0,
                                "Capability " + code + " overruns its parameter");
                    }
                    byte[] value = new byte[length];
                    param.get(value);
                    capabilities.add(new Capability(code, value));
                }
            }

            long asNumber = myAs;
            for (Capability c : capabilities) {
                if (c.code() == Capability.FOUR_OCTET_AS) {
                    if (c.value().length != 4) {
                        throw new BgpDecodeException(OPEN_MESSAGE_ERROR, 0,
                                "4-octet AS capability must carry 4 bytes");
                    }
                    asNumber = c.fourOctetAsNumber();
                }
            }

            return new OpenMessage(version, asNumber, holdTime, bgpId, capabilities);
        }
        catch (BufferUnderflowException e) {
            throw new BgpDecodeException(MESSAGE_HEADER_ERROR, BAD_MESSAGE_LENGTH, "Truncated OPEN");
        }
    }

    // ========================================================================
    // UPDATE
    // ========================================================================

    private UpdateMessage decodeUpdate(ByteBuffer body, boolean fourOctetAs) {
        try {
            int withdrawnLength = body.getShort() & 0xFFFF;
            if (withdrawnLength > body.remaining() - 2) {
                throw new BgpDecodeException(UPDATE_MESSAGE_ERROR, MALFORMED_ATTRIBUTE_LIST,
                        "Withdrawn routes length " + withdrawnLength + " overruns the message");
            }
            List<Ipv4Prefix> withdrawn = decodePrefixes(slice(body, withdrawnLength));

            int attributesLength = body.getShort() & 0xFFFF;
            if (attributesLength > body.remaining()) {
                throw new BgpDecodeException(UPDATE_MESSAGE_ERROR, MALFORMED_ATTRIBUTE_LIST,
                        "Path attribute length " + attributesLength + " overruns the message");
            }
            PathAttributes attributes = attributesLength == 0
                    ? null
                    : decodeAttributes(slice(body, attributesLength), fourOctetAs);

            List<Ipv4Prefix> announced = decodePrefixes(body);

            if (!announced.isEmpty() && attributes == null) {
                // NLRI without any attributes: every mandatory attribute is missing.
                attributes = PathAttributes.builder().build();
            }
            return new UpdateMessage(withdrawn, attributes, announced);
        }
        catch (BufferUnderflowException e) {
            throw new BgpDecodeException(UPDATE_MESSAGE_ERROR, MALFORMED_ATTRIBUTE_LIST, "Truncated UPDATE");
        }
    }

    private static List<Ipv4Prefix> decodePrefixes(ByteBuffer buf) {
        List<Ipv4Prefix> prefixes = new ArrayList<>();
        while (buf.hasRemaining()) {
            int length = buf.get() & 0xFF;
            if (length > 32) {
                throw new BgpDecodeException(UPDATE_MESSAGE_ERROR, INVALID_NETWORK_FIELD,
                        "Prefix length " + length + " exceeds 32");
            }
            int octets = (length + 7) / 8;
            if (octets > buf.remaining()) {
                throw new BgpDecodeException(UPDATE_MESSAGE_ERROR, INVALID_NETWORK_FIELD,
                        "Prefix overruns its field");
            }
            byte[] raw = new byte[4];
            buf.get(raw, 0, octets);
            prefixes.add(new Ipv4Prefix(Ipv4Address.fromBytes(raw, 0), length));
        }
        return prefixes;
    }

    private PathAttributes decodeAttributes(ByteBuffer buf, boolean fourOctetAs) {
        PathAttributes.Builder builder = PathAttributes.builder();
        Set<Integer> seen = new HashSet<>();

        while (buf.hasRemaining()) {
            if (buf.remaining() < 3) {
                throw new BgpDecodeException(UPDATE_MESSAGE_ERROR, MALFORMED_ATTRIBUTE_LIST,
                        "Truncated attribute header");
            }
            int start = buf.position();
            int flags = buf.get() & 0xFF;
            int typeCode = buf.get() & 0xFF;
            boolean extended = (flags & RawAttribute.FLAG_EXTENDED_LENGTH) != 0;
            if (extended && buf.remaining() < 2) {
                throw new BgpDecodeException(UPDATE_MESSAGE_ERROR, MALFORMED_ATTRIBUTE_LIST,
                        "Truncated attribute header");
            }
            int length = extended ? buf.getShort() & 0xFFFF : buf.get() & 0xFF;
            if (length > buf.remaining()) {
                throw new BgpDecodeException(UPDATE_MESSAGE_ERROR, ATTRIBUTE_LENGTH_ERROR,
                        attributeData(buf, start, buf.limit()),
                        "Attribute " + typeCode + " length " + length + " overruns the attribute list");
            }
            byte[] value = new byte[length];
            buf.get(value);
            byte[] whole = attributeData(buf, start, buf.position());

            if (!seen.add(typeCode)) {
                throw new BgpDecodeException(UPDATE_MESSAGE_ERROR, MALFORMED_ATTRIBUTE_LIST,
                        "Duplicate attribute " + typeCode);
            }

            switch (typeCode) {
                case ATTR_ORIGIN -> {
                    checkWellKnownFlags(flags, whole, typeCode);
                    checkLength(length, 1, whole, typeCode);
                    int code = value[0] & 0xFF;
                    if (code > 2) {
                        throw new BgpDecodeException(UPDATE_MESSAGE_ERROR, INVALID_ORIGIN_ATTRIBUTE,
                                whole, "Invalid ORIGIN " + code);
                    }
                    builder.origin(Origin.fromCode(code));
                }
                case ATTR_AS_PATH -> {
                    checkWellKnownFlags(flags, whole, typeCode);
                    builder.asPath(decodeAsPath(value, fourOctetAs));
                }
                case ATTR_NEXT_HOP -> {
                    checkWellKnownFlags(flags, whole, typeCode);
                    checkLength(length, 4, whole, typeCode);
                    Ipv4Address nextHop = Ipv4Address.fromBytes(value, 0);
                    if (nextHop.isUnspecified() || nextHop.value() == -1) {
                        throw new BgpDecodeException(UPDATE_MESSAGE_ERROR, INVALID_NEXT_HOP_ATTRIBUTE,
                                whole, "Invalid NEXT_HOP " + nextHop);
                    }
                    builder.nextHop(nextHop);
                }
                case ATTR_MED -> {
                    if ((flags & (RawAttribute.FLAG_OPTIONAL | RawAttribute.FLAG_TRANSITIVE))
                            != RawAttribute.FLAG_OPTIONAL) {
                        throw new BgpDecodeException(UPDATE_MESSAGE_ERROR, ATTRIBUTE_FLAGS_ERROR,
                                whole, "Bad flags for MULTI_EXIT_DISC");
                    }
                    checkLength(length, 4, whole, typeCode);
                    builder.multiExitDisc(unsigned32(value));
                }
                case ATTR_LOCAL_PREF -> {
                    checkWellKnownFlags(flags, whole, typeCode);
                    checkLength(length, 4, whole, typeCode);
                    builder.localPref(unsigned32(value));
                }
                case ATTR_ATOMIC_AGGREGATE -> {
                    checkWellKnownFlags(flags, whole, typeCode);
                    checkLength(length, 0, whole, typeCode);
                    builder.addOptional(new RawAttribute(flags & ~RawAttribute.FLAG_EXTENDED_LENGTH,
                            typeCode, value));
                }
                default -> {
                    if ((flags & RawAttribute.FLAG_OPTIONAL) == 0) {
                        throw new BgpDecodeException(UPDATE_MESSAGE_ERROR, UNRECOGNIZED_WELL_KNOWN_ATTRIBUTE,
                                whole, "Unrecognized well-known attribute " + typeCode);
                    }
                    builder.addOptional(new RawAttribute(flags & ~RawAttribute.FLAG_EXTENDED_LENGTH,
                            typeCode, value));
                }
            }
        }
        return builder.build();
    }

    private static AsPath decodeAsPath(byte[] value, boolean fourOctetAs) {
        final int asSize = fourOctetAs ? 4 : 2;
        ByteBuffer buf = ByteBuffer.wrap(value);
        List<AsPathSegment> segments = new ArrayList<>();

        while (buf.hasRemaining()) {
            if (buf.remaining() < 2) {
                throw new BgpDecodeException(UPDATE_MESSAGE_ERROR, MALFORMED_AS_PATH,
                        "Truncated AS_PATH segment header");
            }
            int type = buf.get() & 0xFF;
            int count = buf.get() & 0xFF;
            if (type != AsPathSegment.Type.AS_SET.code() && type != AsPathSegment.Type.AS_SEQUENCE.code()) {
                throw new BgpDecodeException(UPDATE_MESSAGE_ERROR, MALFORMED_AS_PATH,
                        "Unknown AS_PATH segment type " + type);
            }
            if (count == 0 || count * asSize > buf.remaining()) {
                throw new BgpDecodeException(UPDATE_MESSAGE_ERROR, MALFORMED_AS_PATH,
                        "AS_PATH segment of " + count + " AS numbers does not fit");
            }
            List<Long> asns = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                asns.add(fourOctetAs ? buf.getInt() & 0xFFFFFFFFL : (long) (buf.getShort() & 0xFFFF));
            }
            segments.add(new AsPathSegment(AsPathSegment.Type.fromCode(type), asns));
        }
        return new AsPath(segments);
    }

    private static void checkWellKnownFlags(int flags, byte[] whole, int typeCode) {
        if ((flags & (RawAttribute.FLAG_OPTIONAL | RawAttribute.FLAG_TRANSITIVE))
                != RawAttribute.FLAG_TRANSITIVE) {
            throw new BgpDecodeException(UPDATE_MESSAGE_ERROR, ATTRIBUTE_FLAGS_ERROR,
                    whole, "Bad flags 0x" + Integer.toHexString(flags) + " for attribute " + typeCode);
        }
    }

    private static void checkLength(int actual, int expected, byte[] whole, int typeCode) {
        if (actual != expected) {
            throw new BgpDecodeException(UPDATE_MESSAGE_ERROR, ATTRIBUTE_LENGTH_ERROR,
                    whole, "Attribute " + typeCode + " must be " + expected + " bytes, was " + actual);
        }
    }

    private static byte[] attributeData(ByteBuffer buf, int from, int to) {
        return Arrays.copyOfRange(buf.array(), buf.arrayOffset() + from, buf.arrayOffset() + to);
    }

    private static long unsigned32(byte[] v) {
        return ((long) (v[0] & 0xFF) << 24) | ((v[1] & 0xFF) << 16) | ((v[2] & 0xFF) << 8) | (v[3] & 0xFF);
    }

    // ========================================================================
    // NOTIFICATION, KEEPALIVE, ROUTE-REFRESH
    // ========================================================================

    private static NotificationMessage decodeNotification(ByteBuffer body) {
        try {
            int code = body.get() & 0xFF;
            int subcode = body.get() & 0xFF;
            byte[] data = new byte[body.remaining()];
            body.get(data);
            return new NotificationMessage(code, subcode, data);
        }
        catch (BufferUnderflowException e) {
            throw new BgpDecodeException(MESSAGE_HEADER_ERROR, BAD_MESSAGE_LENGTH, "Truncated NOTIFICATION");
        }
    }

    private static KeepaliveMessage decodeKeepalive(ByteBuffer body) {
        if (body.hasRemaining()) {
            throw new BgpDecodeException(MESSAGE_HEADER_ERROR, BAD_MESSAGE_LENGTH,
                    "KEEPALIVE must not carry a body");
        }
        return KeepaliveMessage.INSTANCE;
    }

    private static RouteRefreshMessage decodeRouteRefresh(ByteBuffer body) {
        if (body.remaining() != 4) {
            throw new BgpDecodeException(MESSAGE_HEADER_ERROR, BAD_MESSAGE_LENGTH,
                    "ROUTE-REFRESH body must be 4 bytes");
        }
        int afi = body.getShort() & 0xFFFF;
        body.get(); // reserved
        int safi = body.get() & 0xFF;
        return new RouteRefreshMessage(afi, safi);
    }

    private static ByteBuffer slice(ByteBuffer buf, int length) {
        ByteBuffer slice = buf.slice();
        slice.limit(length);
        buf.position(buf.position() + length);
        return slice;
    }
}
