package com.questrail.routing.protocol.bgp.internal.encode;

import com.questrail.routing.protocol.bgp.internal.frame.BgpFrame;
import com.questrail.routing.protocol.bgp.model.*;

import java.io.ByteArrayOutputStream;
import java.util.List;
import java.util.Objects;

/**
 * BgpMessageEncoder
 * ============================================================================
 * Converts a semantic {@link BgpMessage} into a {@link BgpFrame} ready for the
 * header encoder.
 *
 * <p>This is the outbound mirror of
 * {@code com.questrail.routing.protocol.bgp.internal.decode.BgpMessageDecoder}:
 * it decides attribute order, flag bits and AS number width, and nothing
 * else.</p>
 *
 * <p>Attributes are written in type code order (ORIGIN, AS_PATH, NEXT_HOP,
 * MULTI_EXIT_DISC, LOCAL_PREF) followed by carried raw attributes.</p>
 */
public final class BgpMessageEncoder
{
    private static final int WELL_KNOWN = RawAttribute.FLAG_TRANSITIVE;
    private static final int OPTIONAL_NON_TRANSITIVE = RawAttribute.FLAG_OPTIONAL;

    /**
     * @param message     message to encode
     * @param fourOctetAs whether AS_PATH AS numbers are written as 4 octets
     */
    public BgpFrame encode(BgpMessage message, boolean fourOctetAs) {
        Objects.requireNonNull(message, "message");

        byte[] body;
        if (message instanceof OpenMessage open) {
            body = encodeOpen(open);
        } else if (message instanceof UpdateMessage update) {
            body = encodeUpdate(update, fourOctetAs);
        } else if (message instanceof NotificationMessage notification) {
            body = encodeNotification(notification);
        } else if (message instanceof RouteRefreshMessage refresh) {
            body = new byte[] {
                    (byte) (refresh.afi() >>> 8), (byte) refresh.afi(), 0, (byte) refresh.safi()
            };
        } else {
            body = new byte[0];
        }
        return new BgpFrame(message.type().code(), body);
    }

    // ========================================================================
    // OPEN
    // ========================================================================

    private static byte[] encodeOpen(OpenMessage open) {
        ByteArrayOutputStream capabilities = new ByteArrayOutputStream();
        for (Capability c : open.capabilities()) {
            byte[] value = c.value();
            capabilities.write(c.code());
            capabilities.write(value.length);
            capabilities.writeBytes(value);
        }
        byte[] caps = capabilities.toByteArray();

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(open.version());
        long as = open.asNumber() > 0xFFFF ? OpenMessage.AS_TRANS : open.asNumber();
        writeShort(out, (int) as);
        writeShort(out, open.holdTimeSeconds());
        out.writeBytes(open.bgpIdentifier().toBytes());

        if (caps.length == 0) {
            out.write(0);
        } else {
            // A single capabilities parameter carries every capability.
            out.write(caps.length + 2);
            out.write(2);
            out.write(caps.length);
            out.writeBytes(caps);
        }
        return out.toByteArray();
    }

    // ========================================================================
    // UPDATE
    // ========================================================================

    private static byte[] encodeUpdate(UpdateMessage update, boolean fourOctetAs) {
        byte[] withdrawn = encodePrefixes(update.withdrawn());
        byte[] attributes = update.attributes() == null
                ? new byte[0]
                : encodeAttributes(update.attributes(), fourOctetAs);
        byte[] nlri = encodePrefixes(update.announced());

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeShort(out, withdrawn.length);
        out.writeBytes(withdrawn);
        writeShort(out, attributes.length);
        out.writeBytes(attributes);
        out.writeBytes(nlri);
        return out.toByteArray();
    }

    private static byte[] encodePrefixes(List<Ipv4Prefix> prefixes) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Ipv4Prefix p : prefixes) {
            out.write(p.length());
            out.write(p.address().toBytes(), 0, p.wireOctets());
        }
        return out.toByteArray();
    }

    private static byte[] encodeAttributes(PathAttributes attrs, boolean fourOctetAs) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        attrs.origin().ifPresent(o -> writeAttribute(out, WELL_KNOWN, 1, new byte[] { (byte) o.code() }));
        attrs.asPath().ifPresent(p -> writeAttribute(out, WELL_KNOWN, 2, encodeAsPath(p, fourOctetAs)));
        attrs.nextHop().ifPresent(nh -> writeAttribute(out, WELL_KNOWN, 3, nh.toBytes()));
        attrs.multiExitDisc().ifPresent(med -> writeAttribute(out, OPTIONAL_NON_TRANSITIVE, 4, int32(med)));
        attrs.localPref().ifPresent(lp -> writeAttribute(out, WELL_KNOWN, 5, int32(lp)));
        for (RawAttribute raw : attrs.optionalAttributes()) {
            writeAttribute(out, raw.flags(), raw.typeCode(), raw.value());
        }
        return out.toByteArray();
    }

    private static byte[] encodeAsPath(AsPath path, boolean fourOctetAs) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (AsPathSegment segment : path.segments()) {
            out.write(segment.type().code());
            out.write(segment.asNumbers().size());
            for (long asn : segment.asNumbers()) {
                if (fourOctetAs) {
                    out.writeBytes(int32(asn));
                } else {
                    writeShort(out, asn > 0xFFFF ? OpenMessage.AS_TRANS : (int) asn);
                }
            }
        }
        return out.toByteArray();
    }

    private static void writeAttribute(ByteArrayOutputStream out, int flags, int typeCode, byte[] value) {
        boolean extended = value.length > 255;
        int wireFlags = extended
                ? flags | RawAttribute.FLAG_EXTENDED_LENGTH
                : flags & ~RawAttribute.FLAG_EXTENDED_LENGTH;
        out.write(wireFlags);
        out.write(typeCode);
        if (extended) {
            writeShort(out, value.length);
        } else {
            out.write(value.length);
        }
        out.writeBytes(value);
    }

    // ========================================================================
    // NOTIFICATION
    // ========================================================================

    private static byte[] encodeNotification(NotificationMessage n) {
        byte[] data = n.data();
        byte[] body = new byte[2 + data.length];
        body[0] = (byte) n.errorCode();
        body[1] = (byte) n.errorSubcode();
        System.arraycopy(data, 0, body, 2, data.length);
        return body;
    }

    private static void writeShort(ByteArrayOutputStream out, int v) {
        out.write(v >>> 8);
        out.write(v);
    }

    private static byte[] int32(long v) {
        return new byte[] { (byte) (v >>> 24), (byte) (v >>> 16), (byte) (v >>> 8), (byte) v };
    }
}
