package com.questrail.routing.protocol.bgp.model;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A capability advertised in the OPEN message's optional parameters.
 */
public final class Capability
{
    public static final int MULTIPROTOCOL = 1;
    public static final int ROUTE_REFRESH = 2;
    public static final int FOUR_OCTET_AS = 65;

    public static final int AFI_IPV4 = 1;
    public static final int SAFI_UNICAST = 1;

    private final int code;
    private final byte[] value;

    public Capability(int code, byte[] value) {
        this.code = code & 0xFF;
        this.value = Objects.requireNonNull(value, "value").clone();
    }

    public static Capability multiprotocol(int afi, int safi) {
        return new Capability(MULTIPROTOCOL, new byte[] {
                (byte) (afi >>> 8), (byte) afi, 0, (byte) safi
        });
    }

    public static Capability routeRefresh() {
        return new Capability(ROUTE_REFRESH, new byte[0]);
    }

    public static Capability fourOctetAs(long asNumber) {
        return new Capability(FOUR_OCTET_AS, new byte[] {
                (byte) (asNumber >>> 24), (byte) (asNumber >>> 16), (byte) (asNumber >>> 8), (byte) asNumber
        });
    }

    public int code() {
        return code;
    }

    public byte[] value() {
        return value.clone();
    }

    /**
     * True for a multiprotocol capability naming IPv4 unicast.
     */
    public boolean isIpv4Unicast() {
        return code == MULTIPROTOCOL
                && value.length == 4
                && (((value[0] & 0xFF) << 8) | (value[1] & 0xFF)) == AFI_IPV4
                && (value[3] & 0xFF) == SAFI_UNICAST;
    }

    /**
     * The AS number carried by a 4-octet AS capability.
     *
     * @throws IllegalStateException if this is not a well-formed 4-octet AS capability
     */
    public long fourOctetAsNumber() {
        if (code != FOUR_OCTET_AS || value.length != 4) {
            throw new IllegalStateException("Not a 4-octet AS capability: " + this);
        }
        return ((long) (value[0] & 0xFF) << 24) | ((value[1] & 0xFF) << 16)
                | ((value[2] & 0xFF) << 8) | (value[3] & 0xFF);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Capability other)) {
            return false;
        }
        return code == other.code && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return 31 * code + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "Capability[code=" + code + ", value=" + HexFormat.of().formatHex(value) + ']';
    }
}
