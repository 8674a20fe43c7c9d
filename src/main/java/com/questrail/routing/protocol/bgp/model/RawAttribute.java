package com.questrail.routing.protocol.bgp.model;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A path attribute carried opaquely: any optional attribute this speaker does
 * not interpret (COMMUNITIES, AGGREGATOR, ...).
 *
 * <p>Equality is by value, including the attribute bytes, so attribute sets
 * that carry identical raw attributes intern to the same arena entry.</p>
 */
public final class RawAttribute
{
    public static final int FLAG_OPTIONAL = 0x80;
    public static final int FLAG_TRANSITIVE = 0x40;
    public static final int FLAG_PARTIAL = 0x20;
    public static final int FLAG_EXTENDED_LENGTH = 0x10;

    private final int flags;
    private final int typeCode;
    private final byte[] value;

    public RawAttribute(int flags, int typeCode, byte[] value) {
        this.flags = flags & 0xF0;
        this.typeCode = typeCode & 0xFF;
        this.value = Objects.requireNonNull(value, "value").clone();
    }

    public int flags() {
        return flags;
    }

    public int typeCode() {
        return typeCode;
    }

    public byte[] value() {
        return value.clone();
    }

    public boolean isTransitive() {
        return (flags & FLAG_TRANSITIVE) != 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RawAttribute other)) {
            return false;
        }
        return flags == other.flags && typeCode == other.typeCode && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * flags + typeCode) + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "RawAttribute[type=" + typeCode + ", flags=0x" + Integer.toHexString(flags)
                + ", value=" + HexFormat.of().formatHex(value) + ']';
    }
}
