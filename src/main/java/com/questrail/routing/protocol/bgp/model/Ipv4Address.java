package com.questrail.routing.protocol.bgp.model;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Ipv4Address
 * -----------------------------------------------------------------------------
 * Immutable 32-bit IPv4 address used for next hops, BGP identifiers and peer
 * identity.
 *
 * <p>The value is held as a signed {@code int} in network order; ordering is
 * always unsigned so that {@code 10.0.0.1 < 192.168.0.1}.</p>
 */
public record Ipv4Address(int value) implements Comparable<Ipv4Address>
{
    public static final Ipv4Address ANY = new Ipv4Address(0);

    /**
     * Parses a dotted-quad literal. Host names are never resolved.
     *
     * @throws IllegalArgumentException if the text is not a dotted-quad IPv4 literal
     */
    public static Ipv4Address parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("address must not be null");
        }
        String[] parts = text.trim().split("\\.", -1);
        if (parts.length != 4) {
            throw new IllegalArgumentException("Not an IPv4 address: " + text);
        }
        int value = 0;
        for (String part : parts) {
            final int octet;
            try {
                octet = Integer.parseInt(part);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not an IPv4 address: " + text, e);
            }
            if (part.isEmpty() || octet < 0 || octet > 255) {
                throw new IllegalArgumentException("Not an IPv4 address: " + text);
            }
            value = (value << 8) | octet;
        }
        return new Ipv4Address(value);
    }

    public static Ipv4Address of(InetAddress address) {
        byte[] raw = address.getAddress();
        if (raw.length != 4) {
            throw new IllegalArgumentException("Not an IPv4 address: " + address);
        }
        return fromBytes(raw, 0);
    }

    public static Ipv4Address fromBytes(byte[] raw, int offset) {
        return new Ipv4Address(((raw[offset] & 0xFF) << 24)
                | ((raw[offset + 1] & 0xFF) << 16)
                | ((raw[offset + 2] & 0xFF) << 8)
                | (raw[offset + 3] & 0xFF));
    }

    public byte[] toBytes() {
        return new byte[] {
                (byte) (value >>> 24),
                (byte) (value >>> 16),
                (byte) (value >>> 8),
                (byte) value
        };
    }

    public InetAddress toInetAddress() {
        try {
            return InetAddress.getByAddress(toBytes());
        } catch (UnknownHostException e) {
            // Only thrown for illegal lengths; four bytes is always legal.
            throw new IllegalStateException(e);
        }
    }

    public boolean isUnspecified() {
        return value == 0;
    }

    @Override
    public int compareTo(Ipv4Address other) {
        return Integer.compareUnsigned(value, other.value);
    }

    @Override
    public String toString() {
        return ((value >>> 24) & 0xFF) + "." + ((value >>> 16) & 0xFF) + "."
                + ((value >>> 8) & 0xFF) + "." + (value & 0xFF);
    }
}
