package com.questrail.routing.protocol.bgp.model;

/**
 * Ipv4Prefix
 * -----------------------------------------------------------------------------
 * An IPv4 destination prefix ({@code address/length}).
 *
 * <p>Host bits beyond {@code length} are always cleared, so two prefixes that
 * cover the same destination are equal regardless of how they were written.</p>
 */
public record Ipv4Prefix(Ipv4Address address, int length) implements Comparable<Ipv4Prefix>
{
    public Ipv4Prefix {
        if (address == null) {
            throw new IllegalArgumentException("address must not be null");
        }
        if (length < 0 || length > 32) {
            throw new IllegalArgumentException("prefix length must be 0-32: " + length);
        }
        address = new Ipv4Address(address.value() & mask(length));
    }

    public static Ipv4Prefix of(String address, int length) {
        return new Ipv4Prefix(Ipv4Address.parse(address), length);
    }

    /**
     * Parses {@code a.b.c.d/len}.
     */
    public static Ipv4Prefix parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("prefix must not be null");
        }
        int slash = text.indexOf('/');
        if (slash < 0) {
            throw new IllegalArgumentException("Missing prefix length: " + text);
        }
        final int length;
        try {
            length = Integer.parseInt(text.substring(slash + 1).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad prefix length: " + text, e);
        }
        return new Ipv4Prefix(Ipv4Address.parse(text.substring(0, slash)), length);
    }

    /**
     * Number of address octets carried on the wire for this prefix.
     */
    public int wireOctets() {
        return (length + 7) / 8;
    }

    private static int mask(int length) {
        return length == 0 ? 0 : -1 << (32 - length);
    }

    @Override
    public int compareTo(Ipv4Prefix other) {
        int c = address.compareTo(other.address);
        return c != 0 ? c : Integer.compare(length, other.length);
    }

    @Override
    public String toString() {
        return address + "/" + length;
    }
}
