package com.questrail.routing.protocol.bgp.model;

import java.util.List;
import java.util.Objects;

/**
 * OPEN: the first message of every session.
 *
 * <p>{@code asNumber} is the sender's real AS. When it does not fit in two
 * octets the wire form carries AS_TRANS (23456) in the fixed field and the real
 * value in a 4-octet AS capability; the codec handles both directions.</p>
 */
public record OpenMessage(int version,
                          long asNumber,
                          int holdTimeSeconds,
                          Ipv4Address bgpIdentifier,
                          List<Capability> capabilities) implements BgpMessage
{
    public static final int BGP_VERSION = 4;
    public static final int AS_TRANS = 23456;

    public OpenMessage {
        Objects.requireNonNull(bgpIdentifier, "bgpIdentifier");
        capabilities = List.copyOf(capabilities);
        if (holdTimeSeconds < 0 || holdTimeSeconds > 0xFFFF) {
            throw new IllegalArgumentException("holdTimeSeconds out of range: " + holdTimeSeconds);
        }
    }

    /**
     * OPEN as this speaker sends it: version 4, IPv4 unicast, route refresh and
     * 4-octet AS capabilities.
     */
    public static OpenMessage local(long asNumber, int holdTimeSeconds, Ipv4Address routerId) {
        return new OpenMessage(BGP_VERSION, asNumber, holdTimeSeconds, routerId, List.of(
                Capability.multiprotocol(Capability.AFI_IPV4, Capability.SAFI_UNICAST),
                Capability.routeRefresh(),
                Capability.fourOctetAs(asNumber)));
    }

    public boolean hasCapability(int code) {
        return capabilities.stream().anyMatch(c -> c.code() == code);
    }

    public boolean supportsFourOctetAs() {
        return hasCapability(Capability.FOUR_OCTET_AS);
    }

    @Override
    public BgpMessageType type() {
        return BgpMessageType.OPEN;
    }
}
