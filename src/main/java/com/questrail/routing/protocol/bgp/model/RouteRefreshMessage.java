package com.questrail.routing.protocol.bgp.model;

/**
 * ROUTE-REFRESH: asks the peer to re-send its Adj-RIB-Out for one AFI/SAFI.
 */
public record RouteRefreshMessage(int afi, int safi) implements BgpMessage
{
    public static RouteRefreshMessage ipv4Unicast() {
        return new RouteRefreshMessage(Capability.AFI_IPV4, Capability.SAFI_UNICAST);
    }

    @Override
    public BgpMessageType type() {
        return BgpMessageType.ROUTE_REFRESH;
    }
}
