package com.questrail.routing.rib;

import com.questrail.routing.protocol.bgp.config.BgpPeerConfig;
import com.questrail.routing.protocol.bgp.model.Ipv4Address;

import java.util.Objects;

/**
 * An Established neighbor as the RIB sees it: the source of Adj-RIB-In routes
 * and the target of Adj-RIB-Out routes.
 *
 * @param peerAddress          neighbor transport address, unique per peer
 * @param peerAs               neighbor AS
 * @param localAs              our AS on this session
 * @param routerId             neighbor BGP identifier (from its OPEN)
 * @param localAddress         our address on this session, used as next hop on eBGP export
 * @param routeReflectorClient the neighbor is one of our route-reflector clients
 */
public record RibPeer(Ipv4Address peerAddress,
                      long peerAs,
                      long localAs,
                      Ipv4Address routerId,
                      Ipv4Address localAddress,
                      boolean routeReflectorClient)
{
    public RibPeer {
        Objects.requireNonNull(peerAddress, "peerAddress");
        Objects.requireNonNull(routerId, "routerId");
        Objects.requireNonNull(localAddress, "localAddress");
    }

    public static RibPeer of(BgpPeerConfig config, Ipv4Address peerRouterId) {
        return new RibPeer(config.peerAddress(), config.remoteAs(), config.localAs(), peerRouterId,
                config.localAddress(), config.routeReflectorClient());
    }

    public boolean isExternal() {
        return peerAs != localAs;
    }
}
