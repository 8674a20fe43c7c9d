package com.questrail.routing.rib;

import com.questrail.routing.protocol.bgp.model.Ipv4Address;

/**
 * Supplies the interior cost to reach a BGP next hop.
 */
@FunctionalInterface
public interface IgpCostResolver
{
    /** Every next hop costs the same. */
    IgpCostResolver ZERO = nextHop -> 0L;

    long costTo(Ipv4Address nextHop);
}
