package com.questrail.routing.api;

import com.questrail.routing.protocol.bgp.model.Ipv4Address;
import com.questrail.routing.protocol.bgp.model.Ipv4Prefix;
import com.questrail.routing.protocol.bgp.model.Origin;

import java.util.Objects;

/**
 * One path in a RIB dump.
 *
 * @param source    the peer the path was learned from
 * @param localPref LOCAL_PREF as carried, or the default when absent
 * @param med       MED as carried, or 0 when absent
 * @param best      the path is the Loc-RIB winner for its prefix
 */
public record RibEntrySummary(Ipv4Prefix prefix,
                              Ipv4Address source,
                              Ipv4Address nextHop,
                              String asPath,
                              Origin origin,
                              long localPref,
                              long med,
                              boolean best)
{
    public RibEntrySummary {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(source, "source");
    }
}
