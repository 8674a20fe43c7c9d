package com.questrail.routing.rib;

import com.questrail.routing.protocol.bgp.model.Ipv4Address;
import com.questrail.routing.protocol.bgp.model.Ipv4Prefix;

import java.time.Instant;
import java.util.Objects;

/**
 * A route the RIB refused to install in Adj-RIB-In.
 *
 * @param timestamp wall-clock time of the rejection (observational only)
 * @param peer      the peer that announced the route
 * @param prefix    the rejected prefix
 * @param reason    rejection class
 * @param detail    human-readable detail, e.g. the missing attribute names
 */
public record RibDiagnostic(Instant timestamp,
                            Ipv4Address peer,
                            Ipv4Prefix prefix,
                            Reason reason,
                            String detail)
{
    public enum Reason {
        /** ORIGIN, AS_PATH or NEXT_HOP absent. */
        MISSING_ATTRIBUTE,
        /** Local AS found in the AS path of a route learned over eBGP. */
        AS_PATH_LOOP
    }

    public RibDiagnostic {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(peer, "peer");
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(reason, "reason");
        detail = detail == null ? "" : detail;
    }
}
