package com.questrail.routing.rib;

import com.questrail.routing.protocol.bgp.model.Ipv4Prefix;
import com.questrail.routing.protocol.bgp.model.PathAttributes;

import java.util.Objects;

/**
 * One path to a prefix, as held in a RIB table.
 *
 * @param prefix     destination
 * @param attributes interned attribute set
 * @param source     the peer the path was learned from
 */
public record Route(Ipv4Prefix prefix, AttributeRef attributes, RibPeer source)
{
    public Route {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(attributes, "attributes");
        Objects.requireNonNull(source, "source");
    }

    public PathAttributes pathAttributes() {
        return attributes.attributes();
    }
}
