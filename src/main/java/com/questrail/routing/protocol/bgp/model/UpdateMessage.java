package com.questrail.routing.protocol.bgp.model;

import java.util.List;
import java.util.Optional;

/**
 * UPDATE: withdrawn prefixes, a path attribute set and the prefixes announced
 * with that set.
 *
 * <p>{@code attributes} is absent for a withdrawal-only update.</p>
 */
public record UpdateMessage(List<Ipv4Prefix> withdrawn,
                            PathAttributes attributes,
                            List<Ipv4Prefix> announced) implements BgpMessage
{
    public UpdateMessage {
        withdrawn = List.copyOf(withdrawn);
        announced = List.copyOf(announced);
        if (!announced.isEmpty() && attributes == null) {
            throw new IllegalArgumentException("announced prefixes require path attributes");
        }
    }

    public static UpdateMessage announce(PathAttributes attributes, List<Ipv4Prefix> prefixes) {
        return new UpdateMessage(List.of(), attributes, prefixes);
    }

    public static UpdateMessage withdraw(List<Ipv4Prefix> prefixes) {
        return new UpdateMessage(prefixes, null, List.of());
    }

    public Optional<PathAttributes> pathAttributes() {
        return Optional.ofNullable(attributes);
    }

    /**
     * An UPDATE carrying nothing; used as the end-of-RIB marker.
     */
    public boolean isEmpty() {
        return withdrawn.isEmpty() && announced.isEmpty();
    }

    @Override
    public BgpMessageType type() {
        return BgpMessageType.UPDATE;
    }
}
