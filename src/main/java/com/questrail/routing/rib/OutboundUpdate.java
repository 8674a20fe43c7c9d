package com.questrail.routing.rib;

import com.questrail.routing.protocol.bgp.codec.impl.BgpFraming;
import com.questrail.routing.protocol.bgp.model.Ipv4Address;
import com.questrail.routing.protocol.bgp.model.Ipv4Prefix;
import com.questrail.routing.protocol.bgp.model.PathAttributes;
import com.questrail.routing.protocol.bgp.model.UpdateMessage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The Adj-RIB-Out changes for one peer produced by a single RIB pass.
 *
 * @param peer      target peer address
 * @param withdrawn prefixes no longer advertised, in prefix order
 * @param announced prefixes newly advertised or re-advertised with changed
 *                  attributes, in prefix order
 */
public record OutboundUpdate(Ipv4Address peer,
                             List<Ipv4Prefix> withdrawn,
                             Map<Ipv4Prefix, PathAttributes> announced)
{
    // UPDATE body room: the 4096-octet limit less the 19-octet header and the
    // two 2-octet length fields.
    static final int MAX_BODY_OCTETS = BgpFraming.MAX_MESSAGE_LENGTH - BgpFraming.HEADER_LENGTH - 4;

    public OutboundUpdate {
        Objects.requireNonNull(peer, "peer");
        withdrawn = List.copyOf(withdrawn);
        announced = Collections.unmodifiableMap(new LinkedHashMap<>(announced));
    }

    public boolean isEmpty() {
        return withdrawn.isEmpty() && announced.isEmpty();
    }

    /**
     * Packs the changes into UPDATE messages: withdrawals first, then one or
     * more announcements per distinct attribute set. Every message fits the
     * 4096-octet limit whichever AS number width the session uses, provided
     * each attribute set leaves room for one prefix (see
     * {@link #fitsOnePrefix(PathAttributes)}).
     */
    public List<UpdateMessage> toMessages() {
        List<UpdateMessage> messages = new ArrayList<>();

        for (List<Ipv4Prefix> chunk : chunks(withdrawn, MAX_BODY_OCTETS)) {
            messages.add(UpdateMessage.withdraw(chunk));
        }

        Map<PathAttributes, List<Ipv4Prefix>> byAttributes = new LinkedHashMap<>();
        announced.forEach((prefix, attributes) ->
                byAttributes.computeIfAbsent(attributes, a -> new ArrayList<>()).add(prefix));

        byAttributes.forEach((attributes, prefixes) -> {
            for (List<Ipv4Prefix> chunk : chunks(prefixes, MAX_BODY_OCTETS - attributes.wireOctets())) {
                messages.add(UpdateMessage.announce(attributes, chunk));
            }
        });
        return messages;
    }

    /**
     * True if an UPDATE carrying {@code attributes} has room for at least one
     * prefix of any length.
     */
    public static boolean fitsOnePrefix(PathAttributes attributes) {
        return attributes.wireOctets() + 5 <= MAX_BODY_OCTETS;
    }

    private static List<List<Ipv4Prefix>> chunks(List<Ipv4Prefix> prefixes, int budget) {
        List<List<Ipv4Prefix>> result = new ArrayList<>();
        int start = 0;
        int used = 0;
        for (int i = 0; i < prefixes.size(); i++) {
            int octets = 1 + prefixes.get(i).wireOctets();
            if (used + octets > budget && i > start) {
                result.add(prefixes.subList(start, i));
                start = i;
                used = 0;
            }
            used += octets;
        }
        if (start < prefixes.size()) {
            result.add(prefixes.subList(start, prefixes.size()));
        }
        return result;
    }
}
