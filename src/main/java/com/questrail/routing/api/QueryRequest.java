package com.questrail.routing.api;

import com.questrail.routing.protocol.bgp.model.Ipv4Address;

import java.util.Objects;
import java.util.Optional;

/**
 * A typed management query.
 *
 * <p>{@code key} is the peer address for the kinds that
 * {@linkplain QueryKind#requiresKey() require one}; it may be {@code null}
 * otherwise. A missing key is answered with
 * {@link QueryError.Code#INVALID_REQUEST}, not rejected here.</p>
 */
public record QueryRequest(QueryKind kind, Ipv4Address key)
{
    public QueryRequest {
        Objects.requireNonNull(kind, "kind");
    }

    public static QueryRequest neighbor(Ipv4Address peer) {
        return new QueryRequest(QueryKind.NEIGHBOR, peer);
    }

    public static QueryRequest neighbors() {
        return new QueryRequest(QueryKind.NEIGHBORS, null);
    }

    public static QueryRequest adjRibIn(Ipv4Address peer) {
        return new QueryRequest(QueryKind.ADJ_RIB_IN, peer);
    }

    public static QueryRequest adjRibOut(Ipv4Address peer) {
        return new QueryRequest(QueryKind.ADJ_RIB_OUT, peer);
    }

    public static QueryRequest locRib() {
        return new QueryRequest(QueryKind.LOC_RIB, null);
    }

    public static QueryRequest locRibBest() {
        return new QueryRequest(QueryKind.LOC_RIB_BEST, null);
    }

    public Optional<Ipv4Address> peer() {
        return Optional.ofNullable(key);
    }
}
