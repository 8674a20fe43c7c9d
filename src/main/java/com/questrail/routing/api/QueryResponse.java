package com.questrail.routing.api;

import com.questrail.routing.protocol.bgp.model.Ipv4Address;

import java.util.List;
import java.util.Objects;

/**
 * The single answer to a {@link QueryRequest}.
 */
public sealed interface QueryResponse
        permits QueryResponse.NeighborResponse,
                QueryResponse.NeighborsResponse,
                QueryResponse.RibResponse,
                QueryError
{
    /** Answer to {@link QueryKind#NEIGHBOR}. */
    record NeighborResponse(PeerStatus status) implements QueryResponse {
        public NeighborResponse {
            Objects.requireNonNull(status, "status");
        }
    }

    /** Answer to {@link QueryKind#NEIGHBORS}, ordered by peer address. */
    record NeighborsResponse(List<PeerStatus> neighbors) implements QueryResponse {
        public NeighborsResponse {
            neighbors = List.copyOf(neighbors);
        }
    }

    /**
     * Answer to the RIB dump kinds, ordered by prefix.
     *
     * @param peer the keyed peer for Adj-RIB queries, {@code null} for Loc-RIB
     */
    record RibResponse(QueryKind kind, Ipv4Address peer, List<RibEntrySummary> entries) implements QueryResponse {
        public RibResponse {
            Objects.requireNonNull(kind, "kind");
            entries = List.copyOf(entries);
        }
    }
}
