package com.questrail.routing.api;

import java.util.concurrent.CompletableFuture;

/**
 * BgpQueryGateway
 * -----------------------------------------------------------------------------
 * The management boundary of the speaker: one typed request in, exactly one
 * typed response out.
 *
 * <p>Queries are answered on the coordinator thread, in submission order and
 * interleaved with RIB updates, so every answer reflects a consistent RIB.
 * The returned future never completes exceptionally; failures arrive as a
 * {@link QueryError}.</p>
 */
public interface BgpQueryGateway
{
    CompletableFuture<QueryResponse> query(QueryRequest request);
}
