package com.questrail.routing.api;

import java.util.Objects;

/**
 * A query that could not be answered.
 */
public record QueryError(Code code, String message) implements QueryResponse
{
    public enum Code {
        /** The keyed peer is not configured. */
        NOT_FOUND,
        /** The request is malformed, e.g. a required key is missing. */
        INVALID_REQUEST,
        /** The speaker is stopped or stopping. */
        UNAVAILABLE
    }

    public QueryError {
        Objects.requireNonNull(code, "code");
        message = message == null ? "" : message;
    }
}
