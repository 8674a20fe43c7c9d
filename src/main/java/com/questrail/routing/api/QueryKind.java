package com.questrail.routing.api;

/**
 * The questions the management gateway can ask the speaker.
 */
public enum QueryKind
{
    /** Status of one neighbor. Keyed by peer address. */
    NEIGHBOR(true),

    /** Status of every configured neighbor. */
    NEIGHBORS(false),

    /** Routes received from one neighbor. Keyed by peer address. */
    ADJ_RIB_IN(true),

    /** Routes advertised to one neighbor. Keyed by peer address. */
    ADJ_RIB_OUT(true),

    /** Every candidate path per prefix, the best one flagged. */
    LOC_RIB(false),

    /** Only the best path per prefix. */
    LOC_RIB_BEST(false);

    private final boolean requiresKey;

    QueryKind(boolean requiresKey) {
        this.requiresKey = requiresKey;
    }

    public boolean requiresKey() {
        return requiresKey;
    }
}
