package com.questrail.routing.rib;

/**
 * Tunables of the decision process.
 *
 * @param alwaysCompareMed compare MED between routes from different neighbor
 *                         ASes. When false (the default) MED only separates
 *                         routes that share a neighbor AS.
 */
public record DecisionPolicy(boolean alwaysCompareMed)
{
    public static DecisionPolicy defaults() {
        return new DecisionPolicy(false);
    }
}
