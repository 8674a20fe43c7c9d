package com.questrail.routing.rib;

import com.questrail.routing.protocol.bgp.model.Origin;
import com.questrail.routing.protocol.bgp.model.PathAttributes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.ToLongFunction;

/**
 * DecisionProcess
 * =============================================================================
 * Selects the best path among the candidates for one prefix.
 *
 * <h2>Elimination order</h2>
 * <ol>
 *   <li>Highest LOCAL_PREF (absent = 100)</li>
 *   <li>Shortest AS path (an AS_SET counts as one)</li>
 *   <li>Lowest ORIGIN (IGP, then EGP, then INCOMPLETE)</li>
 *   <li>Lowest MED (absent = 0), compared only between routes with the same
 *       neighbor AS unless {@link DecisionPolicy#alwaysCompareMed()}</li>
 *   <li>Routes learned over eBGP over routes learned over iBGP</li>
 *   <li>Lowest IGP cost to the next hop</li>
 *   <li>Lowest peer router id</li>
 *   <li>Lowest peer address</li>
 * </ol>
 *
 * <p>Each step removes candidates from the set left by the previous step.
 * MED elimination is evaluated against the whole set at the start of that
 * step, never pairwise in arrival order, so the winner does not depend on the
 * order candidates are presented in. The final step makes the choice total
 * because peer addresses are unique.</p>
 *
 * <p>Stateless and safe to share.</p>
 */
public final class DecisionProcess
{
    private static final Comparator<Route> BY_PEER_ADDRESS =
            Comparator.comparing(r -> r.source().peerAddress());

    private final DecisionPolicy policy;
    private final IgpCostResolver igpCost;

    public DecisionProcess(DecisionPolicy policy, IgpCostResolver igpCost) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.igpCost = Objects.requireNonNull(igpCost, "igpCost");
    }

    public Optional<Route> select(Collection<Route> candidates) {
        Objects.requireNonNull(candidates, "candidates");
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        List<Route> set = new ArrayList<>(candidates);
        set.sort(BY_PEER_ADDRESS);

        set = keepMax(set, r -> r.pathAttributes().effectiveLocalPref());
        set = keepMin(set, r -> asPathLength(r.pathAttributes()));
        set = keepMin(set, r -> r.pathAttributes().origin().orElse(Origin.INCOMPLETE).code());
        set = eliminateByMed(set);
        if (set.stream().anyMatch(r -> r.source().isExternal())) {
            set = keepMin(set, r -> r.source().isExternal() ? 0 : 1);
        }
        set = keepMin(set, r -> r.pathAttributes().nextHop().map(igpCost::costTo).orElse(0L));
        set = keepMin(set, r -> Integer.toUnsignedLong(r.source().routerId().value()));

        // Sorted by peer address, so the head is the lowest.
        return Optional.of(set.get(0));
    }

    /**
     * Orders every candidate: the winner first, then the rest by repeatedly
     * selecting among the remainder.
     */
    public List<Route> rank(Collection<Route> candidates) {
        List<Route> remaining = new ArrayList<>(candidates);
        List<Route> ranked = new ArrayList<>(remaining.size());
        while (!remaining.isEmpty()) {
            Route best = select(remaining).orElseThrow();
            ranked.add(best);
            remaining.remove(best);
        }
        return ranked;
    }

    private List<Route> eliminateByMed(List<Route> set) {
        if (set.size() < 2) {
            return set;
        }
        List<Route> survivors = new ArrayList<>(set.size());
        for (Route route : set) {
            if (!beatenOnMed(route, set)) {
                survivors.add(route);
            }
        }
        return survivors;
    }

    private boolean beatenOnMed(Route route, List<Route> set) {
        PathAttributes mine = route.pathAttributes();
        for (Route other : set) {
            PathAttributes theirs = other.pathAttributes();
            if (other == route) {
                continue;
            }
            if (!policy.alwaysCompareMed() && neighborAs(mine) != neighborAs(theirs)) {
                continue;
            }
            if (theirs.effectiveMed() < mine.effectiveMed()) {
                return true;
            }
        }
        return false;
    }

    private static long neighborAs(PathAttributes attributes) {
        return attributes.asPath().map(p -> p.neighborAs()).orElse(0L);
    }

    private static long asPathLength(PathAttributes attributes) {
        return attributes.asPath().map(p -> (long) p.pathLength()).orElse(0L);
    }

    private static List<Route> keepMax(List<Route> set, ToLongFunction<Route> key) {
        long best = Long.MIN_VALUE;
        for (Route r : set) {
            best = Math.max(best, key.applyAsLong(r));
        }
        return filter(set, key, best);
    }

    private static List<Route> keepMin(List<Route> set, ToLongFunction<Route> key) {
        long best = Long.MAX_VALUE;
        for (Route r : set) {
            best = Math.min(best, key.applyAsLong(r));
        }
        return filter(set, key, best);
    }

    private static List<Route> filter(List<Route> set, ToLongFunction<Route> key, long value) {
        if (set.size() < 2) {
            return set;
        }
        List<Route> kept = new ArrayList<>(set.size());
        for (Route r : set) {
            if (key.applyAsLong(r) == value) {
                kept.add(r);
            }
        }
        return kept;
    }
}
