package com.questrail.routing.rib;

import com.questrail.routing.protocol.bgp.model.AsPath;
import com.questrail.routing.protocol.bgp.model.Ipv4Address;
import com.questrail.routing.protocol.bgp.model.Ipv4Prefix;
import com.questrail.routing.protocol.bgp.model.Origin;
import com.questrail.routing.protocol.bgp.model.PathAttributes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DecisionProcessTest {

    private static final long LOCAL_AS = 65001;
    private static final Ipv4Prefix PREFIX = Ipv4Prefix.of("203.0.113.0", 24);

    private AttributeArena arena;
    private DecisionProcess process;

    @BeforeEach
    void setUp() {
        arena = new AttributeArena();
        process = new DecisionProcess(DecisionPolicy.defaults(), IgpCostResolver.ZERO);
    }

    private static RibPeer peer(String address, long peerAs, String routerId) {
        return new RibPeer(Ipv4Address.parse(address), peerAs, LOCAL_AS, Ipv4Address.parse(routerId),
                Ipv4Address.parse("10.0.0.1"), false);
    }

    private static PathAttributes.Builder attrs(long... path) {
        return PathAttributes.builder()
                .origin(Origin.IGP)
                .asPath(AsPath.ofSequence(path))
                .nextHop(Ipv4Address.parse("192.0.2.1"));
    }

    private Route route(RibPeer source, PathAttributes attributes) {
        return new Route(PREFIX, arena.acquire(attributes), source);
    }

    @Test
    void noCandidatesSelectsNothing() {
        assertTrue(process.select(List.of()).isEmpty());
    }

    @Test
    void highestLocalPrefWins() {
        Route low = route(peer("10.0.1.1", LOCAL_AS, "1.1.1.1"), attrs(65002).localPref(100L).build());
        Route high = route(peer("10.0.1.2", LOCAL_AS, "2.2.2.2"), attrs(65002, 65003, 65004).localPref(200L).build());

        assertSame(high, process.select(List.of(low, high)).orElseThrow());
    }

    @Test
    void missingLocalPrefCountsAsDefault() {
        Route missing = route(peer("10.0.1.1", LOCAL_AS, "1.1.1.1"), attrs(65002).build());
        Route lower = route(peer("10.0.1.2", LOCAL_AS, "2.2.2.2"), attrs(65002).localPref(99L).build());

        assertSame(missing, process.select(List.of(lower, missing)).orElseThrow());
    }

    @Test
    void shortestAsPathWins() {
        Route longer = route(peer("10.0.0.2", 65002, "1.1.1.1"), attrs(65002, 65010).build());
        Route shorter = route(peer("10.0.0.3", 65003, "2.2.2.2"), attrs(65003).build());

        assertSame(shorter, process.select(List.of(longer, shorter)).orElseThrow());
    }

    @Test
    void lowestOriginWins() {
        Route incomplete = route(peer("10.0.0.2", 65002, "1.1.1.1"), attrs(65002).origin(Origin.INCOMPLETE).build());
        Route egp = route(peer("10.0.0.3", 65003, "2.2.2.2"), attrs(65003).origin(Origin.EGP).build());

        assertSame(egp, process.select(List.of(incomplete, egp)).orElseThrow());
    }

    @Test
    void medComparedOnlyWithinSameNeighborAs() {
        Route highMed = route(peer("10.0.0.2", 65002, "1.1.1.1"), attrs(65002).multiExitDisc(50L).build());
        Route lowMedOtherAs = route(peer("10.0.0.3", 65003, "2.2.2.2"), attrs(65003).multiExitDisc(10L).build());

        // Different neighbor AS: MED ignored, router id decides.
        assertSame(highMed, process.select(List.of(lowMedOtherAs, highMed)).orElseThrow());

        Route lowMedSameAs = route(peer("10.0.0.4", 65002, "3.3.3.3"), attrs(65002).multiExitDisc(10L).build());
        assertSame(lowMedSameAs, process.select(List.of(highMed, lowMedSameAs)).orElseThrow());
    }

    @Test
    void alwaysCompareMedIgnoresNeighborAs() {
        process = new DecisionProcess(new DecisionPolicy(true), IgpCostResolver.ZERO);
        Route highMed = route(peer("10.0.0.2", 65002, "1.1.1.1"), attrs(65002).multiExitDisc(50L).build());
        Route lowMed = route(peer("10.0.0.3", 65003, "2.2.2.2"), attrs(65003).multiExitDisc(10L).build());

        assertSame(lowMed, process.select(List.of(highMed, lowMed)).orElseThrow());
    }

    @Test
    void missingMedCountsAsZero() {
        Route withMed = route(peer("10.0.0.2", 65002, "1.1.1.1"), attrs(65002).multiExitDisc(1L).build());
        Route without = route(peer("10.0.0.3", 65002, "2.2.2.2"), attrs(65002).build());

        assertSame(without, process.select(List.of(withMed, without)).orElseThrow());
    }

    @Test
    void winnerIsIndependentOfCandidateOrder() {
        // r1 loses to r3 on MED (same neighbor AS); r2 is not comparable to either.
        Route r1 = route(peer("10.0.0.2", 65002, "1.1.1.1"), attrs(65002).multiExitDisc(10L).build());
        Route r2 = route(peer("10.0.0.3", 65003, "2.2.2.2"), attrs(65003).multiExitDisc(7L).build());
        Route r3 = route(peer("10.0.0.4", 65002, "3.3.3.3"), attrs(65002).multiExitDisc(5L).build());

        for (List<Route> order : permutations(List.of(r1, r2, r3))) {
            assertSame(r2, process.select(order).orElseThrow(), "order " + order);
        }

        process = new DecisionProcess(new DecisionPolicy(true), IgpCostResolver.ZERO);
        for (List<Route> order : permutations(List.of(r1, r2, r3))) {
            assertSame(r3, process.select(order).orElseThrow(), "order " + order);
        }
    }

    @Test
    void externalPreferredOverInternal() {
        Route internal = route(peer("10.0.1.1", LOCAL_AS, "1.1.1.1"), attrs(65002).build());
        Route external = route(peer("10.0.0.9", 65002, "9.9.9.9"), attrs(65002).build());

        assertSame(external, process.select(List.of(internal, external)).orElseThrow());
    }

    @Test
    void lowestIgpCostWins() {
        Map<Ipv4Address, Long> costs = Map.of(
                Ipv4Address.parse("192.0.2.1"), 20L,
                Ipv4Address.parse("192.0.2.2"), 5L);
        process = new DecisionProcess(DecisionPolicy.defaults(), nextHop -> costs.getOrDefault(nextHop, 0L));

        Route far = route(peer("10.0.1.1", LOCAL_AS, "1.1.1.1"), attrs(65002).build());
        Route near = route(peer("10.0.1.2", LOCAL_AS, "2.2.2.2"),
                attrs(65002).nextHop(Ipv4Address.parse("192.0.2.2")).build());

        assertSame(near, process.select(List.of(far, near)).orElseThrow());
    }

    @Test
    void routerIdComparedUnsigned() {
        Route high = route(peer("10.0.0.2", 65002, "200.0.0.1"), attrs(65002).build());
        Route low = route(peer("10.0.0.3", 65003, "100.0.0.1"), attrs(65003).build());

        assertSame(low, process.select(List.of(high, low)).orElseThrow());
    }

    @Test
    void lowestPeerAddressBreaksFinalTie() {
        Route a = route(peer("10.0.0.3", 65002, "1.1.1.1"), attrs(65002).build());
        Route b = route(peer("10.0.0.2", 65002, "1.1.1.1"), attrs(65002).build());

        assertSame(b, process.select(List.of(a, b)).orElseThrow());
    }

    @Test
    void rankOrdersAllCandidatesBestFirst() {
        Route best = route(peer("10.0.0.2", 65002, "1.1.1.1"), attrs(65002).build());
        Route second = route(peer("10.0.0.3", 65003, "2.2.2.2"), attrs(65003, 65010).build());
        Route third = route(peer("10.0.0.4", 65004, "3.3.3.3"), attrs(65004, 65010, 65011).build());

        assertEquals(List.of(best, second, third), process.rank(List.of(third, best, second)));
    }

    private static <T> List<List<T>> permutations(List<T> items) {
        if (items.size() <= 1) {
            return List.of(items);
        }
        List<List<T>> result = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            List<T> rest = new ArrayList<>(items);
            T head = rest.remove(i);
            for (List<T> tail : permutations(rest)) {
                List<T> p = new ArrayList<>();
                p.add(head);
                p.addAll(tail);
                result.add(p);
            }
        }
        return result;
    }
}
