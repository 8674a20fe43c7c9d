package com.questrail.routing.rib;

import com.questrail.routing.protocol.bgp.internal.time.WallClock;
import com.questrail.routing.protocol.bgp.model.AsPath;
import com.questrail.routing.protocol.bgp.model.Ipv4Address;
import com.questrail.routing.protocol.bgp.model.Ipv4Prefix;
import com.questrail.routing.protocol.bgp.model.PathAttributes;
import com.questrail.routing.protocol.bgp.model.RawAttribute;
import com.questrail.routing.protocol.bgp.model.UpdateMessage;
import com.questrail.routing.protocol.bgp.observability.BgpObservabilitySink;
import com.questrail.routing.protocol.bgp.observability.NullObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * RibEngine
 * =============================================================================
 * Adj-RIB-In per peer, the Loc-RIB, Adj-RIB-Out per peer, and the decision
 * process that links them.
 *
 * <h2>Pass structure</h2>
 * Every mutating operation runs one pass:
 * <pre>
 *   mutate Adj-RIB-In
 *     → re-run the decision process for each touched prefix
 *         → compute the export of the Loc-RIB winner for every peer
 *             → diff against Adj-RIB-Out, record the new Adj-RIB-Out
 *                 → return the diffs as {@link OutboundUpdate}s
 * </pre>
 * Adj-RIB-Out is updated before the diff leaves this class. A diff is only
 * produced on change, so re-running a pass for an unchanged prefix emits
 * nothing.
 *
 * <h2>Export rules</h2>
 * <ul>
 *   <li>Never back to the peer the route was learned from.</li>
 *   <li>Routes learned over iBGP go to iBGP peers only when the source or the
 *       target is a route-reflector client.</li>
 *   <li>eBGP: prepend the local AS, next hop becomes our session address,
 *       MULTI_EXIT_DISC and LOCAL_PREF are removed.</li>
 *   <li>iBGP: LOCAL_PREF is always present.</li>
 *   <li>Optional non-transitive attributes are not propagated; optional
 *       transitive ones are passed on with the partial bit set.</li>
 *   <li>A route whose exported attributes leave no room for a prefix in a
 *       4096-octet UPDATE is not exported.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Not thread-safe. Owned by the coordinator thread.
 */
public final class RibEngine
{
    private static final Logger log = LoggerFactory.getLogger(RibEngine.class);

    static final int MAX_DIAGNOSTICS = 256;

    private final long localAs;
    private final DecisionProcess decisionProcess;
    private final AttributeArena arena = new AttributeArena();
    private final WallClock wallClock;
    private final BgpObservabilitySink observabilitySink;

    private final SortedMap<Ipv4Address, PeerTables> peers = new TreeMap<>();
    private final SortedMap<Ipv4Prefix, Route> locRib = new TreeMap<>();
    private final Deque<RibDiagnostic> diagnostics = new ArrayDeque<>();

    public RibEngine(long localAs,
                     DecisionProcess decisionProcess,
                     WallClock wallClock,
                     BgpObservabilitySink observabilitySink) {
        this.localAs = localAs;
        this.decisionProcess = Objects.requireNonNull(decisionProcess, "decisionProcess");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    // -------------------------------------------------------------------------
    // Peer lifecycle
    // -------------------------------------------------------------------------

    /**
     * Registers a newly Established peer with empty tables and returns its
     * initial advertisement of the current Loc-RIB. A stale registration for
     * the same address is torn down first.
     */
    public List<OutboundUpdate> peerUp(RibPeer peer) {
        Objects.requireNonNull(peer, "peer");

        List<OutboundUpdate> result = new ArrayList<>();
        if (peers.containsKey(peer.peerAddress())) {
            result.addAll(peerDown(peer.peerAddress()));
        }

        PeerTables tables = new PeerTables(peer);
        peers.put(peer.peerAddress(), tables);

        Map<Ipv4Prefix, PathAttributes> announced = new LinkedHashMap<>();
        for (Route best : locRib.values()) {
            exportTo(best, peer).ifPresent(attributes -> {
                tables.adjOut.put(best.prefix(), new Route(best.prefix(), arena.acquire(attributes), best.source()));
                announced.put(best.prefix(), attributes);
            });
        }
        if (!announced.isEmpty()) {
            result.add(new OutboundUpdate(peer.peerAddress(), List.of(), announced));
        }
        return result;
    }

    /**
     * Forgets everything learned from {@code peerAddress} and clears what was
     * advertised to it. Returns the resulting changes for the remaining peers.
     */
    public List<OutboundUpdate> peerDown(Ipv4Address peerAddress) {
        PeerTables tables = peers.remove(Objects.requireNonNull(peerAddress, "peerAddress"));
        if (tables == null) {
            return List.of();
        }

        NavigableSet<Ipv4Prefix> touched = new TreeSet<>(tables.adjIn.keySet());
        tables.adjIn.values().forEach(r -> arena.release(r.attributes()));
        tables.adjIn.clear();
        tables.adjOut.values().forEach(r -> arena.release(r.attributes()));
        tables.adjOut.clear();

        return runDecision(touched);
    }

    public boolean isPeerUp(Ipv4Address peerAddress) {
        return peers.containsKey(peerAddress);
    }

    // -------------------------------------------------------------------------
    // Route input
    // -------------------------------------------------------------------------

    /**
     * Applies one received UPDATE to the peer's Adj-RIB-In and runs a pass.
     * An UPDATE from a peer that is not up is ignored.
     */
    public List<OutboundUpdate> applyUpdate(Ipv4Address peerAddress, UpdateMessage update) {
        Objects.requireNonNull(update, "update");
        PeerTables tables = peers.get(Objects.requireNonNull(peerAddress, "peerAddress"));
        if (tables == null) {
            return List.of();
        }

        NavigableSet<Ipv4Prefix> touched = new TreeSet<>();
        for (Ipv4Prefix prefix : update.withdrawn()) {
            if (removeAdjIn(tables, prefix)) {
                touched.add(prefix);
            }
        }

        if (!update.announced().isEmpty()) {
            PathAttributes attributes = update.pathAttributes().orElseThrow();
            Optional<RibDiagnostic> rejection = validate(tables.peer, attributes, update.announced().get(0));
            if (rejection.isPresent()) {
                for (Ipv4Prefix prefix : update.announced()) {
                    record(rejection.get(), prefix);
                    if (removeAdjIn(tables, prefix)) {
                        touched.add(prefix);
                    }
                }
            } else {
                PathAttributes imported = importFrom(tables.peer, attributes);
                for (Ipv4Prefix prefix : update.announced()) {
                    Route previous = tables.adjIn.put(prefix, new Route(prefix, arena.acquire(imported), tables.peer));
                    if (previous != null) {
                        arena.release(previous.attributes());
                    }
                    touched.add(prefix);
                }
            }
        }

        return runDecision(touched);
    }

    /**
     * Re-sends the whole Adj-RIB-Out of a peer, used to answer ROUTE-REFRESH.
     */
    public Optional<OutboundUpdate> refresh(Ipv4Address peerAddress) {
        PeerTables tables = peers.get(Objects.requireNonNull(peerAddress, "peerAddress"));
        if (tables == null || tables.adjOut.isEmpty()) {
            return Optional.empty();
        }
        Map<Ipv4Prefix, PathAttributes> announced = new LinkedHashMap<>();
        tables.adjOut.forEach((prefix, route) -> announced.put(prefix, route.pathAttributes()));
        return Optional.of(new OutboundUpdate(peerAddress, List.of(), announced));
    }

    // -------------------------------------------------------------------------
    // Queries
    // -------------------------------------------------------------------------

    public Optional<RibPeer> peer(Ipv4Address peerAddress) {
        PeerTables tables = peers.get(peerAddress);
        return tables == null ? Optional.empty() : Optional.of(tables.peer);
    }

    public Optional<SortedMap<Ipv4Prefix, Route>> adjRibIn(Ipv4Address peerAddress) {
        PeerTables tables = peers.get(peerAddress);
        return tables == null ? Optional.empty() : Optional.of(Collections.unmodifiableSortedMap(tables.adjIn));
    }

    public Optional<SortedMap<Ipv4Prefix, Route>> adjRibOut(Ipv4Address peerAddress) {
        PeerTables tables = peers.get(peerAddress);
        return tables == null ? Optional.empty() : Optional.of(Collections.unmodifiableSortedMap(tables.adjOut));
    }

    /** The Loc-RIB: one winner per prefix. */
    public SortedMap<Ipv4Prefix, Route> locRib() {
        return Collections.unmodifiableSortedMap(locRib);
    }

    /**
     * Every candidate path for every prefix, best first.
     */
    public SortedMap<Ipv4Prefix, List<Route>> allPaths() {
        SortedMap<Ipv4Prefix, List<Route>> result = new TreeMap<>();
        for (Ipv4Prefix prefix : allPrefixes()) {
            result.put(prefix, decisionProcess.rank(candidates(prefix)));
        }
        return result;
    }

    public List<RibDiagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    public int attributeSetCount() {
        return arena.size();
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private Optional<RibDiagnostic> validate(RibPeer peer, PathAttributes attributes, Ipv4Prefix first) {
        List<String> missing = attributes.missingMandatory();
        if (!missing.isEmpty()) {
            return Optional.of(new RibDiagnostic(wallClock.now(), peer.peerAddress(), first,
                    RibDiagnostic.Reason.MISSING_ATTRIBUTE, "missing " + String.join(", ", missing)));
        }
        if (peer.isExternal() && attributes.asPath().orElse(AsPath.EMPTY).contains(localAs)) {
            return Optional.of(new RibDiagnostic(wallClock.now(), peer.peerAddress(), first,
                    RibDiagnostic.Reason.AS_PATH_LOOP, "local AS " + localAs + " in " + attributes.asPath().get()));
        }
        return Optional.empty();
    }

    private void record(RibDiagnostic template, Ipv4Prefix prefix) {
        RibDiagnostic diagnostic = new RibDiagnostic(template.timestamp(), template.peer(), prefix,
                template.reason(), template.detail());
        if (diagnostics.size() == MAX_DIAGNOSTICS) {
            diagnostics.removeFirst();
        }
        diagnostics.addLast(diagnostic);
        observabilitySink.onRibDiagnostic(diagnostic);
    }

    // LOCAL_PREF received over eBGP is ignored.
    private static PathAttributes importFrom(RibPeer peer, PathAttributes attributes) {
        if (peer.isExternal() && attributes.localPref().isPresent()) {
            return attributes.toBuilder().localPref(null).build();
        }
        return attributes;
    }

    private boolean removeAdjIn(PeerTables tables, Ipv4Prefix prefix) {
        Route previous = tables.adjIn.remove(prefix);
        if (previous == null) {
            return false;
        }
        arena.release(previous.attributes());
        return true;
    }

    private List<Route> candidates(Ipv4Prefix prefix) {
        List<Route> candidates = new ArrayList<>();
        for (PeerTables tables : peers.values()) {
            Route route = tables.adjIn.get(prefix);
            if (route != null) {
                candidates.add(route);
            }
        }
        return candidates;
    }

    private NavigableSet<Ipv4Prefix> allPrefixes() {
        NavigableSet<Ipv4Prefix> prefixes = new TreeSet<>();
        for (PeerTables tables : peers.values()) {
            prefixes.addAll(tables.adjIn.keySet());
        }
        return prefixes;
    }

    private List<OutboundUpdate> runDecision(NavigableSet<Ipv4Prefix> touched) {
        if (touched.isEmpty()) {
            return List.of();
        }

        Map<Ipv4Address, Diff> diffs = new LinkedHashMap<>();
        for (Ipv4Prefix prefix : touched) {
            Optional<Route> best = decisionProcess.select(candidates(prefix));
            if (best.isPresent()) {
                locRib.put(prefix, best.get());
            } else {
                locRib.remove(prefix);
            }

            for (PeerTables target : peers.values()) {
                Optional<PathAttributes> exported = best.flatMap(r -> exportTo(r, target.peer));
                Route current = target.adjOut.get(prefix);
                Diff diff = diffs.computeIfAbsent(target.peer.peerAddress(), a -> new Diff());

                if (exported.isEmpty()) {
                    if (current != null) {
                        target.adjOut.remove(prefix);
                        arena.release(current.attributes());
                        diff.withdrawn.add(prefix);
                    }
                } else if (current == null || !current.pathAttributes().equals(exported.get())) {
                    target.adjOut.put(prefix, new Route(prefix, arena.acquire(exported.get()), best.get().source()));
                    if (current != null) {
                        arena.release(current.attributes());
                    }
                    diff.announced.put(prefix, exported.get());
                }
            }
        }

        List<OutboundUpdate> result = new ArrayList<>();
        diffs.forEach((peer, diff) -> {
            if (!diff.isEmpty()) {
                result.add(new OutboundUpdate(peer, diff.withdrawn, diff.announced));
            }
        });
        return result;
    }

    Optional<PathAttributes> exportTo(Route route, RibPeer target) {
        RibPeer source = route.source();
        if (source.peerAddress().equals(target.peerAddress())) {
            return Optional.empty();
        }
        if (!source.isExternal() && !target.isExternal()
                && !source.routeReflectorClient() && !target.routeReflectorClient()) {
            return Optional.empty();
        }

        PathAttributes attributes = route.pathAttributes();
        PathAttributes.Builder out = attributes.toBuilder().clearOptional();
        for (RawAttribute raw : attributes.optionalAttributes()) {
            boolean optional = (raw.flags() & RawAttribute.FLAG_OPTIONAL) != 0;
            if (!optional) {
                out.addOptional(raw);
            } else if (raw.isTransitive()) {
                out.addOptional(new RawAttribute(raw.flags() | RawAttribute.FLAG_PARTIAL, raw.typeCode(), raw.value()));
            }
        }

        if (target.isExternal()) {
            // MED never leaves the AS it was received from.
            out.asPath(attributes.asPath().orElse(AsPath.EMPTY).prepend(target.localAs()))
               .nextHop(target.localAddress())
               .multiExitDisc(null)
               .localPref(null);
        } else {
            out.localPref(attributes.effectiveLocalPref());
        }
        PathAttributes exported = out.build();
        if (!OutboundUpdate.fitsOnePrefix(exported)) {
            log.warn("Not exporting {} to {}: {} octets of path attributes",
                    route.prefix(), target.peerAddress(), exported.wireOctets());
            return Optional.empty();
        }
        return Optional.of(exported);
    }

    private static final class PeerTables {
        final RibPeer peer;
        final SortedMap<Ipv4Prefix, Route> adjIn = new TreeMap<>();
        final SortedMap<Ipv4Prefix, Route> adjOut = new TreeMap<>();

        PeerTables(RibPeer peer) {
            this.peer = peer;
        }
    }

    private static final class Diff {
        final List<Ipv4Prefix> withdrawn = new ArrayList<>();
        final Map<Ipv4Prefix, PathAttributes> announced = new LinkedHashMap<>();

        boolean isEmpty() {
            return withdrawn.isEmpty() && announced.isEmpty();
        }
    }
}
