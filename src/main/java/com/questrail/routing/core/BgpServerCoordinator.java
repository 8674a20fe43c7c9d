package com.questrail.routing.core;

import com.questrail.routing.api.BgpQueryGateway;
import com.questrail.routing.api.PeerStatus;
import com.questrail.routing.api.QueryError;
import com.questrail.routing.api.QueryKind;
import com.questrail.routing.api.QueryRequest;
import com.questrail.routing.api.QueryResponse;
import com.questrail.routing.api.RibEntrySummary;
import com.questrail.routing.protocol.bgp.PeerSessionListener;
import com.questrail.routing.protocol.bgp.config.BgpPeerConfig;
import com.questrail.routing.protocol.bgp.internal.time.WallClock;
import com.questrail.routing.protocol.bgp.model.Ipv4Address;
import com.questrail.routing.protocol.bgp.model.Ipv4Prefix;
import com.questrail.routing.protocol.bgp.model.OpenMessage;
import com.questrail.routing.protocol.bgp.model.PathAttributes;
import com.questrail.routing.protocol.bgp.model.UpdateMessage;
import com.questrail.routing.protocol.bgp.observability.BgpErrorEvent;
import com.questrail.routing.protocol.bgp.observability.BgpObservabilitySink;
import com.questrail.routing.protocol.bgp.observability.NullObservabilitySink;
import com.questrail.routing.rib.OutboundUpdate;
import com.questrail.routing.rib.RibEngine;
import com.questrail.routing.rib.RibPeer;
import com.questrail.routing.rib.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingDeque;

/**
 * BgpServerCoordinator
 * =============================================================================
 * The single owner of the {@link RibEngine}.
 *
 * <h2>Purpose</h2>
 * <ul>
 *   <li>Serializes every RIB mutation and every management query on one thread</li>
 *   <li>Turns session reports ({@link PeerSessionListener}) into RIB passes</li>
 *   <li>Hands each resulting Adj-RIB-Out diff to the affected peer session</li>
 *   <li>Answers {@link BgpQueryGateway} queries, exactly once each</li>
 *   <li>Adds, removes, enables and disables peers at runtime</li>
 * </ul>
 *
 * <h2>Threading Model</h2>
 * Producers (peer session threads, management callers) only enqueue. The
 * coordinator thread drains the queue in FIFO order, so a query observes
 * every UPDATE that was reported before it.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   coordinator.start()     → starts the coordinator thread
 *   coordinator.addPeer(h)  → registers and starts a peer session
 *   coordinator.stop()      → stops every session; pending and later queries
 *                             are answered UNAVAILABLE
 * </pre>
 */
public final class BgpServerCoordinator implements PeerSessionListener, BgpQueryGateway
{
    private static final Logger log = LoggerFactory.getLogger(BgpServerCoordinator.class);

    private final RibEngine rib;
    private final WallClock wallClock;
    private final BgpObservabilitySink observabilitySink;

    private final BlockingDeque<CoordinatorMessage> queue = new LinkedBlockingDeque<>();
    private final Object lifecycleLock = new Object();
    private boolean running;
    private boolean stopped;
    private Thread thread;

    // Coordinator thread only.
    private final SortedMap<Ipv4Address, PeerSessionHandle> peers = new TreeMap<>();
    private final Map<Ipv4Address, Long> sessions = new HashMap<>();

    public BgpServerCoordinator(RibEngine rib, WallClock wallClock, BgpObservabilitySink observabilitySink)
    {
        this.rib = Objects.requireNonNull(rib, "rib");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    public void start() {
        synchronized (lifecycleLock) {
            if (running || stopped) {
                return;
            }
            running = true;
            thread = new Thread(this::runLoop, "bgp-coordinator");
            thread.setDaemon(true);
            thread.start();
        }
        log.info("Coordinator started");
    }

    /**
     * Stops every peer session and the coordinator thread. Queries still
     * queued, and any submitted afterwards, are answered UNAVAILABLE.
     */
    public void stop() {
        Thread t;
        synchronized (lifecycleLock) {
            if (!running) {
                if (!stopped) {
                    stopped = true;
                    failPending();
                }
                return;
            }
            running = false;
            stopped = true;
            queue.offerFirst(new Shutdown());
            t = thread;
        }
        if (t != Thread.currentThread()) {
            try {
                t.join(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Coordinator stopped");
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return running;
        }
    }

    // -------------------------------------------------------------------------
    // Administration
    // -------------------------------------------------------------------------

    /**
     * Registers and starts a peer session.
     *
     * @return completes with {@code false} if a peer with the same address exists
     */
    public CompletableFuture<Boolean> addPeer(PeerSessionHandle handle) {
        Objects.requireNonNull(handle, "handle");
        CompletableFuture<Boolean> done = new CompletableFuture<>();
        submitAdmin(new AddPeer(handle, done), done);
        return done;
    }

    /**
     * Withdraws everything learned from the peer and stops its session.
     *
     * @return completes with {@code false} if the peer is not configured
     */
    public CompletableFuture<Boolean> removePeer(Ipv4Address peer) {
        Objects.requireNonNull(peer, "peer");
        CompletableFuture<Boolean> done = new CompletableFuture<>();
        submitAdmin(new RemovePeer(peer, done), done);
        return done;
    }

    public CompletableFuture<Boolean> enablePeer(Ipv4Address peer) {
        return setPeerEnabled(peer, true);
    }

    public CompletableFuture<Boolean> disablePeer(Ipv4Address peer) {
        return setPeerEnabled(peer, false);
    }

    private CompletableFuture<Boolean> setPeerEnabled(Ipv4Address peer, boolean enabled) {
        Objects.requireNonNull(peer, "peer");
        CompletableFuture<Boolean> done = new CompletableFuture<>();
        submitAdmin(new SetPeerEnabled(peer, enabled, done), done);
        return done;
    }

    private void submitAdmin(CoordinatorMessage message, CompletableFuture<Boolean> done) {
        if (!enqueue(message)) {
            done.complete(false);
        }
    }

    // -------------------------------------------------------------------------
    // BgpQueryGateway
    // -------------------------------------------------------------------------

    @Override
    public CompletableFuture<QueryResponse> query(QueryRequest request) {
        Objects.requireNonNull(request, "request");
        CompletableFuture<QueryResponse> response = new CompletableFuture<>();
        if (!enqueue(new Query(request, response))) {
            response.complete(unavailable());
        }
        return response;
    }

    // -------------------------------------------------------------------------
    // PeerSessionListener (session threads)
    // -------------------------------------------------------------------------

    @Override
    public void onEstablished(BgpPeerConfig peer, OpenMessage peerOpen, long session) {
        enqueue(new PeerEstablished(peer, peerOpen, session));
    }

    @Override
    public void onUpdate(BgpPeerConfig peer, UpdateMessage update) {
        enqueue(new RoutesReceived(peer, update));
    }

    @Override
    public void onSessionDown(BgpPeerConfig peer, String reason) {
        enqueue(new PeerDown(peer, reason));
    }

    @Override
    public void onRefreshRequested(BgpPeerConfig peer) {
        enqueue(new RefreshRequested(peer));
    }

    private boolean enqueue(CoordinatorMessage message) {
        synchronized (lifecycleLock) {
            if (stopped) {
                return false;
            }
            // Accepted before start(); processed once the thread runs.
            queue.offerLast(message);
            return true;
        }
    }

    // -------------------------------------------------------------------------
    // Coordinator thread
    // -------------------------------------------------------------------------

    private void runLoop() {
        while (true) {
            final CoordinatorMessage message;
            try {
                message = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (message instanceof Shutdown) {
                break;
            }
            try {
                process(message);
            } catch (RuntimeException e) {
                observabilitySink.onError(new BgpErrorEvent(wallClock.now(),
                        "Coordinator: error processing " + message, e));
                if (message instanceof Query q) {
                    q.response().complete(new QueryError(QueryError.Code.UNAVAILABLE, "internal error: " + e));
                }
            }
        }
        shutdown();
    }

    private void shutdown() {
        for (PeerSessionHandle handle : peers.values()) {
            try {
                handle.stop();
            } catch (RuntimeException e) {
                observabilitySink.onError(new BgpErrorEvent(wallClock.now(),
                        "Coordinator: error stopping peer " + handle.config().peerAddress(), e));
            }
        }
        peers.clear();
        sessions.clear();
        failPending();
    }

    private void failPending() {
        List<CoordinatorMessage> pending = new ArrayList<>();
        queue.drainTo(pending);
        for (CoordinatorMessage message : pending) {
            if (message instanceof Query q) {
                q.response().complete(unavailable());
            } else if (message instanceof AdminMessage a) {
                a.done().complete(false);
            }
        }
    }

    private void process(CoordinatorMessage message) {
        if (message instanceof PeerEstablished m) {
            Ipv4Address address = m.peer().peerAddress();
            if (!peers.containsKey(address)) {
                return;
            }
            sessions.put(address, m.session());
            log.info("Peer {} established (router id {})", address, m.peerOpen().bgpIdentifier());
            dispatch(rib.peerUp(RibPeer.of(m.peer(), m.peerOpen().bgpIdentifier())));
        }
        else if (message instanceof RoutesReceived m) {
            dispatch(rib.applyUpdate(m.peer().peerAddress(), m.update()));
        }
        else if (message instanceof PeerDown m) {
            Ipv4Address address = m.peer().peerAddress();
            sessions.remove(address);
            log.info("Peer {} down: {}", address, m.reason());
            dispatch(rib.peerDown(address));
        }
        else if (message instanceof RefreshRequested m) {
            rib.refresh(m.peer().peerAddress()).ifPresent(u -> dispatch(List.of(u)));
        }
        else if (message instanceof Query m) {
            m.response().complete(answer(m.request()));
        }
        else if (message instanceof AddPeer m) {
            Ipv4Address address = m.handle().config().peerAddress();
            if (peers.containsKey(address)) {
                m.done().complete(false);
                return;
            }
            peers.put(address, m.handle());
            m.handle().start();
            log.info("Peer {} added (AS {})", address, m.handle().config().remoteAs());
            m.done().complete(true);
        }
        else if (message instanceof RemovePeer m) {
            PeerSessionHandle handle = peers.remove(m.peer());
            if (handle == null) {
                m.done().complete(false);
                return;
            }
            sessions.remove(m.peer());
            dispatch(rib.peerDown(m.peer()));
            handle.stop();
            log.info("Peer {} removed", m.peer());
            m.done().complete(true);
        }
        else if (message instanceof SetPeerEnabled m) {
            PeerSessionHandle handle = peers.get(m.peer());
            if (handle == null) {
                m.done().complete(false);
                return;
            }
            if (m.enabled()) {
                handle.enable();
            } else {
                handle.disable();
            }
            m.done().complete(true);
        }
    }

    private void dispatch(Collection<OutboundUpdate> updates) {
        for (OutboundUpdate update : updates) {
            PeerSessionHandle handle = peers.get(update.peer());
            Long session = sessions.get(update.peer());
            if (handle == null || session == null) {
                continue;
            }
            handle.advertise(session, update.toMessages());
        }
    }

    // -------------------------------------------------------------------------
    // Queries
    // -------------------------------------------------------------------------

    private QueryResponse answer(QueryRequest request) {
        QueryKind kind = request.kind();
        Ipv4Address key = request.key();
        if (kind.requiresKey()) {
            if (key == null) {
                return new QueryError(QueryError.Code.INVALID_REQUEST, kind + " requires a peer address");
            }
            if (!peers.containsKey(key)) {
                return new QueryError(QueryError.Code.NOT_FOUND, "no such peer: " + key);
            }
        }

        return switch (kind) {
            case NEIGHBOR -> new QueryResponse.NeighborResponse(peers.get(key).status());
            case NEIGHBORS -> {
                List<PeerStatus> statuses = new ArrayList<>(peers.size());
                peers.values().forEach(h -> statuses.add(h.status()));
                yield new QueryResponse.NeighborsResponse(statuses);
            }
            case ADJ_RIB_IN -> {
                SortedMap<Ipv4Prefix, Route> best = rib.locRib();
                List<RibEntrySummary> entries = new ArrayList<>();
                rib.adjRibIn(key).ifPresent(table ->
                        table.values().forEach(r -> entries.add(summarize(r, best.get(r.prefix()) == r))));
                yield new QueryResponse.RibResponse(kind, key, entries);
            }
            case ADJ_RIB_OUT -> {
                List<RibEntrySummary> entries = new ArrayList<>();
                rib.adjRibOut(key).ifPresent(table ->
                        table.values().forEach(r -> entries.add(summarize(r, true))));
                yield new QueryResponse.RibResponse(kind, key, entries);
            }
            case LOC_RIB -> {
                List<RibEntrySummary> entries = new ArrayList<>();
                rib.allPaths().values().forEach(paths -> {
                    for (int i = 0; i < paths.size(); i++) {
                        entries.add(summarize(paths.get(i), i == 0));
                    }
                });
                yield new QueryResponse.RibResponse(kind, null, entries);
            }
            case LOC_RIB_BEST -> {
                List<RibEntrySummary> entries = new ArrayList<>();
                rib.locRib().values().forEach(r -> entries.add(summarize(r, true)));
                yield new QueryResponse.RibResponse(kind, null, entries);
            }
        };
    }

    private static RibEntrySummary summarize(Route route, boolean best) {
        PathAttributes attributes = route.pathAttributes();
        return new RibEntrySummary(
                route.prefix(),
                route.source().peerAddress(),
                attributes.nextHop().orElse(null),
                attributes.asPath().map(Object::toString).orElse(""),
                attributes.origin().orElse(null),
                attributes.effectiveLocalPref(),
                attributes.effectiveMed(),
                best);
    }

    private static QueryError unavailable() {
        return new QueryError(QueryError.Code.UNAVAILABLE, "coordinator stopped");
    }

    // -------------------------------------------------------------------------
    // Messages
    // -------------------------------------------------------------------------

    private sealed interface CoordinatorMessage
            permits PeerEstablished, RoutesReceived, PeerDown, RefreshRequested, Query, AdminMessage, Shutdown {}

    private sealed interface AdminMessage extends CoordinatorMessage
            permits AddPeer, RemovePeer, SetPeerEnabled {
        CompletableFuture<Boolean> done();
    }

    private record PeerEstablished(BgpPeerConfig peer, OpenMessage peerOpen, long session) implements CoordinatorMessage {}

    private record RoutesReceived(BgpPeerConfig peer, UpdateMessage update) implements CoordinatorMessage {}

    private record PeerDown(BgpPeerConfig peer, String reason) implements CoordinatorMessage {}

    private record RefreshRequested(BgpPeerConfig peer) implements CoordinatorMessage {}

    private record Query(QueryRequest request, CompletableFuture<QueryResponse> response) implements CoordinatorMessage {}

    private record AddPeer(PeerSessionHandle handle, CompletableFuture<Boolean> done) implements AdminMessage {}

    private record RemovePeer(Ipv4Address peer, CompletableFuture<Boolean> done) implements AdminMessage {}

    private record SetPeerEnabled(Ipv4Address peer, boolean enabled, CompletableFuture<Boolean> done) implements AdminMessage {}

    private record Shutdown() implements CoordinatorMessage {}
}
