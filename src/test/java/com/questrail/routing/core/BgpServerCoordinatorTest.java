package com.questrail.routing.core;

import com.questrail.routing.api.PeerFsmState;
import com.questrail.routing.api.PeerStatus;
import com.questrail.routing.api.QueryError;
import com.questrail.routing.api.QueryKind;
import com.questrail.routing.api.QueryRequest;
import com.questrail.routing.api.QueryResponse;
import com.questrail.routing.api.RibEntrySummary;
import com.questrail.routing.protocol.bgp.config.BgpPeerConfig;
import com.questrail.routing.protocol.bgp.model.AsPath;
import com.questrail.routing.protocol.bgp.model.Ipv4Address;
import com.questrail.routing.protocol.bgp.model.Ipv4Prefix;
import com.questrail.routing.protocol.bgp.model.OpenMessage;
import com.questrail.routing.protocol.bgp.model.Origin;
import com.questrail.routing.protocol.bgp.model.PathAttributes;
import com.questrail.routing.protocol.bgp.model.UpdateMessage;
import com.questrail.routing.protocol.bgp.observability.BgpErrorEvent;
import com.questrail.routing.protocol.bgp.observability.RecordingObservabilitySink;
import com.questrail.routing.rib.DecisionPolicy;
import com.questrail.routing.rib.DecisionProcess;
import com.questrail.routing.rib.IgpCostResolver;
import com.questrail.routing.rib.RibEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BgpServerCoordinatorTest
 * -----------------------------------------------------------------------------
 * Drives the coordinator through its listener and gateway surfaces with fake
 * peer sessions. Every assertion on advertisements is preceded by a query,
 * which the coordinator answers only after everything queued before it.
 */
class BgpServerCoordinatorTest {

    private static final long LOCAL_AS = 65001;
    private static final Ipv4Prefix NET = Ipv4Prefix.of("198.51.100.0", 24);

    private RecordingObservabilitySink sink;
    private BgpServerCoordinator coordinator;
    private FakePeer a;
    private FakePeer b;

    @BeforeEach
    void setUp() {
        sink = new RecordingObservabilitySink();
        RibEngine rib = new RibEngine(LOCAL_AS,
                new DecisionProcess(DecisionPolicy.defaults(), IgpCostResolver.ZERO),
                Instant::now, sink);
        coordinator = new BgpServerCoordinator(rib, Instant::now, sink);
        a = new FakePeer(config("10.0.0.2", 65002));
        b = new FakePeer(config("10.0.0.3", 65003));
    }

    @AfterEach
    void tearDown() {
        coordinator.stop();
    }

    private static BgpPeerConfig config(String address, long remoteAs) {
        return BgpPeerConfig.builder()
                .withPeerAddress(address)
                .withRemoteAs(remoteAs)
                .withLocalAs(LOCAL_AS)
                .withLocalRouterId(Ipv4Address.parse("10.0.0.1"))
                .build();
    }

    private static OpenMessage open(long as, String routerId) {
        return OpenMessage.local(as, 90, Ipv4Address.parse(routerId));
    }

    private static UpdateMessage announcement(String nextHop, long... path) {
        PathAttributes attrs = PathAttributes.builder()
                .origin(Origin.IGP)
                .asPath(AsPath.ofSequence(path))
                .nextHop(Ipv4Address.parse(nextHop))
                .build();
        return UpdateMessage.announce(attrs, List.of(NET));
    }

    private QueryResponse query(QueryRequest request) throws Exception {
        return coordinator.query(request).get(2, TimeUnit.SECONDS);
    }

    private void startWithEstablishedPeers() throws Exception {
        coordinator.start();
        assertTrue(coordinator.addPeer(a).get(2, TimeUnit.SECONDS));
        assertTrue(coordinator.addPeer(b).get(2, TimeUnit.SECONDS));
        coordinator.onEstablished(a.config(), open(65002, "2.2.2.2"), 1);
        coordinator.onEstablished(b.config(), open(65003, "3.3.3.3"), 4);
    }

    // ---------------------------------------------------------------------
    // Administration
    // ---------------------------------------------------------------------

    @Test
    void addPeerStartsSessionAndRejectsDuplicates() throws Exception {
        coordinator.start();

        assertTrue(coordinator.addPeer(a).get(2, TimeUnit.SECONDS));
        assertFalse(coordinator.addPeer(new FakePeer(a.config())).get(2, TimeUnit.SECONDS));
        assertTrue(a.started.get());
    }

    @Test
    void enableAndDisableAreForwarded() throws Exception {
        coordinator.start();
        coordinator.addPeer(a).get(2, TimeUnit.SECONDS);

        assertTrue(coordinator.disablePeer(a.config().peerAddress()).get(2, TimeUnit.SECONDS));
        assertTrue(coordinator.enablePeer(a.config().peerAddress()).get(2, TimeUnit.SECONDS));
        assertFalse(coordinator.enablePeer(Ipv4Address.parse("10.9.9.9")).get(2, TimeUnit.SECONDS));

        assertEquals(1, a.disables.get());
        assertEquals(1, a.enables.get());
    }

    @Test
    void removePeerStopsSessionAndWithdrawsItsRoutes() throws Exception {
        startWithEstablishedPeers();
        coordinator.onUpdate(a.config(), announcement("10.0.0.2", 65002));
        query(QueryRequest.locRibBest());

        assertTrue(coordinator.removePeer(a.config().peerAddress()).get(2, TimeUnit.SECONDS));

        assertTrue(a.stopped.get());
        UpdateMessage last = b.advertised.get(b.advertised.size() - 1).updates().get(0);
        assertEquals(List.of(NET), last.withdrawn());
        assertEquals(QueryError.Code.NOT_FOUND,
                ((QueryError) query(QueryRequest.neighbor(a.config().peerAddress()))).code());
        assertFalse(coordinator.removePeer(a.config().peerAddress()).get(2, TimeUnit.SECONDS));
    }

    // ---------------------------------------------------------------------
    // Route flow
    // ---------------------------------------------------------------------

    @Test
    void updateFromOnePeerIsAdvertisedToTheOtherWithItsSession() throws Exception {
        startWithEstablishedPeers();

        coordinator.onUpdate(a.config(), announcement("10.0.0.2", 65002));
        query(QueryRequest.locRibBest());

        assertTrue(a.advertised.isEmpty());
        assertEquals(1, b.advertised.size());
        Advertisement adv = b.advertised.get(0);
        assertEquals(4, adv.session());
        assertEquals(List.of(NET), adv.updates().get(0).announced());
        assertEquals(AsPath.ofSequence(65001, 65002),
                adv.updates().get(0).pathAttributes().orElseThrow().asPath().orElseThrow());
    }

    @Test
    void sessionDownWithdrawsFromOtherPeers() throws Exception {
        startWithEstablishedPeers();
        coordinator.onUpdate(a.config(), announcement("10.0.0.2", 65002));

        coordinator.onSessionDown(a.config(), "hold timer expired");
        QueryResponse best = query(QueryRequest.locRibBest());

        assertTrue(((QueryResponse.RibResponse) best).entries().isEmpty());
        assertEquals(List.of(NET), b.advertised.get(1).updates().get(0).withdrawn());
    }

    @Test
    void updatesBeforeEstablishedAreIgnored() throws Exception {
        coordinator.start();
        coordinator.addPeer(a).get(2, TimeUnit.SECONDS);

        coordinator.onUpdate(a.config(), announcement("10.0.0.2", 65002));

        assertTrue(((QueryResponse.RibResponse) query(QueryRequest.locRibBest())).entries().isEmpty());
    }

    @Test
    void establishedForUnconfiguredPeerIsIgnored() throws Exception {
        coordinator.start();
        coordinator.addPeer(b).get(2, TimeUnit.SECONDS);
        coordinator.onEstablished(b.config(), open(65003, "3.3.3.3"), 1);

        coordinator.onEstablished(a.config(), open(65002, "2.2.2.2"), 1);
        coordinator.onUpdate(a.config(), announcement("10.0.0.2", 65002));
        query(QueryRequest.locRibBest());

        assertTrue(b.advertised.isEmpty());
    }

    @Test
    void refreshRequestResendsAdjRibOut() throws Exception {
        startWithEstablishedPeers();
        coordinator.onUpdate(a.config(), announcement("10.0.0.2", 65002));

        coordinator.onRefreshRequested(b.config());
        query(QueryRequest.locRibBest());

        assertEquals(2, b.advertised.size());
        assertEquals(b.advertised.get(0).updates(), b.advertised.get(1).updates());
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    @Test
    void neighborQueries() throws Exception {
        coordinator.start();
        coordinator.addPeer(b).get(2, TimeUnit.SECONDS);
        coordinator.addPeer(a).get(2, TimeUnit.SECONDS);

        QueryResponse one = query(QueryRequest.neighbor(a.config().peerAddress()));
        assertEquals(a.config().peerAddress(), ((QueryResponse.NeighborResponse) one).status().peerAddress());

        QueryResponse all = query(QueryRequest.neighbors());
        List<PeerStatus> statuses = ((QueryResponse.NeighborsResponse) all).neighbors();
        assertEquals(List.of(a.config().peerAddress(), b.config().peerAddress()),
                statuses.stream().map(PeerStatus::peerAddress).toList());
    }

    @Test
    void keyedQueryWithoutKeyIsInvalid() throws Exception {
        coordinator.start();

        for (QueryKind kind : List.of(QueryKind.NEIGHBOR, QueryKind.ADJ_RIB_IN, QueryKind.ADJ_RIB_OUT)) {
            QueryResponse r = query(new QueryRequest(kind, null));
            assertEquals(QueryError.Code.INVALID_REQUEST, ((QueryError) r).code(), kind.name());
        }
    }

    @Test
    void keyedQueryForUnknownPeerIsNotFound() throws Exception {
        coordinator.start();

        QueryResponse r = query(QueryRequest.adjRibIn(Ipv4Address.parse("10.9.9.9")));

        assertEquals(QueryError.Code.NOT_FOUND, ((QueryError) r).code());
    }

    @Test
    void ribQueriesReportCandidatesAndBest() throws Exception {
        startWithEstablishedPeers();
        coordinator.onUpdate(a.config(), announcement("10.0.0.2", 65002));
        coordinator.onUpdate(b.config(), announcement("10.0.0.3", 65003, 65030));

        List<RibEntrySummary> all = ((QueryResponse.RibResponse) query(QueryRequest.locRib())).entries();
        assertEquals(2, all.size());
        assertTrue(all.get(0).best());
        assertEquals(a.config().peerAddress(), all.get(0).source());
        assertFalse(all.get(1).best());

        List<RibEntrySummary> best = ((QueryResponse.RibResponse) query(QueryRequest.locRibBest())).entries();
        assertEquals(1, best.size());
        assertEquals("65002", best.get(0).asPath());

        List<RibEntrySummary> inB = ((QueryResponse.RibResponse)
                query(QueryRequest.adjRibIn(b.config().peerAddress()))).entries();
        assertEquals(1, inB.size());
        assertFalse(inB.get(0).best());

        QueryResponse.RibResponse outB = (QueryResponse.RibResponse)
                query(QueryRequest.adjRibOut(b.config().peerAddress()));
        assertEquals(QueryKind.ADJ_RIB_OUT, outB.kind());
        assertEquals(b.config().peerAddress(), outB.peer());
        assertEquals(Ipv4Address.parse("10.0.0.1"), outB.entries().get(0).nextHop());
    }

    @Test
    void failingQueryIsAnsweredUnavailable() throws Exception {
        coordinator.start();
        FakePeer broken = new FakePeer(config("10.0.0.4", 65004)) {
            @Override
            public PeerStatus status() {
                throw new IllegalStateException("boom");
            }
        };
        coordinator.addPeer(broken).get(2, TimeUnit.SECONDS);

        QueryResponse r = query(QueryRequest.neighbor(broken.config().peerAddress()));

        assertEquals(QueryError.Code.UNAVAILABLE, ((QueryError) r).code());
        assertTrue(sink.hasEventOfType(BgpErrorEvent.class));
        // Still serving.
        assertInstanceOf(QueryResponse.NeighborsResponse.class, query(QueryRequest.neighbors()));
    }

    // ---------------------------------------------------------------------
    // Shutdown
    // ---------------------------------------------------------------------

    @Test
    void stopStopsSessionsAndRefusesFurtherWork() throws Exception {
        coordinator.start();
        coordinator.addPeer(a).get(2, TimeUnit.SECONDS);

        coordinator.stop();

        assertFalse(coordinator.isRunning());
        assertTrue(a.stopped.get());
        assertEquals(QueryError.Code.UNAVAILABLE, ((QueryError) query(QueryRequest.neighbors())).code());
        assertFalse(coordinator.addPeer(b).get(2, TimeUnit.SECONDS));
    }

    @Test
    void requestsQueuedBeforeStartAreFailedOnStop() throws Exception {
        CompletableFuture<QueryResponse> pending = coordinator.query(QueryRequest.neighbors());
        CompletableFuture<Boolean> add = coordinator.addPeer(a);

        coordinator.stop();

        assertEquals(QueryError.Code.UNAVAILABLE, ((QueryError) pending.get(2, TimeUnit.SECONDS)).code());
        assertFalse(add.get(2, TimeUnit.SECONDS));
    }

    // ---------------------------------------------------------------------
    // Fakes
    // ---------------------------------------------------------------------

    record Advertisement(long session, List<UpdateMessage> updates) {}

    static class FakePeer implements PeerSessionHandle {
        private final BgpPeerConfig config;
        final AtomicBoolean started = new AtomicBoolean();
        final AtomicBoolean stopped = new AtomicBoolean();
        final AtomicInteger enables = new AtomicInteger();
        final AtomicInteger disables = new AtomicInteger();
        final List<Advertisement> advertised = new CopyOnWriteArrayList<>();

        FakePeer(BgpPeerConfig config) {
            this.config = config;
        }

        @Override
        public BgpPeerConfig config() {
            return config;
        }

        @Override
        public void start() {
            started.set(true);
        }

        @Override
        public void enable() {
            enables.incrementAndGet();
        }

        @Override
        public void disable() {
            disables.incrementAndGet();
        }

        @Override
        public void stop() {
            stopped.set(true);
        }

        @Override
        public void advertise(long session, List<UpdateMessage> updates) {
            advertised.add(new Advertisement(session, updates));
        }

        @Override
        public PeerStatus status() {
            return new PeerStatus(config.peerAddress(), config.remoteAs(), config.localAs(),
                    PeerFsmState.ESTABLISHED, true, null, 90, 0, 0, 0, 0, 1, null, Instant.EPOCH);
        }
    }
}
