package com.questrail.routing.protocol.bgp.runtime;

import com.questrail.routing.api.PeerFsmState;
import com.questrail.routing.api.QueryError;
import com.questrail.routing.api.QueryRequest;
import com.questrail.routing.api.QueryResponse;
import com.questrail.routing.protocol.bgp.codec.impl.DefaultBgpFrameDecoder;
import com.questrail.routing.protocol.bgp.codec.impl.DefaultBgpFrameEncoder;
import com.questrail.routing.protocol.bgp.config.BgpPeerConfig;
import com.questrail.routing.protocol.bgp.config.BgpServerConfig;
import com.questrail.routing.protocol.bgp.internal.decode.BgpMessageDecoder;
import com.questrail.routing.protocol.bgp.internal.encode.BgpMessageEncoder;
import com.questrail.routing.protocol.bgp.model.AsPath;
import com.questrail.routing.protocol.bgp.model.BgpMessage;
import com.questrail.routing.protocol.bgp.model.Ipv4Address;
import com.questrail.routing.protocol.bgp.model.Ipv4Prefix;
import com.questrail.routing.protocol.bgp.model.KeepaliveMessage;
import com.questrail.routing.protocol.bgp.model.NotificationMessage;
import com.questrail.routing.protocol.bgp.model.OpenMessage;
import com.questrail.routing.protocol.bgp.model.Origin;
import com.questrail.routing.protocol.bgp.model.PathAttributes;
import com.questrail.routing.protocol.bgp.model.UpdateMessage;
import com.questrail.routing.protocol.bgp.transport.FakeStreamTransport;
import com.questrail.routing.protocol.bgp.transport.FakeStreamTransport.FakeChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BgpProductionRuntimeTest
 * -----------------------------------------------------------------------------
 * Whole-speaker scenarios over an in-memory transport: the test plays both
 * neighbors at the byte level.
 */
class BgpProductionRuntimeTest {

    private static final Ipv4Address ROUTER_ID = Ipv4Address.parse("10.0.0.1");
    private static final Ipv4Prefix NET = Ipv4Prefix.of("198.51.100.0", 24);

    private FakeStreamTransport transport;
    private BgpServerConfig config;
    private BgpProductionRuntime runtime;

    @BeforeEach
    void setUp() {
        transport = new FakeStreamTransport();
        config = BgpServerConfig.builder()
                .withLocalAs(65001)
                .withRouterId(ROUTER_ID)
                .withListenAddress(new InetSocketAddress("127.0.0.1", 1179))
                .build();
        runtime = BgpProductionRuntime.builder()
                .withConfig(config)
                .withTransport(transport)
                .build();
        runtime.start();
    }

    @AfterEach
    void tearDown() {
        runtime.stop();
    }

    private BgpPeerConfig passivePeer(String address, long as) {
        return config.peerBuilder()
                .withPeerAddress(address)
                .withRemoteAs(as)
                .withPassive(true)
                .build();
    }

    private static byte[] wire(BgpMessage message) {
        return new DefaultBgpFrameEncoder().encode(new BgpMessageEncoder().encode(message, true));
    }

    private static BgpMessage read(byte[] bytes) {
        return new BgpMessageDecoder().decode(new DefaultBgpFrameDecoder().decode(bytes), true);
    }

    private static void await(BooleanSupplier condition, String what) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(3);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("timed out waiting for " + what);
            }
            Thread.sleep(5);
        }
    }

    private PeerFsmState stateOf(BgpPeerConfig peer) {
        try {
            QueryResponse r = runtime.gateway().query(QueryRequest.neighbor(peer.peerAddress())).get(2, TimeUnit.SECONDS);
            return ((QueryResponse.NeighborResponse) r).status().state();
        } catch (Exception e) {
            throw new AssertionError(e);
        }
    }

    /**
     * Adds a passive peer, connects to it from its own address and completes
     * the OPEN / KEEPALIVE exchange.
     */
    private FakeChannel establish(BgpPeerConfig peer) throws Exception {
        assertTrue(runtime.addPeer(peer).get(2, TimeUnit.SECONDS));
        await(() -> stateOf(peer) == PeerFsmState.ACTIVE, peer.peerAddress() + " ACTIVE");

        FakeChannel channel = transport.acceptInbound(
                new InetSocketAddress(peer.peerAddress().toInetAddress(), 40000));
        assertNotNull(channel);

        await(() -> channel.sent().size() == 1, "our OPEN");
        OpenMessage ours = (OpenMessage) read(channel.sent().get(0));
        assertEquals(65001, ours.asNumber());
        assertEquals(ROUTER_ID, ours.bgpIdentifier());

        channel.inject(wire(OpenMessage.local(peer.remoteAs(), 90, peer.peerAddress())));
        await(() -> channel.sent().size() == 2, "KEEPALIVE answering the OPEN");
        assertInstanceOf(KeepaliveMessage.class, read(channel.sent().get(1)));

        channel.inject(wire(KeepaliveMessage.INSTANCE));
        await(() -> stateOf(peer) == PeerFsmState.ESTABLISHED, peer.peerAddress() + " ESTABLISHED");
        return channel;
    }

    private static List<UpdateMessage> updatesSent(FakeChannel channel) {
        return channel.sent().stream()
                .map(BgpProductionRuntimeTest::read)
                .filter(UpdateMessage.class::isInstance)
                .map(UpdateMessage.class::cast)
                .toList();
    }

    @Test
    void routeLearnedFromOnePeerIsAdvertisedToAnother() throws Exception {
        BgpPeerConfig a = passivePeer("10.0.0.2", 65002);
        BgpPeerConfig b = passivePeer("10.0.0.3", 65003);
        FakeChannel toA = establish(a);
        FakeChannel toB = establish(b);

        PathAttributes attrs = PathAttributes.builder()
                .origin(Origin.IGP)
                .asPath(AsPath.ofSequence(65002))
                .nextHop(a.peerAddress())
                .build();
        toA.inject(wire(UpdateMessage.announce(attrs, List.of(NET))));

        await(() -> !updatesSent(toB).isEmpty(), "UPDATE to second peer");
        UpdateMessage update = updatesSent(toB).get(0);
        assertEquals(List.of(NET), update.announced());
        PathAttributes exported = update.pathAttributes().orElseThrow();
        assertEquals(AsPath.ofSequence(65001, 65002), exported.asPath().orElseThrow());
        assertEquals(ROUTER_ID, exported.nextHop().orElseThrow());
        assertTrue(updatesSent(toA).isEmpty());

        QueryResponse best = runtime.gateway().query(QueryRequest.locRibBest()).get(2, TimeUnit.SECONDS);
        assertEquals(1, ((QueryResponse.RibResponse) best).entries().size());
    }

    @Test
    void lostSessionWithdrawsItsRoutes() throws Exception {
        BgpPeerConfig a = passivePeer("10.0.0.2", 65002);
        BgpPeerConfig b = passivePeer("10.0.0.3", 65003);
        FakeChannel toA = establish(a);
        FakeChannel toB = establish(b);
        PathAttributes attrs = PathAttributes.builder()
                .origin(Origin.IGP)
                .asPath(AsPath.ofSequence(65002))
                .nextHop(a.peerAddress())
                .build();
        toA.inject(wire(UpdateMessage.announce(attrs, List.of(NET))));
        await(() -> updatesSent(toB).size() == 1, "announcement");

        toA.drop(null);

        await(() -> updatesSent(toB).size() == 2, "withdrawal");
        assertEquals(List.of(NET), updatesSent(toB).get(1).withdrawn());
        await(() -> stateOf(a) == PeerFsmState.ACTIVE || stateOf(a) == PeerFsmState.IDLE, "peer reset");
    }

    @Test
    void badOpenIsAnsweredWithNotification() throws Exception {
        BgpPeerConfig a = passivePeer("10.0.0.2", 65002);
        assertTrue(runtime.addPeer(a).get(2, TimeUnit.SECONDS));
        await(() -> stateOf(a) == PeerFsmState.ACTIVE, "ACTIVE");
        FakeChannel channel = transport.acceptInbound(new InetSocketAddress(a.peerAddress().toInetAddress(), 40000));
        await(() -> channel.sent().size() == 1, "our OPEN");

        channel.inject(wire(OpenMessage.local(65099, 90, a.peerAddress())));

        await(() -> channel.sent().size() == 2, "NOTIFICATION");
        NotificationMessage n = (NotificationMessage) read(channel.sent().get(1));
        assertEquals(NotificationMessage.OPEN_MESSAGE_ERROR, n.errorCode());
        assertEquals(NotificationMessage.BAD_PEER_AS, n.errorSubcode());
        await(() -> !channel.isOpen(), "connection closed");
    }

    @Test
    void connectionFromUnknownAddressIsRefused() {
        assertNull(transport.acceptInbound(new InetSocketAddress("192.0.2.99", 40000)));
    }

    @Test
    void activePeerConnectsOnStart() throws Exception {
        BgpPeerConfig c = config.peerBuilder()
                .withPeerAddress("10.0.0.4")
                .withRemoteAs(65004)
                .build();

        assertTrue(runtime.addPeer(c).get(2, TimeUnit.SECONDS));

        await(() -> !transport.attempts().isEmpty(), "connect attempt");
        assertEquals(179, transport.attempts().get(0).remote().getPort());
        assertFalse(runtime.addPeer(c).get(2, TimeUnit.SECONDS));
    }

    @Test
    void peerWithAnotherLocalAsIsRejected() {
        BgpPeerConfig c = config.peerBuilder()
                .withPeerAddress("10.0.0.5")
                .withRemoteAs(65005)
                .withLocalAs(65099)
                .build();

        assertThrows(IllegalArgumentException.class, () -> runtime.addPeer(c));
        assertTrue(transport.attempts().isEmpty());
    }

    @Test
    void disabledPeerReportsAdminState() throws Exception {
        BgpPeerConfig a = passivePeer("10.0.0.2", 65002);
        FakeChannel channel = establish(a);

        assertTrue(runtime.disablePeer(a.peerAddress()).get(2, TimeUnit.SECONDS));

        await(() -> !channel.isOpen(), "connection closed");
        NotificationMessage cease = (NotificationMessage) read(channel.sent().get(channel.sent().size() - 1));
        assertEquals(NotificationMessage.CEASE, cease.errorCode());
        assertEquals(PeerFsmState.IDLE, stateOf(a));
        QueryResponse r = runtime.gateway().query(QueryRequest.neighbor(a.peerAddress())).get(2, TimeUnit.SECONDS);
        assertFalse(((QueryResponse.NeighborResponse) r).status().adminEnabled());
    }

    @Test
    void stopAnswersLaterQueriesUnavailable() throws Exception {
        runtime.stop();

        QueryResponse r = runtime.gateway().query(QueryRequest.neighbors()).get(2, TimeUnit.SECONDS);

        assertInstanceOf(QueryError.class, r);
        assertTrue(transport.isStopped());
    }
}
