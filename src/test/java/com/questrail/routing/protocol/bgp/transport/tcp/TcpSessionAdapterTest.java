package com.questrail.routing.protocol.bgp.transport.tcp;

import com.questrail.routing.protocol.bgp.codec.impl.DefaultBgpFrameDecoder;
import com.questrail.routing.protocol.bgp.codec.impl.DefaultBgpFrameEncoder;
import com.questrail.routing.protocol.bgp.config.BgpPeerConfig;
import com.questrail.routing.protocol.bgp.internal.decode.BgpMessageDecoder;
import com.questrail.routing.protocol.bgp.internal.encode.BgpMessageEncoder;
import com.questrail.routing.protocol.bgp.internal.events.BgpEvent;
import com.questrail.routing.protocol.bgp.internal.events.BgpMessageEvent;
import com.questrail.routing.protocol.bgp.internal.events.BgpTransportEvent;
import com.questrail.routing.protocol.bgp.model.BgpMessage;
import com.questrail.routing.protocol.bgp.model.Ipv4Address;
import com.questrail.routing.protocol.bgp.model.KeepaliveMessage;
import com.questrail.routing.protocol.bgp.model.NotificationMessage;
import com.questrail.routing.protocol.bgp.model.OpenMessage;
import com.questrail.routing.protocol.bgp.observability.BgpTransportObservabilityEvent;
import com.questrail.routing.protocol.bgp.observability.RecordingObservabilitySink;
import com.questrail.routing.protocol.bgp.transport.FakeStreamTransport;
import com.questrail.routing.protocol.bgp.transport.FakeStreamTransport.FakeChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TcpSessionAdapterTest {

    private BgpPeerConfig config;
    private FakeStreamTransport transport;
    private List<BgpEvent> events;
    private RecordingObservabilitySink sink;
    private TcpSessionAdapter adapter;

    @BeforeEach
    void setUp() {
        config = BgpPeerConfig.builder()
                .withPeerAddress("10.0.0.2")
                .withRemoteAs(65002)
                .withLocalAs(65001)
                .withLocalRouterId(Ipv4Address.parse("10.0.0.1"))
                .build();
        transport = new FakeStreamTransport();
        events = new ArrayList<>();
        sink = new RecordingObservabilitySink();
        adapter = new TcpSessionAdapter(config, transport, events::add,
                new DefaultBgpFrameDecoder(), new DefaultBgpFrameEncoder(),
                new BgpMessageDecoder(), new BgpMessageEncoder(),
                () -> Instant.EPOCH, sink);
    }

    private static byte[] wire(BgpMessage message) {
        return new DefaultBgpFrameEncoder().encode(new BgpMessageEncoder().encode(message, false));
    }

    private FakeChannel connected() {
        adapter.connect();
        FakeChannel channel = transport.completeLastConnect();
        events.clear();
        return channel;
    }

    @Test
    void connectTargetsPeerSocketAddress() {
        adapter.connect();

        assertEquals(1, transport.attempts().size());
        assertEquals(new InetSocketAddress(config.peerAddress().toInetAddress(), 179),
                transport.attempts().get(0).remote());
        assertTrue(sink.eventsOfType(BgpTransportObservabilityEvent.class).stream()
                .anyMatch(e -> e.kind() == BgpTransportObservabilityEvent.Kind.CONNECTING));
    }

    @Test
    void completedConnectEmitsTransportUp() {
        adapter.connect();
        transport.completeLastConnect();

        assertTrue(adapter.isConnected());
        assertInstanceOf(BgpTransportEvent.TransportUp.class, events.get(0));
    }

    @Test
    void failedConnectEmitsConnectFailed() {
        adapter.connect();
        transport.failLastConnect(new IOException("connection refused"));

        BgpTransportEvent.ConnectFailed failed = assertInstanceOf(BgpTransportEvent.ConnectFailed.class, events.get(0));
        assertEquals("connection refused", failed.cause());
        assertFalse(adapter.isConnected());
    }

    @Test
    void inboundOpenIsDecodedAndEnablesFourOctetAs() {
        FakeChannel channel = connected();

        channel.inject(wire(OpenMessage.local(65002, 90, Ipv4Address.parse("10.0.0.2"))));

        BgpMessageEvent.MessageReceived received = assertInstanceOf(BgpMessageEvent.MessageReceived.class, events.get(0));
        OpenMessage open = assertInstanceOf(OpenMessage.class, received.message());
        assertEquals(65002, open.asNumber());
        assertTrue(adapter.fourOctetAs());
    }

    @Test
    void malformedMessageBecomesMessageInvalid() {
        FakeChannel channel = connected();
        byte[] bad = wire(KeepaliveMessage.INSTANCE);
        bad[0] = 0;

        channel.inject(bad);

        BgpMessageEvent.MessageInvalid invalid = assertInstanceOf(BgpMessageEvent.MessageInvalid.class, events.get(0));
        assertEquals(NotificationMessage.MESSAGE_HEADER_ERROR, invalid.notification().errorCode());
        assertEquals(NotificationMessage.CONNECTION_NOT_SYNCHRONIZED, invalid.notification().errorSubcode());
    }

    @Test
    void framingErrorBecomesBadMessageLength() {
        FakeChannel channel = connected();

        channel.injectFramingError("length 5000");

        BgpMessageEvent.MessageInvalid invalid = assertInstanceOf(BgpMessageEvent.MessageInvalid.class, events.get(0));
        assertEquals(NotificationMessage.BAD_MESSAGE_LENGTH, invalid.notification().errorSubcode());
        assertEquals("length 5000", invalid.reason());
    }

    @Test
    void sendWritesFramedMessage() {
        FakeChannel channel = connected();

        adapter.send(KeepaliveMessage.INSTANCE);

        assertEquals(1, channel.sent().size());
        assertArrayEquals(wire(KeepaliveMessage.INSTANCE), channel.sent().get(0));
    }

    @Test
    void sendWithoutConnectionIsDropped() {
        adapter.send(KeepaliveMessage.INSTANCE);

        assertFalse(adapter.isConnected());
        assertTrue(events.isEmpty());
    }

    @Test
    void secondConnectionIsRefused() {
        FakeChannel first = connected();
        adapter.connect();

        FakeChannel second = transport.completeLastConnect();

        assertFalse(second.isOpen());
        assertTrue(first.isOpen());
        assertTrue(events.isEmpty());
    }

    @Test
    void peerCloseEmitsTransportDown() {
        FakeChannel channel = connected();

        channel.drop(null);

        BgpTransportEvent.TransportDown down = assertInstanceOf(BgpTransportEvent.TransportDown.class, events.get(0));
        assertEquals("closed by peer", down.cause());
        assertFalse(adapter.isConnected());
    }

    @Test
    void callbacksFromClosedChannelAreIgnored() {
        FakeChannel channel = connected();
        adapter.close();

        assertFalse(channel.isOpen());
        channel.inject(wire(KeepaliveMessage.INSTANCE));
        channel.drop(new IOException("reset"));

        assertTrue(events.isEmpty());
        assertTrue(sink.eventsOfType(BgpTransportObservabilityEvent.class).stream()
                .anyMatch(e -> e.kind() == BgpTransportObservabilityEvent.Kind.CLOSED));
    }
}
