package com.questrail.routing.protocol.bgp.transport.tcp;

import com.questrail.routing.protocol.bgp.codec.BgpFrameDecoder;
import com.questrail.routing.protocol.bgp.codec.BgpFrameEncoder;
import com.questrail.routing.protocol.bgp.config.BgpPeerConfig;
import com.questrail.routing.protocol.bgp.internal.decode.BgpDecodeException;
import com.questrail.routing.protocol.bgp.internal.decode.BgpMessageDecoder;
import com.questrail.routing.protocol.bgp.internal.encode.BgpMessageEncoder;
import com.questrail.routing.protocol.bgp.internal.events.BgpEvent;
import com.questrail.routing.protocol.bgp.internal.events.BgpMessageEvent;
import com.questrail.routing.protocol.bgp.internal.events.BgpTransportEvent;
import com.questrail.routing.protocol.bgp.internal.frame.BgpFrame;
import com.questrail.routing.protocol.bgp.internal.time.WallClock;
import com.questrail.routing.protocol.bgp.model.BgpMessage;
import com.questrail.routing.protocol.bgp.model.NotificationMessage;
import com.questrail.routing.protocol.bgp.model.OpenMessage;
import com.questrail.routing.protocol.bgp.observability.BgpObservabilitySink;
import com.questrail.routing.protocol.bgp.observability.BgpTransportObservabilityEvent;
import com.questrail.routing.protocol.bgp.observability.NullObservabilitySink;
import com.questrail.routing.protocol.bgp.transport.StreamChannel;
import com.questrail.routing.protocol.bgp.transport.StreamTransport;
import com.questrail.routing.protocol.bgp.transport.StreamTransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * TcpSessionAdapter
 * =============================================================================
 * Connects one peer session to its TCP connection.
 *
 * <h2>Inbound path (decode-before-event)</h2>
 * <pre>
 *   StreamTransport
 *        → BgpFrameDecoder
 *            → BgpMessageDecoder
 *                → BgpMessageEvent.MessageReceived / MessageInvalid
 *                    → PeerSessionDriver
 * </pre>
 *
 * <h2>Outbound path (executor-authoritative)</h2>
 * <pre>
 *   BgpMessage
 *        → BgpMessageEncoder
 *            → BgpFrameEncoder
 *                → StreamChannel.send(byte[])
 * </pre>
 *
 * <h2>Channel ownership</h2>
 * The adapter holds at most one current channel. Callbacks from any other
 * channel (one it has closed, or a second connection racing the first) are
 * ignored, and a second connection arriving while one is open is refused.
 *
 * <p>This class adds no retries and no timing. Unlike a datagram transport,
 * a decode failure is never dropped: it becomes a {@code MessageInvalid}
 * event and the session answers with a NOTIFICATION.</p>
 */
public final class TcpSessionAdapter implements StreamTransportListener {

    private static final Logger log = LoggerFactory.getLogger(TcpSessionAdapter.class);

    private final BgpPeerConfig config;
    private final StreamTransport transport;
    private final Consumer<BgpEvent> eventSink;
    private final BgpFrameDecoder frameDecoder;
    private final BgpFrameEncoder frameEncoder;
    private final BgpMessageDecoder messageDecoder;
    private final BgpMessageEncoder messageEncoder;
    private final WallClock wallClock;
    private final BgpObservabilitySink observabilitySink;

    private final Object channelLock = new Object();
    private StreamChannel current;

    // Set when the peer's OPEN advertises 4-octet AS support; we always do.
    private volatile boolean fourOctetAs;

    public TcpSessionAdapter(BgpPeerConfig config,
                             StreamTransport transport,
                             Consumer<BgpEvent> eventSink,
                             BgpFrameDecoder frameDecoder,
                             BgpFrameEncoder frameEncoder,
                             BgpMessageDecoder messageDecoder,
                             BgpMessageEncoder messageEncoder,
                             WallClock wallClock,
                             BgpObservabilitySink observabilitySink) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.frameDecoder = Objects.requireNonNull(frameDecoder, "frameDecoder");
        this.frameEncoder = Objects.requireNonNull(frameEncoder, "frameEncoder");
        this.messageDecoder = Objects.requireNonNull(messageDecoder, "messageDecoder");
        this.messageEncoder = Objects.requireNonNull(messageEncoder, "messageEncoder");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Start an outbound connection attempt to the peer.
     */
    public void connect() {
        transportEvent(BgpTransportObservabilityEvent.Kind.CONNECTING, config.remoteSocketAddress().toString());
        transport.connect(config.remoteSocketAddress(), this);
    }

    /**
     * Encode and write a message on the current connection. Dropped (with a
     * debug log) when there is none.
     */
    public void send(BgpMessage message) {
        Objects.requireNonNull(message, "message");

        StreamChannel ch;
        synchronized (channelLock) {
            ch = current;
        }
        if (ch == null) {
            log.debug("Peer {}: no connection, dropping {}", config.peerAddress(), message.type());
            return;
        }

        BgpFrame frame = messageEncoder.encode(message, fourOctetAs);
        ch.send(frameEncoder.encode(frame));
    }

    /**
     * Close the current connection, if any. Later callbacks from it are ignored.
     */
    public void close() {
        StreamChannel ch;
        synchronized (channelLock) {
            ch = current;
            current = null;
        }
        if (ch != null) {
            ch.close();
            transportEvent(BgpTransportObservabilityEvent.Kind.CLOSED, String.valueOf(ch.remoteAddress()));
        }
    }

    public boolean isConnected() {
        synchronized (channelLock) {
            return current != null;
        }
    }

    boolean fourOctetAs() {
        return fourOctetAs;
    }

    // -------------------------------------------------------------------------
    // StreamTransportListener
    // -------------------------------------------------------------------------

    @Override
    public void onConnected(StreamChannel channel) {
        Objects.requireNonNull(channel, "channel");
        synchronized (channelLock) {
            if (current != null) {
                // Connection collision: keep the connection we already have.
                log.info("Peer {}: refusing second connection from {}", config.peerAddress(),
                        channel.remoteAddress());
                channel.close();
                return;
            }
            current = channel;
            fourOctetAs = false;
        }
        transportEvent(BgpTransportObservabilityEvent.Kind.CONNECTED, String.valueOf(channel.remoteAddress()));
        eventSink.accept(new BgpTransportEvent.TransportUp(wallClock.now()));
    }

    @Override
    public void onConnectFailed(Throwable cause) {
        String reason = describe(cause);
        transportEvent(BgpTransportObservabilityEvent.Kind.CONNECT_FAILED, reason);
        eventSink.accept(new BgpTransportEvent.ConnectFailed(wallClock.now(), reason));
    }

    @Override
    public void onMessage(StreamChannel channel, byte[] message) {
        Objects.requireNonNull(message, "message");
        if (!isCurrent(channel)) {
            return;
        }

        final BgpMessage decoded;
        try {
            BgpFrame frame = frameDecoder.decode(message);
            decoded = messageDecoder.decode(frame, fourOctetAs);
        } catch (BgpDecodeException e) {
            eventSink.accept(new BgpMessageEvent.MessageInvalid(wallClock.now(), e.toNotification(), e.getMessage()));
            return;
        }

        if (decoded instanceof OpenMessage open && open.supportsFourOctetAs()) {
            fourOctetAs = true;
        }
        eventSink.accept(new BgpMessageEvent.MessageReceived(wallClock.now(), decoded));
    }

    @Override
    public void onFramingError(StreamChannel channel, String reason) {
        if (!isCurrent(channel)) {
            return;
        }
        eventSink.accept(new BgpMessageEvent.MessageInvalid(wallClock.now(),
                new NotificationMessage(NotificationMessage.MESSAGE_HEADER_ERROR,
                        NotificationMessage.BAD_MESSAGE_LENGTH),
                reason));
    }

    @Override
    public void onDisconnected(StreamChannel channel, Throwable cause) {
        synchronized (channelLock) {
            if (channel != current) {
                return;
            }
            current = null;
        }
        String reason = cause == null ? "closed by peer" : describe(cause);
        transportEvent(BgpTransportObservabilityEvent.Kind.DISCONNECTED, reason);
        eventSink.accept(new BgpTransportEvent.TransportDown(wallClock.now(), reason));
    }

    private boolean isCurrent(StreamChannel channel) {
        synchronized (channelLock) {
            return channel == current;
        }
    }

    private void transportEvent(BgpTransportObservabilityEvent.Kind kind, String detail) {
        observabilitySink.onTransportEvent(new BgpTransportObservabilityEvent(
                wallClock.now(), config.peerAddress(), kind, detail));
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
