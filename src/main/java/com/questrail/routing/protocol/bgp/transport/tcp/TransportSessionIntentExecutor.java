package com.questrail.routing.protocol.bgp.transport.tcp;

import com.questrail.routing.protocol.bgp.PeerSessionListener;
import com.questrail.routing.protocol.bgp.config.BgpPeerConfig;
import com.questrail.routing.protocol.bgp.internal.exec.SessionIntentExecutor;
import com.questrail.routing.protocol.bgp.internal.state.SessionIntents;
import com.questrail.routing.protocol.bgp.internal.time.WallClock;
import com.questrail.routing.protocol.bgp.model.KeepaliveMessage;
import com.questrail.routing.protocol.bgp.model.UpdateMessage;
import com.questrail.routing.protocol.bgp.observability.BgpObservabilitySink;
import com.questrail.routing.protocol.bgp.observability.BgpProtocolObservabilityEvent;
import com.questrail.routing.protocol.bgp.observability.NullObservabilitySink;

import java.util.Objects;

/**
 * TransportSessionIntentExecutor
 * =============================================================================
 * Executes the non-timer intents of a peer session.
 *
 * <pre>
 *   BgpEvent
 *      ↓
 *   PeerSessionReducer
 *      ↓ emits
 *   SessionIntents
 *      ↓ consumed by
 *   TimedSessionIntentExecutor     (timers)
 *      ↓ delegates to
 *   TransportSessionIntentExecutor (this class)
 *      ↓                      ↓
 *   TcpSessionAdapter     PeerSessionListener
 * </pre>
 *
 * <p>Intent kinds are handled in their declaration order. Timer kinds are
 * ignored here.</p>
 */
public final class TransportSessionIntentExecutor implements SessionIntentExecutor
{
    private final BgpPeerConfig config;
    private final TcpSessionAdapter transport;
    private final PeerSessionListener listener;
    private final WallClock wallClock;
    private final BgpObservabilitySink observabilitySink;

    public TransportSessionIntentExecutor(BgpPeerConfig config,
                                          TcpSessionAdapter transport,
                                          PeerSessionListener listener,
                                          WallClock wallClock,
                                          BgpObservabilitySink observabilitySink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    @Override
    public void execute(SessionIntents intents)
    {
        Objects.requireNonNull(intents, "intents");

        for (SessionIntents.Kind kind : intents.kinds()) {
            switch (kind) {
                case SEND_NOTIFICATION -> intents.notification().ifPresent(n -> {
                    transport.send(n);
                    protocolEvent(BgpProtocolObservabilityEvent.Kind.NOTIFICATION_SENT, n.describe());
                });
                case CLOSE_TRANSPORT -> transport.close();
                case SESSION_DOWN -> {
                    String reason = intents.downReason().orElse("session closed");
                    protocolEvent(BgpProtocolObservabilityEvent.Kind.SESSION_DOWN, reason);
                    listener.onSessionDown(config, reason);
                }
                case CONNECT -> transport.connect();
                case SEND_OPEN -> intents.localOpen().ifPresent(open -> {
                    transport.send(open);
                    protocolEvent(BgpProtocolObservabilityEvent.Kind.OPEN_SENT,
                            "as=" + open.asNumber() + " hold=" + open.holdTimeSeconds());
                });
                case SEND_KEEPALIVE -> transport.send(KeepaliveMessage.INSTANCE);
                case SEND_UPDATE -> {
                    for (UpdateMessage update : intents.outboundUpdates()) {
                        transport.send(update);
                    }
                    protocolEvent(BgpProtocolObservabilityEvent.Kind.UPDATES_SENT,
                            intents.outboundUpdates().size() + " updates");
                }
                case SESSION_ESTABLISHED -> intents.peerOpen().ifPresent(open -> {
                    protocolEvent(BgpProtocolObservabilityEvent.Kind.SESSION_ESTABLISHED,
                            "peer id " + open.bgpIdentifier());
                    listener.onEstablished(config, open, intents.session());
                });
                case DELIVER_UPDATE -> intents.inboundUpdate().ifPresent(u -> listener.onUpdate(config, u));
                case REQUEST_REFRESH -> {
                    protocolEvent(BgpProtocolObservabilityEvent.Kind.REFRESH_REQUESTED, "ipv4 unicast");
                    listener.onRefreshRequested(config);
                }
                default -> {
                    // Timer kinds belong to TimedSessionIntentExecutor.
                }
            }
        }
    }

    private void protocolEvent(BgpProtocolObservabilityEvent.Kind kind, String detail) {
        observabilitySink.onProtocolEvent(new BgpProtocolObservabilityEvent(
                wallClock.now(), config.peerAddress(), kind, detail));
    }
}
