package com.questrail.routing.protocol.bgp.runtime;

import com.questrail.routing.api.PeerStatus;
import com.questrail.routing.core.PeerSessionHandle;
import com.questrail.routing.protocol.bgp.PeerSessionListener;
import com.questrail.routing.protocol.bgp.codec.impl.DefaultBgpFrameDecoder;
import com.questrail.routing.protocol.bgp.codec.impl.DefaultBgpFrameEncoder;
import com.questrail.routing.protocol.bgp.config.BgpPeerConfig;
import com.questrail.routing.protocol.bgp.internal.decode.BgpMessageDecoder;
import com.questrail.routing.protocol.bgp.internal.encode.BgpMessageEncoder;
import com.questrail.routing.protocol.bgp.internal.events.BgpAdminEvent;
import com.questrail.routing.protocol.bgp.internal.events.BgpEvent;
import com.questrail.routing.protocol.bgp.internal.events.BgpRouteEvent;
import com.questrail.routing.protocol.bgp.internal.exec.PeerSessionDriver;
import com.questrail.routing.protocol.bgp.internal.exec.SessionTimingPolicy;
import com.questrail.routing.protocol.bgp.internal.exec.TimedSessionIntentExecutor;
import com.questrail.routing.protocol.bgp.internal.state.PeerSessionReducer;
import com.questrail.routing.protocol.bgp.internal.state.PeerSessionState;
import com.questrail.routing.protocol.bgp.internal.state.SessionCounters;
import com.questrail.routing.protocol.bgp.internal.time.MonotonicClock;
import com.questrail.routing.protocol.bgp.internal.time.MonotonicScheduler;
import com.questrail.routing.protocol.bgp.internal.time.WallClock;
import com.questrail.routing.protocol.bgp.model.NotificationMessage;
import com.questrail.routing.protocol.bgp.model.UpdateMessage;
import com.questrail.routing.protocol.bgp.observability.BgpObservabilitySink;
import com.questrail.routing.protocol.bgp.transport.StreamTransport;
import com.questrail.routing.protocol.bgp.transport.StreamTransportListener;
import com.questrail.routing.protocol.bgp.transport.tcp.TcpSessionAdapter;
import com.questrail.routing.protocol.bgp.transport.tcp.TransportSessionIntentExecutor;

import java.util.List;
import java.util.Objects;

/**
 * PeerSession
 * =============================================================================
 * Composition of one peer's session stack:
 *
 * <pre>
 *   TcpSessionAdapter ──events──▶ PeerSessionDriver ──intents──▶ TimedSessionIntentExecutor
 *          ▲                                                              │
 *          └──────────────── TransportSessionIntentExecutor ◀────────────┘
 * </pre>
 *
 * <p>The adapter is also the listener for inbound connections from this
 * peer's address.</p>
 */
public final class PeerSession implements PeerSessionHandle
{
    private final BgpPeerConfig config;
    private final WallClock wallClock;
    private final TcpSessionAdapter adapter;
    private final TimedSessionIntentExecutor timedExecutor;
    private final PeerSessionDriver driver;

    public PeerSession(BgpPeerConfig config,
                       SessionTimingPolicy timingPolicy,
                       StreamTransport transport,
                       PeerSessionListener listener,
                       MonotonicClock clock,
                       MonotonicScheduler scheduler,
                       WallClock wallClock,
                       BgpObservabilitySink observabilitySink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        this.adapter = new TcpSessionAdapter(
            config,
            transport,
            this::submit,
            new DefaultBgpFrameDecoder(),
            new DefaultBgpFrameEncoder(),
            new BgpMessageDecoder(),
            new BgpMessageEncoder(),
            wallClock,
            observabilitySink
        );

        TransportSessionIntentExecutor transportExecutor = new TransportSessionIntentExecutor(
            config,
            adapter,
            listener,
            wallClock,
            observabilitySink
        );

        this.timedExecutor = new TimedSessionIntentExecutor(
            transportExecutor,
            this::submit,
            clock,
            scheduler,
            wallClock::now
        );

        this.driver = new PeerSessionDriver(
            new PeerSessionReducer(timingPolicy),
            timedExecutor,
            wallClock,
            PeerSessionState.initial(config, wallClock.now()),
            observabilitySink
        );
    }

    @Override
    public BgpPeerConfig config() {
        return config;
    }

    @Override
    public void start() {
        driver.start();
        enable();
    }

    @Override
    public void enable() {
        submit(new BgpAdminEvent.Start(wallClock.now()));
    }

    @Override
    public void disable() {
        submit(new BgpAdminEvent.Stop(wallClock.now(), NotificationMessage.ADMINISTRATIVE_SHUTDOWN));
    }

    @Override
    public void stop() {
        driver.stop();
        timedExecutor.cancelAll();
        adapter.close();
    }

    @Override
    public void advertise(long session, List<UpdateMessage> updates) {
        submit(new BgpRouteEvent.AdvertiseRoutes(wallClock.now(), session, updates));
    }

    @Override
    public PeerStatus status() {
        PeerSessionState state = driver.currentState();
        SessionCounters counters = state.counters();
        return new PeerStatus(
            config.peerAddress(),
            config.remoteAs(),
            config.localAs(),
            state.fsmState(),
            state.adminEnabled(),
            state.peerOpen().map(o -> o.bgpIdentifier()).orElse(null),
            state.negotiatedHoldSeconds(),
            counters.messagesReceived(),
            counters.messagesSent(),
            counters.updatesReceived(),
            counters.updatesSent(),
            counters.establishedTransitions(),
            state.lastError().orElse(null),
            state.lastTransition()
        );
    }

    /**
     * Listener for an inbound connection from this peer.
     */
    StreamTransportListener inboundListener() {
        return adapter;
    }

    PeerSessionState currentState() {
        return driver.currentState();
    }

    private void submit(BgpEvent event) {
        driver.submitEvent(event);
    }
}
