package com.questrail.routing.protocol.bgp.runtime;

import com.questrail.routing.api.BgpQueryGateway;
import com.questrail.routing.core.BgpServerCoordinator;
import com.questrail.routing.protocol.bgp.config.BgpPeerConfig;
import com.questrail.routing.protocol.bgp.config.BgpServerConfig;
import com.questrail.routing.protocol.bgp.internal.time.MonotonicClock;
import com.questrail.routing.protocol.bgp.internal.time.MonotonicScheduler;
import com.questrail.routing.protocol.bgp.internal.time.ScheduledExecutorScheduler;
import com.questrail.routing.protocol.bgp.internal.time.SystemMonotonicClock;
import com.questrail.routing.protocol.bgp.internal.time.SystemWallClock;
import com.questrail.routing.protocol.bgp.internal.time.WallClock;
import com.questrail.routing.protocol.bgp.model.Ipv4Address;
import com.questrail.routing.protocol.bgp.observability.BgpObservabilitySink;
import com.questrail.routing.protocol.bgp.observability.Slf4jBgpObservabilitySink;
import com.questrail.routing.protocol.bgp.transport.StreamTransport;
import com.questrail.routing.protocol.bgp.transport.StreamTransportListener;
import com.questrail.routing.protocol.bgp.transport.tcp.netty.NettyTcpStreamTransport;
import com.questrail.routing.rib.DecisionProcess;
import com.questrail.routing.rib.IgpCostResolver;
import com.questrail.routing.rib.RibEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * BgpProductionRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the production BGP speaker.
 *
 * <p>Builds one {@link RibEngine} owned by one {@link BgpServerCoordinator},
 * a {@link PeerSession} per configured neighbor, a shared timer thread and a
 * Netty TCP transport. Inbound connections are matched to a configured peer
 * by source address; connections from anyone else are refused.</p>
 */
public final class BgpProductionRuntime
{
    private static final Logger log = LoggerFactory.getLogger(BgpProductionRuntime.class);

    private final BgpServerConfig config;
    private final StreamTransport transport;
    private final BgpServerCoordinator coordinator;
    private final ScheduledExecutorService schedulerExecutor;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final BgpObservabilitySink observabilitySink;

    private final Map<Ipv4Address, PeerSession> sessions = new ConcurrentHashMap<>();
    private volatile InetSocketAddress boundAddress;

    private BgpProductionRuntime(BgpServerConfig config,
                                 StreamTransport transport,
                                 BgpServerCoordinator coordinator,
                                 ScheduledExecutorService schedulerExecutor,
                                 MonotonicClock clock,
                                 WallClock wallClock,
                                 BgpObservabilitySink observabilitySink) {
        this.config = config;
        this.transport = transport;
        this.coordinator = coordinator;
        this.schedulerExecutor = schedulerExecutor;
        this.clock = clock;
        this.scheduler = new ScheduledExecutorScheduler(schedulerExecutor, clock);
        this.wallClock = wallClock;
        this.observabilitySink = observabilitySink;
    }

    public void start() {
        coordinator.start();
        if (config.listenAddress() != null) {
            boundAddress = transport.listen(config.listenAddress(), this::acceptInbound);
        }
        for (BgpPeerConfig peer : config.peers()) {
            addPeer(peer);
        }
        log.info("BGP speaker AS {} router id {} started with {} peers",
                config.localAs(), config.routerId(), config.peers().size());
    }

    public void stop() {
        coordinator.stop();
        sessions.clear();
        transport.stop();
        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public BgpQueryGateway gateway() {
        return coordinator;
    }

    /**
     * The address actually listened on, once started with a listen address.
     */
    public Optional<InetSocketAddress> listenAddress() {
        return Optional.ofNullable(boundAddress);
    }

    /**
     * @throws IllegalArgumentException if the peer's local AS is not the speaker's
     */
    public CompletableFuture<Boolean> addPeer(BgpPeerConfig peer) {
        config.checkPeer(peer);
        PeerSession session = new PeerSession(
            peer,
            config.timingPolicy(),
            transport,
            coordinator,
            clock,
            scheduler,
            wallClock,
            observabilitySink
        );
        if (sessions.putIfAbsent(peer.peerAddress(), session) != null) {
            return CompletableFuture.completedFuture(false);
        }
        return coordinator.addPeer(session).whenComplete((added, error) -> {
            if (!Boolean.TRUE.equals(added)) {
                sessions.remove(peer.peerAddress(), session);
            }
        });
    }

    public CompletableFuture<Boolean> removePeer(Ipv4Address peer) {
        return coordinator.removePeer(peer).whenComplete((removed, error) -> sessions.remove(peer));
    }

    public CompletableFuture<Boolean> enablePeer(Ipv4Address peer) {
        return coordinator.enablePeer(peer);
    }

    public CompletableFuture<Boolean> disablePeer(Ipv4Address peer) {
        return coordinator.disablePeer(peer);
    }

    private StreamTransportListener acceptInbound(InetSocketAddress remote) {
        final Ipv4Address address;
        try {
            address = Ipv4Address.of(remote.getAddress());
        } catch (IllegalArgumentException e) {
            log.debug("Refusing non-IPv4 connection from {}", remote);
            return null;
        }
        PeerSession session = sessions.get(address);
        return session == null ? null : session.inboundListener();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BgpServerConfig config;
        private BgpObservabilitySink observabilitySink = new Slf4jBgpObservabilitySink();
        private StreamTransport transport;
        private IgpCostResolver igpCostResolver = IgpCostResolver.ZERO;

        public Builder withConfig(BgpServerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(BgpObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Replaces the Netty transport, e.g. with an in-memory one.
         */
        public Builder withTransport(StreamTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder withIgpCostResolver(IgpCostResolver resolver) {
            this.igpCostResolver = resolver;
            return this;
        }

        public BgpProductionRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(igpCostResolver, "igpCostResolver");

            // 1. Time
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            WallClock wallClock = SystemWallClock.INSTANCE;
            ScheduledExecutorService schedulerExec = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "bgp-timers");
                t.setDaemon(true);
                return t;
            });

            // 2. Routing table and its owner
            RibEngine rib = new RibEngine(
                config.localAs(),
                new DecisionProcess(config.decisionPolicy(), igpCostResolver),
                wallClock,
                observabilitySink
            );
            BgpServerCoordinator coordinator = new BgpServerCoordinator(rib, wallClock, observabilitySink);

            // 3. Transport
            StreamTransport effectiveTransport = transport != null ? transport : new NettyTcpStreamTransport();

            return new BgpProductionRuntime(config, effectiveTransport, coordinator, schedulerExec,
                    clock, wallClock, observabilitySink);
        }
    }
}
