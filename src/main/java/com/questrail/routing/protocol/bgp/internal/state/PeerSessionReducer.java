package com.questrail.routing.protocol.bgp.internal.state;

import com.questrail.routing.api.PeerFsmState;
import com.questrail.routing.protocol.bgp.config.BgpPeerConfig;
import com.questrail.routing.protocol.bgp.internal.events.BgpAdminEvent;
import com.questrail.routing.protocol.bgp.internal.events.BgpEvent;
import com.questrail.routing.protocol.bgp.internal.events.BgpMessageEvent;
import com.questrail.routing.protocol.bgp.internal.events.BgpRouteEvent;
import com.questrail.routing.protocol.bgp.internal.events.BgpTimerEvent;
import com.questrail.routing.protocol.bgp.internal.events.BgpTransportEvent;
import com.questrail.routing.protocol.bgp.internal.exec.SessionTimingPolicy;
import com.questrail.routing.protocol.bgp.model.BgpMessage;
import com.questrail.routing.protocol.bgp.model.Capability;
import com.questrail.routing.protocol.bgp.model.KeepaliveMessage;
import com.questrail.routing.protocol.bgp.model.NotificationMessage;
import com.questrail.routing.protocol.bgp.model.OpenMessage;
import com.questrail.routing.protocol.bgp.model.RouteRefreshMessage;
import com.questrail.routing.protocol.bgp.model.UpdateMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * PeerSessionReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic state transition engine for one BGP peer session
 * (RFC 4271 section 8).
 *
 * <p>Given a {@link PeerSessionState} and a single {@link BgpEvent} the reducer
 * computes the next state and the {@link SessionIntents} to execute. It never
 * performs I/O, reads a clock or touches a timer: time enters only as event
 * timestamps, and timers only as arm/cancel intents plus generation numbers.</p>
 *
 * <h2>Teardown</h2>
 * Every session-ending path goes through one routine: cancel timers, send the
 * NOTIFICATION the cause requires (if any), close the connection, notify the
 * coordinator if the session was Established, return to IDLE and, when the
 * peer is still administratively enabled, arm connect-retry for an automatic
 * restart.
 */
public final class PeerSessionReducer
{
    /**
     * Result of applying an event to a session state.
     *
     * @param newState the updated session state
     * @param intents  actions to be executed by the caller
     */
    public record Result(PeerSessionState newState, SessionIntents intents) {}

    private final SessionTimingPolicy timing;

    public PeerSessionReducer(SessionTimingPolicy timing) {
        this.timing = Objects.requireNonNull(timing, "timing");
    }

    /**
     * Applies a single event to the current session state.
     */
    public Result apply(PeerSessionState state, BgpEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        if (event instanceof BgpAdminEvent.Start e) {
            return onStart(state, e);
        }
        if (event instanceof BgpAdminEvent.Stop e) {
            return onStop(state, e);
        }
        if (event instanceof BgpTransportEvent.TransportUp e) {
            return onTransportUp(state, e);
        }
        if (event instanceof BgpTransportEvent.ConnectFailed e) {
            return onConnectFailed(state, e.timestamp(), e.cause());
        }
        if (event instanceof BgpTransportEvent.TransportDown e) {
            return onTransportDown(state, e);
        }
        if (event instanceof BgpTimerEvent.ConnectRetryExpired e) {
            return onConnectRetryExpired(state, e);
        }
        if (event instanceof BgpTimerEvent.HoldTimerExpired e) {
            return onHoldTimerExpired(state, e);
        }
        if (event instanceof BgpTimerEvent.KeepaliveTimerExpired e) {
            return onKeepaliveTimerExpired(state, e);
        }
        if (event instanceof BgpMessageEvent.MessageReceived e) {
            return onMessageReceived(state, e);
        }
        if (event instanceof BgpMessageEvent.MessageInvalid e) {
            return onMessageInvalid(state, e);
        }
        if (event instanceof BgpRouteEvent.AdvertiseRoutes e) {
            return onAdvertiseRoutes(state, e);
        }

        return new Result(state, SessionIntents.none());
    }

    // ---------------------------------------------------------------------
    // Administrative events
    // ---------------------------------------------------------------------

    private Result onStart(PeerSessionState state, BgpAdminEvent.Start e) {
        if (state.fsmState() != PeerFsmState.IDLE) {
            return new Result(state.withAdminEnabled(true), SessionIntents.none());
        }
        return beginConnecting(state.withAdminEnabled(true), e.timestamp(), SessionIntents.builder());
    }

    private Result onStop(PeerSessionState state, BgpAdminEvent.Stop e) {
        PeerSessionState disabled = state.withAdminEnabled(false);

        if (state.fsmState() == PeerFsmState.IDLE) {
            return new Result(disabled.withAllTimersInvalidated(),
                    SessionIntents.builder().add(SessionIntents.Kind.CANCEL_TIMERS).build());
        }

        NotificationMessage cease = state.fsmState().hasTransport()
                ? NotificationMessage.cease(e.ceaseSubcode())
                : null;
        return teardown(disabled, cease, "administratively stopped", e.timestamp(), false);
    }

    // ---------------------------------------------------------------------
    // Transport events
    // ---------------------------------------------------------------------

    private Result onTransportUp(PeerSessionState state, BgpTransportEvent.TransportUp e) {
        switch (state.fsmState()) {
            case CONNECT, ACTIVE -> {
                BgpPeerConfig config = state.config();
                PeerSessionState next = state
                        .withAllTimersInvalidated()
                        .withNextHoldGeneration()
                        .withFsmState(PeerFsmState.OPEN_SENT, e.timestamp())
                        .withCounters(state.counters().sent(1));

                SessionIntents intents = SessionIntents.builder()
                        .add(SessionIntents.Kind.CANCEL_TIMERS)
                        .sendOpen(OpenMessage.local(config.localAs(), config.holdTimeSeconds(),
                                config.localRouterId()))
                        .armHold(timing.provisionalHold(), next.holdGeneration())
                        .build();
                return new Result(next, intents);
            }
            case IDLE -> {
                // Not accepting connections while idle.
                return new Result(state,
                        SessionIntents.builder().add(SessionIntents.Kind.CLOSE_TRANSPORT).build());
            }
            default -> {
                return new Result(state, SessionIntents.none());
            }
        }
    }

    private Result onConnectFailed(PeerSessionState state, Instant now, String cause) {
        if (state.fsmState() != PeerFsmState.CONNECT) {
            return new Result(state, SessionIntents.none());
        }
        PeerSessionState next = state
                .withNextConnectRetryGeneration()
                .withFsmState(PeerFsmState.ACTIVE, now)
                .withLastError("connect failed: " + cause);
        return new Result(next, SessionIntents.builder()
                .armConnectRetry(timing.connectRetry(), next.connectRetryGeneration())
                .build());
    }

    private Result onTransportDown(PeerSessionState state, BgpTransportEvent.TransportDown e) {
        if (state.fsmState() == PeerFsmState.CONNECT) {
            return onConnectFailed(state, e.timestamp(), e.cause());
        }
        if (!state.fsmState().hasTransport()) {
            return new Result(state, SessionIntents.none());
        }
        return teardown(state, null, "connection lost: " + e.cause(), e.timestamp(), true);
    }

    // ---------------------------------------------------------------------
    // Timer events
    // ---------------------------------------------------------------------

    private Result onConnectRetryExpired(PeerSessionState state, BgpTimerEvent.ConnectRetryExpired e) {
        if (e.generation() != state.connectRetryGeneration() || !state.adminEnabled()) {
            return new Result(state, SessionIntents.none());
        }
        return switch (state.fsmState()) {
            case IDLE -> beginConnecting(state, e.timestamp(), SessionIntents.builder());
            case CONNECT, ACTIVE -> state.config().passive()
                    ? new Result(state, SessionIntents.none())
                    : beginConnecting(state, e.timestamp(),
                            SessionIntents.builder().add(SessionIntents.Kind.CLOSE_TRANSPORT));
            default -> new Result(state, SessionIntents.none());
        };
    }

    private Result onHoldTimerExpired(PeerSessionState state, BgpTimerEvent.HoldTimerExpired e) {
        if (e.generation() != state.holdGeneration() || !state.fsmState().hasTransport()) {
            return new Result(state, SessionIntents.none());
        }
        return teardown(state, NotificationMessage.holdTimerExpired(), "hold timer expired",
                e.timestamp(), true);
    }

    private Result onKeepaliveTimerExpired(PeerSessionState state, BgpTimerEvent.KeepaliveTimerExpired e) {
        if (e.generation() != state.keepaliveGeneration()
                || (state.fsmState() != PeerFsmState.OPEN_CONFIRM
                    && state.fsmState() != PeerFsmState.ESTABLISHED)) {
            return new Result(state, SessionIntents.none());
        }
        PeerSessionState next = state
                .withNextKeepaliveGeneration()
                .withCounters(state.counters().sent(1));
        return new Result(next, SessionIntents.builder()
                .add(SessionIntents.Kind.SEND_KEEPALIVE)
                .armKeepalive(state.keepaliveInterval(), next.keepaliveGeneration())
                .build());
    }

    // ---------------------------------------------------------------------
    // Message events
    // ---------------------------------------------------------------------

    private Result onMessageInvalid(PeerSessionState state, BgpMessageEvent.MessageInvalid e) {
        if (!state.fsmState().hasTransport()) {
            return new Result(state, SessionIntents.none());
        }
        return teardown(state, e.notification(), e.reason(), e.timestamp(), true);
    }

    private Result onMessageReceived(PeerSessionState state, BgpMessageEvent.MessageReceived e) {
        if (!state.fsmState().hasTransport()) {
            // Bytes from a connection the session no longer owns.
            return new Result(state, SessionIntents.none());
        }

        PeerSessionState counted = state.withCounters(state.counters().received());
        BgpMessage message = e.message();
        Instant now = e.timestamp();

        if (message instanceof NotificationMessage n) {
            return teardown(counted, null, "peer sent " + n.describe(), now, true);
        }

        return switch (state.fsmState()) {
            case OPEN_SENT -> message instanceof OpenMessage open
                    ? onOpen(counted, open, now)
                    : fsmError(counted, message, now);
            case OPEN_CONFIRM -> message instanceof KeepaliveMessage
                    ? onFirstKeepalive(counted, now)
                    : fsmError(counted, message, now);
            case ESTABLISHED -> onEstablishedMessage(counted, message, now);
            default -> new Result(state, SessionIntents.none());
        };
    }

    private Result onOpen(PeerSessionState state, OpenMessage open, Instant now) {
        NotificationMessage rejection = validateOpen(state.config(), open);
        if (rejection != null) {
            return teardown(state, rejection, "OPEN rejected: " + rejection.describe(), now, true);
        }

        int hold = Math.min(state.config().holdTimeSeconds(), open.holdTimeSeconds());
        Duration keepalive = hold == 0 ? Duration.ZERO : timing.keepaliveFor(Duration.ofSeconds(hold));

        PeerSessionState next = state
                .withAllTimersInvalidated()
                .withNegotiated(open, hold, keepalive, open.supportsFourOctetAs())
                .withFsmState(PeerFsmState.OPEN_CONFIRM, now)
                .withCounters(state.counters().sent(1));

        SessionIntents.Builder intents = SessionIntents.builder()
                .add(SessionIntents.Kind.CANCEL_TIMERS)
                .add(SessionIntents.Kind.SEND_KEEPALIVE);
        if (hold > 0) {
            intents.armHold(Duration.ofSeconds(hold), next.holdGeneration())
                    .armKeepalive(keepalive, next.keepaliveGeneration());
        }
        return new Result(next, intents.build());
    }

    /**
     * @return the NOTIFICATION that rejects {@code open}, or {@code null} if acceptable
     */
    static NotificationMessage validateOpen(BgpPeerConfig config, OpenMessage open) {
        if (open.version() != OpenMessage.BGP_VERSION) {
            return new NotificationMessage(NotificationMessage.OPEN_MESSAGE_ERROR,
                    NotificationMessage.UNSUPPORTED_VERSION_NUMBER,
                    new byte[] { 0, (byte) OpenMessage.BGP_VERSION });
        }
        if (open.asNumber() != config.remoteAs()) {
            return NotificationMessage.openError(NotificationMessage.BAD_PEER_AS);
        }
        if (open.holdTimeSeconds() == 1 || open.holdTimeSeconds() == 2) {
            return NotificationMessage.openError(NotificationMessage.UNACCEPTABLE_HOLD_TIME);
        }
        if (open.bgpIdentifier().isUnspecified()
                || open.bgpIdentifier().equals(config.localRouterId())) {
            return NotificationMessage.openError(NotificationMessage.BAD_BGP_IDENTIFIER);
        }
        boolean multiprotocol = open.hasCapability(Capability.MULTIPROTOCOL);
        if (multiprotocol && open.capabilities().stream().noneMatch(Capability::isIpv4Unicast)) {
            return NotificationMessage.openError(NotificationMessage.UNSUPPORTED_CAPABILITY);
        }
        return null;
    }

    private Result onFirstKeepalive(PeerSessionState state, Instant now) {
        PeerSessionState next = state
                .withFsmState(PeerFsmState.ESTABLISHED, now)
                .withCounters(state.counters().established())
                .withLastError(null);

        SessionIntents.Builder intents = SessionIntents.builder()
                .sessionEstablished(state.peerOpen().orElseThrow(), next.counters().establishedTransitions());
        return new Result(rearmHold(next, intents), intents.build());
    }

    private Result onEstablishedMessage(PeerSessionState state, BgpMessage message, Instant now) {
        SessionIntents.Builder intents = SessionIntents.builder();
        PeerSessionState next = state;

        if (message instanceof UpdateMessage update) {
            next = next.withCounters(next.counters().updateReceived());
            intents.deliverUpdate(update);
        } else if (message instanceof RouteRefreshMessage refresh) {
            if (refresh.afi() == Capability.AFI_IPV4 && refresh.safi() == Capability.SAFI_UNICAST) {
                intents.add(SessionIntents.Kind.REQUEST_REFRESH);
            }
        } else if (!(message instanceof KeepaliveMessage)) {
            return fsmError(state, message, now);
        }

        return new Result(rearmHold(next, intents), intents.build());
    }

    private PeerSessionState rearmHold(PeerSessionState state, SessionIntents.Builder intents) {
        if (state.negotiatedHoldSeconds() == 0) {
            return state;
        }
        PeerSessionState next = state.withNextHoldGeneration();
        intents.armHold(Duration.ofSeconds(state.negotiatedHoldSeconds()), next.holdGeneration());
        return next;
    }

    private Result fsmError(PeerSessionState state, BgpMessage message, Instant now) {
        return teardown(state, NotificationMessage.fsmError(),
                "unexpected " + message.type() + " in " + state.fsmState(), now, true);
    }

    // ---------------------------------------------------------------------
    // Route events
    // ---------------------------------------------------------------------

    private Result onAdvertiseRoutes(PeerSessionState state, BgpRouteEvent.AdvertiseRoutes e) {
        if (state.fsmState() != PeerFsmState.ESTABLISHED
                || e.session() != state.counters().establishedTransitions()
                || e.updates().isEmpty()) {
            return new Result(state, SessionIntents.none());
        }
        PeerSessionState next = state.withCounters(state.counters().updatesSent(e.updates().size()));
        return new Result(next, SessionIntents.builder().sendUpdates(e.updates()).build());
    }

    // ---------------------------------------------------------------------
    // Shared transitions
    // ---------------------------------------------------------------------

    private Result beginConnecting(PeerSessionState state, Instant now, SessionIntents.Builder intents) {
        if (state.config().passive()) {
            return new Result(state.withFsmState(PeerFsmState.ACTIVE, now), intents.build());
        }
        PeerSessionState next = state
                .withNextConnectRetryGeneration()
                .withFsmState(PeerFsmState.CONNECT, now);
        intents.add(SessionIntents.Kind.CONNECT)
                .armConnectRetry(timing.connectRetry(), next.connectRetryGeneration());
        return new Result(next, intents.build());
    }

    private Result teardown(PeerSessionState state,
                            NotificationMessage notification,
                            String reason,
                            Instant now,
                            boolean restart) {
        SessionIntents.Builder intents = SessionIntents.builder()
                .add(SessionIntents.Kind.CANCEL_TIMERS);
        SessionCounters counters = state.counters();

        if (notification != null) {
            intents.sendNotification(notification);
            counters = counters.sent(1);
        }
        intents.add(SessionIntents.Kind.CLOSE_TRANSPORT);
        if (state.fsmState() == PeerFsmState.ESTABLISHED) {
            intents.sessionDown(reason);
        }

        PeerSessionState next = state
                .withAllTimersInvalidated()
                .withSessionCleared()
                .withCounters(counters)
                .withLastError(reason)
                .withFsmState(PeerFsmState.IDLE, now);

        if (restart && next.adminEnabled()) {
            intents.armConnectRetry(timing.connectRetry(), next.connectRetryGeneration());
        }
        return new Result(next, intents.build());
    }
}
