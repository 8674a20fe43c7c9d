package com.questrail.routing.protocol.bgp.internal.state;

import com.questrail.routing.api.PeerFsmState;
import com.questrail.routing.protocol.bgp.config.BgpPeerConfig;
import com.questrail.routing.protocol.bgp.model.OpenMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * PeerSessionState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of one peer session as seen by the
 * {@link PeerSessionReducer}.
 *
 * <h2>Session fields</h2>
 * {@code peerOpen}, {@code negotiatedHoldSeconds}, {@code keepaliveInterval}
 * and {@code fourOctetAs} describe the current session and are only
 * meaningful from OPEN_CONFIRM onwards. They are cleared whenever the session
 * returns to IDLE.
 *
 * <h2>Timer generations</h2>
 * Each timer has a generation number that is advanced whenever the timer is
 * armed or invalidated. An expiry event is acted on only when its generation
 * equals the current one.
 */
public final class PeerSessionState
{
    private final BgpPeerConfig config;
    private final PeerFsmState fsmState;
    private final boolean adminEnabled;
    private final OpenMessage peerOpen;
    private final int negotiatedHoldSeconds;
    private final Duration keepaliveInterval;
    private final boolean fourOctetAs;
    private final long connectRetryGeneration;
    private final long holdGeneration;
    private final long keepaliveGeneration;
    private final SessionCounters counters;
    private final String lastError;
    private final Instant lastTransition;

    private PeerSessionState(BgpPeerConfig config,
                             PeerFsmState fsmState,
                             boolean adminEnabled,
                             OpenMessage peerOpen,
                             int negotiatedHoldSeconds,
                             Duration keepaliveInterval,
                             boolean fourOctetAs,
                             long connectRetryGeneration,
                             long holdGeneration,
                             long keepaliveGeneration,
                             SessionCounters counters,
                             String lastError,
                             Instant lastTransition) {
        this.config = Objects.requireNonNull(config, "config");
        this.fsmState = Objects.requireNonNull(fsmState, "fsmState");
        this.adminEnabled = adminEnabled;
        this.peerOpen = peerOpen;
        this.negotiatedHoldSeconds = negotiatedHoldSeconds;
        this.keepaliveInterval = Objects.requireNonNull(keepaliveInterval, "keepaliveInterval");
        this.fourOctetAs = fourOctetAs;
        this.connectRetryGeneration = connectRetryGeneration;
        this.holdGeneration = holdGeneration;
        this.keepaliveGeneration = keepaliveGeneration;
        this.counters = Objects.requireNonNull(counters, "counters");
        this.lastError = lastError;
        this.lastTransition = Objects.requireNonNull(lastTransition, "lastTransition");
    }

    /**
     * Initial state for a configured peer: IDLE and administratively disabled.
     */
    public static PeerSessionState initial(BgpPeerConfig config, Instant now) {
        return new PeerSessionState(config, PeerFsmState.IDLE, false, null, 0, Duration.ZERO,
                false, 0, 0, 0, SessionCounters.ZERO, null, now);
    }

    public BgpPeerConfig config() {
        return config;
    }

    public PeerFsmState fsmState() {
        return fsmState;
    }

    public boolean adminEnabled() {
        return adminEnabled;
    }

    public Optional<OpenMessage> peerOpen() {
        return Optional.ofNullable(peerOpen);
    }

    public int negotiatedHoldSeconds() {
        return negotiatedHoldSeconds;
    }

    public Duration keepaliveInterval() {
        return keepaliveInterval;
    }

    public boolean fourOctetAs() {
        return fourOctetAs;
    }

    public long connectRetryGeneration() {
        return connectRetryGeneration;
    }

    public long holdGeneration() {
        return holdGeneration;
    }

    public long keepaliveGeneration() {
        return keepaliveGeneration;
    }

    public SessionCounters counters() {
        return counters;
    }

    public Optional<String> lastError() {
        return Optional.ofNullable(lastError);
    }

    public Instant lastTransition() {
        return lastTransition;
    }

    // ---------------------------------------------------------------------
    // Copy-on-write helpers
    // ---------------------------------------------------------------------

    /**
     * Moves to {@code next}. {@code lastTransition} only changes when the FSM
     * state actually changes.
     */
    public PeerSessionState withFsmState(PeerFsmState next, Instant now) {
        return new PeerSessionState(config, next, adminEnabled, peerOpen, negotiatedHoldSeconds,
                keepaliveInterval, fourOctetAs, connectRetryGeneration, holdGeneration,
                keepaliveGeneration, counters, lastError,
                next == fsmState ? lastTransition : now);
    }

    public PeerSessionState withAdminEnabled(boolean enabled) {
        return new PeerSessionState(config, fsmState, enabled, peerOpen, negotiatedHoldSeconds,
                keepaliveInterval, fourOctetAs, connectRetryGeneration, holdGeneration,
                keepaliveGeneration, counters, lastError, lastTransition);
    }

    public PeerSessionState withNegotiated(OpenMessage open, int holdSeconds, Duration keepalive,
                                           boolean fourOctet) {
        return new PeerSessionState(config, fsmState, adminEnabled, open, holdSeconds,
                keepalive, fourOctet, connectRetryGeneration, holdGeneration,
                keepaliveGeneration, counters, lastError, lastTransition);
    }

    /**
     * Clears everything learned from the peer's OPEN.
     */
    public PeerSessionState withSessionCleared() {
        return new PeerSessionState(config, fsmState, adminEnabled, null, 0, Duration.ZERO,
                false, connectRetryGeneration, holdGeneration, keepaliveGeneration,
                counters, lastError, lastTransition);
    }

    public PeerSessionState withNextConnectRetryGeneration() {
        return new PeerSessionState(config, fsmState, adminEnabled, peerOpen, negotiatedHoldSeconds,
                keepaliveInterval, fourOctetAs, connectRetryGeneration + 1, holdGeneration,
                keepaliveGeneration, counters, lastError, lastTransition);
    }

    public PeerSessionState withNextHoldGeneration() {
        return new PeerSessionState(config, fsmState, adminEnabled, peerOpen, negotiatedHoldSeconds,
                keepaliveInterval, fourOctetAs, connectRetryGeneration, holdGeneration + 1,
                keepaliveGeneration, counters, lastError, lastTransition);
    }

    public PeerSessionState withNextKeepaliveGeneration() {
        return new PeerSessionState(config, fsmState, adminEnabled, peerOpen, negotiatedHoldSeconds,
                keepaliveInterval, fourOctetAs, connectRetryGeneration, holdGeneration,
                keepaliveGeneration + 1, counters, lastError, lastTransition);
    }

    /**
     * Invalidates every outstanding timer.
     */
    public PeerSessionState withAllTimersInvalidated() {
        return new PeerSessionState(config, fsmState, adminEnabled, peerOpen, negotiatedHoldSeconds,
                keepaliveInterval, fourOctetAs, connectRetryGeneration + 1, holdGeneration + 1,
                keepaliveGeneration + 1, counters, lastError, lastTransition);
    }

    public PeerSessionState withCounters(SessionCounters counters) {
        return new PeerSessionState(config, fsmState, adminEnabled, peerOpen, negotiatedHoldSeconds,
                keepaliveInterval, fourOctetAs, connectRetryGeneration, holdGeneration,
                keepaliveGeneration, counters, lastError, lastTransition);
    }

    public PeerSessionState withLastError(String error) {
        return new PeerSessionState(config, fsmState, adminEnabled, peerOpen, negotiatedHoldSeconds,
                keepaliveInterval, fourOctetAs, connectRetryGeneration, holdGeneration,
                keepaliveGeneration, counters, error, lastTransition);
    }

    @Override
    public String toString() {
        return "PeerSessionState[peer=" + config.peerAddress()
                + ", state=" + fsmState
                + ", adminEnabled=" + adminEnabled
                + ", hold=" + negotiatedHoldSeconds
                + (lastError == null ? "" : ", lastError=" + lastError)
                + ']';
    }
}
