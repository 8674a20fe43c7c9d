package com.questrail.routing.protocol.bgp.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * SessionTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for peer sessions.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>connectRetry</b>: wait between connection attempts, and before an
 *       automatic restart after a session ends.</li>
 *   <li><b>provisionalHold</b>: hold timer armed while waiting for the peer's
 *       OPEN, before a hold time has been negotiated.</li>
 *   <li><b>minKeepalive</b>: lower bound for the keepalive interval derived
 *       from the negotiated hold time (hold / 3).</li>
 * </ul>
 *
 * <p>The negotiated hold time itself is not here: it comes from the peer
 * configuration and the peer's OPEN.</p>
 */
public record SessionTimingPolicy(
        Duration connectRetry,
        Duration provisionalHold,
        Duration minKeepalive
) {
    public SessionTimingPolicy {
        Objects.requireNonNull(connectRetry, "connectRetry");
        Objects.requireNonNull(provisionalHold, "provisionalHold");
        Objects.requireNonNull(minKeepalive, "minKeepalive");

        if (connectRetry.isNegative() || connectRetry.isZero()) {
            throw new IllegalArgumentException("connectRetry must be positive");
        }
        if (provisionalHold.isNegative() || provisionalHold.isZero()) {
            throw new IllegalArgumentException("provisionalHold must be positive");
        }
        if (minKeepalive.isNegative()) {
            throw new IllegalArgumentException("minKeepalive must be non-negative");
        }
    }

    /**
     * RFC 4271 suggested values.
     *
     * <ul>
     *   <li>connectRetry: 120s</li>
     *   <li>provisionalHold: 240s</li>
     *   <li>minKeepalive: 1s</li>
     * </ul>
     */
    public static SessionTimingPolicy defaults() {
        return new SessionTimingPolicy(
                Duration.ofSeconds(120),
                Duration.ofSeconds(240),
                Duration.ofSeconds(1)
        );
    }

    /**
     * Keepalive interval for a negotiated hold time: one third of it, never
     * below {@link #minKeepalive()}. Only meaningful for a non-zero hold time.
     */
    public Duration keepaliveFor(Duration negotiatedHold) {
        Duration third = negotiatedHold.dividedBy(3);
        return third.compareTo(minKeepalive) < 0 ? minKeepalive : third;
    }
}
