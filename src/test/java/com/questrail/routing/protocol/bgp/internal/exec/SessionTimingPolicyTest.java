package com.questrail.routing.protocol.bgp.internal.exec;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SessionTimingPolicyTest {

    @Test
    void defaultsFollowRfc4271() {
        SessionTimingPolicy p = SessionTimingPolicy.defaults();

        assertEquals(Duration.ofSeconds(120), p.connectRetry());
        assertEquals(Duration.ofSeconds(240), p.provisionalHold());
        assertEquals(Duration.ofSeconds(1), p.minKeepalive());
    }

    @Test
    void keepaliveIsOneThirdOfHold() {
        SessionTimingPolicy p = SessionTimingPolicy.defaults();

        assertEquals(Duration.ofSeconds(30), p.keepaliveFor(Duration.ofSeconds(90)));
        assertEquals(Duration.ofSeconds(1), p.keepaliveFor(Duration.ofSeconds(3)));
    }

    @Test
    void keepaliveNeverDropsBelowMinimum() {
        SessionTimingPolicy p = new SessionTimingPolicy(Duration.ofSeconds(5), Duration.ofSeconds(10),
                Duration.ofSeconds(2));

        assertEquals(Duration.ofSeconds(2), p.keepaliveFor(Duration.ofSeconds(3)));
    }

    @Test
    void rejectsNonPositiveDurations() {
        assertThrows(IllegalArgumentException.class,
                () -> new SessionTimingPolicy(Duration.ZERO, Duration.ofSeconds(1), Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new SessionTimingPolicy(Duration.ofSeconds(1), Duration.ofSeconds(-1), Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new SessionTimingPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofSeconds(-1)));
        assertThrows(NullPointerException.class,
                () -> new SessionTimingPolicy(null, Duration.ofSeconds(1), Duration.ZERO));
    }
}
