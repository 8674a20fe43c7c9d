package com.questrail.routing.protocol.bgp.internal.time;

/**
 * {@link MonotonicClock} backed by {@link System#nanoTime()}; unaffected by
 * NTP steps or manual clock changes.
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
