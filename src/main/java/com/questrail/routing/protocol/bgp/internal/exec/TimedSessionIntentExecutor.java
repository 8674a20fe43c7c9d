package com.questrail.routing.protocol.bgp.internal.exec;

import com.questrail.routing.protocol.bgp.internal.events.BgpEvent;
import com.questrail.routing.protocol.bgp.internal.events.BgpTimerEvent;
import com.questrail.routing.protocol.bgp.internal.state.SessionIntents;
import com.questrail.routing.protocol.bgp.internal.time.Cancellable;
import com.questrail.routing.protocol.bgp.internal.time.MonotonicClock;
import com.questrail.routing.protocol.bgp.internal.time.MonotonicScheduler;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.LongFunction;
import java.util.function.Supplier;

/**
 * TimedSessionIntentExecutor
 * =============================================================================
 * Wrapper that realizes the timer intents of {@link SessionIntents} and
 * delegates everything else.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>{@code CANCEL_TIMERS} cancels every armed timer before the delegate
 *       runs, so no expiry can race with a teardown in progress.</li>
 *   <li>{@code ARM_*} replaces any earlier arm of the same timer after the
 *       delegate runs.</li>
 *   <li>An expiry is injected into the session's event queue as a
 *       {@link BgpTimerEvent} carrying the generation it was armed with. The
 *       reducer discards stale generations, so a cancel that loses the race
 *       with a firing timer is harmless.</li>
 * </ul>
 *
 * <p>All deadlines use the monotonic clock; the wall clock only stamps the
 * injected events.</p>
 */
public final class TimedSessionIntentExecutor implements SessionIntentExecutor {

    enum Timer { CONNECT_RETRY, HOLD, KEEPALIVE }

    private final SessionIntentExecutor delegate;
    private final Consumer<BgpEvent> eventSink;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final Supplier<Instant> wallClock;

    private final Map<Timer, Armed> armed = new EnumMap<>(Timer.class);

    public TimedSessionIntentExecutor(SessionIntentExecutor delegate,
                                      Consumer<BgpEvent> eventSink,
                                      MonotonicClock clock,
                                      MonotonicScheduler scheduler,
                                      Supplier<Instant> wallClock)
    {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public void execute(SessionIntents intents)
    {
        Objects.requireNonNull(intents, "intents");

        if (intents.contains(SessionIntents.Kind.CANCEL_TIMERS)) {
            cancelAll();
        }

        delegate.execute(intents);

        intents.connectRetry().ifPresent(arm -> arm(Timer.CONNECT_RETRY, arm,
                gen -> new BgpTimerEvent.ConnectRetryExpired(wallClock.get(), gen)));
        intents.hold().ifPresent(arm -> arm(Timer.HOLD, arm,
                gen -> new BgpTimerEvent.HoldTimerExpired(wallClock.get(), gen)));
        intents.keepalive().ifPresent(arm -> arm(Timer.KEEPALIVE, arm,
                gen -> new BgpTimerEvent.KeepaliveTimerExpired(wallClock.get(), gen)));
    }

    /**
     * Cancels every armed timer. Also used when the session driver stops.
     */
    public synchronized void cancelAll()
    {
        for (Armed a : armed.values()) {
            a.handle().cancel();
        }
        armed.clear();
    }

    synchronized boolean isArmed(Timer timer)
    {
        return armed.containsKey(timer);
    }

    private synchronized void arm(Timer timer, SessionIntents.TimerArm arm, LongFunction<BgpEvent> expiry)
    {
        Armed previous = armed.remove(timer);
        if (previous != null) {
            previous.handle().cancel();
        }
        final long generation = arm.generation();
        Cancellable handle = scheduler.scheduleAfter(arm.delay(), clock, () -> {
            synchronized (this) {
                Armed current = armed.get(timer);
                if (current != null && current.generation() == generation) {
                    armed.remove(timer);
                }
            }
            eventSink.accept(expiry.apply(generation));
        });
        armed.put(timer, new Armed(generation, handle));
    }

    private record Armed(long generation, Cancellable handle) {}
}
