package com.questrail.routing.protocol.bgp.internal.exec;

import com.questrail.routing.protocol.bgp.internal.events.BgpEvent;
import com.questrail.routing.protocol.bgp.internal.events.BgpTimerEvent;
import com.questrail.routing.protocol.bgp.internal.state.SessionIntents;
import com.questrail.routing.protocol.bgp.time.DeterministicScheduler;
import com.questrail.routing.protocol.bgp.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimedSessionIntentExecutorTest {

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private List<SessionIntents> delegated;
    private List<BgpEvent> injected;
    private TimedSessionIntentExecutor executor;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        delegated = new ArrayList<>();
        injected = new ArrayList<>();
        executor = new TimedSessionIntentExecutor(delegated::add, injected::add, clock, scheduler,
                () -> Instant.EPOCH);
    }

    @Test
    void delegatesEveryIntentSet() {
        SessionIntents intents = SessionIntents.builder().add(SessionIntents.Kind.SEND_KEEPALIVE).build();

        executor.execute(intents);

        assertEquals(List.of(intents), delegated);
    }

    @Test
    void armedHoldTimerFiresAtItsDeadlineWithGeneration() {
        executor.execute(SessionIntents.builder().armHold(Duration.ofSeconds(90), 7).build());

        clock.advanceSeconds(89);
        scheduler.runDueTasks();
        assertTrue(injected.isEmpty());

        clock.advanceSeconds(1);
        scheduler.runDueTasks();
        assertEquals(1, injected.size());
        BgpTimerEvent.HoldTimerExpired expiry = assertInstanceOf(BgpTimerEvent.HoldTimerExpired.class, injected.get(0));
        assertEquals(7, expiry.generation());
        assertFalse(executor.isArmed(TimedSessionIntentExecutor.Timer.HOLD));
    }

    @Test
    void rearmingReplacesEarlierArm() {
        executor.execute(SessionIntents.builder().armHold(Duration.ofSeconds(90), 1).build());
        clock.advanceSeconds(60);
        executor.execute(SessionIntents.builder().armHold(Duration.ofSeconds(90), 2).build());

        clock.advanceSeconds(60);
        scheduler.runDueTasks();
        assertTrue(injected.isEmpty(), "first arm must have been cancelled");

        clock.advanceSeconds(30);
        scheduler.runDueTasks();
        assertEquals(1, injected.size());
        assertEquals(2, ((BgpTimerEvent.HoldTimerExpired) injected.get(0)).generation());
    }

    @Test
    void cancelTimersRunsBeforeNewArms() {
        executor.execute(SessionIntents.builder()
                .armConnectRetry(Duration.ofSeconds(120), 1)
                .armKeepalive(Duration.ofSeconds(30), 1)
                .build());

        executor.execute(SessionIntents.builder()
                .add(SessionIntents.Kind.CANCEL_TIMERS)
                .armHold(Duration.ofSeconds(240), 3)
                .build());

        assertFalse(executor.isArmed(TimedSessionIntentExecutor.Timer.CONNECT_RETRY));
        assertFalse(executor.isArmed(TimedSessionIntentExecutor.Timer.KEEPALIVE));
        assertTrue(executor.isArmed(TimedSessionIntentExecutor.Timer.HOLD));

        clock.advanceSeconds(300);
        scheduler.runDueTasks();
        assertEquals(1, injected.size());
        assertInstanceOf(BgpTimerEvent.HoldTimerExpired.class, injected.get(0));
    }

    @Test
    void cancelAllLeavesNothingPending() {
        executor.execute(SessionIntents.builder()
                .armConnectRetry(Duration.ofSeconds(120), 1)
                .armHold(Duration.ofSeconds(90), 1)
                .armKeepalive(Duration.ofSeconds(30), 1)
                .build());
        assertEquals(3, scheduler.pendingCount());

        executor.cancelAll();

        assertEquals(0, scheduler.pendingCount());
        clock.advanceSeconds(1000);
        scheduler.runDueTasks();
        assertTrue(injected.isEmpty());
    }
}
