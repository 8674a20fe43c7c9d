package com.questrail.routing.protocol.bgp.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Schedules session timer callbacks against a {@link MonotonicClock}.
 *
 * <p>Deadlines are monotonic nanoseconds, never wall-clock instants.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Run {@code task} at or after {@code deadlineNanos}.
     *
     * @param deadlineNanos deadline on the {@link MonotonicClock#nowNanos()} scale
     * @param task          callback; typically enqueues a timer event
     * @return handle used to cancel the task before it runs
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Run {@code task} once {@code delay} has elapsed on {@code clock}.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        long deadline = clock.nowNanos() + delay.toNanos();
        return scheduleAtNanos(deadline, task);
    }
}
