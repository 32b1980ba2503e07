package com.txscript.script.time;

import java.time.Duration;
import java.util.Objects;

/**
 * Scheduler surface the executor suspends on. Script tasks never sleep a thread:
 * a delay, a wait_for timeout or the next slice of a task is a scheduled continuation.
 *
 * <h2>Binding invariant</h2>
 * Scheduling is expressed in monotonic ticks or durations, never in wall-clock instants.
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos monotonic deadline in nanoseconds (from {@link MonotonicClock#nowNanos()})
     * @param task         runnable task
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Convenience method: schedule after a duration using a provided monotonic clock.
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
