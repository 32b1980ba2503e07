package com.txscript.script.time;

/**
 * Time source for every script timing decision: delays, wait_for timeouts, interval
 * cadence and the run clock reported by {@code now()}.
 *
 * <p>
 * Values are only meaningful for elapsed time computations. Wall-clock time is used
 * for log timestamps only.
 * </p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     */
    long nowNanos();

    default long nowMillis()
    {
        return nowNanos() / 1_000_000L;
    }
}
