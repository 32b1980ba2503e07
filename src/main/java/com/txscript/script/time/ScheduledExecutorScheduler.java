package com.txscript.script.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <p>Monotonic deadlines are converted into relative delays at scheduling time, so the
 * same {@link MonotonicClock} must be used by callers computing deadlines. Tasks may run
 * slightly after their deadline, never before.</p>
 *
 * <p>This class does not own the executor; callers are responsible for shutdown.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // Deadlines in the past run immediately.
        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        return new ScheduledFutureCancellable(future);
    }

    private static final class ScheduledFutureCancellable implements Cancellable {
        private final ScheduledFuture<?> future;

        private ScheduledFutureCancellable(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            // don't interrupt a task that is already executing
            return future.cancel(false);
        }
    }
}
