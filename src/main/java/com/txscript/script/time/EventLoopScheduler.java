package com.txscript.script.time;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import com.txscript.debug.Debug;

/**
 * Owns a single daemon thread and schedules on it. Every task slice and timer of an
 * executor driven by this scheduler runs on that one thread, in deadline order.
 */
public final class EventLoopScheduler implements MonotonicScheduler, AutoCloseable {

    private static final String TAG = "txscript.loop";

    private final ScheduledExecutorService executor;
    private final ScheduledExecutorScheduler delegate;

    public EventLoopScheduler(String threadName) {
        this(threadName, SystemMonotonicClock.INSTANCE);
    }

    public EventLoopScheduler(String threadName, MonotonicClock clock) {
        ScheduledThreadPoolExecutor ex = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = Executors.defaultThreadFactory().newThread(r);
            t.setName(threadName);
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((th, e) -> Debug.get().e(TAG, "uncaught on " + th.getName(), e));
            return t;
        });
        ex.setRemoveOnCancelPolicy(true);
        this.executor = ex;
        this.delegate = new ScheduledExecutorScheduler(ex, clock);
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        return delegate.scheduleAtNanos(deadlineNanos, task);
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                Debug.get().w(TAG, "event loop did not terminate within 1s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
