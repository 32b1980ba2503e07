import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;

import com.txscript.script.time.Cancellable;
import com.txscript.script.time.MonotonicScheduler;

/**
 * Scheduler driven by a {@link ManualMonotonicClock}. Tasks run only from
 * {@link #runDueTasks()} or {@link #advanceMillis(long)}, on the calling thread.
 * Tasks with the same deadline run in the order they were scheduled.
 */
public final class DeterministicScheduler implements MonotonicScheduler {

    private final ManualMonotonicClock clock;
    private final PriorityQueue<Scheduled> queue = new PriorityQueue<>();
    private long sequence = 0;

    public DeterministicScheduler(ManualMonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Scheduled scheduled = new Scheduled(deadlineNanos, sequence++, task);
        queue.add(scheduled);
        return scheduled;
    }

    /** Run every task whose deadline is at or before the current clock time. */
    public void runDueTasks() {
        Scheduled next;
        while ((next = pollDue()) != null) {
            if (!next.cancelled.get()) {
                next.task.run();
            }
        }
    }

    /**
     * Move the clock forward by {@code millis}, stopping at each deadline on the way so
     * that tasks scheduled by earlier tasks see the time they were due at.
     */
    public void advanceMillis(long millis) {
        long target = clock.nowNanos() + millis * 1_000_000L;
        runDueTasks();
        while (true) {
            long next = nextDeadlineNanos();
            if (next > target) break;
            clock.advanceNanos(Math.max(0, next - clock.nowNanos()));
            runDueTasks();
        }
        clock.advanceNanos(target - clock.nowNanos());
        runDueTasks();
    }

    /** Deadline of the earliest live task, or {@link Long#MAX_VALUE} if none. */
    public synchronized long nextDeadlineNanos() {
        while (!queue.isEmpty() && queue.peek().cancelled.get()) {
            queue.poll();
        }
        return queue.isEmpty() ? Long.MAX_VALUE : queue.peek().deadlineNanos;
    }

    public synchronized int pendingTasks() {
        int n = 0;
        for (Scheduled s : queue) {
            if (!s.cancelled.get()) n++;
        }
        return n;
    }

    private synchronized Scheduled pollDue() {
        if (queue.isEmpty() || queue.peek().deadlineNanos > clock.nowNanos()) return null;
        return queue.poll();
    }

    private static final class Scheduled implements Comparable<Scheduled>, Cancellable {
        private final long deadlineNanos;
        private final long sequence;
        private final Runnable task;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        private Scheduled(long deadlineNanos, long sequence, Runnable task) {
            this.deadlineNanos = deadlineNanos;
            this.sequence = sequence;
            this.task = task;
        }

        @Override
        public boolean cancel() {
            return cancelled.compareAndSet(false, true);
        }

        @Override
        public int compareTo(Scheduled o) {
            int c = Long.compare(this.deadlineNanos, o.deadlineNanos);
            return (c != 0) ? c : Long.compare(this.sequence, o.sequence);
        }
    }
}
