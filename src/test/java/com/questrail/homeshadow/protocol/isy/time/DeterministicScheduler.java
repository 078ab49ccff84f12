package com.questrail.homeshadow.protocol.isy.time;

import com.questrail.homeshadow.protocol.isy.internal.time.Cancellable;
import com.questrail.homeshadow.protocol.isy.internal.time.MonotonicClock;
import com.questrail.homeshadow.protocol.isy.internal.time.MonotonicScheduler;

import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deterministic scheduler driven by a ManualMonotonicClock.
 *
 * Tasks execute ONLY when {@link #runDueTasks()} is called. Tasks with equal
 * deadlines run in scheduling order.
 */
public final class DeterministicScheduler implements MonotonicScheduler {

    private final MonotonicClock clock;
    private final PriorityQueue<Scheduled> queue = new PriorityQueue<>();
    private long sequence;

    public DeterministicScheduler(MonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Scheduled scheduled = new Scheduled(deadlineNanos, sequence++, task);
        queue.add(scheduled);
        return scheduled;
    }

    /**
     * Run all tasks whose deadlines are <= current clock time.
     *
     * @return number of tasks run
     */
    public int runDueTasks() {
        int ran = 0;
        while (true) {
            Scheduled next;
            synchronized (this) {
                if (queue.isEmpty() || queue.peek().deadlineNanos > clock.nowNanos()) {
                    return ran;
                }
                next = queue.poll();
            }
            if (next.done.compareAndSet(false, true)) {
                next.task.run();
                ran++;
            }
        }
    }

    /**
     * Number of tasks scheduled and neither run nor cancelled.
     */
    public synchronized int pendingCount() {
        return (int) queue.stream().filter(s -> !s.done.get()).count();
    }

    private static final class Scheduled implements Comparable<Scheduled>, Cancellable {
        private final long deadlineNanos;
        private final long sequence;
        private final Runnable task;
        private final AtomicBoolean done = new AtomicBoolean(false);

        private Scheduled(long deadlineNanos, long sequence, Runnable task) {
            this.deadlineNanos = deadlineNanos;
            this.sequence = sequence;
            this.task = task;
        }

        @Override
        public boolean cancel() {
            return done.compareAndSet(false, true);
        }

        @Override
        public int compareTo(Scheduled o) {
            int byDeadline = Long.compare(this.deadlineNanos, o.deadlineNanos);
            return byDeadline != 0 ? byDeadline : Long.compare(this.sequence, o.sequence);
        }
    }
}
