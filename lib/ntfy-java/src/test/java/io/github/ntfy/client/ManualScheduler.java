package io.github.ntfy.client;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Scheduler with a fake clock: timers run only when the test calls {@link #advance(Duration)},
 * on the calling thread.
 */
class ManualScheduler implements Scheduler {

    static final Instant EPOCH = Instant.parse("2025-01-15T10:00:00Z");

    private final List<Task> tasks = new ArrayList<>();
    private final List<Duration> oneShotDelays = new ArrayList<>();
    private long now;
    private boolean closed;

    @Override
    public synchronized long monotonicMillis() {
        return now;
    }

    @Override
    public synchronized Cancellable schedule(Runnable task, Duration delay) {
        oneShotDelays.add(delay);
        Task t = new Task(task, now + delay.toMillis(), 0);
        tasks.add(t);
        return t;
    }

    @Override
    public synchronized Cancellable scheduleAtFixedRate(Runnable task, Duration period) {
        Task t = new Task(task, now + period.toMillis(), period.toMillis());
        tasks.add(t);
        return t;
    }

    @Override
    public synchronized void close() {
        closed = true;
        tasks.clear();
    }

    /**
     * Moves time forward, running every timer that comes due in order.
     */
    void advance(Duration duration) {
        long target;
        synchronized (this) {
            target = now + duration.toMillis();
        }
        while (true) {
            Task due;
            synchronized (this) {
                due = null;
                for (Task t : tasks) {
                    if (!t.cancelled && t.dueAt <= target && (due == null || t.dueAt < due.dueAt)) {
                        due = t;
                    }
                }
                if (due == null) {
                    now = target;
                    return;
                }
                now = due.dueAt;
                if (due.period > 0) {
                    due.dueAt += due.period;
                } else {
                    tasks.remove(due);
                }
            }
            due.task.run();
        }
    }

    /**
     * Returns the delays of all one-shot timers ever scheduled, in order.
     */
    synchronized List<Duration> oneShotDelays() {
        return new ArrayList<>(oneShotDelays);
    }

    synchronized int pendingOneShots() {
        int count = 0;
        for (Task t : tasks) {
            if (!t.cancelled && t.period == 0) {
                count++;
            }
        }
        return count;
    }

    synchronized int pendingPeriodic() {
        int count = 0;
        for (Task t : tasks) {
            if (!t.cancelled && t.period > 0) {
                count++;
            }
        }
        return count;
    }

    synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Wall clock that moves together with the fake monotonic time.
     */
    Clock clock() {
        return new Clock() {
            @Override
            public ZoneId getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                return EPOCH.plusMillis(monotonicMillis());
            }
        };
    }

    private static final class Task implements Cancellable {
        final Runnable task;
        final long period;
        long dueAt;
        volatile boolean cancelled;

        Task(Runnable task, long dueAt, long period) {
            this.task = task;
            this.dueAt = dueAt;
            this.period = period;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
