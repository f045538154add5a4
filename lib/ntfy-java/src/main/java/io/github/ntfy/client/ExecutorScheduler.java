package io.github.ntfy.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Scheduler backed by a single daemon thread, so timer callbacks never run concurrently
 * with each other.
 */
public final class ExecutorScheduler implements Scheduler {

    private static final Logger log = LoggerFactory.getLogger(ExecutorScheduler.class);

    private final ScheduledExecutorService executor;

    /**
     * Creates a scheduler with its own thread named "ntfy-scheduler".
     */
    public ExecutorScheduler() {
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "ntfy-scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public long monotonicMillis() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
    }

    @Override
    public Cancellable schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = executor.schedule(guard(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        return new FutureHandle(future);
    }

    @Override
    public Cancellable scheduleAtFixedRate(Runnable task, Duration period) {
        long millis = period.toMillis();
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(guard(task), millis, millis, TimeUnit.MILLISECONDS);
        return new FutureHandle(future);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    // an escaping exception would silently cancel a periodic task
    private static Runnable guard(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("scheduled task failed", e);
            }
        };
    }

    private static final class FutureHandle implements Cancellable {
        private final ScheduledFuture<?> future;

        FutureHandle(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
