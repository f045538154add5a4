package io.github.ntfy.client;

import java.time.Duration;

/**
 * Monotonic clock and timer facility driving keepalive checks, reconnect delays,
 * subscription timeouts and periodic sweeps.
 */
public interface Scheduler extends AutoCloseable {

    /**
     * Returns a monotonic time in milliseconds, unrelated to wall-clock time.
     *
     * @return monotonic milliseconds
     */
    long monotonicMillis();

    /**
     * Runs a task once after a delay.
     *
     * @param task  the task
     * @param delay the delay
     * @return handle to cancel the task
     */
    Cancellable schedule(Runnable task, Duration delay);

    /**
     * Runs a task repeatedly, first after one period.
     *
     * @param task   the task
     * @param period time between runs
     * @return handle to cancel further runs
     */
    Cancellable scheduleAtFixedRate(Runnable task, Duration period);

    /**
     * Stops all timers.
     */
    @Override
    void close();

    /**
     * Handle of a scheduled task.
     */
    interface Cancellable {

        /**
         * Prevents further runs. Safe to call multiple times.
         */
        void cancel();

        /**
         * Returns whether {@link #cancel()} was called.
         *
         * @return true if cancelled
         */
        boolean isCancelled();
    }
}
