package io.github.ntfy.client.errors;

import java.time.Duration;

/**
 * Thrown when a connection shows no activity within the keepalive timeout,
 * or a request does not complete in time.
 */
public class TimeoutError extends ConnectionError {

    private final Duration timeout;

    /**
     * Creates a new TimeoutError.
     *
     * @param message the error message
     * @param timeout the timeout that elapsed
     */
    public TimeoutError(String message, Duration timeout) {
        super(message + " (" + timeout.toMillis() + "ms)");
        this.timeout = timeout;
    }

    /**
     * Returns the timeout that elapsed.
     *
     * @return the timeout
     */
    public Duration getTimeout() {
        return timeout;
    }
}
