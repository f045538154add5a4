package io.github.ntfy.client.errors;

/**
 * Thrown when a network connection fails or the server answers with an unexpected status.
 * <p>
 * Streaming subscriptions reconnect after retryable connection errors. A non-retryable
 * instance is terminal: the subscription gave up.
 */
public class ConnectionError extends NtfyException {

    private final String url;
    private final boolean retryable;

    /**
     * Creates a new retryable ConnectionError.
     *
     * @param message the error message
     */
    public ConnectionError(String message) {
        this(message, null, null, true);
    }

    /**
     * Creates a new retryable ConnectionError with a cause.
     *
     * @param message the error message
     * @param cause   the underlying cause
     */
    public ConnectionError(String message, Throwable cause) {
        this(message, null, cause, true);
    }

    /**
     * Creates a new ConnectionError.
     *
     * @param message   the error message
     * @param url       the URL that failed, may be null
     * @param cause     the underlying cause, may be null
     * @param retryable whether the operation may be attempted again
     */
    public ConnectionError(String message, String url, Throwable cause, boolean retryable) {
        super(message, cause);
        this.url = url;
        this.retryable = retryable;
    }

    /**
     * Returns the URL that failed, or null if unknown.
     *
     * @return the url
     */
    public String getUrl() {
        return url;
    }

    /**
     * Returns whether the failed operation may be attempted again.
     *
     * @return true if retryable
     */
    public boolean isRetryable() {
        return retryable;
    }
}
