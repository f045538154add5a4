package io.github.ntfy.client.errors;

/**
 * Thrown when the maximum number of concurrent subscriptions is reached.
 */
public class CapacityExceededError extends NtfyException {

    private final int limit;

    /**
     * Creates a new CapacityExceededError.
     *
     * @param limit the configured maximum
     */
    public CapacityExceededError(int limit) {
        super("maximum subscription limit reached (" + limit + "), stop existing subscriptions first");
        this.limit = limit;
    }

    /**
     * Returns the configured maximum.
     *
     * @return the limit
     */
    public int getLimit() {
        return limit;
    }
}
