package io.github.ntfy.client.errors;

import java.time.Duration;

/**
 * Thrown when the client-side rate limit rejects a request.
 * The request is never queued or retried by the client.
 */
public class RateLimitedError extends NtfyException {

    private final String scope;
    private final Duration retryAfter;

    /**
     * Creates a new RateLimitedError.
     *
     * @param scope      the limited scope: "global" or a normalized topic
     * @param retryAfter time until the current window ends
     */
    public RateLimitedError(String scope, Duration retryAfter) {
        super(messageFor(scope, retryAfter));
        this.scope = scope;
        this.retryAfter = retryAfter;
    }

    /**
     * Returns the limited scope.
     *
     * @return "global" or the normalized topic
     */
    public String getScope() {
        return scope;
    }

    /**
     * Returns the time until the current window ends.
     *
     * @return the wait time
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }

    private static String messageFor(String scope, Duration retryAfter) {
        long seconds = (retryAfter.toMillis() + 999) / 1000;
        if ("global".equals(scope)) {
            return "global rate limit exceeded, try again in " + seconds + " seconds";
        }
        return "rate limit exceeded for topic '" + scope + "', try again in " + seconds + " seconds";
    }
}
