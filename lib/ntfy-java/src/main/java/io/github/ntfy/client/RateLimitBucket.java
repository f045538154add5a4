package io.github.ntfy.client;

import io.github.ntfy.client.errors.RateLimitedError;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed-window request counter for one scope.
 * <p>
 * At most {@code maxRequests} requests pass per window; the window starts with the
 * first request after the previous one ended. Rejected requests are not counted.
 */
public final class RateLimitBucket {

    private final String scope;
    private final int maxRequests;
    private final long windowMillis;
    private long windowStart;
    private int count;
    private boolean started;

    /**
     * Creates a bucket.
     *
     * @param scope       scope key, "global" or a normalized topic
     * @param maxRequests requests allowed per window
     * @param window      window length
     */
    public RateLimitBucket(String scope, int maxRequests, Duration window) {
        if (maxRequests <= 0) throw new IllegalArgumentException("maxRequests must be positive");
        Objects.requireNonNull(window, "window");
        if (window.isNegative() || window.isZero()) throw new IllegalArgumentException("window must be positive");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.maxRequests = maxRequests;
        this.windowMillis = window.toMillis();
    }

    /**
     * Counts one request at the given time.
     *
     * @param nowMillis current time in milliseconds
     * @throws RateLimitedError if the window is full
     */
    public synchronized void check(long nowMillis) {
        if (!started || nowMillis - windowStart >= windowMillis) {
            started = true;
            windowStart = nowMillis;
            count = 0;
        }
        if (count >= maxRequests) {
            long wait = Math.max(0, windowStart + windowMillis - nowMillis);
            throw new RateLimitedError(scope, Duration.ofMillis(wait));
        }
        count++;
    }

    /**
     * Returns how many more requests pass in the window active at the given time.
     *
     * @param nowMillis current time in milliseconds
     * @return remaining requests
     */
    public synchronized int remaining(long nowMillis) {
        if (!started || nowMillis - windowStart >= windowMillis) {
            return maxRequests;
        }
        return maxRequests - count;
    }

    public String getScope() {
        return scope;
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public Duration getWindow() {
        return Duration.ofMillis(windowMillis);
    }
}
