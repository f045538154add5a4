package io.github.ntfy.client;

import io.github.ntfy.client.errors.NtfyException;

import java.time.Duration;

/**
 * Options of a single poll.
 */
public final class PollOptions {

    /** Largest accepted message limit. */
    public static final int MAX_LIMIT = 1000;

    /** Default hint for the next poll. */
    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

    private static final Duration MIN_INTERVAL = Duration.ofSeconds(1);
    private static final Duration MAX_INTERVAL = Duration.ofHours(1);

    private static final PollOptions DEFAULTS = builder().build();

    private final boolean resetState;
    private final Integer limit;
    private final Duration interval;
    private final String baseUrl;

    private PollOptions(Builder builder) {
        this.resetState = builder.resetState;
        this.limit = builder.limit;
        this.interval = builder.interval;
        this.baseUrl = builder.baseUrl;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PollOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Returns whether the topic's cursor is discarded before polling.
     *
     * @return true to start over
     */
    public boolean isResetState() {
        return resetState;
    }

    /**
     * Returns the maximum number of new messages.
     *
     * @return the limit, or null for the client default
     */
    public Integer getLimit() {
        return limit;
    }

    public Duration getInterval() {
        return interval;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Builder for PollOptions.
     */
    public static final class Builder {
        private boolean resetState;
        private Integer limit;
        private Duration interval = DEFAULT_INTERVAL;
        private String baseUrl;

        private Builder() {
        }

        public Builder resetState(boolean resetState) {
            this.resetState = resetState;
            return this;
        }

        /**
         * Sets the maximum number of new messages, 1 to 1000.
         *
         * @param limit the limit
         * @return this builder
         */
        public Builder limit(int limit) {
            if (limit < 1 || limit > MAX_LIMIT) {
                throw new NtfyException("limit must be between 1 and " + MAX_LIMIT);
            }
            this.limit = limit;
            return this;
        }

        /**
         * Sets the hint for the next poll, 1 second to 1 hour.
         *
         * @param interval the interval
         * @return this builder
         */
        public Builder interval(Duration interval) {
            if (interval == null || interval.compareTo(MIN_INTERVAL) < 0 || interval.compareTo(MAX_INTERVAL) > 0) {
                throw new NtfyException("interval must be between 1s and 1h");
            }
            this.interval = interval;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl == null || baseUrl.trim().isEmpty() ? null : baseUrl.trim();
            return this;
        }

        public PollOptions build() {
            return new PollOptions(this);
        }
    }
}
