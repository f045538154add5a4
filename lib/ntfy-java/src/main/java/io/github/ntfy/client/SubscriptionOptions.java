package io.github.ntfy.client;

import io.github.ntfy.client.errors.NtfyException;

import java.util.Objects;

/**
 * Filters and mode of a subscription or message fetch.
 * Use {@link #builder()} to create instances; {@link #defaults()} has no filters.
 */
public final class SubscriptionOptions {

    private static final SubscriptionOptions DEFAULTS = builder().build();

    private final boolean poll;
    private final String since;
    private final boolean scheduled;
    private final String id;
    private final String message;
    private final String title;
    private final String priority;
    private final String tags;
    private final String baseUrl;

    private SubscriptionOptions(Builder builder) {
        this.poll = builder.poll;
        this.since = builder.since;
        this.scheduled = builder.scheduled;
        this.id = builder.id;
        this.message = builder.message;
        this.title = builder.title;
        this.priority = builder.priority;
        this.tags = builder.tags;
        this.baseUrl = builder.baseUrl;
    }

    /**
     * Creates a new builder.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns options without filters, in streaming mode.
     *
     * @return default options
     */
    public static SubscriptionOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Returns a builder initialized with these options.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.poll = poll;
        builder.since = since;
        builder.scheduled = scheduled;
        builder.id = id;
        builder.message = message;
        builder.title = title;
        builder.priority = priority;
        builder.tags = tags;
        builder.baseUrl = baseUrl;
        return builder;
    }

    /**
     * Returns whether cached messages are fetched once instead of streaming.
     *
     * @return true in poll mode
     */
    public boolean isPoll() {
        return poll;
    }

    /**
     * Returns the start position: a message id, a unix timestamp, a duration like "10m", or "all".
     *
     * @return the since value, or null
     */
    public String getSince() {
        return since;
    }

    public boolean isScheduled() {
        return scheduled;
    }

    public String getId() {
        return id;
    }

    public String getMessage() {
        return message;
    }

    public String getTitle() {
        return title;
    }

    public String getPriority() {
        return priority;
    }

    public String getTags() {
        return tags;
    }

    /**
     * Returns the server URL overriding the client's base URL.
     *
     * @return the base URL, or null
     */
    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public String toString() {
        return "SubscriptionOptions{" +
                "poll=" + poll +
                ", since='" + since + '\'' +
                ", scheduled=" + scheduled +
                ", id='" + id + '\'' +
                ", message='" + message + '\'' +
                ", title='" + title + '\'' +
                ", priority='" + priority + '\'' +
                ", tags='" + tags + '\'' +
                ", baseUrl='" + baseUrl + '\'' +
                '}';
    }

    /**
     * Builder for SubscriptionOptions.
     */
    public static final class Builder {
        private boolean poll;
        private String since;
        private boolean scheduled;
        private String id;
        private String message;
        private String title;
        private String priority;
        private String tags;
        private String baseUrl;

        private Builder() {
        }

        /**
         * Fetches cached messages once and closes instead of streaming.
         *
         * @param poll true for poll mode
         * @return this builder
         */
        public Builder poll(boolean poll) {
            this.poll = poll;
            return this;
        }

        /**
         * Starts from a message id, unix timestamp, duration ("10m") or "all".
         *
         * @param since the start position
         * @return this builder
         */
        public Builder since(String since) {
            this.since = clean(since, "since");
            return this;
        }

        /**
         * Includes scheduled (delayed) messages.
         *
         * @param scheduled true to include them
         * @return this builder
         */
        public Builder scheduled(boolean scheduled) {
            this.scheduled = scheduled;
            return this;
        }

        public Builder id(String id) {
            this.id = clean(id, "id");
            return this;
        }

        public Builder message(String message) {
            this.message = clean(message, "message");
            return this;
        }

        public Builder title(String title) {
            this.title = clean(title, "title");
            return this;
        }

        /**
         * Filters by priority, a comma-separated list like "4,5" or "high,urgent".
         *
         * @param priority the priorities
         * @return this builder
         */
        public Builder priority(String priority) {
            this.priority = clean(priority, "priority");
            return this;
        }

        /**
         * Filters by tags, a comma-separated list; all tags must match.
         *
         * @param tags the tags
         * @return this builder
         */
        public Builder tags(String tags) {
            this.tags = clean(tags, "tags");
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = clean(baseUrl, "baseUrl");
            return this;
        }

        /**
         * Builds the options.
         *
         * @return the options
         */
        public SubscriptionOptions build() {
            return new SubscriptionOptions(this);
        }

        private static String clean(String value, String name) {
            if (value == null) {
                return null;
            }
            String trimmed = value.trim();
            if (trimmed.indexOf('\n') >= 0 || trimmed.indexOf('\r') >= 0) {
                throw new NtfyException(name + " cannot contain line breaks");
            }
            return trimmed.isEmpty() ? null : trimmed;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SubscriptionOptions that = (SubscriptionOptions) o;
        return poll == that.poll
                && scheduled == that.scheduled
                && Objects.equals(since, that.since)
                && Objects.equals(id, that.id)
                && Objects.equals(message, that.message)
                && Objects.equals(title, that.title)
                && Objects.equals(priority, that.priority)
                && Objects.equals(tags, that.tags)
                && Objects.equals(baseUrl, that.baseUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(poll, since, scheduled, id, message, title, priority, tags, baseUrl);
    }
}
