package io.github.ntfy.client;

import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of a registered subscription. Instances are immutable; query the client
 * again for fresh values.
 */
public final class SubscriptionInfo {

    private final String id;
    private final String topic;
    private final String baseUrl;
    private final SubscriptionStatus status;
    private final Instant createdAt;
    private final Instant lastActivity;
    private final long messageCount;
    private final String errorMessage;
    private final SubscriptionOptions options;

    SubscriptionInfo(String id, String topic, String baseUrl, SubscriptionStatus status, Instant createdAt,
                     Instant lastActivity, long messageCount, String errorMessage, SubscriptionOptions options) {
        this.id = id;
        this.topic = topic;
        this.baseUrl = baseUrl;
        this.status = status;
        this.createdAt = createdAt;
        this.lastActivity = lastActivity;
        this.messageCount = messageCount;
        this.errorMessage = errorMessage;
        this.options = options;
    }

    public String getId() {
        return id;
    }

    public String getTopic() {
        return topic;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public SubscriptionStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Returns when the last record or status change was seen.
     *
     * @return the time of the last activity
     */
    public Instant getLastActivity() {
        return lastActivity;
    }

    /**
     * Returns the number of notifications received so far.
     *
     * @return the message count
     */
    public long getMessageCount() {
        return messageCount;
    }

    /**
     * Returns the most recent error.
     *
     * @return the error message, or null
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    public SubscriptionOptions getOptions() {
        return options;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SubscriptionInfo that = (SubscriptionInfo) o;
        return messageCount == that.messageCount
                && Objects.equals(id, that.id)
                && Objects.equals(topic, that.topic)
                && Objects.equals(baseUrl, that.baseUrl)
                && status == that.status
                && Objects.equals(createdAt, that.createdAt)
                && Objects.equals(lastActivity, that.lastActivity)
                && Objects.equals(errorMessage, that.errorMessage)
                && Objects.equals(options, that.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, topic, baseUrl, status, createdAt, lastActivity, messageCount, errorMessage, options);
    }

    @Override
    public String toString() {
        return "SubscriptionInfo{" +
                "id='" + id + '\'' +
                ", topic='" + topic + '\'' +
                ", status=" + status +
                ", messageCount=" + messageCount +
                ", errorMessage='" + errorMessage + '\'' +
                '}';
    }
}
