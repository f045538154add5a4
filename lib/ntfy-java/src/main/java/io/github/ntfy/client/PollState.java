package io.github.ntfy.client;

import java.util.Objects;

/**
 * Cursor of a polled topic. Instances are immutable.
 * <p>
 * {@code lastPollTime} is zero for a topic that has never completed a poll.
 */
public final class PollState {

    private final String topic;
    private final String lastMessageId;
    private final long lastPollTime;
    private final long totalMessagesSeen;
    private final long createdAt;
    private final long updatedAt;

    /**
     * Creates a poll state.
     *
     * @param topic             the topic
     * @param lastMessageId     id of the newest message seen, may be null
     * @param lastPollTime      end of the last poll in epoch milliseconds
     * @param totalMessagesSeen number of messages returned by all polls
     * @param createdAt         creation time in epoch milliseconds
     * @param updatedAt         last update in epoch milliseconds
     */
    public PollState(String topic, String lastMessageId, long lastPollTime, long totalMessagesSeen,
                     long createdAt, long updatedAt) {
        this.topic = topic;
        this.lastMessageId = lastMessageId;
        this.lastPollTime = lastPollTime;
        this.totalMessagesSeen = totalMessagesSeen;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    /**
     * Creates the state of a topic that has not been polled yet.
     *
     * @param topic the topic
     * @param now   current epoch milliseconds
     * @return the initial state
     */
    static PollState initial(String topic, long now) {
        return new PollState(topic, null, 0, 0, now, now);
    }

    PollState withUpdatedAt(long time) {
        return new PollState(topic, lastMessageId, lastPollTime, totalMessagesSeen, createdAt, time);
    }

    PollState afterPoll(String newestMessageId, int newMessages, long now) {
        String cursor = newestMessageId != null ? newestMessageId : lastMessageId;
        return new PollState(topic, cursor, Math.max(lastPollTime, now), totalMessagesSeen + newMessages, createdAt, now);
    }

    public String getTopic() {
        return topic;
    }

    public String getLastMessageId() {
        return lastMessageId;
    }

    public long getLastPollTime() {
        return lastPollTime;
    }

    public long getTotalMessagesSeen() {
        return totalMessagesSeen;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Returns whether a poll of this topic has completed before.
     *
     * @return true if polled
     */
    public boolean hasPolled() {
        return lastPollTime > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PollState that = (PollState) o;
        return lastPollTime == that.lastPollTime
                && totalMessagesSeen == that.totalMessagesSeen
                && createdAt == that.createdAt
                && updatedAt == that.updatedAt
                && Objects.equals(topic, that.topic)
                && Objects.equals(lastMessageId, that.lastMessageId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(topic, lastMessageId, lastPollTime, totalMessagesSeen, createdAt, updatedAt);
    }

    @Override
    public String toString() {
        return "PollState{" +
                "topic='" + topic + '\'' +
                ", lastMessageId='" + lastMessageId + '\'' +
                ", lastPollTime=" + lastPollTime +
                ", totalMessagesSeen=" + totalMessagesSeen +
                '}';
    }
}
