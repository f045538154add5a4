package io.github.ntfy.client;

import java.util.List;

/**
 * Outcome of a poll: the messages not returned by earlier polls, and the updated cursor.
 */
public final class PollResult {

    private final String topic;
    private final List<NotificationMessage> messages;
    private final PollState state;
    private final long nextPollRecommended;

    PollResult(String topic, List<NotificationMessage> messages, PollState state, long nextPollRecommended) {
        this.topic = topic;
        this.messages = List.copyOf(messages);
        this.state = state;
        this.nextPollRecommended = nextPollRecommended;
    }

    public String getTopic() {
        return topic;
    }

    /**
     * Returns the new messages, oldest first.
     *
     * @return the messages
     */
    public List<NotificationMessage> getMessages() {
        return messages;
    }

    public int getNewMessageCount() {
        return messages.size();
    }

    /**
     * Returns the cursor after this poll.
     *
     * @return the poll state
     */
    public PollState getState() {
        return state;
    }

    /**
     * Returns when polling again is recommended.
     *
     * @return epoch milliseconds
     */
    public long getNextPollRecommended() {
        return nextPollRecommended;
    }

    @Override
    public String toString() {
        return "PollResult{" +
                "topic='" + topic + '\'' +
                ", newMessageCount=" + messages.size() +
                ", state=" + state +
                '}';
    }
}
