package io.github.ntfy.client;

import java.util.List;

/**
 * Cached messages of a topic.
 */
public final class MessagesResult {

    private final String topic;
    private final List<NotificationMessage> messages;
    private final int limit;
    private final boolean hasMore;

    MessagesResult(String topic, List<NotificationMessage> messages, int limit, boolean hasMore) {
        this.topic = topic;
        this.messages = List.copyOf(messages);
        this.limit = limit;
        this.hasMore = hasMore;
    }

    public String getTopic() {
        return topic;
    }

    /**
     * Returns the messages, oldest first.
     *
     * @return the messages
     */
    public List<NotificationMessage> getMessages() {
        return messages;
    }

    public int getLimit() {
        return limit;
    }

    /**
     * Returns whether the server had more messages than the limit allowed.
     *
     * @return true if messages were left out
     */
    public boolean hasMore() {
        return hasMore;
    }
}
