package io.github.ntfy.client.errors;

/**
 * Thrown when a topic name is empty or contains control characters.
 */
public class InvalidTopicError extends NtfyException {

    private final String topic;

    /**
     * Creates a new InvalidTopicError.
     *
     * @param topic the rejected topic, may be null
     */
    public InvalidTopicError(String topic) {
        super("invalid topic name: " + (topic == null ? "<null>" : "'" + topic + "'"));
        this.topic = topic;
    }

    /**
     * Returns the rejected topic.
     *
     * @return the topic, may be null
     */
    public String getTopic() {
        return topic;
    }
}
