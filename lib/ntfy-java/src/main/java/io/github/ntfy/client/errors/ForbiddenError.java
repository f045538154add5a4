package io.github.ntfy.client.errors;

/**
 * Thrown when access is denied (HTTP 403).
 */
public class ForbiddenError extends NtfyException {

    private final String topic;

    /**
     * Creates a new ForbiddenError.
     *
     * @param topic the topic that access was denied to
     */
    public ForbiddenError(String topic) {
        super("forbidden: access denied for topic: " + topic);
        this.topic = topic;
    }

    /**
     * Returns the topic that access was denied to.
     *
     * @return the topic
     */
    public String getTopic() {
        return topic;
    }
}
