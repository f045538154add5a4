package io.github.ntfy.client;

import io.github.ntfy.client.errors.InvalidTopicError;

/**
 * Topic name validation shared by publishing and subscribing.
 */
public final class Topics {

    private Topics() {
    }

    /**
     * Checks whether a topic name is acceptable: non-blank and free of control characters.
     * Several topics may be joined with commas.
     *
     * @param topic the topic
     * @return true if valid
     */
    public static boolean isValid(String topic) {
        if (topic == null || topic.trim().isEmpty()) {
            return false;
        }
        for (int i = 0; i < topic.length(); i++) {
            if (Character.isISOControl(topic.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Validates a topic name.
     *
     * @param topic the topic
     * @return the topic, trimmed
     * @throws InvalidTopicError if the topic is not valid
     */
    public static String validate(String topic) {
        if (!isValid(topic)) {
            throw new InvalidTopicError(topic);
        }
        return topic.trim();
    }
}
