package io.github.ntfy.client;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Record received from a topic stream or poll.
 * <p>
 * Every record carries an id, a unix timestamp, an event type and a topic.
 * Message records additionally carry the notification content.
 * Instances are immutable.
 */
public final class NotificationMessage {

    private final String id;
    private final long time;
    private final Long expires;
    private final EventType event;
    private final String topic;
    private final String message;
    private final String title;
    private final List<String> tags;
    private final Integer priority;
    private final String click;
    private final List<MessageAction> actions;
    private final MessageAttachment attachment;

    /**
     * Creates a new notification message.
     *
     * @param id         message identifier
     * @param time       message time as unix seconds
     * @param expires    deletion time as unix seconds, may be null
     * @param event      event type
     * @param topic      topic (comma-separated when subscribed to several)
     * @param message    message body, may be null for non-message events
     * @param title      title, may be null
     * @param tags       tags, may be null
     * @param priority   priority 1 (min) to 5 (max), may be null
     * @param click      URL opened when the notification is clicked, may be null
     * @param actions    action buttons, may be null
     * @param attachment attachment descriptor, may be null
     */
    public NotificationMessage(String id, long time, Long expires, EventType event, String topic,
                               String message, String title, List<String> tags, Integer priority,
                               String click, List<MessageAction> actions, MessageAttachment attachment) {
        this.id = id;
        this.time = time;
        this.expires = expires;
        this.event = event;
        this.topic = topic;
        this.message = message;
        this.title = title;
        this.tags = tags == null ? null : List.copyOf(tags);
        this.priority = priority;
        this.click = click;
        this.actions = actions == null ? null : List.copyOf(actions);
        this.attachment = attachment;
    }

    /**
     * Creates a record without notification content (open, keepalive, poll_request).
     *
     * @param id    message identifier
     * @param time  message time as unix seconds
     * @param event event type
     * @param topic topic
     * @return the record
     */
    public static NotificationMessage of(String id, long time, EventType event, String topic) {
        return new NotificationMessage(id, time, null, event, topic, null, null, null, null, null, null, null);
    }

    /**
     * Returns the message identifier.
     *
     * @return the id
     */
    public String getId() {
        return id;
    }

    /**
     * Returns the message time.
     *
     * @return unix timestamp in seconds
     */
    public long getTime() {
        return time;
    }

    /**
     * Returns when the server deletes the message.
     *
     * @return unix timestamp in seconds, or null
     */
    public Long getExpires() {
        return expires;
    }

    /**
     * Returns the event type.
     *
     * @return the event
     */
    public EventType getEvent() {
        return event;
    }

    /**
     * Returns the topic.
     *
     * @return the topic
     */
    public String getTopic() {
        return topic;
    }

    /**
     * Returns the message body.
     *
     * @return the body, or null for non-message events
     */
    public String getMessage() {
        return message;
    }

    /**
     * Returns the title.
     *
     * @return the title, or null
     */
    public String getTitle() {
        return title;
    }

    /**
     * Returns the tags.
     *
     * @return the tags, never null
     */
    public List<String> getTags() {
        return tags == null ? Collections.emptyList() : Collections.unmodifiableList(tags);
    }

    /**
     * Returns the priority.
     *
     * @return 1 (min) to 5 (max), or null when not set (server default 3)
     */
    public Integer getPriority() {
        return priority;
    }

    /**
     * Returns the URL opened when the notification is clicked.
     *
     * @return the click URL, or null
     */
    public String getClick() {
        return click;
    }

    /**
     * Returns the action buttons.
     *
     * @return the actions, never null
     */
    public List<MessageAction> getActions() {
        return actions == null ? Collections.emptyList() : Collections.unmodifiableList(actions);
    }

    /**
     * Returns the attachment descriptor.
     *
     * @return the attachment, or null
     */
    public MessageAttachment getAttachment() {
        return attachment;
    }

    /**
     * Checks whether this is a notification (as opposed to a control record).
     *
     * @return true for message events
     */
    public boolean isNotification() {
        return event == EventType.MESSAGE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NotificationMessage that = (NotificationMessage) o;
        return time == that.time
                && Objects.equals(id, that.id)
                && Objects.equals(expires, that.expires)
                && event == that.event
                && Objects.equals(topic, that.topic)
                && Objects.equals(message, that.message)
                && Objects.equals(title, that.title)
                && Objects.equals(tags, that.tags)
                && Objects.equals(priority, that.priority)
                && Objects.equals(click, that.click)
                && Objects.equals(actions, that.actions)
                && Objects.equals(attachment, that.attachment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, time, expires, event, topic, message, title, tags, priority, click, actions, attachment);
    }

    @Override
    public String toString() {
        return "NotificationMessage{" +
                "id='" + id + '\'' +
                ", time=" + time +
                ", event=" + event +
                ", topic='" + topic + '\'' +
                ", title='" + title + '\'' +
                '}';
    }
}
