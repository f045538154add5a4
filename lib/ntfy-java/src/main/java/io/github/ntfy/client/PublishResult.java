package io.github.ntfy.client;

/**
 * Server acknowledgement of a published message.
 */
public final class PublishResult {

    private String id;
    private long time;
    private Long expires;
    private String topic;

    // for Gson
    private PublishResult() {
    }

    PublishResult(String id, long time, Long expires, String topic) {
        this.id = id;
        this.time = time;
        this.expires = expires;
        this.topic = topic;
    }

    /**
     * Returns the server-assigned message id.
     *
     * @return the id
     */
    public String getId() {
        return id;
    }

    /**
     * Returns when the server received the message.
     *
     * @return unix timestamp in seconds
     */
    public long getTime() {
        return time;
    }

    public Long getExpires() {
        return expires;
    }

    public String getTopic() {
        return topic;
    }

    @Override
    public String toString() {
        return "PublishResult{" +
                "id='" + id + '\'' +
                ", time=" + time +
                ", topic='" + topic + '\'' +
                '}';
    }
}
