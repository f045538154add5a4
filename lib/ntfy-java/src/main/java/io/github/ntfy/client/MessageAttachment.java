package io.github.ntfy.client;

import java.util.Objects;

/**
 * Attachment descriptor of a notification.
 * Type, size and expiry are only present for files uploaded to the server.
 */
public final class MessageAttachment {

    private final String name;
    private final String url;
    private final String type;
    private final Long size;
    private final Long expires;

    /**
     * Creates a new attachment descriptor.
     *
     * @param name    file name
     * @param url     download URL
     * @param type    mime type, may be null
     * @param size    size in bytes, may be null
     * @param expires expiry as unix seconds, may be null
     */
    public MessageAttachment(String name, String url, String type, Long size, Long expires) {
        this.name = name;
        this.url = url;
        this.type = type;
        this.size = size;
        this.expires = expires;
    }

    public String getName() {
        return name;
    }

    public String getUrl() {
        return url;
    }

    public String getType() {
        return type;
    }

    public Long getSize() {
        return size;
    }

    public Long getExpires() {
        return expires;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MessageAttachment that = (MessageAttachment) o;
        return Objects.equals(name, that.name)
                && Objects.equals(url, that.url)
                && Objects.equals(type, that.type)
                && Objects.equals(size, that.size)
                && Objects.equals(expires, that.expires);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, url, type, size, expires);
    }

    @Override
    public String toString() {
        return "MessageAttachment{name='" + name + "', url='" + url + "'}";
    }
}
