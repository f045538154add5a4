package io.github.ntfy.client;

import com.google.gson.annotations.SerializedName;

/**
 * Kinds of records sent on a topic stream.
 */
public enum EventType {
    @SerializedName("open")
    OPEN("open"),

    @SerializedName("message")
    MESSAGE("message"),

    @SerializedName("keepalive")
    KEEPALIVE("keepalive"),

    @SerializedName("poll_request")
    POLL_REQUEST("poll_request");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    /**
     * Returns the string value used on the wire.
     *
     * @return the event string value
     */
    public String getValue() {
        return value;
    }

    /**
     * Parses a wire value to EventType.
     *
     * @param value the string value
     * @return the corresponding EventType, or null if unknown
     */
    public static EventType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }
}
