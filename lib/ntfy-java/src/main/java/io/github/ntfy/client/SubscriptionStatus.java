package io.github.ntfy.client;

/**
 * Status of a registered subscription.
 */
public enum SubscriptionStatus {
    /** Connecting or waiting to reconnect. */
    CONNECTING,
    /** Receiving records. */
    ACTIVE,
    /** Gave up after repeated failures. */
    ERROR,
    /** Stopped explicitly, by timeout, or because a poll finished. */
    STOPPED;

    /**
     * Returns whether the subscription counts against the subscription limit.
     *
     * @return true for CONNECTING and ACTIVE
     */
    public boolean isLive() {
        return this == CONNECTING || this == ACTIVE;
    }
}
