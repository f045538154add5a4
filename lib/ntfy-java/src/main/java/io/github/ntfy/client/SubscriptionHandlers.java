package io.github.ntfy.client;

import io.github.ntfy.client.errors.NtfyException;

import java.util.function.Consumer;

/**
 * Callbacks of a subscription. Every callback is optional.
 * <p>
 * Callbacks of one subscription run on its reader thread in wire order, except
 * {@code onError} for keepalive timeouts and {@code onClose} after {@code unsubscribe()},
 * which run on the thread that detected them. Exceptions thrown by a callback are
 * logged and ignored.
 */
public final class SubscriptionHandlers {

    private static final SubscriptionHandlers NONE = builder().build();

    private final Consumer<NotificationMessage> onOpen;
    private final Consumer<NotificationMessage> onMessage;
    private final Consumer<NotificationMessage> onKeepalive;
    private final Consumer<NotificationMessage> onPollRequest;
    private final Consumer<NotificationMessage> onAnyMessage;
    private final Consumer<NtfyException> onError;
    private final Runnable onClose;

    private SubscriptionHandlers(Builder builder) {
        this.onOpen = builder.onOpen;
        this.onMessage = builder.onMessage;
        this.onKeepalive = builder.onKeepalive;
        this.onPollRequest = builder.onPollRequest;
        this.onAnyMessage = builder.onAnyMessage;
        this.onError = builder.onError;
        this.onClose = builder.onClose;
    }

    /**
     * Creates a new builder.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns handlers that ignore every event.
     *
     * @return empty handlers
     */
    public static SubscriptionHandlers none() {
        return NONE;
    }

    Consumer<NotificationMessage> onOpen() {
        return onOpen;
    }

    Consumer<NotificationMessage> onMessage() {
        return onMessage;
    }

    Consumer<NotificationMessage> onKeepalive() {
        return onKeepalive;
    }

    Consumer<NotificationMessage> onPollRequest() {
        return onPollRequest;
    }

    Consumer<NotificationMessage> onAnyMessage() {
        return onAnyMessage;
    }

    Consumer<NtfyException> onError() {
        return onError;
    }

    Runnable onClose() {
        return onClose;
    }

    /**
     * Builder for SubscriptionHandlers.
     */
    public static final class Builder {
        private Consumer<NotificationMessage> onOpen;
        private Consumer<NotificationMessage> onMessage;
        private Consumer<NotificationMessage> onKeepalive;
        private Consumer<NotificationMessage> onPollRequest;
        private Consumer<NotificationMessage> onAnyMessage;
        private Consumer<NtfyException> onError;
        private Runnable onClose;

        private Builder() {
        }

        /**
         * Called when the server confirms the subscription.
         *
         * @param onOpen the callback
         * @return this builder
         */
        public Builder onOpen(Consumer<NotificationMessage> onOpen) {
            this.onOpen = onOpen;
            return this;
        }

        /**
         * Called for every notification.
         *
         * @param onMessage the callback
         * @return this builder
         */
        public Builder onMessage(Consumer<NotificationMessage> onMessage) {
            this.onMessage = onMessage;
            return this;
        }

        public Builder onKeepalive(Consumer<NotificationMessage> onKeepalive) {
            this.onKeepalive = onKeepalive;
            return this;
        }

        public Builder onPollRequest(Consumer<NotificationMessage> onPollRequest) {
            this.onPollRequest = onPollRequest;
            return this;
        }

        /**
         * Called for every record after the type-specific callback.
         *
         * @param onAnyMessage the callback
         * @return this builder
         */
        public Builder onAnyMessage(Consumer<NotificationMessage> onAnyMessage) {
            this.onAnyMessage = onAnyMessage;
            return this;
        }

        /**
         * Called for malformed records, connection failures and keepalive timeouts.
         * A non-retryable {@link io.github.ntfy.client.errors.ConnectionError} means
         * the subscription gave up.
         *
         * @param onError the callback
         * @return this builder
         */
        public Builder onError(Consumer<NtfyException> onError) {
            this.onError = onError;
            return this;
        }

        /**
         * Called once when the subscription ends normally or is unsubscribed.
         *
         * @param onClose the callback
         * @return this builder
         */
        public Builder onClose(Runnable onClose) {
            this.onClose = onClose;
            return this;
        }

        public SubscriptionHandlers build() {
            return new SubscriptionHandlers(this);
        }
    }
}
