package io.github.ntfy.client;

import java.util.Iterator;

/**
 * Topic stream consumed by iteration instead of callbacks.
 * <p>
 * Use with try-with-resources for automatic cleanup:
 * <pre>{@code
 * try (Subscription sub = client.stream("alerts")) {
 *     for (NotificationMessage message : sub) {
 *         System.out.println(message.getTitle() + ": " + message.getMessage());
 *     }
 * }
 * }</pre>
 * <p>
 * The stream reconnects after failures like any other subscription. Iteration ends
 * when the subscription is closed, gives up reconnecting, or finishes a poll.
 */
public interface Subscription extends AutoCloseable, Iterable<NotificationMessage> {

    /**
     * Returns the registry id of the underlying subscription.
     *
     * @return the subscription id
     */
    String getId();

    /**
     * Returns an iterator over notifications.
     * The iterator blocks waiting for new messages until the subscription ends.
     *
     * @return iterator over messages
     */
    @Override
    Iterator<NotificationMessage> iterator();

    /**
     * Stops the subscription. Safe to call multiple times.
     */
    @Override
    void close();
}
