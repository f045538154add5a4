package io.github.ntfy.client;

import io.github.ntfy.client.errors.ConnectionError;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Subscription that buffers notifications delivered by a registered connection.
 */
final class QueueSubscription implements Subscription {

    private final BlockingQueue<NotificationMessage> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final SubscriptionRegistry registry;
    private final String id;

    /**
     * Registers the subscription through {@code register}, which receives the handlers to use.
     */
    QueueSubscription(SubscriptionRegistry registry, Function<SubscriptionHandlers, String> register) {
        this.registry = registry;
        SubscriptionHandlers handlers = SubscriptionHandlers.builder()
                .onMessage(queue::add)
                .onError(error -> {
                    if (error instanceof ConnectionError && !((ConnectionError) error).isRetryable()) {
                        closed.set(true);
                    }
                })
                .onClose(() -> closed.set(true))
                .build();
        this.id = register.apply(handlers);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public Iterator<NotificationMessage> iterator() {
        return new Iterator<NotificationMessage>() {
            private NotificationMessage next = null;

            @Override
            public boolean hasNext() {
                if (next != null) {
                    return true;
                }
                if (closed.get() && queue.isEmpty()) {
                    return false;
                }
                try {
                    // poll with timeout to allow checking closed flag
                    while (!closed.get()) {
                        next = queue.poll(100, TimeUnit.MILLISECONDS);
                        if (next != null) {
                            return true;
                        }
                    }
                    // drain remaining queue after close
                    next = queue.poll();
                    return next != null;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }

            @Override
            public NotificationMessage next() {
                if (next == null && !hasNext()) {
                    throw new NoSuchElementException();
                }
                NotificationMessage result = next;
                next = null;
                return result;
            }
        };
    }

    @Override
    public void close() {
        closed.set(true);
        registry.stop(id);
    }
}
