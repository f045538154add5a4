package io.github.ntfy.client;

import io.github.ntfy.client.errors.CapacityExceededError;
import io.github.ntfy.client.errors.ConnectionError;
import io.github.ntfy.client.errors.NotFoundError;
import io.github.ntfy.client.errors.ParseError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Owns the subscriptions of a client: enforces the subscription limit, tracks status
 * and counters, stops subscriptions after their timeout and forgets stopped ones after
 * a linger window.
 */
public final class SubscriptionRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private static final String ID_ALPHABET = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int ID_LENGTH = 12;

    private final ClientOptions options;
    private final StreamTransport transport;
    private final Scheduler scheduler;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Scheduler.Cancellable sweepTask;

    /**
     * Creates a registry and starts its periodic sweep.
     *
     * @param options   limits and timeouts
     * @param transport HTTP transport for the connections
     * @param scheduler timer facility
     * @param clock     wall clock for reported timestamps
     */
    public SubscriptionRegistry(ClientOptions options, StreamTransport transport, Scheduler scheduler, Clock clock) {
        this.options = options;
        this.transport = transport;
        this.scheduler = scheduler;
        this.clock = clock;
        this.sweepTask = scheduler.scheduleAtFixedRate(this::sweep, options.getSweepInterval());
    }

    /**
     * Registers and starts a subscription.
     *
     * @param topic    the topic, or several separated by commas
     * @param baseUrl  server URL without trailing slash
     * @param subOpts  filters and mode
     * @param handlers caller callbacks
     * @return the subscription id
     * @throws io.github.ntfy.client.errors.InvalidTopicError if the topic is malformed
     * @throws CapacityExceededError if the subscription limit is reached
     */
    public String create(String topic, String baseUrl, SubscriptionOptions subOpts, SubscriptionHandlers handlers) {
        Entry entry = register(topic, baseUrl, subOpts);
        start(entry, handlers);
        return entry.id;
    }

    Entry register(String topic, String baseUrl, SubscriptionOptions subOpts) {
        String validTopic = Topics.validate(topic);
        synchronized (this) {
            checkCapacity();
            Entry entry = new Entry(newId(), validTopic, baseUrl, subOpts, clock.instant(), scheduler.monotonicMillis());
            entries.put(entry.id, entry);
            return entry;
        }
    }

    // a record stopped before this point (by a concurrent close) is never started
    void start(Entry entry, SubscriptionHandlers handlers) {
        String id = entry.id;
        SubscriptionConnection connection = new SubscriptionConnection(id, entry.baseUrl, entry.topic, entry.options,
                track(id, handlers), options, transport, scheduler);
        synchronized (entry) {
            if (entry.stopped) {
                log.debug("subscription {} stopped before it started", id);
                return;
            }
            entry.connection = connection;
            entry.timeoutTimer = scheduler.schedule(() -> {
                log.info("subscription {} reached its timeout of {}ms", id, options.getSubscriptionTimeout().toMillis());
                stop(id);
            }, options.getSubscriptionTimeout());
        }
        connection.subscribe();
    }

    /**
     * Fails if no further subscription fits under the subscription limit.
     *
     * @throws CapacityExceededError if the limit is reached
     */
    public synchronized void checkCapacity() {
        if (activeCount() >= options.getMaxSubscriptions()) {
            throw new CapacityExceededError(options.getMaxSubscriptions());
        }
    }

    /**
     * Stops a subscription. It stays queryable as STOPPED until the linger window passes.
     *
     * @param id the subscription id
     * @return false if the id is unknown or already stopped
     */
    public boolean stop(String id) {
        Entry entry = entries.get(id);
        if (entry == null) {
            return false;
        }
        SubscriptionConnection connection;
        synchronized (entry) {
            if (entry.stopped) {
                return false;
            }
            entry.stopped = true;
            entry.status = SubscriptionStatus.STOPPED;
            entry.lastActivity = clock.instant();
            entry.lastActivityMillis = scheduler.monotonicMillis();
            if (entry.timeoutTimer != null) {
                entry.timeoutTimer.cancel();
                entry.timeoutTimer = null;
            }
            connection = entry.connection;
            entry.lingerTimer = scheduler.schedule(() -> forget(id, entry), options.getStoppedLinger());
        }
        if (connection != null) {
            connection.unsubscribe();
        }
        log.info("subscription {} to topic '{}' stopped", id, entry.topic);
        return true;
    }

    /**
     * Returns a snapshot of a subscription.
     *
     * @param id the subscription id
     * @return the snapshot
     * @throws NotFoundError if the id is unknown
     */
    public SubscriptionInfo get(String id) {
        Entry entry = entries.get(id);
        if (entry == null) {
            throw new NotFoundError(id);
        }
        return entry.snapshot();
    }

    /**
     * Returns snapshots of all known subscriptions, oldest first.
     *
     * @return the snapshots
     */
    public List<SubscriptionInfo> list() {
        List<SubscriptionInfo> result = new ArrayList<>();
        for (Entry entry : entries.values()) {
            result.add(entry.snapshot());
        }
        result.sort(Comparator.comparing(SubscriptionInfo::getCreatedAt).thenComparing(SubscriptionInfo::getId));
        return result;
    }

    /**
     * Returns the number of subscriptions counting against the limit.
     *
     * @return subscriptions in CONNECTING or ACTIVE
     */
    public int activeCount() {
        int count = 0;
        for (Entry entry : entries.values()) {
            synchronized (entry) {
                if (entry.status.isLive()) {
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * Stops subscriptions older or idler than the subscription timeout and drops
     * stopped ones that went stale. Runs periodically; callable directly.
     *
     * @return number of subscriptions stopped or dropped
     */
    public int sweep() {
        long now = scheduler.monotonicMillis();
        long timeout = options.getSubscriptionTimeout().toMillis();
        int swept = 0;
        for (Entry entry : entries.values()) {
            boolean stale;
            boolean alreadyStopped;
            synchronized (entry) {
                stale = now - entry.createdAtMillis > timeout || now - entry.lastActivityMillis > timeout;
                alreadyStopped = entry.stopped;
            }
            if (!stale) {
                continue;
            }
            if (alreadyStopped) {
                forget(entry.id, entry);
            } else {
                stop(entry.id);
            }
            swept++;
        }
        if (swept > 0) {
            log.info("swept {} stale subscriptions", swept);
        }
        return swept;
    }

    /**
     * Stops every subscription and the periodic sweep.
     */
    @Override
    public void close() {
        sweepTask.cancel();
        for (String id : new ArrayList<>(entries.keySet())) {
            stop(id);
        }
        for (Entry entry : entries.values()) {
            synchronized (entry) {
                if (entry.lingerTimer != null) {
                    entry.lingerTimer.cancel();
                }
            }
        }
        entries.clear();
    }

    private void forget(String id, Entry entry) {
        synchronized (entry) {
            if (entry.lingerTimer != null) {
                entry.lingerTimer.cancel();
                entry.lingerTimer = null;
            }
        }
        if (entries.remove(id, entry)) {
            log.debug("subscription {} removed", id);
        }
    }

    // wraps caller handlers so every event also updates the record
    private SubscriptionHandlers track(String id, SubscriptionHandlers caller) {
        return SubscriptionHandlers.builder()
                .onOpen(record -> {
                    update(id, entry -> entry.status = SubscriptionStatus.ACTIVE);
                    accept(caller.onOpen(), record);
                })
                .onMessage(record -> {
                    update(id, entry -> {
                        entry.status = SubscriptionStatus.ACTIVE;
                        entry.messageCount++;
                    });
                    accept(caller.onMessage(), record);
                })
                .onKeepalive(caller.onKeepalive())
                .onPollRequest(caller.onPollRequest())
                .onAnyMessage(record -> {
                    update(id, entry -> { });
                    accept(caller.onAnyMessage(), record);
                })
                .onError(error -> {
                    update(id, entry -> {
                        entry.errorMessage = error.getMessage();
                        if (error instanceof ParseError) {
                            return;
                        }
                        boolean retryable = error instanceof ConnectionError && ((ConnectionError) error).isRetryable();
                        entry.status = retryable ? SubscriptionStatus.CONNECTING : SubscriptionStatus.ERROR;
                    });
                    accept(caller.onError(), error);
                })
                .onClose(() -> {
                    update(id, entry -> entry.status = SubscriptionStatus.STOPPED);
                    // a finished poll is stopped like an explicit stop so it lingers and goes away
                    stop(id);
                    if (caller.onClose() != null) {
                        caller.onClose().run();
                    }
                })
                .build();
    }

    // events for a removed or stopped record are ignored
    private void update(String id, Consumer<Entry> change) {
        Entry entry = entries.get(id);
        if (entry == null) {
            return;
        }
        synchronized (entry) {
            if (entry.stopped) {
                return;
            }
            change.accept(entry);
            entry.lastActivity = clock.instant();
            entry.lastActivityMillis = scheduler.monotonicMillis();
        }
    }

    private static <T> void accept(Consumer<T> handler, T value) {
        if (handler != null) {
            handler.accept(value);
        }
    }

    // caller holds the registry monitor
    private String newId() {
        String id;
        do {
            StringBuilder sb = new StringBuilder(ID_LENGTH);
            for (int i = 0; i < ID_LENGTH; i++) {
                sb.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
            }
            id = sb.toString();
        } while (entries.containsKey(id));
        return id;
    }

    static final class Entry {
        final String id;
        final String topic;
        final String baseUrl;
        final SubscriptionOptions options;
        final Instant createdAt;
        final long createdAtMillis;

        // guarded by this
        SubscriptionStatus status = SubscriptionStatus.CONNECTING;
        Instant lastActivity;
        long lastActivityMillis;
        long messageCount;
        String errorMessage;
        boolean stopped;
        SubscriptionConnection connection;
        Scheduler.Cancellable timeoutTimer;
        Scheduler.Cancellable lingerTimer;

        Entry(String id, String topic, String baseUrl, SubscriptionOptions options, Instant createdAt, long createdAtMillis) {
            this.id = id;
            this.topic = topic;
            this.baseUrl = baseUrl;
            this.options = options;
            this.createdAt = createdAt;
            this.createdAtMillis = createdAtMillis;
            this.lastActivity = createdAt;
            this.lastActivityMillis = createdAtMillis;
        }

        synchronized SubscriptionInfo snapshot() {
            return new SubscriptionInfo(id, topic, baseUrl, status, createdAt, lastActivity,
                    messageCount, errorMessage, options);
        }
    }
}
