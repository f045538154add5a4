package io.github.ntfy.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fetches cached messages of a topic, and polls a topic for messages not seen before.
 * <p>
 * A poll resumes after the newest message of the previous poll. Without a message
 * cursor it asks for messages since the previous poll time and drops anything at or
 * before that instant locally, since the server's time filter has one-second resolution.
 * <p>
 * Polls of one topic run one at a time. A reset that lands while a poll is in flight
 * wins: the poll's cursor is not stored.
 */
final class TopicPoller {

    private static final Logger log = LoggerFactory.getLogger(TopicPoller.class);

    private final PollStateStore store;
    private final RequestExecutor executor;
    private final Map<String, String> headers;
    private final int defaultLimit;
    private final Clock clock;
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    TopicPoller(PollStateStore store, RequestExecutor executor, ClientOptions options, Clock clock) {
        this.store = store;
        this.executor = executor;
        this.headers = Requests.headers(options);
        this.defaultLimit = options.getDefaultMessageLimit();
        this.clock = clock;
    }

    /**
     * Returns messages published since the previous poll of the topic and advances its cursor.
     *
     * @param topic   validated topic
     * @param baseUrl server URL without trailing slash
     * @param options poll options
     * @return the new messages and the cursor
     */
    PollResult poll(String topic, String baseUrl, PollOptions options) {
        synchronized (lockFor(topic)) {
            return pollLocked(topic, baseUrl, options);
        }
    }

    private PollResult pollLocked(String topic, String baseUrl, PollOptions options) {
        if (options.isResetState()) {
            store.reset(topic);
        }

        PollState previous = store.get(topic);
        PollState state = previous != null ? previous : PollState.initial(topic, clock.millis());

        String since = null;
        if (state.getLastMessageId() != null) {
            since = state.getLastMessageId();
        } else if (state.hasPolled()) {
            since = String.valueOf(state.getLastPollTime() / 1000);
        }
        // a topic without history gets the server's default window

        SubscriptionOptions query = SubscriptionOptions.builder().poll(true).since(since).build();
        List<NotificationMessage> fetched = fetchCached(topic, baseUrl, query);

        List<NotificationMessage> fresh = new ArrayList<>();
        int limit = options.getLimit() != null ? options.getLimit() : defaultLimit;
        boolean timeFiltered = state.getLastMessageId() == null && state.hasPolled();
        for (NotificationMessage message : fetched) {
            if (timeFiltered && message.getTime() * 1000 <= state.getLastPollTime()) {
                continue;
            }
            if (fresh.size() == limit) {
                break;
            }
            fresh.add(message);
        }

        long now = clock.millis();
        String newestId = fresh.isEmpty() ? null : fresh.get(fresh.size() - 1).getId();
        PollState updated = state.afterPoll(newestId, fresh.size(), now);
        if (store.replace(topic, previous, updated)) {
            log.info("polled topic '{}': {} new messages, {} seen in total",
                    topic, fresh.size(), updated.getTotalMessagesSeen());
        } else {
            log.info("polled topic '{}': {} new messages, cursor discarded after a reset", topic, fresh.size());
        }
        return new PollResult(topic, fresh, updated, now + options.getInterval().toMillis());
    }

    private Object lockFor(String topic) {
        return locks.computeIfAbsent(topic, key -> new Object());
    }

    /**
     * Fetches the cached message events of a topic in server order.
     *
     * @param topic   validated topic
     * @param baseUrl server URL without trailing slash
     * @param query   filters; poll mode is implied
     * @return message events, oldest first
     */
    List<NotificationMessage> fetchCached(String topic, String baseUrl, SubscriptionOptions query) {
        SubscriptionOptions pollQuery = query.isPoll() ? query : query.toBuilder().poll(true).build();
        URI uri = Requests.jsonStreamUri(baseUrl, topic, pollQuery, null);
        byte[] body = executor.execute("GET", uri, headers, null, topic);

        StreamDecoder decoder = new StreamDecoder(error -> log.warn("skipping malformed record from topic '{}': {}",
                topic, error.getMessage()));
        List<NotificationMessage> records = new ArrayList<>(decoder.feed(body));
        records.addAll(decoder.finish());

        List<NotificationMessage> messages = new ArrayList<>();
        for (NotificationMessage record : records) {
            if (record.isNotification()) {
                messages.add(record);
            }
        }
        log.debug("fetched {} messages from topic '{}'", messages.size(), topic);
        return messages;
    }
}
