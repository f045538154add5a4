package io.github.ntfy.client;

import io.github.ntfy.client.errors.RateLimitedError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Client-side request rate limit with a global scope and one scope per topic.
 * <p>
 * Topic limits are stricter than the global one (half of it, at most 50) so a single
 * busy topic cannot use up the whole budget. Topic buckets are cached up to
 * {@link #MAX_CACHED_TOPICS}; the oldest inserted bucket is evicted first.
 */
public final class RateGovernor {

    /** scope key of the global bucket */
    public static final String GLOBAL_SCOPE = "global";

    /** maximum number of per-topic buckets kept */
    public static final int MAX_CACHED_TOPICS = 1000;

    private static final Logger log = LoggerFactory.getLogger(RateGovernor.class);

    private final Scheduler scheduler;
    private final Duration window;
    private final int topicLimit;
    private final RateLimitBucket global;
    private final Map<String, RateLimitBucket> topics;

    /**
     * Creates a governor.
     *
     * @param maxRequests global requests allowed per window
     * @param window      window length
     * @param scheduler   source of monotonic time for the windows
     */
    public RateGovernor(int maxRequests, Duration window, Scheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.window = Objects.requireNonNull(window, "window");
        this.global = new RateLimitBucket(GLOBAL_SCOPE, maxRequests, window);
        this.topicLimit = Math.max(1, Math.min(50, maxRequests / 2));
        this.topics = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, RateLimitBucket> eldest) {
                boolean evict = size() > MAX_CACHED_TOPICS;
                if (evict) {
                    log.debug("evicting rate limit bucket for topic {}", eldest.getKey());
                }
                return evict;
            }
        };
    }

    /**
     * Checks the global limit, then the limit of the topic.
     *
     * @param topic the topic the request targets
     * @throws RateLimitedError if either limit is exhausted
     */
    public void check(String topic) {
        checkGlobal();
        checkTopic(topic);
    }

    /**
     * Checks the global limit only.
     *
     * @throws RateLimitedError if the limit is exhausted
     */
    public void checkGlobal() {
        checkBucket(global);
    }

    /**
     * Checks the limit of one topic only.
     *
     * @param topic the topic
     * @throws RateLimitedError if the limit is exhausted
     */
    public void checkTopic(String topic) {
        checkBucket(bucketFor(topic));
    }

    /**
     * Returns the per-topic request limit.
     *
     * @return requests per window for each topic
     */
    public int getTopicLimit() {
        return topicLimit;
    }

    /**
     * Returns the number of cached topic buckets.
     *
     * @return bucket count
     */
    public synchronized int cachedTopicCount() {
        return topics.size();
    }

    /**
     * Checks whether a bucket for the topic is cached.
     *
     * @param topic the topic
     * @return true if cached
     */
    public synchronized boolean hasTopicBucket(String topic) {
        return topics.containsKey(normalize(topic));
    }

    static String normalize(String topic) {
        return topic == null ? "" : topic.trim().toLowerCase(Locale.ROOT);
    }

    private synchronized RateLimitBucket bucketFor(String topic) {
        return topics.computeIfAbsent(normalize(topic), key -> new RateLimitBucket(key, topicLimit, window));
    }

    private void checkBucket(RateLimitBucket bucket) {
        try {
            bucket.check(scheduler.monotonicMillis());
        } catch (RateLimitedError e) {
            log.warn("rate limit exceeded for scope {}, retry after {}ms", e.getScope(), e.getRetryAfter().toMillis());
            throw e;
        }
    }
}
