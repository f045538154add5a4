package io.github.ntfy.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Poll cursors per topic, expiring after a TTL without updates.
 * <p>
 * Expiry runs on the scheduler's monotonic time; the wall clock only stamps the
 * timestamps reported in {@link PollState}.
 */
public final class PollStateStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PollStateStore.class);

    private final Map<String, Stored> states = new ConcurrentHashMap<>();
    private final long ttlMillis;
    private final Scheduler scheduler;
    private final Clock clock;
    private final Scheduler.Cancellable sweepTask;

    /**
     * Creates a store and starts its periodic sweep.
     *
     * @param ttl           lifetime of a state after its last update
     * @param sweepInterval time between sweeps
     * @param scheduler     timer facility and monotonic time for expiry
     * @param clock         wall clock for timestamps
     */
    public PollStateStore(Duration ttl, Duration sweepInterval, Scheduler scheduler, Clock clock) {
        this.ttlMillis = ttl.toMillis();
        this.scheduler = scheduler;
        this.clock = clock;
        this.sweepTask = scheduler.scheduleAtFixedRate(this::sweepExpired, sweepInterval);
    }

    /**
     * Returns the state of a topic. An expired state is removed and not returned.
     *
     * @param topic the topic
     * @return the state, or null if absent or expired
     */
    public PollState get(String topic) {
        Stored stored = states.get(topic);
        if (stored == null) {
            return null;
        }
        if (isExpired(stored, scheduler.monotonicMillis())) {
            states.remove(topic, stored);
            return null;
        }
        return stored.state;
    }

    /**
     * Stores the state of a topic, stamping its update time.
     *
     * @param topic the topic
     * @param state the state
     */
    public void set(String topic, PollState state) {
        states.put(topic, stamp(state));
    }

    /**
     * Replaces the state of a topic only if it is still the one a poll started from.
     * A state reset or expired in the meantime stays gone.
     *
     * @param topic    the topic
     * @param expected the state read before the poll, null for a first poll
     * @param updated  the state after the poll
     * @return true if the update was stored
     */
    boolean replace(String topic, PollState expected, PollState updated) {
        boolean[] stored = new boolean[1];
        states.compute(topic, (key, current) -> {
            PollState currentState = current == null ? null : current.state;
            if (currentState != expected) {
                return current;
            }
            stored[0] = true;
            return stamp(updated);
        });
        return stored[0];
    }

    /**
     * Forgets a topic, so its next poll behaves like the first one.
     *
     * @param topic the topic
     * @return true if a state was removed
     */
    public boolean reset(String topic) {
        boolean removed = states.remove(topic) != null;
        if (removed) {
            log.info("poll state reset for topic '{}'", topic);
        }
        return removed;
    }

    /**
     * Removes every expired state.
     *
     * @return number of states removed
     */
    public int sweepExpired() {
        long now = scheduler.monotonicMillis();
        int removed = 0;
        for (Map.Entry<String, Stored> entry : states.entrySet()) {
            if (isExpired(entry.getValue(), now) && states.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("removed {} expired poll states", removed);
        }
        return removed;
    }

    /**
     * Returns a sorted copy of all states for monitoring.
     *
     * @return states by topic
     */
    public Map<String, PollState> snapshot() {
        Map<String, PollState> copy = new TreeMap<>();
        for (Map.Entry<String, Stored> entry : states.entrySet()) {
            copy.put(entry.getKey(), entry.getValue().state);
        }
        return Collections.unmodifiableMap(copy);
    }

    public int size() {
        return states.size();
    }

    /**
     * Stops the periodic sweep.
     */
    @Override
    public void close() {
        sweepTask.cancel();
    }

    private Stored stamp(PollState state) {
        return new Stored(state.withUpdatedAt(clock.millis()), scheduler.monotonicMillis());
    }

    private boolean isExpired(Stored stored, long now) {
        return now - stored.touchedAt > ttlMillis;
    }

    private static final class Stored {
        final PollState state;
        final long touchedAt;

        Stored(PollState state, long touchedAt) {
            this.state = state;
            this.touchedAt = touchedAt;
        }
    }
}
