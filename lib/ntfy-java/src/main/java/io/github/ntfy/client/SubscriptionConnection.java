package io.github.ntfy.client;

import io.github.ntfy.client.errors.ConnectionError;
import io.github.ntfy.client.errors.NtfyException;
import io.github.ntfy.client.errors.ParseError;
import io.github.ntfy.client.errors.TimeoutError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * One live HTTP stream of a topic, with keepalive supervision and reconnection.
 * <p>
 * The response body is read on a daemon thread named {@code ntfy-subscription-<id>};
 * records are dispatched to the handlers from that thread in wire order. Timers run on
 * the shared {@link Scheduler}.
 * <p>
 * Every connection attempt carries a generation number. Whatever ends an attempt
 * (unsubscribe, keepalive timeout, failure) bumps the generation first, so a reader
 * thread that wakes up late never touches the state of a newer attempt.
 */
public final class SubscriptionConnection {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionConnection.class);

    private static final int READ_BUFFER_SIZE = 8192;

    /**
     * Lifecycle of a connection.
     */
    public enum State {
        IDLE,
        CONNECTING,
        STREAMING,
        CLOSING,
        RECONNECT_PENDING
    }

    private final String id;
    private final String baseUrl;
    private final String topic;
    private final SubscriptionOptions options;
    private final SubscriptionHandlers handlers;
    private final StreamTransport transport;
    private final Scheduler scheduler;
    private final Map<String, String> headers;
    private final Duration keepaliveTimeout;
    private final Duration reconnectDelay;
    private final int maxReconnectAttempts;

    private final Object lock = new Object();

    // guarded by lock
    private State state = State.IDLE;
    private boolean stopped;
    private boolean closeReported;
    private int generation;
    private int attempts;
    private long lastActivityAt;
    private String lastDeliveredId;
    private StreamTransport.StreamResponse response;
    private Thread reader;
    private Scheduler.Cancellable keepaliveCheck;
    private Scheduler.Cancellable reconnectTimer;

    SubscriptionConnection(String id, String baseUrl, String topic, SubscriptionOptions options,
                           SubscriptionHandlers handlers, ClientOptions clientOptions,
                           StreamTransport transport, Scheduler scheduler) {
        this.id = id;
        this.baseUrl = baseUrl;
        this.topic = topic;
        this.options = options;
        this.handlers = handlers;
        this.transport = transport;
        this.scheduler = scheduler;
        this.headers = Requests.headers(clientOptions);
        this.keepaliveTimeout = clientOptions.getKeepaliveTimeout();
        this.reconnectDelay = clientOptions.getReconnectDelay();
        this.maxReconnectAttempts = clientOptions.getMaxReconnectAttempts();
    }

    /**
     * Opens the stream. Does nothing if the connection is already running.
     */
    public void subscribe() {
        synchronized (lock) {
            if (state != State.IDLE) {
                return;
            }
            stopped = false;
            closeReported = false;
            attempts = 0;
            lastDeliveredId = null;
            startAttempt();
        }
        log.info("subscription {} started for topic '{}'", id, topic);
    }

    /**
     * Closes the stream and cancels all timers. Safe to call repeatedly, while connecting,
     * and from inside a handler.
     *
     * @return true if this call stopped a running connection
     */
    public boolean unsubscribe() {
        StreamTransport.StreamResponse activeResponse;
        Thread activeReader;
        boolean fireClose;
        synchronized (lock) {
            if (state == State.IDLE || state == State.CLOSING) {
                return false;
            }
            stopped = true;
            generation++;
            state = State.CLOSING;
            cancelTimers();
            activeResponse = response;
            activeReader = reader;
            response = null;
            reader = null;
            fireClose = !closeReported;
            closeReported = true;
        }

        abort(activeResponse, activeReader);
        synchronized (lock) {
            if (state == State.CLOSING) {
                state = State.IDLE;
            }
        }
        log.info("subscription {} stopped", id);
        if (fireClose) {
            invoke(handlers.onClose());
        }
        return true;
    }

    /**
     * Returns the current state.
     *
     * @return the state
     */
    public State getState() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isStreaming() {
        return getState() == State.STREAMING;
    }

    String getId() {
        return id;
    }

    int getReconnectAttempts() {
        synchronized (lock) {
            return attempts;
        }
    }

    // caller holds lock
    private void startAttempt() {
        generation++;
        int attemptGeneration = generation;
        state = State.CONNECTING;
        lastActivityAt = scheduler.monotonicMillis();

        URI uri = Requests.jsonStreamUri(baseUrl, topic, options, lastDeliveredId);
        Thread thread = new Thread(() -> read(attemptGeneration, uri), "ntfy-subscription-" + id);
        thread.setDaemon(true);
        reader = thread;

        if (!options.isPoll()) {
            keepaliveCheck = scheduler.scheduleAtFixedRate(
                    () -> checkKeepalive(attemptGeneration), keepaliveTimeout.dividedBy(2));
        }
        thread.start();
    }

    private void read(int attemptGeneration, URI uri) {
        StreamTransport.StreamResponse opened = null;
        try {
            log.debug("subscription {} connecting to {}", id, uri);
            opened = transport.openStream(uri, headers);
            synchronized (lock) {
                if (attemptGeneration != generation) {
                    return;
                }
                response = opened;
            }
            if (!opened.isSuccess()) {
                throw new ConnectionError("unexpected status " + opened.status(), uri.toString(), null, true);
            }
            synchronized (lock) {
                if (attemptGeneration != generation) {
                    return;
                }
                state = State.STREAMING;
            }

            StreamDecoder decoder = new StreamDecoder(error -> parseFailed(attemptGeneration, error));
            InputStream body = opened.body();
            byte[] buffer = new byte[READ_BUFFER_SIZE];
            int n;
            while ((n = body.read(buffer)) != -1) {
                if (!deliverAll(attemptGeneration, decoder.feed(buffer, 0, n))) {
                    return;
                }
            }
            if (!deliverAll(attemptGeneration, decoder.finish())) {
                return;
            }
            endOfStream(attemptGeneration, uri);
        } catch (ConnectionError e) {
            failed(attemptGeneration, e);
        } catch (IOException e) {
            failed(attemptGeneration, new ConnectionError("connection failed: " + e.getMessage(), uri.toString(), e, true));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failed(attemptGeneration, new ConnectionError("connection interrupted", uri.toString(), e, true));
        } catch (RuntimeException e) {
            failed(attemptGeneration, new ConnectionError("connection failed: " + e, uri.toString(), e, true));
        } finally {
            closeQuietly(opened);
        }
    }

    private boolean deliverAll(int attemptGeneration, List<NotificationMessage> records) {
        for (NotificationMessage record : records) {
            synchronized (lock) {
                if (attemptGeneration != generation) {
                    return false;
                }
                lastActivityAt = scheduler.monotonicMillis();
                attempts = 0;
                if (record.isNotification()) {
                    lastDeliveredId = record.getId();
                }
            }
            dispatch(record);
        }
        synchronized (lock) {
            return attemptGeneration == generation;
        }
    }

    private void dispatch(NotificationMessage record) {
        log.debug("subscription {} received {} {}", id, record.getEvent().getValue(), record.getId());
        switch (record.getEvent()) {
            case OPEN:
                invoke(handlers.onOpen(), record);
                break;
            case MESSAGE:
                invoke(handlers.onMessage(), record);
                break;
            case KEEPALIVE:
                invoke(handlers.onKeepalive(), record);
                break;
            case POLL_REQUEST:
                invoke(handlers.onPollRequest(), record);
                break;
            default:
                break;
        }
        invoke(handlers.onAnyMessage(), record);
    }

    private void parseFailed(int attemptGeneration, ParseError error) {
        synchronized (lock) {
            if (attemptGeneration != generation) {
                return;
            }
            lastActivityAt = scheduler.monotonicMillis();
        }
        invoke(handlers.onError(), error);
    }

    private void checkKeepalive(int attemptGeneration) {
        synchronized (lock) {
            if (attemptGeneration != generation) {
                return;
            }
            if (scheduler.monotonicMillis() - lastActivityAt <= keepaliveTimeout.toMillis()) {
                return;
            }
        }
        log.warn("subscription {} received nothing for {}ms, reconnecting", id, keepaliveTimeout.toMillis());
        failed(attemptGeneration, new TimeoutError("keepalive timeout", keepaliveTimeout));
    }

    private void endOfStream(int attemptGeneration, URI uri) {
        if (!options.isPoll()) {
            failed(attemptGeneration, new ConnectionError("stream closed by server", uri.toString(), null, true));
            return;
        }
        boolean fireClose;
        synchronized (lock) {
            if (attemptGeneration != generation) {
                return;
            }
            generation++;
            cancelTimers();
            response = null;
            reader = null;
            state = State.IDLE;
            fireClose = !closeReported;
            closeReported = true;
        }
        log.info("subscription {} finished polling topic '{}'", id, topic);
        if (fireClose) {
            invoke(handlers.onClose());
        }
    }

    private void failed(int attemptGeneration, ConnectionError error) {
        StreamTransport.StreamResponse activeResponse;
        Thread activeReader;
        NtfyException reported = error;
        synchronized (lock) {
            if (attemptGeneration != generation || stopped) {
                return;
            }
            generation++;
            cancelTimers();
            activeResponse = response;
            activeReader = reader;
            response = null;
            reader = null;

            if (options.isPoll()) {
                state = State.IDLE;
                if (error.isRetryable()) {
                    reported = new ConnectionError(error.getMessage(), error.getUrl(), error, false);
                }
            } else if (attempts >= maxReconnectAttempts) {
                state = State.IDLE;
                reported = new ConnectionError("giving up after " + attempts + " reconnect attempts: "
                        + error.getMessage(), error.getUrl(), error, false);
            } else {
                attempts++;
                Duration delay = reconnectDelay.multipliedBy(attempts);
                state = State.RECONNECT_PENDING;
                reconnectTimer = scheduler.schedule(this::reconnect, delay);
                log.info("subscription {} failed ({}), reconnect {} of {} in {}ms",
                        id, error.getMessage(), attempts, maxReconnectAttempts, delay.toMillis());
            }
        }

        abort(activeResponse, activeReader);
        if (reported != error) {
            log.error("subscription {} to topic '{}' failed: {}", id, topic, reported.getMessage());
        }
        invoke(handlers.onError(), reported);
    }

    private void reconnect() {
        synchronized (lock) {
            if (stopped || state != State.RECONNECT_PENDING) {
                return;
            }
            reconnectTimer = null;
            startAttempt();
        }
    }

    // caller holds lock
    private void cancelTimers() {
        if (keepaliveCheck != null) {
            keepaliveCheck.cancel();
            keepaliveCheck = null;
        }
        if (reconnectTimer != null) {
            reconnectTimer.cancel();
            reconnectTimer = null;
        }
    }

    // closing the body unblocks a pending read; the interrupt covers a pending connect
    private static void abort(StreamTransport.StreamResponse activeResponse, Thread activeReader) {
        closeQuietly(activeResponse);
        if (activeReader != null && activeReader != Thread.currentThread()) {
            activeReader.interrupt();
        }
    }

    private static void closeQuietly(StreamTransport.StreamResponse activeResponse) {
        if (activeResponse == null) {
            return;
        }
        try {
            activeResponse.close();
        } catch (IOException e) {
            log.debug("failed to close stream response", e);
        }
    }

    private <T> void invoke(Consumer<T> handler, T value) {
        if (handler == null) {
            return;
        }
        try {
            handler.accept(value);
        } catch (RuntimeException e) {
            log.error("subscription {} handler failed", id, e);
        }
    }

    private void invoke(Runnable handler) {
        if (handler == null) {
            return;
        }
        try {
            handler.run();
        } catch (RuntimeException e) {
            log.error("subscription {} close handler failed", id, e);
        }
    }
}
