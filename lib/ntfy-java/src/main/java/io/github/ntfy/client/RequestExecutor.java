package io.github.ntfy.client;

import io.github.ntfy.client.errors.ConnectionError;
import io.github.ntfy.client.errors.ForbiddenError;
import io.github.ntfy.client.errors.NotFoundError;
import io.github.ntfy.client.errors.TimeoutError;
import io.github.ntfy.client.errors.UnauthorizedError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Sends one-shot requests with retries. Connection failures are retried with
 * exponential backoff; HTTP status errors are not.
 */
final class RequestExecutor {

    private static final Logger log = LoggerFactory.getLogger(RequestExecutor.class);

    private static final long MAX_BACKOFF_MILLIS = 30_000;
    private static final int MAX_ERROR_BODY = 200;

    private final StreamTransport transport;
    private final ClientOptions options;

    RequestExecutor(StreamTransport transport, ClientOptions options) {
        this.transport = transport;
        this.options = options;
    }

    /**
     * Sends a request, retrying connection failures.
     *
     * @param method  HTTP method
     * @param uri     target URL
     * @param headers request headers
     * @param body    request body, may be null
     * @param topic   topic named in 403/404 errors
     * @return the response body
     */
    byte[] execute(String method, URI uri, Map<String, String> headers, byte[] body, String topic) {
        int attempts = options.getRetries() + 1;
        ConnectionError lastError = null;

        for (int attempt = 0; attempt < attempts; attempt++) {
            try {
                return executeOnce(method, uri, headers, body, topic);
            } catch (ConnectionError e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                lastError = e;
                if (attempt < attempts - 1) {
                    Duration backoff = calculateBackoff(attempt);
                    log.debug("{} {} failed ({}), retrying in {}ms", method, uri, e.getMessage(), backoff.toMillis());
                    sleep(backoff);
                }
            }
        }

        throw lastError;
    }

    private byte[] executeOnce(String method, URI uri, Map<String, String> headers, byte[] body, String topic) {
        StreamTransport.TransportResponse response;
        try {
            response = transport.fetch(new StreamTransport.TransportRequest(method, uri, headers, body, options.getTimeout()));
        } catch (HttpTimeoutException e) {
            TimeoutError error = new TimeoutError("request timeout", options.getTimeout());
            error.initCause(e);
            throw error;
        } catch (IOException e) {
            throw new ConnectionError("connection failed: " + e.getMessage(), uri.toString(), e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionError("request interrupted", uri.toString(), e, false);
        }

        int status = response.status();
        if (response.isSuccess()) {
            return response.body();
        }
        switch (status) {
            case 401:
                throw new UnauthorizedError();
            case 403:
                throw new ForbiddenError(topic);
            case 404:
                throw new NotFoundError(topic);
            default:
                String errorBody = new String(response.body(), StandardCharsets.UTF_8).trim();
                if (errorBody.length() > MAX_ERROR_BODY) {
                    errorBody = errorBody.substring(0, MAX_ERROR_BODY) + "...";
                }
                throw new ConnectionError("HTTP " + status + ": " + errorBody, uri.toString(), null, false);
        }
    }

    Duration calculateBackoff(int attempt) {
        // exponential backoff: delay * 2^attempt
        long baseMs = options.getRetryDelay().toMillis();
        long backoffMs = baseMs * (1L << Math.min(attempt, 20));
        return Duration.ofMillis(Math.min(backoffMs, MAX_BACKOFF_MILLIS));
    }

    private static void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionError("interrupted while waiting to retry", null, e, false);
        }
    }
}
