package io.github.ntfy.client;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * HTTP seam used by subscriptions, polling and publishing.
 */
public interface StreamTransport {

    /**
     * Opens a streaming GET request. Returns as soon as the response headers arrive.
     *
     * @param uri     the stream URL
     * @param headers request headers
     * @return the open response; the caller must close it
     * @throws IOException          on network failure
     * @throws InterruptedException if the calling thread is interrupted while connecting
     */
    StreamResponse openStream(URI uri, Map<String, String> headers) throws IOException, InterruptedException;

    /**
     * Sends a single request and reads the whole response.
     *
     * @param request the request
     * @return the response
     * @throws IOException          on network failure or timeout
     * @throws InterruptedException if the calling thread is interrupted
     */
    TransportResponse fetch(TransportRequest request) throws IOException, InterruptedException;

    /**
     * An open streaming response. Closing it aborts the transfer.
     */
    final class StreamResponse implements Closeable {
        private final int status;
        private final InputStream body;

        public StreamResponse(int status, InputStream body) {
            this.status = status;
            this.body = Objects.requireNonNull(body, "body");
        }

        public int status() {
            return status;
        }

        public InputStream body() {
            return body;
        }

        public boolean isSuccess() {
            return status >= 200 && status < 300;
        }

        @Override
        public void close() throws IOException {
            body.close();
        }
    }

    /**
     * A single request.
     */
    final class TransportRequest {
        private final String method;
        private final URI uri;
        private final Map<String, String> headers;
        private final byte[] body;
        private final Duration timeout;

        public TransportRequest(String method, URI uri, Map<String, String> headers, byte[] body, Duration timeout) {
            this.method = Objects.requireNonNull(method, "method");
            this.uri = Objects.requireNonNull(uri, "uri");
            this.headers = headers == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
            this.body = body;
            this.timeout = timeout;
        }

        public String method() {
            return method;
        }

        public URI uri() {
            return uri;
        }

        public Map<String, String> headers() {
            return headers;
        }

        public byte[] body() {
            return body;
        }

        public Duration timeout() {
            return timeout;
        }
    }

    /**
     * A fully read response.
     */
    final class TransportResponse {
        private final int status;
        private final byte[] body;

        public TransportResponse(int status, byte[] body) {
            this.status = status;
            this.body = body == null ? new byte[0] : body;
        }

        public int status() {
            return status;
        }

        public byte[] body() {
            return body;
        }

        public boolean isSuccess() {
            return status >= 200 && status < 300;
        }
    }
}
