package io.github.ntfy.client;

import io.github.ntfy.client.errors.NtfyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration options for the ntfy client.
 * Use {@link #builder()} or {@link #fromEnvironment(Map)} to create instances.
 */
public final class ClientOptions {

    /** default timeout for HTTP requests */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /** default number of retries for one-shot requests */
    public static final int DEFAULT_RETRIES = 3;

    /** default delay between retries */
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(100);

    /** how long a stream may stay silent before it is considered dead */
    public static final Duration DEFAULT_KEEPALIVE_TIMEOUT = Duration.ofSeconds(120);

    /** base delay of the linear reconnect backoff */
    public static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(5);

    /** default reconnect attempts before a subscription gives up */
    public static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = 5;

    /** default maximum of concurrent subscriptions */
    public static final int DEFAULT_MAX_SUBSCRIPTIONS = 10;

    /** default hard lifetime of a subscription */
    public static final Duration DEFAULT_SUBSCRIPTION_TIMEOUT = Duration.ofMinutes(5);

    /** default time a stopped subscription stays queryable */
    public static final Duration DEFAULT_STOPPED_LINGER = Duration.ofMinutes(1);

    /** default interval of registry and poll state sweeps */
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(5);

    /** default lifetime of an unused poll cursor */
    public static final Duration DEFAULT_POLL_STATE_TTL = Duration.ofHours(1);

    /** default number of messages returned by one poll or fetch */
    public static final int DEFAULT_MESSAGE_LIMIT = 100;

    /** default rate limit window */
    public static final Duration DEFAULT_RATE_LIMIT_WINDOW = Duration.ofMinutes(1);

    /** default requests allowed per rate limit window */
    public static final int DEFAULT_RATE_LIMIT_MAX_REQUESTS = 100;

    /** default maximum published message size in bytes */
    public static final int DEFAULT_MAX_MESSAGE_SIZE = 4096;

    /** default User-Agent header */
    public static final String DEFAULT_USER_AGENT = "ntfy-java/1.0.0";

    private static final Logger log = LoggerFactory.getLogger(ClientOptions.class);

    private final String token;
    private final String username;
    private final String password;
    private final Map<String, String> headers;
    private final String userAgent;
    private final Duration timeout;
    private final int retries;
    private final Duration retryDelay;
    private final Duration keepaliveTimeout;
    private final Duration reconnectDelay;
    private final int maxReconnectAttempts;
    private final int maxSubscriptions;
    private final Duration subscriptionTimeout;
    private final Duration stoppedLinger;
    private final Duration sweepInterval;
    private final Duration pollStateTtl;
    private final int defaultMessageLimit;
    private final Duration rateLimitWindow;
    private final int rateLimitMaxRequests;
    private final int maxMessageSize;

    private ClientOptions(Builder builder) {
        this.token = builder.token;
        this.username = builder.username;
        this.password = builder.password;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.userAgent = builder.userAgent;
        this.timeout = builder.timeout;
        this.retries = builder.retries;
        this.retryDelay = builder.retryDelay;
        this.keepaliveTimeout = builder.keepaliveTimeout;
        this.reconnectDelay = builder.reconnectDelay;
        this.maxReconnectAttempts = builder.maxReconnectAttempts;
        this.maxSubscriptions = builder.maxSubscriptions;
        this.subscriptionTimeout = builder.subscriptionTimeout;
        this.stoppedLinger = builder.stoppedLinger;
        this.sweepInterval = builder.sweepInterval;
        this.pollStateTtl = builder.pollStateTtl;
        this.defaultMessageLimit = builder.defaultMessageLimit;
        this.rateLimitWindow = builder.rateLimitWindow;
        this.rateLimitMaxRequests = builder.rateLimitMaxRequests;
        this.maxMessageSize = builder.maxMessageSize;
    }

    /**
     * Creates a new builder for ClientOptions.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates options from environment variables.
     * <p>
     * Durations are given in milliseconds. Values that cannot be parsed or fall outside
     * the allowed range are logged and replaced by the default.
     *
     * @param env environment variables, usually {@code System.getenv()}
     * @return the options
     */
    public static ClientOptions fromEnvironment(Map<String, String> env) {
        Builder builder = builder();
        String apiKey = env.get("NTFY_API_KEY");
        if (apiKey != null && !apiKey.isBlank()) {
            builder.token(apiKey.trim());
        }
        String username = env.get("NTFY_USERNAME");
        String password = env.get("NTFY_PASSWORD");
        if (username != null && !username.isBlank() && password != null && !password.isEmpty()) {
            builder.basicAuth(username.trim(), password);
        }
        builder.timeout(Duration.ofMillis(envNumber(env, "NTFY_REQUEST_TIMEOUT", DEFAULT_TIMEOUT.toMillis(), 1000, 60_000)));
        builder.retries((int) envNumber(env, "NTFY_MAX_RETRIES", DEFAULT_RETRIES, 0, 10));
        builder.maxMessageSize((int) envNumber(env, "NTFY_MAX_MESSAGE_SIZE", DEFAULT_MAX_MESSAGE_SIZE, 1, 10_000));
        builder.maxSubscriptions((int) envNumber(env, "NTFY_MAX_SUBSCRIPTIONS", DEFAULT_MAX_SUBSCRIPTIONS, 1, 1000));
        builder.pollStateTtl(Duration.ofMillis(envNumber(env, "NTFY_POLL_STATE_TTL",
                DEFAULT_POLL_STATE_TTL.toMillis(), 1000, Duration.ofDays(7).toMillis())));
        builder.defaultMessageLimit((int) envNumber(env, "NTFY_DEFAULT_MESSAGE_LIMIT", DEFAULT_MESSAGE_LIMIT, 1, 1000));
        builder.subscriptionTimeout(Duration.ofMillis(envNumber(env, "NTFY_SUBSCRIPTION_TIMEOUT",
                DEFAULT_SUBSCRIPTION_TIMEOUT.toMillis(), 1000, Duration.ofHours(24).toMillis())));
        builder.rateLimitWindow(Duration.ofMillis(envNumber(env, "RATE_LIMIT_WINDOW_MS",
                DEFAULT_RATE_LIMIT_WINDOW.toMillis(), 1000, 3_600_000)));
        builder.rateLimitMaxRequests((int) envNumber(env, "RATE_LIMIT_MAX_REQUESTS", DEFAULT_RATE_LIMIT_MAX_REQUESTS, 1, 10_000));
        return builder.build();
    }

    private static long envNumber(Map<String, String> env, String name, long defaultValue, long min, long max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("invalid number for {}: '{}', using default {}", name, raw, defaultValue);
            return defaultValue;
        }
        if (value < min || value > max) {
            log.warn("{}={} outside [{}, {}], using default {}", name, value, min, max, defaultValue);
            return defaultValue;
        }
        return value;
    }

    /**
     * Returns the access token, or null if not set.
     *
     * @return the token
     */
    public String getToken() {
        return token;
    }

    /**
     * Returns the basic auth username, or null if not set.
     *
     * @return the username
     */
    public String getUsername() {
        return username;
    }

    /**
     * Returns the basic auth password, or null if not set.
     *
     * @return the password
     */
    public String getPassword() {
        return password;
    }

    /**
     * Returns extra headers sent with every request.
     *
     * @return the headers, never null
     */
    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getUserAgent() {
        return userAgent;
    }

    /**
     * Returns the request timeout.
     *
     * @return the timeout
     */
    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Returns the number of retry attempts for one-shot requests.
     *
     * @return the retries count
     */
    public int getRetries() {
        return retries;
    }

    /**
     * Returns the delay between retries.
     *
     * @return the retry delay
     */
    public Duration getRetryDelay() {
        return retryDelay;
    }

    public Duration getKeepaliveTimeout() {
        return keepaliveTimeout;
    }

    public Duration getReconnectDelay() {
        return reconnectDelay;
    }

    public int getMaxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public int getMaxSubscriptions() {
        return maxSubscriptions;
    }

    public Duration getSubscriptionTimeout() {
        return subscriptionTimeout;
    }

    public Duration getStoppedLinger() {
        return stoppedLinger;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public Duration getPollStateTtl() {
        return pollStateTtl;
    }

    public int getDefaultMessageLimit() {
        return defaultMessageLimit;
    }

    public Duration getRateLimitWindow() {
        return rateLimitWindow;
    }

    public int getRateLimitMaxRequests() {
        return rateLimitMaxRequests;
    }

    public int getMaxMessageSize() {
        return maxMessageSize;
    }

    /**
     * Checks if basic auth credentials are set.
     *
     * @return true if username and password are set
     */
    public boolean hasBasicAuth() {
        return username != null && password != null;
    }

    /**
     * Builder for ClientOptions.
     */
    public static final class Builder {
        private String token;
        private String username;
        private String password;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String userAgent = DEFAULT_USER_AGENT;
        private Duration timeout = DEFAULT_TIMEOUT;
        private int retries = DEFAULT_RETRIES;
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private Duration keepaliveTimeout = DEFAULT_KEEPALIVE_TIMEOUT;
        private Duration reconnectDelay = DEFAULT_RECONNECT_DELAY;
        private int maxReconnectAttempts = DEFAULT_MAX_RECONNECT_ATTEMPTS;
        private int maxSubscriptions = DEFAULT_MAX_SUBSCRIPTIONS;
        private Duration subscriptionTimeout = DEFAULT_SUBSCRIPTION_TIMEOUT;
        private Duration stoppedLinger = DEFAULT_STOPPED_LINGER;
        private Duration sweepInterval = DEFAULT_SWEEP_INTERVAL;
        private Duration pollStateTtl = DEFAULT_POLL_STATE_TTL;
        private int defaultMessageLimit = DEFAULT_MESSAGE_LIMIT;
        private Duration rateLimitWindow = DEFAULT_RATE_LIMIT_WINDOW;
        private int rateLimitMaxRequests = DEFAULT_RATE_LIMIT_MAX_REQUESTS;
        private int maxMessageSize = DEFAULT_MAX_MESSAGE_SIZE;

        private Builder() {
        }

        /**
         * Sets the access token. Tokens starting with "tk_" are sent as Bearer tokens,
         * anything else is sent as the Authorization header value as is.
         *
         * @param token the token
         * @return this builder
         */
        public Builder token(String token) {
            this.token = token;
            return this;
        }

        /**
         * Sets basic auth credentials. They take precedence over the token.
         *
         * @param username the username
         * @param password the password
         * @return this builder
         * @throws NtfyException if username or password is empty
         */
        public Builder basicAuth(String username, String password) {
            if (username == null || username.isEmpty() || password == null || password.isEmpty()) {
                throw new NtfyException("username and password cannot be empty");
            }
            this.username = username;
            this.password = password;
            return this;
        }

        /**
         * Adds a header sent with every request.
         *
         * @param name  header name
         * @param value header value
         * @return this builder
         * @throws NtfyException if the name or value contains line breaks
         */
        public Builder header(String name, String value) {
            Objects.requireNonNull(name, "name cannot be null");
            Objects.requireNonNull(value, "value cannot be null");
            if (name.isEmpty() || hasLineBreak(name) || hasLineBreak(value)) {
                throw new NtfyException("invalid header: " + name);
            }
            headers.put(name, value);
            return this;
        }

        /**
         * Sets the User-Agent header.
         *
         * @param userAgent the user agent
         * @return this builder
         */
        public Builder userAgent(String userAgent) {
            this.userAgent = Objects.requireNonNull(userAgent, "userAgent cannot be null");
            return this;
        }

        /**
         * Sets the request timeout.
         *
         * @param timeout the timeout duration
         * @return this builder
         * @throws NtfyException if timeout is not positive
         */
        public Builder timeout(Duration timeout) {
            this.timeout = positive(timeout, "timeout");
            return this;
        }

        /**
         * Sets the number of retry attempts for failed one-shot requests.
         *
         * @param retries the number of retries (0 or more)
         * @return this builder
         * @throws NtfyException if retries is negative
         */
        public Builder retries(int retries) {
            if (retries < 0) {
                throw new NtfyException("retries cannot be negative");
            }
            this.retries = retries;
            return this;
        }

        /**
         * Sets the delay between retry attempts.
         *
         * @param retryDelay the delay duration
         * @return this builder
         * @throws NtfyException if retryDelay is negative
         */
        public Builder retryDelay(Duration retryDelay) {
            Objects.requireNonNull(retryDelay, "retryDelay cannot be null");
            if (retryDelay.isNegative()) {
                throw new NtfyException("retryDelay cannot be negative");
            }
            this.retryDelay = retryDelay;
            return this;
        }

        /**
         * Sets how long a stream may stay silent before it is reconnected.
         *
         * @param keepaliveTimeout the timeout
         * @return this builder
         */
        public Builder keepaliveTimeout(Duration keepaliveTimeout) {
            this.keepaliveTimeout = positive(keepaliveTimeout, "keepaliveTimeout");
            return this;
        }

        /**
         * Sets the base reconnect delay; attempt N waits N times this delay.
         *
         * @param reconnectDelay the delay
         * @return this builder
         */
        public Builder reconnectDelay(Duration reconnectDelay) {
            this.reconnectDelay = positive(reconnectDelay, "reconnectDelay");
            return this;
        }

        public Builder maxReconnectAttempts(int maxReconnectAttempts) {
            if (maxReconnectAttempts < 0) {
                throw new NtfyException("maxReconnectAttempts cannot be negative");
            }
            this.maxReconnectAttempts = maxReconnectAttempts;
            return this;
        }

        public Builder maxSubscriptions(int maxSubscriptions) {
            this.maxSubscriptions = atLeastOne(maxSubscriptions, "maxSubscriptions");
            return this;
        }

        public Builder subscriptionTimeout(Duration subscriptionTimeout) {
            this.subscriptionTimeout = positive(subscriptionTimeout, "subscriptionTimeout");
            return this;
        }

        public Builder stoppedLinger(Duration stoppedLinger) {
            this.stoppedLinger = positive(stoppedLinger, "stoppedLinger");
            return this;
        }

        public Builder sweepInterval(Duration sweepInterval) {
            this.sweepInterval = positive(sweepInterval, "sweepInterval");
            return this;
        }

        public Builder pollStateTtl(Duration pollStateTtl) {
            this.pollStateTtl = positive(pollStateTtl, "pollStateTtl");
            return this;
        }

        public Builder defaultMessageLimit(int defaultMessageLimit) {
            this.defaultMessageLimit = atLeastOne(defaultMessageLimit, "defaultMessageLimit");
            return this;
        }

        public Builder rateLimitWindow(Duration rateLimitWindow) {
            this.rateLimitWindow = positive(rateLimitWindow, "rateLimitWindow");
            return this;
        }

        public Builder rateLimitMaxRequests(int rateLimitMaxRequests) {
            this.rateLimitMaxRequests = atLeastOne(rateLimitMaxRequests, "rateLimitMaxRequests");
            return this;
        }

        public Builder maxMessageSize(int maxMessageSize) {
            this.maxMessageSize = atLeastOne(maxMessageSize, "maxMessageSize");
            return this;
        }

        /**
         * Builds the ClientOptions instance.
         *
         * @return the configured options
         */
        public ClientOptions build() {
            return new ClientOptions(this);
        }

        private static Duration positive(Duration value, String name) {
            Objects.requireNonNull(value, name + " cannot be null");
            if (value.isNegative() || value.isZero()) {
                throw new NtfyException(name + " must be positive");
            }
            return value;
        }

        private static int atLeastOne(int value, String name) {
            if (value < 1) {
                throw new NtfyException(name + " must be at least 1");
            }
            return value;
        }

        private static boolean hasLineBreak(String value) {
            return value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0;
        }
    }
}
