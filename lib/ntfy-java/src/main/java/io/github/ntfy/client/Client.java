package io.github.ntfy.client;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import io.github.ntfy.client.errors.ConnectionError;
import io.github.ntfy.client.errors.InvalidTopicError;
import io.github.ntfy.client.errors.NotFoundError;
import io.github.ntfy.client.errors.NtfyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Client for an ntfy server: streaming subscriptions, polling, message retrieval and publishing.
 * <p>
 * Every outbound request is checked against a global and a per-topic rate limit first.
 * Close the client to stop all subscriptions and timers.
 *
 * <pre>{@code
 * try (Client client = Client.builder("https://ntfy.sh").build()) {
 *     String id = client.subscribe("alerts", SubscriptionHandlers.builder()
 *             .onMessage(m -> System.out.println(m.getMessage()))
 *             .build());
 *     ...
 * }
 * }</pre>
 */
public final class Client implements Closeable {

    /** Server used by {@link #fromEnvironment(Map)} when NTFY_BASE_URL is not set. */
    public static final String DEFAULT_BASE_URL = "https://ntfy.sh";

    private static final Logger log = LoggerFactory.getLogger(Client.class);

    private final String baseUrl;
    private final String defaultTopic;
    private final ClientOptions options;
    private final Scheduler scheduler;
    private final boolean ownsScheduler;
    private final RateGovernor governor;
    private final SubscriptionRegistry registry;
    private final PollStateStore pollStates;
    private final RequestExecutor executor;
    private final TopicPoller poller;

    private Client(Builder builder, ClientOptions options) {
        this.baseUrl = Requests.trimBaseUrl(builder.baseUrl);
        this.defaultTopic = builder.defaultTopic;
        this.options = options;
        this.ownsScheduler = builder.scheduler == null;
        this.scheduler = ownsScheduler ? new ExecutorScheduler() : builder.scheduler;
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        StreamTransport transport = builder.transport != null ? builder.transport : new JdkHttpTransport(options.getTimeout());

        this.governor = new RateGovernor(options.getRateLimitMaxRequests(), options.getRateLimitWindow(), scheduler);
        this.registry = new SubscriptionRegistry(options, transport, scheduler, clock);
        this.pollStates = new PollStateStore(options.getPollStateTtl(), options.getSweepInterval(), scheduler, clock);
        this.executor = new RequestExecutor(transport, options);
        this.poller = new TopicPoller(pollStates, executor, options, clock);
    }

    /**
     * Creates a new builder for the Client.
     *
     * @param baseUrl the base URL of the ntfy server
     * @return a new builder
     */
    public static Builder builder(String baseUrl) {
        return new Builder(baseUrl);
    }

    /**
     * Creates a client configured from environment variables: NTFY_BASE_URL,
     * NTFY_DEFAULT_TOPIC and those read by {@link ClientOptions#fromEnvironment(Map)}.
     *
     * @param env environment variables, usually {@code System.getenv()}
     * @return the client
     */
    public static Client fromEnvironment(Map<String, String> env) {
        String url = env.get("NTFY_BASE_URL");
        Builder builder = builder(url == null || url.isBlank() ? DEFAULT_BASE_URL : url.trim())
                .options(ClientOptions.fromEnvironment(env));
        String topic = env.get("NTFY_DEFAULT_TOPIC");
        if (topic != null && !topic.isBlank()) {
            builder.defaultTopic(topic);
        }
        return builder.build();
    }

    /**
     * Subscribes to a topic in streaming mode without filters.
     *
     * @param topic    the topic, or several separated by commas
     * @param handlers callbacks
     * @return the subscription id
     */
    public String subscribe(String topic, SubscriptionHandlers handlers) {
        return subscribe(topic, handlers, SubscriptionOptions.defaults());
    }

    /**
     * Subscribes to a topic. The connection is opened in the background; its progress is
     * reported to the handlers and through {@link #getStatus(String)}.
     *
     * @param topic    the topic, or several separated by commas
     * @param handlers callbacks
     * @param options  filters and mode
     * @return the subscription id
     * @throws InvalidTopicError if the topic is malformed
     * @throws io.github.ntfy.client.errors.RateLimitedError if a rate limit is exhausted
     * @throws io.github.ntfy.client.errors.CapacityExceededError if the subscription limit is reached
     */
    public String subscribe(String topic, SubscriptionHandlers handlers, SubscriptionOptions options) {
        String validTopic = Topics.validate(topic);
        // a subscription refused for capacity spends no rate budget
        registry.checkCapacity();
        governor.check(validTopic);
        return registry.create(validTopic, resolveBaseUrl(options.getBaseUrl()), options,
                handlers == null ? SubscriptionHandlers.none() : handlers);
    }

    /**
     * Stops a subscription.
     *
     * @param id the subscription id
     * @return false if the id is unknown or already stopped
     */
    public boolean unsubscribe(String id) {
        return registry.stop(id);
    }

    /**
     * Returns the status of a subscription.
     *
     * @param id the subscription id
     * @return a snapshot of the subscription
     * @throws NotFoundError if the id is unknown
     */
    public SubscriptionInfo getStatus(String id) {
        return registry.get(id);
    }

    public List<SubscriptionInfo> listSubscriptions() {
        return registry.list();
    }

    /**
     * Returns the number of subscriptions counting against the subscription limit.
     *
     * @return connecting and active subscriptions
     */
    public int activeSubscriptionCount() {
        return registry.activeCount();
    }

    /**
     * Streams a topic as an iterable.
     *
     * @param topic the topic, or several separated by commas
     * @return the subscription; close it when done
     */
    public Subscription stream(String topic) {
        return stream(topic, SubscriptionOptions.defaults());
    }

    /**
     * Streams a topic as an iterable. The subscription counts against the subscription limit.
     *
     * @param topic   the topic, or several separated by commas
     * @param options filters and mode
     * @return the subscription; close it when done
     */
    public Subscription stream(String topic, SubscriptionOptions options) {
        return new QueueSubscription(registry, handlers -> subscribe(topic, handlers, options));
    }

    /**
     * Polls a topic for messages published since the previous poll.
     *
     * @param topic the topic
     * @return the new messages and the cursor
     */
    public PollResult poll(String topic) {
        return poll(topic, PollOptions.defaults());
    }

    /**
     * Polls a topic for messages published since the previous poll. The first poll of a
     * topic returns what the server has cached by default.
     *
     * @param topic   the topic
     * @param options poll options
     * @return the new messages and the cursor
     * @throws InvalidTopicError if the topic is malformed
     * @throws io.github.ntfy.client.errors.RateLimitedError if a rate limit is exhausted
     * @throws ConnectionError   if the server cannot be reached
     */
    public PollResult poll(String topic, PollOptions options) {
        String validTopic = Topics.validate(topic);
        governor.check(validTopic);
        return poller.poll(validTopic, resolveBaseUrl(options.getBaseUrl()), options);
    }

    /**
     * Forgets the poll cursor of a topic.
     *
     * @param topic the topic
     * @return true if a cursor existed
     */
    public boolean resetPollState(String topic) {
        return pollStates.reset(Topics.validate(topic));
    }

    /**
     * Returns the poll cursor of a topic.
     *
     * @param topic the topic
     * @return the cursor, or null if the topic was not polled or the cursor expired
     */
    public PollState getPollState(String topic) {
        return pollStates.get(Topics.validate(topic));
    }

    public Map<String, PollState> listPollStates() {
        return pollStates.snapshot();
    }

    /**
     * Retrieves cached messages of a topic, up to the default message limit.
     *
     * @param topic the topic
     * @return the messages
     */
    public MessagesResult messages(String topic) {
        return messages(topic, SubscriptionOptions.defaults(), options.getDefaultMessageLimit());
    }

    /**
     * Retrieves cached messages of a topic.
     *
     * @param topic   the topic
     * @param filters start position, scheduled flag and filters; poll mode is implied
     * @param limit   maximum number of messages, 1 to 1000
     * @return the oldest matching messages up to the limit
     * @throws InvalidTopicError if the topic is malformed
     * @throws ConnectionError   if the server cannot be reached
     */
    public MessagesResult messages(String topic, SubscriptionOptions filters, int limit) {
        if (limit < 1 || limit > PollOptions.MAX_LIMIT) {
            throw new NtfyException("limit must be between 1 and " + PollOptions.MAX_LIMIT);
        }
        String validTopic = Topics.validate(topic);
        governor.check(validTopic);

        List<NotificationMessage> all = poller.fetchCached(validTopic, resolveBaseUrl(filters.getBaseUrl()), filters);
        boolean hasMore = all.size() > limit;
        List<NotificationMessage> messages = hasMore ? new ArrayList<>(all.subList(0, limit)) : all;
        log.debug("retrieved {} messages from topic '{}'", messages.size(), validTopic);
        return new MessagesResult(validTopic, messages, limit, hasMore);
    }

    /**
     * Publishes a message to the default topic.
     *
     * @param message the message body
     * @return the server acknowledgement
     * @throws NtfyException if no default topic is configured
     */
    public PublishResult publish(String message) {
        if (defaultTopic == null) {
            throw new NtfyException("no topic given and no default topic configured");
        }
        return publish(defaultTopic, message, PublishOptions.defaults());
    }

    public PublishResult publish(String topic, String message) {
        return publish(topic, message, PublishOptions.defaults());
    }

    /**
     * Publishes a message.
     *
     * @param topic   the topic, or null for the default topic
     * @param message the message body
     * @param options title, tags, priority and other message properties
     * @return the server acknowledgement
     * @throws InvalidTopicError if the topic is malformed
     * @throws NtfyException     if the message is empty or too large
     * @throws io.github.ntfy.client.errors.RateLimitedError if a rate limit is exhausted
     * @throws ConnectionError   if the server cannot be reached
     */
    public PublishResult publish(String topic, String message, PublishOptions options) {
        String validTopic = Topics.validate(topic != null ? topic : defaultTopic);
        if (message == null || message.isEmpty()) {
            throw new NtfyException("message cannot be empty");
        }
        byte[] body = message.getBytes(StandardCharsets.UTF_8);
        if (body.length > this.options.getMaxMessageSize()) {
            throw new NtfyException("message exceeds maximum size of " + this.options.getMaxMessageSize() + " bytes");
        }
        governor.check(validTopic);

        Map<String, String> headers = Requests.headers(this.options);
        headers.put("Content-Type", "text/plain");
        headers.putAll(options.headers());
        URI uri = Requests.topicUri(resolveBaseUrl(options.getBaseUrl()), validTopic);

        byte[] response = executor.execute("POST", uri, headers, body, validTopic);
        PublishResult result;
        try {
            result = Json.gson().fromJson(new String(response, StandardCharsets.UTF_8), PublishResult.class);
        } catch (JsonParseException e) {
            throw new NtfyException("invalid publish response: " + e.getMessage(), e);
        }
        if (result == null) {
            throw new NtfyException("empty publish response");
        }
        log.info("published message {} to topic '{}'", result.getId(), validTopic);
        return result;
    }

    /**
     * Checks server health.
     *
     * @return true if the server reports itself healthy
     */
    public boolean ping() {
        try {
            URI uri = URI.create(baseUrl + "/v1/health");
            byte[] response = executor.execute("GET", uri, Requests.headers(options), null, "v1/health");
            JsonObject health = Json.gson().fromJson(new String(response, StandardCharsets.UTF_8), JsonObject.class);
            return health != null && health.has("healthy") && health.get("healthy").getAsBoolean();
        } catch (NtfyException | JsonParseException | IllegalStateException | UnsupportedOperationException e) {
            log.debug("health check failed: {}", e.getMessage());
            return false;
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getDefaultTopic() {
        return defaultTopic;
    }

    public ClientOptions getOptions() {
        return options;
    }

    /**
     * Stops all subscriptions and timers.
     */
    @Override
    public void close() {
        registry.close();
        pollStates.close();
        if (ownsScheduler) {
            scheduler.close();
        }
    }

    private String resolveBaseUrl(String override) {
        return override != null ? Requests.trimBaseUrl(override) : baseUrl;
    }

    /**
     * Builder for creating Client instances.
     */
    public static final class Builder {
        private final String baseUrl;
        private final ClientOptions.Builder optionsBuilder = ClientOptions.builder();
        private ClientOptions options;
        private String defaultTopic;
        private StreamTransport transport;
        private Scheduler scheduler;
        private Clock clock;

        private Builder(String baseUrl) {
            if (baseUrl == null || baseUrl.trim().isEmpty()) {
                throw new NtfyException("baseUrl cannot be empty");
            }
            this.baseUrl = baseUrl.trim();
        }

        /**
         * Sets all client options at once. Replaces values given to the shorthand setters.
         *
         * @param options the options
         * @return this builder
         */
        public Builder options(ClientOptions options) {
            if (options == null) {
                throw new NtfyException("options cannot be null");
            }
            this.options = options;
            return this;
        }

        /**
         * Sets the access token.
         *
         * @param token the token; tokens starting with "tk_" are sent as bearer tokens
         * @return this builder
         */
        public Builder token(String token) {
            optionsBuilder.token(token);
            return this;
        }

        public Builder basicAuth(String username, String password) {
            optionsBuilder.basicAuth(username, password);
            return this;
        }

        /**
         * Sets the request timeout.
         *
         * @param timeout the timeout duration
         * @return this builder
         */
        public Builder timeout(Duration timeout) {
            optionsBuilder.timeout(timeout);
            return this;
        }

        public Builder retries(int retries) {
            optionsBuilder.retries(retries);
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            optionsBuilder.retryDelay(retryDelay);
            return this;
        }

        /**
         * Sets the topic used by {@link Client#publish(String)}.
         *
         * @param defaultTopic the topic
         * @return this builder
         */
        public Builder defaultTopic(String defaultTopic) {
            this.defaultTopic = Topics.validate(defaultTopic);
            return this;
        }

        /**
         * Replaces the HTTP transport, by default {@link JdkHttpTransport}.
         *
         * @param transport the transport
         * @return this builder
         */
        public Builder transport(StreamTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Replaces the timer facility. A scheduler given here is not closed with the client.
         *
         * @param scheduler the scheduler
         * @return this builder
         */
        public Builder scheduler(Scheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Builds the Client instance.
         *
         * @return the configured client
         */
        public Client build() {
            return new Client(this, options != null ? options : optionsBuilder.build());
        }
    }
}
