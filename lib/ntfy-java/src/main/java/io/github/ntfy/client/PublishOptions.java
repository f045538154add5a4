package io.github.ntfy.client;

import io.github.ntfy.client.errors.NtfyException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Optional properties of a published message, sent as {@code X-*} headers.
 */
public final class PublishOptions {

    private static final PublishOptions DEFAULTS = builder().build();

    private final String title;
    private final List<String> tags;
    private final Integer priority;
    private final String click;
    private final List<MessageAction> actions;
    private final String attach;
    private final String filename;
    private final String email;
    private final String delay;
    private final String cache;
    private final String firebase;
    private final String id;
    private final String expires;
    private final boolean markdown;
    private final String baseUrl;

    private PublishOptions(Builder builder) {
        this.title = builder.title;
        this.tags = List.copyOf(builder.tags);
        this.priority = builder.priority;
        this.click = builder.click;
        this.actions = List.copyOf(builder.actions);
        this.attach = builder.attach;
        this.filename = builder.filename;
        this.email = builder.email;
        this.delay = builder.delay;
        this.cache = builder.cache;
        this.firebase = builder.firebase;
        this.id = builder.id;
        this.expires = builder.expires;
        this.markdown = builder.markdown;
        this.baseUrl = builder.baseUrl;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PublishOptions defaults() {
        return DEFAULTS;
    }

    public String getTitle() {
        return title;
    }

    public List<String> getTags() {
        return Collections.unmodifiableList(tags);
    }

    public Integer getPriority() {
        return priority;
    }

    public List<MessageAction> getActions() {
        return Collections.unmodifiableList(actions);
    }

    public boolean isMarkdown() {
        return markdown;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>();
        putIfSet(headers, "X-Title", title);
        if (!tags.isEmpty()) {
            headers.put("X-Tags", String.join(",", tags));
        }
        if (priority != null) {
            headers.put("X-Priority", priority.toString());
        }
        putIfSet(headers, "X-Click", click);
        if (!actions.isEmpty()) {
            headers.put("X-Actions", Json.gson().toJson(actions));
        }
        putIfSet(headers, "X-Attach", attach);
        if (attach != null) {
            putIfSet(headers, "X-Filename", filename);
        }
        putIfSet(headers, "X-Email", email);
        putIfSet(headers, "X-Delay", delay);
        putIfSet(headers, "X-Cache", cache);
        putIfSet(headers, "X-Firebase", firebase);
        putIfSet(headers, "X-ID", id);
        putIfSet(headers, "X-Expires", expires);
        if (markdown) {
            headers.put("X-Markdown", "true");
        }
        return headers;
    }

    private static void putIfSet(Map<String, String> headers, String name, String value) {
        if (value != null) {
            headers.put(name, value);
        }
    }

    /**
     * Builder for PublishOptions.
     */
    public static final class Builder {
        private String title;
        private final List<String> tags = new ArrayList<>();
        private Integer priority;
        private String click;
        private final List<MessageAction> actions = new ArrayList<>();
        private String attach;
        private String filename;
        private String email;
        private String delay;
        private String cache;
        private String firebase;
        private String id;
        private String expires;
        private boolean markdown;
        private String baseUrl;

        private Builder() {
        }

        public Builder title(String title) {
            this.title = header(title, "title");
            return this;
        }

        /**
         * Adds tags; tags matching an emoji short code are shown as emojis.
         *
         * @param tags the tags
         * @return this builder
         */
        public Builder tags(String... tags) {
            for (String tag : tags) {
                String cleaned = header(tag, "tag");
                if (cleaned != null) {
                    this.tags.add(cleaned);
                }
            }
            return this;
        }

        /**
         * Sets the priority, 1 (min) to 5 (max).
         *
         * @param priority the priority
         * @return this builder
         */
        public Builder priority(int priority) {
            if (priority < 1 || priority > 5) {
                throw new NtfyException("priority must be between 1 and 5");
            }
            this.priority = priority;
            return this;
        }

        public Builder click(String click) {
            this.click = header(click, "click");
            return this;
        }

        public Builder action(MessageAction action) {
            if (action == null) {
                throw new NtfyException("action cannot be null");
            }
            this.actions.add(action);
            return this;
        }

        /**
         * Attaches a file by URL.
         *
         * @param url      the file URL
         * @param filename the displayed file name, may be null
         * @return this builder
         */
        public Builder attach(String url, String filename) {
            this.attach = header(url, "attach");
            this.filename = header(filename, "filename");
            return this;
        }

        public Builder email(String email) {
            this.email = header(email, "email");
            return this;
        }

        /**
         * Delays delivery, e.g. "30m", "1h" or "tomorrow, 10am".
         *
         * @param delay the delay
         * @return this builder
         */
        public Builder delay(String delay) {
            this.delay = header(delay, "delay");
            return this;
        }

        public Builder cache(String cache) {
            this.cache = header(cache, "cache");
            return this;
        }

        public Builder firebase(String firebase) {
            this.firebase = header(firebase, "firebase");
            return this;
        }

        public Builder id(String id) {
            this.id = header(id, "id");
            return this;
        }

        public Builder expires(String expires) {
            this.expires = header(expires, "expires");
            return this;
        }

        public Builder markdown(boolean markdown) {
            this.markdown = markdown;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = header(baseUrl, "baseUrl");
            return this;
        }

        public PublishOptions build() {
            return new PublishOptions(this);
        }

        private static String header(String value, String name) {
            if (value == null) {
                return null;
            }
            String trimmed = value.trim();
            if (trimmed.indexOf('\n') >= 0 || trimmed.indexOf('\r') >= 0) {
                throw new NtfyException(name + " cannot contain line breaks");
            }
            return trimmed.isEmpty() ? null : trimmed;
        }
    }
}
