package io.github.ntfy.client;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds request URLs and headers.
 */
final class Requests {

    static final String HEADER_AUTH = "Authorization";

    private Requests() {
    }

    /**
     * Builds {@code {baseUrl}/{topic}/json?{query}} for a subscription or fetch.
     *
     * @param baseUrl server URL without trailing slash
     * @param topic   validated topic
     * @param options filters and mode
     * @param since   start position overriding the one in options, may be null
     * @return the URL
     */
    static URI jsonStreamUri(String baseUrl, String topic, SubscriptionOptions options, String since) {
        StringBuilder query = new StringBuilder();
        if (options.isPoll()) {
            appendParam(query, "poll", "1");
        }
        String effectiveSince = since != null ? since : options.getSince();
        if (effectiveSince != null) {
            appendParam(query, "since", effectiveSince);
        }
        if (options.isScheduled()) {
            appendParam(query, "scheduled", "1");
        }
        appendParam(query, "id", options.getId());
        appendParam(query, "message", options.getMessage());
        appendParam(query, "title", options.getTitle());
        appendParam(query, "priority", options.getPriority());
        appendParam(query, "tags", options.getTags());

        String url = baseUrl + "/" + encodeSegment(topic) + "/json";
        if (query.length() > 0) {
            url += "?" + query;
        }
        return URI.create(url);
    }

    /**
     * Builds {@code {baseUrl}/{topic}} for publishing.
     *
     * @param baseUrl server URL without trailing slash
     * @param topic   validated topic
     * @return the URL
     */
    static URI topicUri(String baseUrl, String topic) {
        return URI.create(baseUrl + "/" + encodeSegment(topic));
    }

    /**
     * Builds the common request headers.
     *
     * @param options client options
     * @return ordered header map
     */
    static Map<String, String> headers(ClientOptions options) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "application/json");
        headers.put("User-Agent", options.getUserAgent());
        headers.putAll(options.getHeaders());

        if (options.hasBasicAuth()) {
            String credentials = options.getUsername() + ":" + options.getPassword();
            headers.put(HEADER_AUTH, "Basic " + Base64.getEncoder()
                    .encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
        } else if (options.getToken() != null && !options.getToken().isEmpty()) {
            String token = options.getToken();
            headers.put(HEADER_AUTH, token.startsWith("tk_") ? "Bearer " + token : token);
        }
        return headers;
    }

    /**
     * Strips a trailing slash from a base URL.
     *
     * @param baseUrl the URL
     * @return the URL without trailing slash
     */
    static String trimBaseUrl(String baseUrl) {
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    // URI encoding (spaces as %20), not form encoding; commas separate topics
    static String encodeSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("%2C", ",");
    }

    private static void appendParam(StringBuilder query, String name, String value) {
        if (value == null) {
            return;
        }
        if (query.length() > 0) {
            query.append('&');
        }
        query.append(name).append('=').append(URLEncoder.encode(value, StandardCharsets.UTF_8));
    }
}
