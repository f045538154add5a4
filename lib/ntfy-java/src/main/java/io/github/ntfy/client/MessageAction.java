package io.github.ntfy.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Action button attached to a notification (view, broadcast or http).
 */
public final class MessageAction {

    private final String id;
    private final String action;
    private final String label;
    private final String url;
    private final String method;
    private final Map<String, String> headers;
    private final String body;
    private final Boolean clear;

    /**
     * Creates a new action.
     *
     * @param id      action identifier, may be null when publishing
     * @param action  action type: view, broadcast or http
     * @param label   button label
     * @param url     target URL, may be null
     * @param method  HTTP method for http actions, may be null
     * @param headers HTTP headers for http actions, may be null
     * @param body    HTTP body for http actions, may be null
     * @param clear   whether to clear the notification after the action, may be null
     */
    public MessageAction(String id, String action, String label, String url, String method,
                         Map<String, String> headers, String body, Boolean clear) {
        this.id = id;
        this.action = action;
        this.label = label;
        this.url = url;
        this.method = method;
        this.headers = headers == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body;
        this.clear = clear;
    }

    /**
     * Creates a "view" action opening a URL.
     *
     * @param label button label
     * @param url   URL to open
     * @return the action
     */
    public static MessageAction view(String label, String url) {
        return new MessageAction(null, "view", label, url, null, null, null, null);
    }

    public String getId() {
        return id;
    }

    public String getAction() {
        return action;
    }

    public String getLabel() {
        return label;
    }

    public String getUrl() {
        return url;
    }

    public String getMethod() {
        return method;
    }

    public Map<String, String> getHeaders() {
        return headers == null ? Collections.emptyMap() : headers;
    }

    public String getBody() {
        return body;
    }

    public Boolean getClear() {
        return clear;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MessageAction that = (MessageAction) o;
        return Objects.equals(id, that.id)
                && Objects.equals(action, that.action)
                && Objects.equals(label, that.label)
                && Objects.equals(url, that.url)
                && Objects.equals(method, that.method)
                && Objects.equals(headers, that.headers)
                && Objects.equals(body, that.body)
                && Objects.equals(clear, that.clear);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, action, label, url, method, headers, body, clear);
    }

    @Override
    public String toString() {
        return "MessageAction{action='" + action + "', label='" + label + "'}";
    }
}
