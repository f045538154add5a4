package io.github.ntfy.client.errors;

/**
 * Thrown when a subscription id is unknown (HTTP 404 for server resources).
 */
public class NotFoundError extends NtfyException {

    private final String id;

    /**
     * Creates a new NotFoundError.
     *
     * @param id the id or path that was not found
     */
    public NotFoundError(String id) {
        super("not found: " + id);
        this.id = id;
    }

    /**
     * Returns the id or path that was not found.
     *
     * @return the id
     */
    public String getId() {
        return id;
    }
}
