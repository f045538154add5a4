package io.github.ntfy.client.errors;

/**
 * Thrown when authentication fails (HTTP 401).
 */
public class UnauthorizedError extends NtfyException {

    /**
     * Creates a new UnauthorizedError.
     */
    public UnauthorizedError() {
        super("unauthorized: authentication required");
    }
}
