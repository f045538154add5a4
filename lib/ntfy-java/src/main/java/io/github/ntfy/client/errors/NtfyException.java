package io.github.ntfy.client.errors;

/**
 * Base exception for all ntfy client errors.
 */
public class NtfyException extends RuntimeException {

    /**
     * Creates a new NtfyException.
     *
     * @param message the error message
     */
    public NtfyException(String message) {
        super(message);
    }

    /**
     * Creates a new NtfyException with a cause.
     *
     * @param message the error message
     * @param cause   the underlying cause
     */
    public NtfyException(String message, Throwable cause) {
        super(message, cause);
    }
}
