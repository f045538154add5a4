package io.github.ntfy.client.errors;

/**
 * Thrown when a single stream record cannot be decoded.
 * The record is skipped; the stream keeps going.
 */
public class ParseError extends NtfyException {

    private static final int MAX_RAW_LENGTH = 100;

    private final String rawData;

    /**
     * Creates a new ParseError.
     *
     * @param message the error message
     * @param rawData the offending line, truncated to 100 characters
     * @param cause   the underlying cause, may be null
     */
    public ParseError(String message, String rawData, Throwable cause) {
        super(message, cause);
        this.rawData = truncate(rawData);
    }

    /**
     * Returns the offending line, truncated to 100 characters.
     *
     * @return the raw data
     */
    public String getRawData() {
        return rawData;
    }

    private static String truncate(String raw) {
        if (raw == null || raw.length() <= MAX_RAW_LENGTH) {
            return raw;
        }
        return raw.substring(0, MAX_RAW_LENGTH) + "...";
    }
}
