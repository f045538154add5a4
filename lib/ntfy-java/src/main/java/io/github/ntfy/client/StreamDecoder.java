package io.github.ntfy.client;

import io.github.ntfy.client.errors.ParseError;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Decodes a newline-delimited JSON stream into {@link NotificationMessage} records.
 * <p>
 * Bytes are buffered until a full line is available, so records split across chunks
 * are decoded once the rest arrives. A line that is not a valid record is dropped and
 * reported to the error sink; decoding continues with the next line.
 * <p>
 * A decoder belongs to exactly one stream and is not thread-safe.
 */
public final class StreamDecoder {

    private static final Logger log = LoggerFactory.getLogger(StreamDecoder.class);

    private final Gson gson;
    private final Consumer<ParseError> errorSink;
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private boolean finished;

    /**
     * Creates a decoder reporting parse failures to the given sink.
     *
     * @param errorSink receives one ParseError per dropped line
     */
    public StreamDecoder(Consumer<ParseError> errorSink) {
        this(Json.gson(), errorSink);
    }

    StreamDecoder(Gson gson, Consumer<ParseError> errorSink) {
        this.gson = Objects.requireNonNull(gson, "gson");
        this.errorSink = Objects.requireNonNull(errorSink, "errorSink");
    }

    /**
     * Feeds a chunk of bytes and returns the records completed by it.
     *
     * @param chunk  the buffer
     * @param offset start of the data in the buffer
     * @param length number of bytes
     * @return decoded records in arrival order, possibly empty
     * @throws IllegalStateException if the decoder was already finished
     */
    public List<NotificationMessage> feed(byte[] chunk, int offset, int length) {
        if (finished) {
            throw new IllegalStateException("decoder already finished");
        }
        List<NotificationMessage> records = null;
        int lineStart = offset;
        int end = offset + length;
        for (int i = offset; i < end; i++) {
            if (chunk[i] != '\n') {
                continue;
            }
            pending.write(chunk, lineStart, i - lineStart);
            NotificationMessage record = decodeLine(takePending());
            if (record != null) {
                if (records == null) {
                    records = new ArrayList<>();
                }
                records.add(record);
            }
            lineStart = i + 1;
        }
        // keep the partial line for the next chunk
        pending.write(chunk, lineStart, end - lineStart);
        return records == null ? Collections.emptyList() : records;
    }

    /**
     * Feeds a whole chunk.
     *
     * @param chunk the bytes
     * @return decoded records in arrival order, possibly empty
     */
    public List<NotificationMessage> feed(byte[] chunk) {
        return feed(chunk, 0, chunk.length);
    }

    /**
     * Ends the stream, decoding a trailing line that had no newline.
     * The decoder cannot be fed afterwards.
     *
     * @return the trailing record, or an empty list
     */
    public List<NotificationMessage> finish() {
        if (finished) {
            return Collections.emptyList();
        }
        finished = true;
        NotificationMessage record = decodeLine(takePending());
        return record == null ? Collections.emptyList() : List.of(record);
    }

    /**
     * Returns the number of buffered bytes of an incomplete line.
     *
     * @return pending byte count
     */
    public int pendingBytes() {
        return pending.size();
    }

    private String takePending() {
        String line = new String(pending.toByteArray(), StandardCharsets.UTF_8);
        pending.reset();
        return line;
    }

    private NotificationMessage decodeLine(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            JsonElement element = JsonParser.parseString(trimmed);
            if (!element.isJsonObject()) {
                throw new ParseError("failed to parse message: not a JSON object", trimmed, null);
            }
            JsonObject object = element.getAsJsonObject();
            requireText(object, "id", trimmed);
            requireText(object, "event", trimmed);
            requireText(object, "topic", trimmed);
            requireTime(object, trimmed);

            NotificationMessage record = gson.fromJson(object, NotificationMessage.class);
            if (record.getEvent() == null) {
                throw new ParseError("failed to parse message: unknown event '"
                        + object.get("event").getAsString() + "'", trimmed, null);
            }
            return record;
        } catch (ParseError e) {
            report(e);
        } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
            report(new ParseError("failed to parse message: " + e.getMessage(), trimmed, e));
        }
        return null;
    }

    private void report(ParseError error) {
        log.debug("dropping malformed record: {} [{}]", error.getMessage(), error.getRawData());
        errorSink.accept(error);
    }

    private static void requireText(JsonObject object, String field, String raw) {
        JsonElement value = object.get(field);
        if (value == null || !value.isJsonPrimitive() || value.getAsString().isEmpty()) {
            throw new ParseError("failed to parse message: missing field '" + field + "'", raw, null);
        }
    }

    private static void requireTime(JsonObject object, String raw) {
        JsonElement value = object.get("time");
        if (value == null || !value.isJsonPrimitive() || !((JsonPrimitive) value).isNumber()
                || value.getAsLong() == 0) {
            throw new ParseError("failed to parse message: missing field 'time'", raw, null);
        }
    }
}
