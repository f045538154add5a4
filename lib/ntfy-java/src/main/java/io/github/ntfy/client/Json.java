package io.github.ntfy.client;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializer;

/**
 * Shared Gson configuration.
 */
final class Json {

    private static final Gson GSON = new GsonBuilder()
            .registerTypeAdapter(EventType.class, (JsonDeserializer<EventType>) (json, type, ctx) ->
                    // unknown events decode to null and are rejected by the decoder
                    EventType.fromValue(json.getAsString()))
            .disableHtmlEscaping()
            .create();

    private Json() {
    }

    static Gson gson() {
        return GSON;
    }
}
