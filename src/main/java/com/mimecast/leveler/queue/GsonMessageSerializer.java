package com.mimecast.leveler.queue;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * JSON message body serializer backed by Gson.
 */
public class GsonMessageSerializer implements MessageSerializer {

    private final Gson gson;

    /**
     * Constructs a new GsonMessageSerializer instance.
     */
    public GsonMessageSerializer() {
        this(new GsonBuilder().disableHtmlEscaping().create());
    }

    /**
     * Constructs a new GsonMessageSerializer instance with given Gson.
     *
     * @param gson Gson instance, for custom type adapters.
     */
    public GsonMessageSerializer(Gson gson) {
        this.gson = gson;
    }

    @Override
    public String serialize(Object body) {
        try {
            return gson.toJson(body);
        } catch (JsonParseException | UnsupportedOperationException e) {
            throw new MessageFormatException("Unable to serialize message body: " + e.getMessage(), e);
        }
    }

    @Override
    public <T> T deserialize(String data, Class<T> type) {
        try {
            return gson.fromJson(data, type);
        } catch (JsonParseException | IllegalStateException | ClassCastException e) {
            throw new MessageFormatException("Unable to deserialize message body as " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String getContentType() {
        return "application/json";
    }
}
