package com.mimecast.leveler.config;

import com.google.gson.Gson;
import com.google.gson.stream.JsonReader;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration file foundation.
 *
 * <p>Reads a JSON5 file into the configuration map.
 * <p>Gson in lenient mode accepts comments, unquoted keys and single quotes.
 */
@SuppressWarnings("unchecked")
public class ConfigFoundation extends BasicConfig {

    /**
     * Constructs a new ConfigFoundation instance.
     */
    public ConfigFoundation() {
        super();
    }

    /**
     * Constructs a new ConfigFoundation instance with given map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ConfigFoundation instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ConfigFoundation(String path) throws IOException {
        super(parse(Files.readString(Paths.get(path), StandardCharsets.UTF_8)));
    }

    /**
     * Parses JSON5 text into a map.
     *
     * @param json5 JSON5 text.
     * @return Map, empty for blank input.
     */
    public static Map<String, Object> parse(String json5) {
        if (json5 == null || json5.isBlank()) {
            return new HashMap<>();
        }

        try (Reader reader = new StringReader(json5)) {
            JsonReader jsonReader = new JsonReader(reader);
            jsonReader.setLenient(true);
            Map<String, Object> parsed = new Gson().fromJson(jsonReader, Map.class);
            return parsed != null ? parsed : new HashMap<>();
        } catch (IOException e) {
            throw new IllegalArgumentException("Unable to parse configuration: " + e.getMessage(), e);
        }
    }
}
