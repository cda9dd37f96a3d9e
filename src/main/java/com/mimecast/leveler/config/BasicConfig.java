package com.mimecast.leveler.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Basic configuration container.
 *
 * <p>Wraps a map parsed from a JSON5 file and provides type safe accessors with defaults.
 * <p>Gson parses every number as a double so numeric getters accept any {@link Number}.
 */
@SuppressWarnings({"unchecked", "rawtypes"})
public class BasicConfig {

    /**
     * Configuration map.
     */
    protected Map<String, Object> map = new HashMap<>();

    /**
     * Constructs a new BasicConfig instance.
     */
    public BasicConfig() {
        // Empty config.
    }

    /**
     * Constructs a new BasicConfig instance with given map.
     *
     * @param map Configuration map, may be null.
     */
    public BasicConfig(Map map) {
        if (map != null) {
            this.map = map;
        }
    }

    /**
     * Gets configuration map.
     *
     * @return Map.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Has property.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return map.containsKey(name);
    }

    /**
     * Gets string property.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return String.
     */
    public String getStringProperty(String name, String def) {
        Object value = map.get(name);
        return value != null ? String.valueOf(value) : def;
    }

    /**
     * Gets string property.
     *
     * @param name Property name.
     * @return String or null.
     */
    public String getStringProperty(String name) {
        return getStringProperty(name, null);
    }

    /**
     * Gets long property.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long def) {
        Object value = map.get(name);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String && !((String) value).isBlank()) {
            return Long.parseLong(((String) value).trim());
        }
        return def;
    }

    /**
     * Gets long property.
     *
     * @param name Property name.
     * @return Long, defaults to 0.
     */
    public Long getLongProperty(String name) {
        return getLongProperty(name, 0L);
    }

    /**
     * Gets double property.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return Double.
     */
    public Double getDoubleProperty(String name, Double def) {
        Object value = map.get(name);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String && !((String) value).isBlank()) {
            return Double.parseDouble(((String) value).trim());
        }
        return def;
    }

    /**
     * Gets boolean property.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean def) {
        Object value = map.get(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return def;
    }

    /**
     * Gets boolean property.
     *
     * @param name Property name.
     * @return Boolean, defaults to false.
     */
    public boolean getBooleanProperty(String name) {
        return getBooleanProperty(name, false);
    }

    /**
     * Gets duration property stored in milliseconds.
     *
     * @param name      Property name.
     * @param defMillis Default value in milliseconds.
     * @return Duration.
     */
    public Duration getMillisProperty(String name, long defMillis) {
        return Duration.ofMillis(getLongProperty(name, defMillis));
    }

    /**
     * Gets map property.
     *
     * @param name Property name.
     * @return Map, empty if missing.
     */
    public Map getMapProperty(String name) {
        Object value = map.get(name);
        return value instanceof Map ? (Map) value : new HashMap<>();
    }

    /**
     * Gets list property.
     *
     * @param name Property name.
     * @return List, empty if missing.
     */
    public List getListProperty(String name) {
        Object value = map.get(name);
        return value instanceof List ? (List) value : new ArrayList<>();
    }
}
