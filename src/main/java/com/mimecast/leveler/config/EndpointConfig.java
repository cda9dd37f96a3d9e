package com.mimecast.leveler.config;

import java.util.Map;

/**
 * Service endpoint configuration.
 */
public class EndpointConfig extends BasicConfig {

    /**
     * Constructs a new EndpointConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public EndpointConfig(Map map) {
        super(map);
    }

    public boolean isEnabled() {
        return getBooleanProperty("enabled", true);
    }

    /**
     * Gets port.
     *
     * @param def Default port.
     * @return Port number.
     */
    public int getPort(int def) {
        return Math.toIntExact(getLongProperty("port", (long) def));
    }
}
