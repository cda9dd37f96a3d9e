package com.mimecast.leveler.config;

import org.apache.commons.lang3.StringUtils;

import java.util.Map;

/**
 * Redis backing store configuration.
 *
 * <p>This class provides type safe access to the {@code redis} section.
 */
public class RedisConfig extends BasicConfig {

    /**
     * Constructs a new RedisConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public RedisConfig(Map map) {
        super(map);
    }

    /**
     * Whether the Redis backend is enabled.
     * <p>When disabled the in-memory store is used.
     *
     * @return Boolean.
     */
    public boolean isEnabled() {
        return getBooleanProperty("enabled", false);
    }

    /**
     * Gets host.
     *
     * @return Host string.
     */
    public String getHost() {
        return getStringProperty("host", "localhost");
    }

    /**
     * Gets port.
     *
     * @return Port number.
     */
    public int getPort() {
        return Math.toIntExact(getLongProperty("port", 6379L));
    }

    /**
     * Gets database index.
     *
     * @return Database number.
     */
    public int getDatabase() {
        return Math.toIntExact(getLongProperty("database", 0L));
    }

    /**
     * Gets password.
     *
     * @return Password or null when not configured.
     */
    public String getPassword() {
        String password = getStringProperty("password", "");
        return StringUtils.isNotBlank(password) ? password : null;
    }

    /**
     * Gets connection and socket timeout in milliseconds.
     *
     * @return Timeout value.
     */
    public int getTimeoutMillis() {
        return Math.toIntExact(getLongProperty("timeoutMillis", 2000L));
    }

    /**
     * Gets maximum pool size.
     *
     * @return Pool size.
     */
    public int getMaxTotal() {
        return Math.toIntExact(getLongProperty("maxTotal", 16L));
    }

    /**
     * Gets maximum idle connections.
     *
     * @return Idle connections.
     */
    public int getMaxIdle() {
        return Math.toIntExact(getLongProperty("maxIdle", 8L));
    }

    /**
     * Gets minimum idle connections.
     *
     * @return Idle connections.
     */
    public int getMinIdle() {
        return Math.toIntExact(getLongProperty("minIdle", 1L));
    }
}
