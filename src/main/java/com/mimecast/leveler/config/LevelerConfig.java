package com.mimecast.leveler.config;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Load leveler configuration.
 *
 * <p>This class provides type safe access to the root {@code leveler.json5} file.
 * <p>Each section is wrapped in its own config class, missing sections fall back to defaults.
 *
 * @see RedisConfig
 * @see QueueConfig
 * @see LoadLevelingConfig
 * @see ProcessorConfig
 * @see CircuitBreakerConfig
 * @see MonitorConfig
 * @see EndpointConfig
 */
public class LevelerConfig extends ConfigFoundation {

    /**
     * Constructs a new LevelerConfig instance.
     */
    public LevelerConfig() {
        super();
    }

    /**
     * Constructs a new LevelerConfig instance.
     *
     * @param map Configuration map.
     */
    public LevelerConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new LevelerConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public LevelerConfig(String path) throws IOException {
        super(path);
    }

    public RedisConfig getRedis() {
        return new RedisConfig(getMapProperty("redis"));
    }

    public QueueConfig getQueue() {
        return new QueueConfig(getMapProperty("queue"));
    }

    public LoadLevelingConfig getLoadLeveling() {
        return new LoadLevelingConfig(getMapProperty("loadLeveling"));
    }

    public ProcessorConfig getProcessor() {
        return new ProcessorConfig(getMapProperty("processor"));
    }

    public CircuitBreakerConfig getCircuitBreaker() {
        return new CircuitBreakerConfig(getMapProperty("circuitBreaker"));
    }

    public MonitorConfig getMonitor() {
        return new MonitorConfig(getMapProperty("monitor"));
    }

    public EndpointConfig getEndpoint() {
        return new EndpointConfig(getMapProperty("endpoint"));
    }

    /**
     * Gets names of the queues to process.
     *
     * @return List of queue names.
     */
    public List<String> getQueues() {
        List<String> names = new ArrayList<>();
        for (Object name : getListProperty("queues")) {
            names.add(String.valueOf(name));
        }
        return names;
    }
}
