package com.mimecast.leveler.store;

import com.mimecast.leveler.config.RedisConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Factory for creating QueueStore instances based on configuration.
 * <p>Selects the backend based on the enabled flag:
 * <ol>
 *   <li>Redis - if {@code redis.enabled} is true</li>
 *   <li>InMemory - fallback when Redis is disabled (default for tests)</li>
 * </ol>
 * <p>The InMemory backend provides no persistence.
 */
public class StoreFactory {

    private static final Logger log = LogManager.getLogger(StoreFactory.class);

    /**
     * Private constructor to prevent instantiation.
     */
    private StoreFactory() {
        throw new IllegalStateException("Factory class");
    }

    /**
     * Creates and initializes a QueueStore instance based on configuration.
     *
     * @param redisConfig Redis configuration.
     * @return Initialized QueueStore instance.
     * @throws StoreUnavailableException If Redis is enabled but unreachable.
     */
    public static QueueStore createStore(RedisConfig redisConfig) {
        QueueStore store;

        if (redisConfig != null && redisConfig.isEnabled()) {
            log.info("Using Redis queue store: {}:{}", redisConfig.getHost(), redisConfig.getPort());
            store = new RedisQueueStore(redisConfig);
            store.initialize();
            return store;
        }

        // Fall back to in-memory store when Redis is disabled.
        log.info("Redis disabled, using in-memory queue store");
        store = new InMemoryQueueStore();
        store.initialize();
        return store;
    }
}
