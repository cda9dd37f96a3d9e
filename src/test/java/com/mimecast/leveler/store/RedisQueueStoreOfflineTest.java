package com.mimecast.leveler.store;

import com.mimecast.leveler.config.RedisConfig;
import org.junit.jupiter.api.Test;

import java.util.HashMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RedisQueueStore behaviour that needs no Redis instance.
 */
class RedisQueueStoreOfflineTest {

    @Test
    void testZeroRangeIsEmptyWithoutConnection() {
        RedisQueueStore store = new RedisQueueStore(new RedisConfig(new HashMap<>()));

        assertTrue(store.range("leveler-test:list", 0).isEmpty());
    }
}
