package com.mimecast.leveler.store;

import com.mimecast.leveler.config.RedisConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test class for RedisQueueStore.
 * <p>These tests require a Redis instance running on localhost:6379.
 * <p>Tests are only run if REDIS_TEST_ENABLED environment variable is set.
 */
@EnabledIfEnvironmentVariable(named = "REDIS_TEST_ENABLED", matches = "true")
class RedisQueueStoreTest {

    private static final String LIST = "leveler-test:list";
    private static final String PROCESSING = "leveler-test:processing";
    private static final String DELAYED = "leveler-test:delayed";
    private static final String STATS = "leveler-test:stats";

    private RedisQueueStore store;

    @BeforeEach
    void setUp() {
        Map<String, Object> map = new HashMap<>();
        map.put("enabled", true);
        map.put("host", "localhost");
        map.put("port", 6379);
        store = new RedisQueueStore(new RedisConfig(map));
        try {
            store.initialize();
            store.delete(LIST, PROCESSING, DELAYED, STATS);
        } catch (StoreUnavailableException e) {
            Assumptions.assumeTrue(false, "Redis not available: " + e.getMessage());
        }
    }

    @AfterEach
    void tearDown() {
        if (store != null) {
            try {
                store.delete(LIST, PROCESSING, DELAYED, STATS);
            } catch (StoreUnavailableException e) {
                // Ignore errors during cleanup.
            }
            store.close();
        }
    }

    @Test
    void testPopAndPushIsFifo() {
        store.push(LIST, "a");
        store.push(LIST, "b");

        assertEquals("a", store.popAndPush(LIST, PROCESSING));
        assertEquals("b", store.popAndPush(LIST, PROCESSING));
        assertNull(store.popAndPush(LIST, PROCESSING));
        assertEquals(List.of("a", "b"), store.range(PROCESSING, -1));
    }

    @Test
    void testRangeLimits() {
        store.push(LIST, "a");
        store.push(LIST, "b");
        store.push(LIST, "c");

        assertEquals(List.of("a", "b", "c"), store.range(LIST, -1));
        assertEquals(List.of("a", "b"), store.range(LIST, 2));
        assertTrue(store.range(LIST, 0).isEmpty());
    }

    @Test
    void testRemove() {
        store.push(LIST, "a");

        assertTrue(store.remove(LIST, "a"));
        assertFalse(store.remove(LIST, "a"));
        assertEquals(0, store.length(LIST));
    }

    @Test
    void testScoredMoveIsAtomic() {
        store.addScored(DELAYED, "due", 100);
        store.addScored(DELAYED, "later", 1000);

        assertEquals(List.of("due"), store.rangeByScore(DELAYED, 500, 10));
        assertTrue(store.moveScoredToList(DELAYED, "due", LIST));
        assertFalse(store.moveScoredToList(DELAYED, "due", LIST));
        assertEquals(1, store.scoredCount(DELAYED));
        assertEquals(List.of("due"), store.range(LIST, -1));
    }

    @Test
    void testBatchAndCounters() {
        store.batch()
                .push(LIST, "a")
                .addScored(DELAYED, "b", 1)
                .increment(STATS, "messages_sent", 2)
                .execute();

        assertEquals(1, store.length(LIST));
        assertEquals(1, store.scoredCount(DELAYED));
        assertEquals(2L, store.getCounters(STATS).get("messages_sent"));
    }
}
