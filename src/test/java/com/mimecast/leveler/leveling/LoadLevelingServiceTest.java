package com.mimecast.leveler.leveling;

import com.mimecast.leveler.MutableClock;
import com.mimecast.leveler.config.LoadLevelingConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LoadLevelingServiceTest {

    private static final String QUEUE = "orders";

    private MutableClock clock;
    private Map<String, Object> map;
    private LoadLevelingService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        map = new HashMap<>();
        map.put("maxConcurrentLoad", 10);
        map.put("maxErrorRate", 0.1);
        map.put("maxAverageProcessingTimeMillis", 1000);
        map.put("maxQueueBacklog", 100);
        map.put("defaultBatchSize", 10);
        map.put("maxBatchSize", 15);
        map.put("minProcessingDelayMillis", 100);
        map.put("maxProcessingDelayMillis", 30000);
        map.put("initialThrottleDelayMillis", 1000);
        map.put("maxThrottleDelayMillis", 5000);
        map.put("throttleBackoffMultiplier", 2.0);
        map.put("throttleRecoveryFactor", 1.5);
        map.put("failureThresholdForThrottling", 100);
        map.put("successThresholdForRecovery", 2);
        map.put("metricsWindowMillis", 600000);
        map.put("metricsRetentionMillis", 3600000);
        service = new LoadLevelingService(new LoadLevelingConfig(map), clock);
    }

    @AfterEach
    void tearDown() {
        service.close();
    }

    private LoadLevelingService rebuild(String key, Object value) {
        service.close();
        map.put(key, value);
        service = new LoadLevelingService(new LoadLevelingConfig(map), clock);
        return service;
    }

    @Test
    void testLoadAtCeilingIsRejected() {
        assertFalse(service.shouldProcess(QUEUE, 10));
        assertFalse(service.shouldProcess(QUEUE, 11));
        assertTrue(service.shouldProcess(QUEUE, 9));
    }

    @Test
    void testAdmissionsAreSpacedByThrottleDelay() {
        assertTrue(service.shouldProcess(QUEUE, 0));
        assertFalse(service.shouldProcess(QUEUE, 0));

        clock.advanceMillis(999);
        assertFalse(service.shouldProcess(QUEUE, 0));

        clock.advanceMillis(1);
        assertTrue(service.shouldProcess(QUEUE, 0));
    }

    @Test
    void testHighErrorRateThrottles() {
        service.recordProcessingTime(QUEUE, Duration.ofMillis(10), true);
        service.recordProcessingTime(QUEUE, Duration.ofMillis(10), false);

        assertFalse(service.shouldProcess(QUEUE, 0));
        AdaptiveThrottling throttling = service.getThrottling(QUEUE);
        assertTrue(throttling.isThrottled());
        assertEquals(clock.millis() + 1000, throttling.getThrottleUntil());
        assertEquals(2000, throttling.getCurrentThrottleDelay());

        // Window passes but the error rate is still high, so the throttle is applied again and keeps growing.
        clock.advanceMillis(1000);
        assertFalse(service.shouldProcess(QUEUE, 0));
        assertEquals(4000, throttling.getCurrentThrottleDelay());

        clock.advanceMillis(2000);
        assertFalse(service.shouldProcess(QUEUE, 0));
        assertEquals(5000, throttling.getCurrentThrottleDelay());
    }

    @Test
    void testErrorsOutsideWindowAreIgnored() {
        service.recordProcessingTime(QUEUE, Duration.ofMillis(10), false);
        clock.advance(Duration.ofMinutes(11));

        assertTrue(service.shouldProcess(QUEUE, 0));
    }

    @Test
    void testSlowProcessingThrottles() {
        service.recordProcessingTime(QUEUE, Duration.ofMillis(1500), true);

        assertFalse(service.shouldProcess(QUEUE, 0));
        assertTrue(service.getThrottling(QUEUE).isThrottled());
    }

    @Test
    void testBacklogThrottles() {
        service.updateBacklog(QUEUE, 101);

        assertFalse(service.shouldProcess(QUEUE, 0));
        assertTrue(service.getThrottling(QUEUE).isThrottled());
        assertEquals(101, service.getMetrics(QUEUE).getBacklog());
    }

    @Test
    void testConsecutiveFailuresThrottleAndSuccessesRecover() {
        rebuild("failureThresholdForThrottling", 3);
        rebuild("maxErrorRate", 1.0);

        service.recordProcessingTime(QUEUE, Duration.ofMillis(10), false);
        service.recordProcessingTime(QUEUE, Duration.ofMillis(10), false);
        assertFalse(service.getThrottling(QUEUE).isThrottled());

        service.recordProcessingTime(QUEUE, Duration.ofMillis(10), false);
        AdaptiveThrottling throttling = service.getThrottling(QUEUE);
        assertTrue(throttling.isThrottled());
        assertEquals(3, throttling.getConsecutiveFailures());
        assertEquals(2000, throttling.getCurrentThrottleDelay());
        assertFalse(service.shouldProcess(QUEUE, 0));

        // Each further failure past the threshold throttles again.
        service.recordProcessingTime(QUEUE, Duration.ofMillis(10), false);
        assertEquals(4000, throttling.getCurrentThrottleDelay());

        service.recordProcessingTime(QUEUE, Duration.ofMillis(10), true);
        assertEquals(0, throttling.getConsecutiveFailures());
        assertEquals(4000, throttling.getCurrentThrottleDelay());

        service.recordProcessingTime(QUEUE, Duration.ofMillis(10), true);
        assertEquals(2667, throttling.getCurrentThrottleDelay());
        assertEquals(0, throttling.getConsecutiveSuccesses());
    }

    @Test
    void testRecoveryNeverGoesBelowInitialDelay() {
        for (int i = 0; i < 10; i++) {
            service.recordProcessingTime(QUEUE, Duration.ofMillis(10), true);
        }

        assertEquals(1000, service.getThrottling(QUEUE).getCurrentThrottleDelay());
    }

    @Test
    void testThrottleExpires() {
        service.updateBacklog(QUEUE, 500);
        assertFalse(service.shouldProcess(QUEUE, 0));

        service.updateBacklog(QUEUE, 0);
        clock.advanceMillis(1000);

        assertTrue(service.shouldProcess(QUEUE, 0));
        assertFalse(service.getThrottling(QUEUE).isThrottled());
    }

    @Test
    void testOptimalBatchSize() {
        assertEquals(10, service.getOptimalBatchSize("unknown"));

        service.shouldProcess(QUEUE, 9);
        assertEquals(5, service.getOptimalBatchSize(QUEUE));

        service.shouldProcess(QUEUE, 5);
        assertEquals(10, service.getOptimalBatchSize(QUEUE));

        service.shouldProcess(QUEUE, 0);
        assertEquals(15, service.getOptimalBatchSize(QUEUE));
    }

    @Test
    void testBatchSizeShrinksOnErrorsAndThrottle() {
        service.shouldProcess(QUEUE, 5);
        service.recordProcessingTime(QUEUE, Duration.ofMillis(10), false);
        assertEquals(5, service.getOptimalBatchSize(QUEUE));

        service.shouldProcess(QUEUE, 5);
        assertEquals(1, service.getOptimalBatchSize(QUEUE));
    }

    @Test
    void testOptimalDelay() {
        assertEquals(Duration.ofMillis(100), service.getOptimalDelay("unknown"));

        service.shouldProcess(QUEUE, 5);
        assertEquals(Duration.ofMillis(100), service.getOptimalDelay(QUEUE));

        service.shouldProcess(QUEUE, 9);
        assertEquals(Duration.ofMillis(24100), service.getOptimalDelay(QUEUE));
    }

    @Test
    void testDelayGrowsWithErrorRate() {
        service.recordProcessingTime(QUEUE, Duration.ofMillis(10), true);
        service.recordProcessingTime(QUEUE, Duration.ofMillis(10), false);

        assertEquals(Duration.ofMillis(500), service.getOptimalDelay(QUEUE));
    }

    @Test
    void testDelayIsAtLeastThrottleDelayAndCapped() {
        rebuild("maxProcessingDelayMillis", 1500);
        service.updateBacklog(QUEUE, 1000);
        service.shouldProcess(QUEUE, 0);

        // Throttle delay grew to 2000 but the delay is capped at the maximum.
        assertEquals(Duration.ofMillis(1500), service.getOptimalDelay(QUEUE));
    }

    @Test
    void testCleanupDropsInactiveQueues() {
        service.recordProcessingTime(QUEUE, Duration.ofMillis(10), true);
        service.recordProcessingTime("other", Duration.ofMillis(10), true);

        clock.advance(Duration.ofMinutes(30));
        service.recordProcessingTime("other", Duration.ofMillis(10), true);
        assertEquals(0, service.cleanup());

        clock.advance(Duration.ofMinutes(31));
        assertEquals(1, service.cleanup());
        assertNull(service.getMetrics(QUEUE));
        assertNotNull(service.getMetrics("other"));
        assertEquals(1, service.getMetrics("other").getSampleCount());
    }

    @Test
    void testStartAndClose() {
        service.start();
        service.start();
        service.close();
        service.close();
    }
}
