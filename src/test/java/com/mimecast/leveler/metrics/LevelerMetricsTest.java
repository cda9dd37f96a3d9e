package com.mimecast.leveler.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for LevelerMetrics.
 */
@Execution(ExecutionMode.SAME_THREAD)
class LevelerMetricsTest {

    private PrometheusMeterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        MetricsRegistry.register(registry);
    }

    @AfterEach
    void tearDown() {
        MetricsRegistry.register(null);
        registry.close();
    }

    @Test
    void testInitializeRegistersCounters() {
        LevelerMetrics.initialize("orders");

        assertNotNull(registry.find(LevelerMetrics.SENT).tag("queue", "orders").counter());
        for (String outcome : new String[]{LevelerMetrics.COMPLETED, LevelerMetrics.ABANDONED, LevelerMetrics.DEADLETTERED}) {
            Counter counter = registry.find(LevelerMetrics.OUTCOME).tags("queue", "orders", "outcome", outcome).counter();
            assertNotNull(counter, outcome);
            assertEquals(0.0, counter.count());
        }
    }

    @Test
    void testIncrementSent() {
        LevelerMetrics.incrementSent("orders", 3);
        LevelerMetrics.incrementSent("orders", 2);

        assertEquals(5.0, registry.get(LevelerMetrics.SENT).tag("queue", "orders").counter().count());
    }

    @Test
    void testIncrementOutcome() {
        LevelerMetrics.incrementOutcome("orders", LevelerMetrics.COMPLETED);
        LevelerMetrics.incrementOutcome("orders", LevelerMetrics.COMPLETED);
        LevelerMetrics.incrementOutcome("orders", LevelerMetrics.DEADLETTERED);

        assertEquals(2.0, registry.get(LevelerMetrics.OUTCOME)
                .tags("queue", "orders", "outcome", LevelerMetrics.COMPLETED).counter().count());
        assertEquals(1.0, registry.get(LevelerMetrics.OUTCOME)
                .tags("queue", "orders", "outcome", LevelerMetrics.DEADLETTERED).counter().count());
    }

    @Test
    void testRecordProcessingTime() {
        LevelerMetrics.recordProcessingTime("orders", Duration.ofMillis(250));

        Timer timer = registry.get(LevelerMetrics.PROCESSING_TIME).tag("queue", "orders").timer();
        assertEquals(1, timer.count());
        assertEquals(250.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
    }

    @Test
    void testScrapeContainsQueueMetrics() {
        LevelerMetrics.incrementSent("orders", 1);

        assertTrue(registry.scrape().contains("leveler_messages_sent_total"));
    }

    @Test
    void testNoRegistryIsNoOp() {
        MetricsRegistry.register(null);

        assertDoesNotThrow(() -> {
            LevelerMetrics.initialize("orders");
            LevelerMetrics.incrementSent("orders", 1);
            LevelerMetrics.incrementOutcome("orders", LevelerMetrics.ABANDONED);
            LevelerMetrics.recordProcessingTime("orders", Duration.ofMillis(1));
        });
        assertNull(registry.find(LevelerMetrics.SENT).counter());
    }
}
