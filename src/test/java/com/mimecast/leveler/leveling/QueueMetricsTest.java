package com.mimecast.leveler.leveling;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QueueMetricsTest {

    @Test
    void testSamplesAreBounded() {
        QueueMetrics metrics = new QueueMetrics(3, 0L);
        for (int i = 0; i < 5; i++) {
            metrics.addSample(new ProcessingSample(i, 10, i % 2 == 0));
        }

        assertEquals(3, metrics.getSampleCount());
        assertEquals(3, metrics.getSuccessCount());
        assertEquals(2, metrics.getErrorCount());
        assertEquals(4L, metrics.getLastActivity());
    }

    @Test
    void testWindowedRates() {
        QueueMetrics metrics = new QueueMetrics(100, 0L);
        metrics.addSample(new ProcessingSample(100, 400, false));
        metrics.addSample(new ProcessingSample(200, 100, true));
        metrics.addSample(new ProcessingSample(300, 300, true));

        assertEquals(1.0 / 3, metrics.getErrorRate(0), 0.0001);
        assertEquals(0.0, metrics.getErrorRate(150));
        assertEquals(200.0, metrics.getAverageProcessingMillis(150));
        assertEquals(0.0, metrics.getAverageProcessingMillis(1000));
    }

    @Test
    void testEvictBefore() {
        QueueMetrics metrics = new QueueMetrics(100, 0L);
        metrics.addSample(new ProcessingSample(100, 10, true));
        metrics.addSample(new ProcessingSample(200, 10, true));

        assertEquals(1, metrics.evictBefore(150));
        assertEquals(1, metrics.getSampleCount());
    }
}
