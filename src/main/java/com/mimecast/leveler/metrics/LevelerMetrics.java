package com.mimecast.leveler.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;

/**
 * Queue processing Micrometer metrics.
 *
 * <p>Counters for sent messages and processing outcomes and a timer for handler time, tagged by queue.
 * <p>Does nothing while no registry is registered. Failures are logged and never thrown.
 */
public final class LevelerMetrics {
    private static final Logger log = LogManager.getLogger(LevelerMetrics.class);

    public static final String SENT = "leveler.messages.sent";
    public static final String OUTCOME = "leveler.messages.outcome";
    public static final String PROCESSING_TIME = "leveler.processing.time";

    public static final String COMPLETED = "completed";
    public static final String ABANDONED = "abandoned";
    public static final String DEADLETTERED = "deadlettered";

    /**
     * Private constructor for utility class.
     */
    private LevelerMetrics() {
    }

    /**
     * Register zero valued outcome counters for a queue so they show before any traffic.
     *
     * @param queueName Queue name.
     */
    public static void initialize(String queueName) {
        MeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
        if (registry == null) {
            log.warn("Cannot initialize metrics for {} - Prometheus registry is null", queueName);
            return;
        }
        try {
            sentCounter(registry, queueName);
            for (String outcome : new String[]{COMPLETED, ABANDONED, DEADLETTERED}) {
                outcomeCounter(registry, queueName, outcome);
            }
            log.debug("Metrics initialized for {}", queueName);
        } catch (Exception e) {
            log.error("Failed to initialize metrics for {}: {}", queueName, e.getMessage(), e);
        }
    }

    /**
     * Increment the sent counter.
     *
     * @param queueName Queue name.
     * @param count     Messages sent.
     */
    public static void incrementSent(String queueName, int count) {
        MeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
        if (registry == null) {
            return;
        }
        try {
            sentCounter(registry, queueName).increment(count);
        } catch (Exception e) {
            log.warn("Failed to increment sent counter: {}", e.getMessage());
        }
    }

    /**
     * Increment an outcome counter.
     *
     * @param queueName Queue name.
     * @param outcome   One of completed, abandoned, deadlettered.
     */
    public static void incrementOutcome(String queueName, String outcome) {
        MeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
        if (registry == null) {
            return;
        }
        try {
            outcomeCounter(registry, queueName, outcome).increment();
        } catch (Exception e) {
            log.warn("Failed to increment {} counter: {}", outcome, e.getMessage());
        }
    }

    /**
     * Record handler processing time.
     *
     * @param queueName Queue name.
     * @param duration  Processing time.
     */
    public static void recordProcessingTime(String queueName, Duration duration) {
        MeterRegistry registry = MetricsRegistry.getPrometheusRegistry();
        if (registry == null) {
            return;
        }
        try {
            Timer.builder(PROCESSING_TIME)
                    .description("Message handler processing time")
                    .tag("queue", queueName)
                    .register(registry)
                    .record(duration);
        } catch (Exception e) {
            log.warn("Failed to record processing time: {}", e.getMessage());
        }
    }

    private static Counter sentCounter(MeterRegistry registry, String queueName) {
        return Counter.builder(SENT)
                .description("Number of messages sent to the queue")
                .tag("queue", queueName)
                .register(registry);
    }

    private static Counter outcomeCounter(MeterRegistry registry, String queueName, String outcome) {
        return Counter.builder(OUTCOME)
                .description("Number of processed messages by outcome")
                .tag("queue", queueName)
                .tag("outcome", outcome)
                .register(registry);
    }
}
