package com.mimecast.leveler.config;

import java.time.Duration;
import java.util.Map;

/**
 * Message processor configuration.
 *
 * <p>This class provides type safe access to the {@code processor} section.
 * <p>The same settings apply to every processed queue.
 */
public class ProcessorConfig extends BasicConfig {

    /**
     * Constructs a new ProcessorConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public ProcessorConfig(Map map) {
        super(map);
    }

    /**
     * Gets the size of the handler concurrency limiter.
     *
     * @return Max concurrent messages.
     */
    public int getMaxConcurrentMessages() {
        return Math.toIntExact(getLongProperty("maxConcurrentMessages", 10L));
    }

    public int getMaxDeliveryCount() {
        return Math.toIntExact(getLongProperty("maxDeliveryCount", 5L));
    }

    public Duration getVisibilityTimeout() {
        return getMillisProperty("visibilityTimeoutMillis", 300_000L);
    }

    /**
     * Gets the age after which a message is dead-lettered instead of dispatched.
     *
     * @return Duration, 7 days by default.
     */
    public Duration getMaxMessageAge() {
        return getMillisProperty("maxMessageAgeMillis", Duration.ofDays(7).toMillis());
    }

    public Duration getEmptyQueueDelay() {
        return getMillisProperty("emptyQueueDelayMillis", 5000L);
    }

    public Duration getErrorRetryDelay() {
        return getMillisProperty("errorRetryDelayMillis", 30_000L);
    }

    public Duration getCircuitBreakerCooldownDelay() {
        return getMillisProperty("circuitBreakerCooldownDelayMillis", 60_000L);
    }

    public Duration getHealthCheckInterval() {
        return getMillisProperty("healthCheckIntervalMillis", 60_000L);
    }

    public long getDeadLetterWarningThreshold() {
        return getLongProperty("deadLetterWarningThreshold", 100L);
    }

    public long getBacklogWarningThreshold() {
        return getLongProperty("backlogWarningThreshold", 1000L);
    }

    /**
     * Gets how long shutdown waits for in-flight handlers.
     *
     * @return Duration.
     */
    public Duration getShutdownGracePeriod() {
        return getMillisProperty("shutdownGracePeriodMillis", 30_000L);
    }
}
