package com.mimecast.leveler.config;

import java.time.Duration;
import java.util.Map;

/**
 * Load leveling configuration.
 *
 * <p>This class provides type safe access to the {@code loadLeveling} section.
 * <p>Defaults allow 100 concurrent handlers, a 10% error rate and a 1000 message backlog.
 */
public class LoadLevelingConfig extends BasicConfig {

    /**
     * Constructs a new LoadLevelingConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public LoadLevelingConfig(Map map) {
        super(map);
    }

    public int getMaxConcurrentLoad() {
        return Math.toIntExact(getLongProperty("maxConcurrentLoad", 100L));
    }

    public double getMaxErrorRate() {
        return getDoubleProperty("maxErrorRate", 0.1);
    }

    public Duration getMaxAverageProcessingTime() {
        return getMillisProperty("maxAverageProcessingTimeMillis", 30_000L);
    }

    public long getMaxQueueBacklog() {
        return getLongProperty("maxQueueBacklog", 1000L);
    }

    public int getDefaultBatchSize() {
        return Math.toIntExact(getLongProperty("defaultBatchSize", 10L));
    }

    public int getMaxBatchSize() {
        return Math.toIntExact(getLongProperty("maxBatchSize", 50L));
    }

    public Duration getMinProcessingDelay() {
        return getMillisProperty("minProcessingDelayMillis", 100L);
    }

    public Duration getMaxProcessingDelay() {
        return getMillisProperty("maxProcessingDelayMillis", 30_000L);
    }

    public Duration getInitialThrottleDelay() {
        return getMillisProperty("initialThrottleDelayMillis", 1000L);
    }

    public Duration getMaxThrottleDelay() {
        return getMillisProperty("maxThrottleDelayMillis", 300_000L);
    }

    public double getThrottleBackoffMultiplier() {
        return getDoubleProperty("throttleBackoffMultiplier", 2.0);
    }

    public double getThrottleRecoveryFactor() {
        return getDoubleProperty("throttleRecoveryFactor", 1.5);
    }

    public int getFailureThresholdForThrottling() {
        return Math.toIntExact(getLongProperty("failureThresholdForThrottling", 5L));
    }

    public int getSuccessThresholdForRecovery() {
        return Math.toIntExact(getLongProperty("successThresholdForRecovery", 10L));
    }

    /**
     * Gets the window over which error rate and average processing time are computed.
     *
     * @return Duration.
     */
    public Duration getMetricsWindow() {
        return getMillisProperty("metricsWindowMillis", 600_000L);
    }

    /**
     * Gets how long samples and inactive queue state are retained.
     *
     * @return Duration.
     */
    public Duration getMetricsRetention() {
        return getMillisProperty("metricsRetentionMillis", 3_600_000L);
    }

    public Duration getMetricsCleanupInterval() {
        return getMillisProperty("metricsCleanupIntervalMillis", 300_000L);
    }

    /**
     * Gets the upper bound of samples kept per queue.
     *
     * @return Sample count.
     */
    public int getMaxSamples() {
        return Math.toIntExact(getLongProperty("maxSamples", 1000L));
    }
}
