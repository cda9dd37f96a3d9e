package com.mimecast.leveler.config;

import com.mimecast.leveler.queue.BackoffType;
import com.mimecast.leveler.queue.RetryPolicy;

import java.util.Map;

/**
 * Message queue configuration.
 *
 * <p>This class provides type safe access to the {@code queue} section shared by all queues.
 */
public class QueueConfig extends BasicConfig {

    /**
     * Constructs a new QueueConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public QueueConfig(Map map) {
        super(map);
    }

    /**
     * Gets the delivery count at which an abandoned message is dead-lettered.
     *
     * @return Max delivery count.
     */
    public int getMaxDeliveryCount() {
        return Math.toIntExact(getLongProperty("maxDeliveryCount", 5L));
    }

    /**
     * Gets the maximum number of delayed messages promoted per receive.
     *
     * @return Sweep size.
     */
    public int getPromotionBatchSize() {
        return Math.toIntExact(getLongProperty("promotionBatchSize", 32L));
    }

    /**
     * Whether processing lists are moved back to their priority lists on startup.
     *
     * @return Boolean.
     */
    public boolean isRecoverOnStartup() {
        return getBooleanProperty("recoverOnStartup", false);
    }

    /**
     * Gets the redelivery backoff policy.
     *
     * @return RetryPolicy instance.
     */
    public RetryPolicy getRetryPolicy() {
        BasicConfig retry = new BasicConfig(getMapProperty("retryPolicy"));
        return new RetryPolicy(
                BackoffType.fromString(retry.getStringProperty("backoffType", "exponential")),
                retry.getMillisProperty("initialDelayMillis", 1000L),
                retry.getDoubleProperty("multiplier", 2.0),
                retry.getMillisProperty("maxDelayMillis", 300_000L)
        );
    }
}
