package com.mimecast.leveler.leveling;

import java.time.Duration;

/**
 * Load-leveling strategy.
 * <p>Decides per queue whether processing may proceed and how fast, from rolling metrics.
 */
public interface LoadLevelingStrategy {

    /**
     * Admission decision.
     *
     * @param queueName   Queue name.
     * @param currentLoad Messages currently in flight.
     * @return true if the caller may receive and process now.
     */
    boolean shouldProcess(String queueName, int currentLoad);

    /**
     * Record the outcome of one processed message.
     *
     * @param queueName Queue name.
     * @param duration  Processing time.
     * @param success   Whether processing succeeded.
     */
    void recordProcessingTime(String queueName, Duration duration, boolean success);

    /**
     * Gets the recommended receive batch size.
     *
     * @param queueName Queue name.
     * @return Batch size, at least 1.
     */
    int getOptimalBatchSize(String queueName);

    /**
     * Gets the recommended delay before the next poll.
     *
     * @param queueName Queue name.
     * @return Delay.
     */
    Duration getOptimalDelay(String queueName);

    /**
     * Update the observed backlog of a queue.
     * <p>Fed by the embedding application, for instance a producer that wants to hold back consumers.
     * Message processors never call this, since a backlog above the limit would then stop the queue draining.
     *
     * @param queueName Queue name.
     * @param backlog   Waiting messages.
     */
    void updateBacklog(String queueName, long backlog);
}
