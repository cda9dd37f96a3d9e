package com.mimecast.leveler.queue;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point in time statistics for one queue.
 * <p>Counts come from the store structures, cumulative counters from the stats hash.
 */
public class QueueStatistics {

    private final String queueName;
    private final Map<MessagePriority, Long> activeCounts;
    private final long processingCount;
    private final long delayedCount;
    private final long deadLetterCount;
    private final long sent;
    private final long received;
    private final long completed;
    private final long abandoned;
    private final long deadLettered;
    private final long lastUpdated;

    /**
     * Constructs a new QueueStatistics instance.
     *
     * @param queueName       Queue name.
     * @param activeCounts    Waiting messages per priority.
     * @param processingCount Received and not yet resolved messages.
     * @param delayedCount    Delayed messages.
     * @param deadLetterCount Dead-lettered messages.
     * @param counters        Cumulative counters keyed by stats field.
     * @param lastUpdated     Read time.
     */
    public QueueStatistics(String queueName, Map<MessagePriority, Long> activeCounts, long processingCount,
                           long delayedCount, long deadLetterCount, Map<String, Long> counters, Instant lastUpdated) {
        this.queueName = queueName;
        this.activeCounts = Collections.unmodifiableMap(new EnumMap<>(activeCounts));
        this.processingCount = processingCount;
        this.delayedCount = delayedCount;
        this.deadLetterCount = deadLetterCount;
        this.sent = counters.getOrDefault(QueueKeys.SENT, 0L);
        this.received = counters.getOrDefault(QueueKeys.RECEIVED, 0L);
        this.completed = counters.getOrDefault(QueueKeys.COMPLETED, 0L);
        this.abandoned = counters.getOrDefault(QueueKeys.ABANDONED, 0L);
        this.deadLettered = counters.getOrDefault(QueueKeys.DEADLETTERED, 0L);
        this.lastUpdated = lastUpdated.toEpochMilli();
    }

    public String getQueueName() {
        return queueName;
    }

    /**
     * Gets waiting message count for a priority.
     *
     * @param priority Priority.
     * @return Count.
     */
    public long getActiveCount(MessagePriority priority) {
        return activeCounts.getOrDefault(priority, 0L);
    }

    public Map<MessagePriority, Long> getActiveCounts() {
        return activeCounts;
    }

    /**
     * Gets waiting message count across all priorities.
     *
     * @return Count.
     */
    public long getActiveTotal() {
        long total = 0;
        for (long count : activeCounts.values()) {
            total += count;
        }
        return total;
    }

    public long getProcessingCount() {
        return processingCount;
    }

    public long getDelayedCount() {
        return delayedCount;
    }

    public long getDeadLetterCount() {
        return deadLetterCount;
    }

    /**
     * Gets backlog: waiting plus delayed messages.
     *
     * @return Count.
     */
    public long getBacklog() {
        return getActiveTotal() + delayedCount;
    }

    public long getSent() {
        return sent;
    }

    public long getReceived() {
        return received;
    }

    public long getCompleted() {
        return completed;
    }

    public long getAbandoned() {
        return abandoned;
    }

    public long getDeadLettered() {
        return deadLettered;
    }

    public Instant getLastUpdated() {
        return Instant.ofEpochMilli(lastUpdated);
    }
}
