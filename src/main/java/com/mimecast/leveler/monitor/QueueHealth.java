package com.mimecast.leveler.monitor;

import com.mimecast.leveler.breaker.CircuitBreakerState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Health of one queue.
 * <p>Plain fields so the endpoint can serialize it with Gson.
 */
public class QueueHealth {

    private final String queueName;
    private final QueueHealthStatus status;
    private final long activeCount;
    private final long processingCount;
    private final long deadLetterCount;
    private final CircuitBreakerState circuitBreakerState;
    private final List<String> issues;
    private final long checkedAt;

    /**
     * Constructs a new QueueHealth instance.
     *
     * @param queueName           Queue name.
     * @param status              Status.
     * @param activeCount         Waiting messages across the priority lists.
     * @param processingCount     In-flight messages.
     * @param deadLetterCount     Dead-lettered messages.
     * @param circuitBreakerState Breaker state.
     * @param issues              Issue descriptions.
     * @param checkedAt           Check time.
     */
    public QueueHealth(String queueName, QueueHealthStatus status, long activeCount, long processingCount,
                       long deadLetterCount, CircuitBreakerState circuitBreakerState, List<String> issues, Instant checkedAt) {
        this.queueName = queueName;
        this.status = status;
        this.activeCount = activeCount;
        this.processingCount = processingCount;
        this.deadLetterCount = deadLetterCount;
        this.circuitBreakerState = circuitBreakerState;
        this.issues = new ArrayList<>(issues);
        this.checkedAt = checkedAt.toEpochMilli();
    }

    public String getQueueName() {
        return queueName;
    }

    public QueueHealthStatus getStatus() {
        return status;
    }

    public boolean isHealthy() {
        return status == QueueHealthStatus.HEALTHY;
    }

    public long getActiveCount() {
        return activeCount;
    }

    public long getProcessingCount() {
        return processingCount;
    }

    public long getDeadLetterCount() {
        return deadLetterCount;
    }

    public CircuitBreakerState getCircuitBreakerState() {
        return circuitBreakerState;
    }

    public List<String> getIssues() {
        return Collections.unmodifiableList(issues);
    }

    public Instant getCheckedAt() {
        return Instant.ofEpochMilli(checkedAt);
    }
}
