package com.mimecast.leveler.monitor;

import com.mimecast.leveler.queue.QueueRegistry;
import com.mimecast.leveler.store.QueueStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated messaging health.
 * <p>Checks every registered queue. The worst queue status wins and an unreachable store is unhealthy.
 */
public class MessagingHealthCheck {

    private final QueueRegistry registry;
    private final QueueMonitor monitor;
    private final Clock clock;

    /**
     * Constructs a new MessagingHealthCheck instance.
     *
     * @param registry Queue registry.
     * @param monitor  Queue monitor.
     * @param clock    Clock.
     */
    public MessagingHealthCheck(QueueRegistry registry, QueueMonitor monitor, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Run the check.
     *
     * @return Report instance.
     */
    public Report check() {
        boolean storeReachable = registry.getStore().ping();
        QueueHealthStatus status = storeReachable ? QueueHealthStatus.HEALTHY : QueueHealthStatus.UNHEALTHY;

        List<QueueHealth> queues = new ArrayList<>();
        for (String queueName : registry.getQueueNames()) {
            QueueHealth health = monitor.checkHealth(queueName);
            queues.add(health);
            status = status.worst(health.getStatus());
        }

        return new Report(status, storeReachable, queues, clock.instant());
    }

    /**
     * Health report.
     */
    public static class Report {
        private final QueueHealthStatus status;
        private final boolean storeReachable;
        private final int healthyQueues;
        private final int totalQueues;
        private final List<QueueHealth> queues;
        private final long checkedAt;

        Report(QueueHealthStatus status, boolean storeReachable, List<QueueHealth> queues, Instant checkedAt) {
            this.status = status;
            this.storeReachable = storeReachable;
            this.queues = queues;
            this.totalQueues = queues.size();
            this.healthyQueues = (int) queues.stream().filter(QueueHealth::isHealthy).count();
            this.checkedAt = checkedAt.toEpochMilli();
        }

        public QueueHealthStatus getStatus() {
            return status;
        }

        public boolean isStoreReachable() {
            return storeReachable;
        }

        public int getHealthyQueues() {
            return healthyQueues;
        }

        public int getTotalQueues() {
            return totalQueues;
        }

        public List<QueueHealth> getQueues() {
            return Collections.unmodifiableList(queues);
        }

        public Instant getCheckedAt() {
            return Instant.ofEpochMilli(checkedAt);
        }
    }
}
