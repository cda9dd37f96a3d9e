package com.mimecast.leveler.monitor;

import com.mimecast.leveler.breaker.CircuitBreakerState;
import com.mimecast.leveler.breaker.QueueCircuitBreaker;
import com.mimecast.leveler.config.MonitorConfig;
import com.mimecast.leveler.queue.MessageQueue;
import com.mimecast.leveler.queue.QueueRegistry;
import com.mimecast.leveler.queue.QueueStatistics;
import com.mimecast.leveler.store.StoreUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Queue monitor.
 * <p>Derives a health status per queue from its statistics and breaker state and raises alerts:
 * <ul>
 *     <li>UNHEALTHY: store unreachable, queue unknown or breaker open.</li>
 *     <li>DEGRADED: breaker half open, dead-letter or backlog count above threshold.</li>
 * </ul>
 * <p>Checks are read only. Recent alerts are kept up to a configured bound.
 */
public class QueueMonitor {
    private static final Logger log = LogManager.getLogger(QueueMonitor.class);

    private final QueueRegistry registry;
    private final QueueCircuitBreaker breaker;
    private final MonitorConfig config;
    private final Clock clock;
    private final List<QueueAlertListener> listeners = new CopyOnWriteArrayList<>();
    private final Deque<QueueAlert> recentAlerts = new ConcurrentLinkedDeque<>();

    /**
     * Constructs a new QueueMonitor instance.
     *
     * @param registry Queue registry.
     * @param breaker  Circuit breaker.
     * @param config   Monitor configuration.
     * @param clock    Clock.
     */
    public QueueMonitor(QueueRegistry registry, QueueCircuitBreaker breaker, MonitorConfig config, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.breaker = Objects.requireNonNull(breaker, "breaker");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Register an alert listener.
     *
     * @param listener Listener.
     */
    public void addListener(QueueAlertListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Check the health of a queue.
     *
     * @param queueName Queue name.
     * @return QueueHealth instance.
     */
    public QueueHealth checkHealth(String queueName) {
        CircuitBreakerState breakerState = breaker.getState(queueName);
        List<String> issues = new ArrayList<>();

        MessageQueue<?> queue = registry.findQueue(queueName);
        if (queue == null) {
            issues.add("Queue not registered");
            return new QueueHealth(queueName, QueueHealthStatus.UNHEALTHY, 0, 0, 0, breakerState, issues, clock.instant());
        }

        QueueStatistics stats;
        try {
            stats = queue.getStatistics();
        } catch (StoreUnavailableException e) {
            issues.add("Store unavailable: " + e.getMessage());
            raise(queueName, QueueAlertType.CONNECTION_FAILURE, QueueAlertSeverity.CRITICAL,
                    "Cannot read queue statistics: " + e.getMessage());
            return new QueueHealth(queueName, QueueHealthStatus.UNHEALTHY, 0, 0, 0, breakerState, issues, clock.instant());
        }

        QueueHealthStatus status = QueueHealthStatus.HEALTHY;
        if (breakerState == CircuitBreakerState.OPEN) {
            status = QueueHealthStatus.UNHEALTHY;
            issues.add("Circuit breaker open");
            raise(queueName, QueueAlertType.CIRCUIT_BREAKER_OPEN, QueueAlertSeverity.ERROR, "Circuit breaker is open");
        } else if (breakerState == CircuitBreakerState.HALF_OPEN) {
            status = status.worst(QueueHealthStatus.DEGRADED);
            issues.add("Circuit breaker half open");
        }

        if (stats.getDeadLetterCount() > config.getDeadLetterWarningThreshold()) {
            status = status.worst(QueueHealthStatus.DEGRADED);
            issues.add("Dead-letter count " + stats.getDeadLetterCount() + " above " + config.getDeadLetterWarningThreshold());
            raise(queueName, QueueAlertType.DEAD_LETTER_MESSAGES, QueueAlertSeverity.WARNING,
                    stats.getDeadLetterCount() + " dead-lettered messages");
        }

        if (stats.getBacklog() > config.getBacklogWarningThreshold()) {
            status = status.worst(QueueHealthStatus.DEGRADED);
            issues.add("Backlog " + stats.getBacklog() + " above " + config.getBacklogWarningThreshold());
            raise(queueName, QueueAlertType.HIGH_MESSAGE_COUNT, QueueAlertSeverity.WARNING,
                    stats.getBacklog() + " messages waiting");
        }

        return new QueueHealth(queueName, status, stats.getActiveTotal(), stats.getProcessingCount(),
                stats.getDeadLetterCount(), breakerState, issues, clock.instant());
    }

    /**
     * Gets recent alerts, oldest first.
     *
     * @return Alerts.
     */
    public List<QueueAlert> getRecentAlerts() {
        return new ArrayList<>(recentAlerts);
    }

    /**
     * Raise an alert to the listeners and the recent alert list.
     *
     * @param queueName Queue name.
     * @param type      Alert type.
     * @param severity  Severity.
     * @param message   Description.
     */
    void raise(String queueName, QueueAlertType type, QueueAlertSeverity severity, String message) {
        QueueAlert alert = new QueueAlert(queueName, type, severity, message, clock.instant());
        log.warn("Queue alert: queue={}, type={}, severity={}, message={}", queueName, type, severity, message);

        recentAlerts.addLast(alert);
        while (recentAlerts.size() > config.getMaxRecentAlerts()) {
            recentAlerts.pollFirst();
        }

        for (QueueAlertListener listener : listeners) {
            try {
                listener.onAlert(alert);
            } catch (RuntimeException e) {
                log.warn("Alert listener failed for {}: {}", queueName, e.getMessage());
            }
        }
    }
}
