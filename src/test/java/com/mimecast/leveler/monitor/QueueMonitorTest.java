package com.mimecast.leveler.monitor;

import com.mimecast.leveler.MutableClock;
import com.mimecast.leveler.breaker.CircuitBreakerState;
import com.mimecast.leveler.breaker.DefaultQueueCircuitBreaker;
import com.mimecast.leveler.config.MonitorConfig;
import com.mimecast.leveler.config.QueueConfig;
import com.mimecast.leveler.queue.GsonMessageSerializer;
import com.mimecast.leveler.queue.MessageQueue;
import com.mimecast.leveler.queue.QueueRegistry;
import com.mimecast.leveler.store.InMemoryQueueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueueMonitorTest {

    private static final String QUEUE = "orders";

    private MutableClock clock;
    private InMemoryQueueStore store;
    private QueueRegistry registry;
    private DefaultQueueCircuitBreaker breaker;
    private QueueMonitor monitor;
    private MessageQueue<String> queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        store = new InMemoryQueueStore();
        registry = new QueueRegistry(store, new QueueConfig(new HashMap<>()), new GsonMessageSerializer(), clock);
        breaker = new DefaultQueueCircuitBreaker(2, Duration.ofMinutes(1), clock);

        Map<String, Object> map = new HashMap<>();
        map.put("deadLetterWarningThreshold", 1);
        map.put("backlogWarningThreshold", 3);
        map.put("maxRecentAlerts", 2);
        monitor = new QueueMonitor(registry, breaker, new MonitorConfig(map), clock);
        queue = registry.getQueue(QUEUE, String.class);
    }

    @Test
    void testHealthyQueue() {
        queue.send("one");
        queue.receive(1, Duration.ofMinutes(1));
        queue.send("two");

        QueueHealth health = monitor.checkHealth(QUEUE);

        assertEquals(QueueHealthStatus.HEALTHY, health.getStatus());
        assertTrue(health.isHealthy());
        assertEquals(1, health.getActiveCount());
        assertEquals(1, health.getProcessingCount());
        assertEquals(CircuitBreakerState.CLOSED, health.getCircuitBreakerState());
        assertTrue(health.getIssues().isEmpty());
        assertEquals(clock.instant(), health.getCheckedAt());
        assertTrue(monitor.getRecentAlerts().isEmpty());
    }

    @Test
    void testUnregisteredQueueIsUnhealthy() {
        QueueHealth health = monitor.checkHealth("missing");

        assertEquals(QueueHealthStatus.UNHEALTHY, health.getStatus());
        assertFalse(health.getIssues().isEmpty());
    }

    @Test
    void testBacklogDegrades() {
        for (int i = 0; i < 4; i++) {
            queue.send("message-" + i);
        }

        QueueHealth health = monitor.checkHealth(QUEUE);

        assertEquals(QueueHealthStatus.DEGRADED, health.getStatus());
        QueueAlert alert = monitor.getRecentAlerts().get(0);
        assertEquals(QueueAlertType.HIGH_MESSAGE_COUNT, alert.getType());
        assertEquals(QueueAlertSeverity.WARNING, alert.getSeverity());
        assertEquals(QUEUE, alert.getQueueName());
    }

    @Test
    void testDeadLettersDegrade() {
        queue.send("one");
        queue.send("two");
        queue.deadLetter(queue.receive(1, Duration.ofMinutes(1)).get(0), "test");
        queue.deadLetter(queue.receive(1, Duration.ofMinutes(1)).get(0), "test");

        QueueHealth health = monitor.checkHealth(QUEUE);

        assertEquals(QueueHealthStatus.DEGRADED, health.getStatus());
        assertEquals(2, health.getDeadLetterCount());
        assertEquals(QueueAlertType.DEAD_LETTER_MESSAGES, monitor.getRecentAlerts().get(0).getType());
    }

    @Test
    void testOpenBreakerIsUnhealthy() {
        breaker.recordFailure(QUEUE, new IllegalStateException("down"));
        breaker.recordFailure(QUEUE, new IllegalStateException("down"));

        QueueHealth health = monitor.checkHealth(QUEUE);

        assertEquals(QueueHealthStatus.UNHEALTHY, health.getStatus());
        assertEquals(CircuitBreakerState.OPEN, health.getCircuitBreakerState());
        QueueAlert alert = monitor.getRecentAlerts().get(0);
        assertEquals(QueueAlertType.CIRCUIT_BREAKER_OPEN, alert.getType());
        assertEquals(QueueAlertSeverity.ERROR, alert.getSeverity());
    }

    @Test
    void testHalfOpenBreakerDegrades() {
        breaker.recordFailure(QUEUE, null);
        breaker.recordFailure(QUEUE, null);
        clock.advance(Duration.ofMinutes(2));
        assertTrue(breaker.canExecute(QUEUE));

        assertEquals(QueueHealthStatus.DEGRADED, monitor.checkHealth(QUEUE).getStatus());
    }

    @Test
    void testStoreOutageRaisesConnectionFailure() {
        store.setAvailable(false);

        QueueHealth health = monitor.checkHealth(QUEUE);

        assertEquals(QueueHealthStatus.UNHEALTHY, health.getStatus());
        QueueAlert alert = monitor.getRecentAlerts().get(0);
        assertEquals(QueueAlertType.CONNECTION_FAILURE, alert.getType());
        assertEquals(QueueAlertSeverity.CRITICAL, alert.getSeverity());
    }

    @Test
    void testListenersAndRecentAlertBound() {
        List<QueueAlert> received = new ArrayList<>();
        monitor.addListener(received::add);
        monitor.addListener(alert -> {
            throw new IllegalStateException("listener broken");
        });
        store.setAvailable(false);

        for (int i = 0; i < 3; i++) {
            monitor.checkHealth(QUEUE);
        }

        assertEquals(3, received.size());
        assertEquals(2, monitor.getRecentAlerts().size());
    }

    @Test
    void testWorstStatus() {
        assertEquals(QueueHealthStatus.DEGRADED, QueueHealthStatus.HEALTHY.worst(QueueHealthStatus.DEGRADED));
        assertEquals(QueueHealthStatus.UNHEALTHY, QueueHealthStatus.UNHEALTHY.worst(QueueHealthStatus.DEGRADED));
        assertEquals(QueueHealthStatus.HEALTHY, QueueHealthStatus.HEALTHY.worst(QueueHealthStatus.HEALTHY));
    }
}
