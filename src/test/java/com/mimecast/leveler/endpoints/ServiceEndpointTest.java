package com.mimecast.leveler.endpoints;

import com.google.gson.Gson;
import com.mimecast.leveler.MutableClock;
import com.mimecast.leveler.breaker.DefaultQueueCircuitBreaker;
import com.mimecast.leveler.config.EndpointConfig;
import com.mimecast.leveler.config.MonitorConfig;
import com.mimecast.leveler.config.QueueConfig;
import com.mimecast.leveler.metrics.LevelerMetrics;
import com.mimecast.leveler.metrics.MetricsRegistry;
import com.mimecast.leveler.monitor.MessagingHealthCheck;
import com.mimecast.leveler.monitor.QueueMonitor;
import com.mimecast.leveler.queue.GsonMessageSerializer;
import com.mimecast.leveler.queue.MessageQueue;
import com.mimecast.leveler.queue.QueueRegistry;
import com.mimecast.leveler.store.InMemoryQueueStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the monitoring service endpoint.
 */
@Execution(ExecutionMode.SAME_THREAD)
class ServiceEndpointTest {

    private InMemoryQueueStore store;
    private QueueRegistry registry;
    private DefaultQueueCircuitBreaker breaker;
    private ServiceEndpoint endpoint;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() throws IOException {
        MutableClock clock = new MutableClock();
        store = new InMemoryQueueStore();
        registry = new QueueRegistry(store, new QueueConfig(new HashMap<>()), new GsonMessageSerializer(), clock);
        breaker = new DefaultQueueCircuitBreaker(1, Duration.ofMinutes(1), clock);
        QueueMonitor monitor = new QueueMonitor(registry, breaker, new MonitorConfig(new HashMap<>()), clock);

        Map<String, Object> map = new HashMap<>();
        map.put("port", 0);
        endpoint = new ServiceEndpoint(new MessagingHealthCheck(registry, monitor, clock), registry);
        endpoint.start(new EndpointConfig(map));
        httpClient = HttpClient.newHttpClient();
    }

    @AfterEach
    void tearDown() {
        endpoint.stop();
        store.close();
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + endpoint.getPort() + path))
                .timeout(Duration.ofSeconds(5))
                .GET()
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void testBindsEphemeralPort() {
        assertTrue(endpoint.getPort() > 0);
        assertNotNull(MetricsRegistry.getPrometheusRegistry());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testHealthyReport() throws IOException, InterruptedException {
        registry.getQueue("orders", String.class);

        HttpResponse<String> response = get("/health");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
        Map<String, Object> body = new Gson().fromJson(response.body(), Map.class);
        assertEquals("HEALTHY", body.get("status"));
        Map<String, Object> report = (Map<String, Object>) body.get("report");
        assertEquals(1.0, report.get("totalQueues"));
        assertEquals(Boolean.TRUE, report.get("storeReachable"));
    }

    @Test
    void testUnhealthyReturns503() throws IOException, InterruptedException {
        registry.getQueue("orders", String.class);
        breaker.recordFailure("orders", new IllegalStateException("down"));

        HttpResponse<String> response = get("/health");

        assertEquals(503, response.statusCode());
        assertTrue(response.body().contains("UNHEALTHY"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testQueueStatistics() throws IOException, InterruptedException {
        MessageQueue<String> queue = registry.getQueue("orders", String.class);
        queue.send("one");
        queue.send("two");

        HttpResponse<String> response = get("/queues");

        assertEquals(200, response.statusCode());
        List<Map<String, Object>> body = new Gson().fromJson(response.body(), List.class);
        assertEquals(1, body.size());
        assertEquals("orders", body.get(0).get("queueName"));
        assertEquals(2.0, body.get(0).get("sent"));
    }

    @Test
    void testQueueStatisticsStoreOutage() throws IOException, InterruptedException {
        registry.getQueue("orders", String.class);
        store.setAvailable(false);

        HttpResponse<String> response = get("/queues");

        assertEquals(503, response.statusCode());
        assertTrue(response.body().startsWith("Store unavailable"));
    }

    @Test
    void testPrometheusScrape() throws IOException, InterruptedException {
        LevelerMetrics.incrementSent("orders", 3);

        HttpResponse<String> response = get("/metrics/prometheus");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("leveler_messages_sent_total"));
        assertTrue(response.body().contains("jvm_memory_used_bytes"));
    }

    @Test
    void testStopUnregistersRegistry() {
        endpoint.stop();

        assertNull(MetricsRegistry.getPrometheusRegistry());
        assertEquals(-1, endpoint.getPort());
    }
}
