package com.mimecast.leveler.endpoints;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.mimecast.leveler.config.EndpointConfig;
import com.mimecast.leveler.metrics.MetricsRegistry;
import com.mimecast.leveler.monitor.MessagingHealthCheck;
import com.mimecast.leveler.monitor.QueueHealthStatus;
import com.mimecast.leveler.queue.MessageQueue;
import com.mimecast.leveler.queue.QueueRegistry;
import com.mimecast.leveler.queue.QueueStatistics;
import com.mimecast.leveler.store.StoreUnavailableException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Monitoring service endpoint.
 *
 * <p>Embedded HTTP server exposing:
 * <ul>
 *     <li>{@code /health} aggregated queue health, 200 when healthy or degraded and 503 when unhealthy.</li>
 *     <li>{@code /queues} statistics of every registered queue.</li>
 *     <li>{@code /metrics/prometheus} Prometheus scrape output.</li>
 * </ul>
 */
public class ServiceEndpoint {
    private static final Logger log = LogManager.getLogger(ServiceEndpoint.class);

    private final MessagingHealthCheck healthCheck;
    private final QueueRegistry registry;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    protected HttpServer server;
    private PrometheusMeterRegistry prometheusRegistry;
    private JvmGcMetrics jvmGcMetrics;
    protected final long startTime = System.currentTimeMillis();

    /**
     * Constructs a new ServiceEndpoint instance.
     *
     * @param healthCheck Messaging health check.
     * @param registry    Queue registry.
     */
    public ServiceEndpoint(MessagingHealthCheck healthCheck, QueueRegistry registry) {
        this.healthCheck = Objects.requireNonNull(healthCheck, "healthCheck");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Starts the embedded HTTP server.
     * <p>Creates the Prometheus registry, registers it globally and binds JVM metrics.
     *
     * @param config Endpoint configuration.
     * @throws IOException If the server cannot bind.
     */
    public void start(EndpointConfig config) throws IOException {
        prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        MetricsRegistry.register(prometheusRegistry);
        bindJvmMetrics();

        server = HttpServer.create(new InetSocketAddress(config.getPort(8080)), 10);
        createContexts();
        server.start();
    }

    /**
     * Gets the bound port.
     *
     * @return Port, or -1 if not started.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    /**
     * Stops the server and closes the registry.
     */
    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (jvmGcMetrics != null) {
            jvmGcMetrics.close();
            jvmGcMetrics = null;
        }
        if (prometheusRegistry != null) {
            if (MetricsRegistry.getPrometheusRegistry() == prometheusRegistry) {
                MetricsRegistry.register(null);
            }
            prometheusRegistry.close();
            prometheusRegistry = null;
        }
        log.info("Service endpoint stopped");
    }

    /**
     * Binds standard JVM metrics to the Prometheus registry.
     */
    private void bindJvmMetrics() {
        new JvmMemoryMetrics().bindTo(prometheusRegistry);
        jvmGcMetrics = new JvmGcMetrics();
        jvmGcMetrics.bindTo(prometheusRegistry);
        new JvmThreadMetrics().bindTo(prometheusRegistry);
        new ProcessorMetrics().bindTo(prometheusRegistry);
    }

    /**
     * Creates and registers HTTP context handlers.
     */
    protected void createContexts() {
        int port = getPort();

        server.createContext("/health", this::handleHealth);
        log.info("Health available at http://localhost:{}/health", port);

        server.createContext("/queues", this::handleQueues);
        log.info("Queue statistics available at http://localhost:{}/queues", port);

        server.createContext("/metrics/prometheus", this::handlePrometheus);
        log.info("Prometheus data available at http://localhost:{}/metrics/prometheus", port);
    }

    /**
     * Handles requests for aggregated health.
     *
     * @param exchange The HTTP exchange object.
     * @throws IOException If an I/O error occurs.
     */
    protected void handleHealth(HttpExchange exchange) throws IOException {
        log.debug("Handling /health: method={}, uri={}, remote={}",
                exchange.getRequestMethod(), exchange.getRequestURI(), exchange.getRemoteAddress());

        MessagingHealthCheck.Report report = healthCheck.check();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", report.getStatus());
        response.put("uptimeMillis", System.currentTimeMillis() - startTime);
        response.put("report", report);

        int code = report.getStatus() == QueueHealthStatus.UNHEALTHY ? 503 : 200;
        sendResponse(exchange, code, "application/json; charset=utf-8", gson.toJson(response));
    }

    /**
     * Handles requests for queue statistics.
     *
     * @param exchange The HTTP exchange object.
     * @throws IOException If an I/O error occurs.
     */
    protected void handleQueues(HttpExchange exchange) throws IOException {
        log.debug("Handling /queues: method={}, uri={}, remote={}",
                exchange.getRequestMethod(), exchange.getRequestURI(), exchange.getRemoteAddress());

        List<QueueStatistics> statistics = new ArrayList<>();
        try {
            for (String name : registry.getQueueNames()) {
                MessageQueue<?> queue = registry.findQueue(name);
                if (queue != null) {
                    statistics.add(queue.getStatistics());
                }
            }
        } catch (StoreUnavailableException e) {
            sendError(exchange, 503, "Store unavailable: " + e.getMessage());
            return;
        }

        sendResponse(exchange, 200, "application/json; charset=utf-8", gson.toJson(statistics));
    }

    /**
     * Handles requests for metrics in Prometheus exposition format.
     *
     * @param exchange The HTTP exchange object.
     * @throws IOException If an I/O error occurs.
     */
    protected void handlePrometheus(HttpExchange exchange) throws IOException {
        log.debug("Handling /metrics/prometheus: method={}, uri={}, remote={}",
                exchange.getRequestMethod(), exchange.getRequestURI(), exchange.getRemoteAddress());
        sendResponse(exchange, 200, "text/plain; charset=utf-8", prometheusRegistry.scrape());
    }

    /**
     * Sends an HTTP response.
     *
     * @param exchange    The HTTP exchange object.
     * @param code        The HTTP status code.
     * @param contentType The content type of the response.
     * @param response    The response body as a string.
     * @throws IOException If an I/O error occurs.
     */
    protected void sendResponse(HttpExchange exchange, int code, String contentType, String response) throws IOException {
        byte[] responseBytes = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(code, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
        log.trace("Sent response: status={}, contentType={}, bytes={}", code, contentType, responseBytes.length);
    }

    /**
     * Sends an error HTTP response.
     *
     * @param exchange The HTTP exchange object.
     * @param code     The HTTP error code.
     * @param message  The error message.
     * @throws IOException If an I/O error occurs.
     */
    protected void sendError(HttpExchange exchange, int code, String message) throws IOException {
        byte[] responseBytes = message.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(code, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
        log.debug("Sent error response: status={}, bytes={}", code, responseBytes.length);
    }
}
