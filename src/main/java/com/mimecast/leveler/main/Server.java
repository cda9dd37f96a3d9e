package com.mimecast.leveler.main;

import com.mimecast.leveler.breaker.DefaultQueueCircuitBreaker;
import com.mimecast.leveler.config.LevelerConfig;
import com.mimecast.leveler.endpoints.ServiceEndpoint;
import com.mimecast.leveler.leveling.LoadLevelingService;
import com.mimecast.leveler.monitor.MessagingHealthCheck;
import com.mimecast.leveler.monitor.QueueMonitor;
import com.mimecast.leveler.processor.MessageProcessor;
import com.mimecast.leveler.queue.GsonMessageSerializer;
import com.mimecast.leveler.queue.MessagePublisher;
import com.mimecast.leveler.queue.MessageQueue;
import com.mimecast.leveler.queue.QueueRegistry;
import com.mimecast.leveler.store.QueueStore;
import com.mimecast.leveler.store.StoreFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Load leveler server.
 *
 * <p>Builds the store, queue registry, load-leveling strategy, circuit breaker and monitor from configuration,
 * starts the service endpoint and one message processor per configured queue.
 *
 * <p>The server is started by calling the static {@link #run(String)} method with the path
 * to the configuration file.
 *
 * <p>Shutdown stops processors first, all within one grace period, then the strategy, the endpoint and the store.
 */
public class Server {
    private static final Logger log = LogManager.getLogger(Server.class);

    private final LevelerConfig config;
    private final Clock clock;
    private final List<MessageProcessor<?>> processors = new ArrayList<>();

    private QueueStore store;
    private QueueRegistry registry;
    private MessagePublisher publisher;
    private LoadLevelingService strategy;
    private DefaultQueueCircuitBreaker breaker;
    private QueueMonitor monitor;
    private MessagingHealthCheck healthCheck;
    private ServiceEndpoint endpoint;
    private volatile boolean started;

    /**
     * Constructs a new Server instance.
     *
     * @param config Leveler configuration.
     * @param clock  Clock.
     */
    public Server(LevelerConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Loads configuration, starts the server and registers a shutdown hook.
     *
     * @param path Configuration file path.
     * @return Server instance.
     * @throws IOException Unable to read configuration.
     */
    public static Server run(String path) throws IOException {
        Config.initLeveler(path);
        Server server = new Server(Config.getLeveler(), Clock.systemUTC());
        server.registerShutdownHook();
        server.start();
        return server;
    }

    /**
     * Starts all components.
     */
    @SuppressWarnings({"rawtypes", "unchecked"})
    public synchronized void start() {
        if (started) {
            return;
        }

        store = StoreFactory.createStore(config.getRedis());
        registry = new QueueRegistry(store, config.getQueue(), new GsonMessageSerializer(), clock);
        publisher = new MessagePublisher(registry);

        strategy = new LoadLevelingService(config.getLoadLeveling(), clock);
        strategy.start();

        breaker = new DefaultQueueCircuitBreaker(config.getCircuitBreaker(), clock);
        monitor = new QueueMonitor(registry, breaker, config.getMonitor(), clock);
        healthCheck = new MessagingHealthCheck(registry, monitor, clock);

        // Start the service endpoint before processors so their metrics are registered.
        if (config.getEndpoint().isEnabled()) {
            try {
                endpoint = new ServiceEndpoint(healthCheck, registry);
                endpoint.start(config.getEndpoint());
            } catch (IOException e) {
                log.error("Unable to start service endpoint: {}", e.getMessage());
                endpoint = null;
            }
        }

        List<String> queueNames = config.getQueues();
        if (queueNames.isEmpty()) {
            log.warn("No queues configured, nothing to process");
        }

        for (String queueName : queueNames) {
            MessageQueue<Map> queue = registry.getQueue(queueName, Map.class);
            if (config.getQueue().isRecoverOnStartup()) {
                queue.recoverProcessing();
            }

            MessageProcessor<Map> processor = new MessageProcessor<>(queue, new LoggingConsumer(),
                    strategy, breaker, config.getProcessor(), clock);
            processor.setMonitor(monitor).start();
            processors.add(processor);
        }

        started = true;
        log.info("Server started: queues={}, endpoint={}", queueNames, endpoint != null ? endpoint.getPort() : "disabled");
    }

    /**
     * Stops all components in order.
     */
    public synchronized void shutdown() {
        if (!started) {
            return;
        }
        log.info("Service is shutting down.");

        stopProcessors(processors, config.getProcessor().getShutdownGracePeriod());
        processors.clear();

        strategy.close();

        if (endpoint != null) {
            endpoint.stop();
        }

        store.close();
        started = false;
        log.info("Shutdown complete.");
    }

    /**
     * Signals every processor to stop, then waits for all of them against one shared grace period deadline.
     *
     * @param processors  Processors to stop.
     * @param gracePeriod Total time to wait for in-flight messages.
     * @return true if every processor drained before the deadline.
     */
    static boolean stopProcessors(List<MessageProcessor<?>> processors, Duration gracePeriod) {
        long deadline = System.currentTimeMillis() + gracePeriod.toMillis();
        for (MessageProcessor<?> processor : processors) {
            processor.signalStop();
        }

        boolean drained = true;
        for (MessageProcessor<?> processor : processors) {
            try {
                drained &= processor.awaitStop(deadline);
            } catch (Exception e) {
                drained = false;
                log.error("Error stopping processor for {}: {}", processor.getQueueName(), e.getMessage());
            }
        }
        return drained;
    }

    /**
     * Registers a shutdown hook to ensure graceful termination of the server.
     */
    private void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "leveler-shutdown"));
    }

    public boolean isStarted() {
        return started;
    }

    public QueueRegistry getRegistry() {
        return registry;
    }

    public MessagePublisher getPublisher() {
        return publisher;
    }

    public MessagingHealthCheck getHealthCheck() {
        return healthCheck;
    }

    public QueueMonitor getMonitor() {
        return monitor;
    }

    public ServiceEndpoint getEndpoint() {
        return endpoint;
    }

    public List<MessageProcessor<?>> getProcessors() {
        return Collections.unmodifiableList(processors);
    }
}
