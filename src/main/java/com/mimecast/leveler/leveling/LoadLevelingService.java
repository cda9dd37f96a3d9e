package com.mimecast.leveler.leveling;

import com.mimecast.leveler.config.LoadLevelingConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Load-leveling strategy over rolling per queue metrics and adaptive throttling.
 * <p>Admission checks, in order, stopping at the first failure:
 * <ol>
 *     <li>Current load below the concurrent load ceiling.</li>
 *     <li>No active throttle window.</li>
 *     <li>Error rate over the metrics window at or below the limit, else throttle.</li>
 *     <li>Average processing time over the window at or below the limit, else throttle.</li>
 *     <li>Backlog at or below the limit, else throttle.</li>
 *     <li>At least the current throttle delay since the last admission.</li>
 * </ol>
 * <p>Per queue state lives in a concurrent map of atomic entries. A single scheduled task evicts old samples
 * and drops queues inactive beyond the retention window.
 */
public class LoadLevelingService implements LoadLevelingStrategy, Closeable {
    private static final Logger log = LogManager.getLogger(LoadLevelingService.class);

    private final LoadLevelingConfig config;
    private final Clock clock;
    private final Map<String, QueueState> states = new ConcurrentHashMap<>();

    private volatile ScheduledExecutorService scheduler;

    /**
     * Constructs a new LoadLevelingService instance.
     *
     * @param config Load-leveling configuration.
     * @param clock  Clock.
     */
    public LoadLevelingService(LoadLevelingConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Start the periodic cleanup task.
     */
    public synchronized void start() {
        if (scheduler != null) {
            return; // Already running.
        }

        long period = config.getMetricsCleanupInterval().toMillis();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "leveler-metrics-cleanup");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(() -> {
            try {
                cleanup();
            } catch (Exception e) {
                log.error("Metrics cleanup error: {}", e.getMessage(), e);
            }
        }, period, period, TimeUnit.MILLISECONDS);
        log.info("Load leveling started: maxConcurrentLoad={}, maxErrorRate={}, cleanupIntervalMillis={}",
                config.getMaxConcurrentLoad(), config.getMaxErrorRate(), period);
    }

    @Override
    public boolean shouldProcess(String queueName, int currentLoad) {
        QueueState state = state(queueName);
        long now = clock.millis();
        state.metrics.setCurrentLoad(currentLoad);

        if (currentLoad >= config.getMaxConcurrentLoad()) {
            log.debug("Rejecting {}: load {} at ceiling {}", queueName, currentLoad, config.getMaxConcurrentLoad());
            return false;
        }

        AdaptiveThrottling throttling = state.throttling;
        if (throttling.isThrottled()) {
            if (throttling.isActive(now)) {
                return false;
            }
            if (throttling.expire(now)) {
                log.info("Throttling expired for {}", queueName);
            }
        }

        long windowStart = now - config.getMetricsWindow().toMillis();
        double errorRate = state.metrics.getErrorRate(windowStart);
        if (errorRate > config.getMaxErrorRate()) {
            throttle(queueName, state, now, "error rate " + String.format("%.2f", errorRate));
            return false;
        }

        double average = state.metrics.getAverageProcessingMillis(windowStart);
        if (average > config.getMaxAverageProcessingTime().toMillis()) {
            throttle(queueName, state, now, "average processing time " + Math.round(average) + "ms");
            return false;
        }

        long backlog = state.metrics.getBacklog();
        if (backlog > config.getMaxQueueBacklog()) {
            throttle(queueName, state, now, "backlog " + backlog);
            return false;
        }

        return throttling.tryAdmit(now);
    }

    @Override
    public void recordProcessingTime(String queueName, Duration duration, boolean success) {
        QueueState state = state(queueName);
        long now = clock.millis();
        state.metrics.addSample(new ProcessingSample(now, Math.max(0L, duration.toMillis()), success));

        AdaptiveThrottling throttling = state.throttling;
        if (success) {
            if (throttling.recordSuccess() >= config.getSuccessThresholdForRecovery()) {
                throttling.resetSuccesses();
                long delay = throttling.reduce(config.getThrottleRecoveryFactor(), config.getInitialThrottleDelay().toMillis());
                log.debug("Throttle delay for {} reduced to {}ms", queueName, delay);
            }
        } else if (throttling.recordFailure() >= config.getFailureThresholdForThrottling()) {
            throttle(queueName, state, now, throttling.getConsecutiveFailures() + " consecutive failures");
        }
    }

    @Override
    public int getOptimalBatchSize(String queueName) {
        int size = config.getDefaultBatchSize();
        QueueState state = states.get(queueName);
        if (state == null) {
            return Math.max(1, size);
        }

        long now = clock.millis();
        long windowStart = now - config.getMetricsWindow().toMillis();
        double load = loadFactor(state);
        if (load > 0.8) {
            size = size / 2;
        } else if (load < 0.3) {
            size = Math.min(size * 2, config.getMaxBatchSize());
        }

        if (state.metrics.getErrorRate(windowStart) > config.getMaxErrorRate() / 2) {
            size = size / 2;
        }
        if (state.metrics.getAverageProcessingMillis(windowStart) > config.getMaxAverageProcessingTime().toMillis() / 2.0) {
            size = size / 2;
        }
        if (state.throttling.isActive(now)) {
            size = 1;
        }

        return Math.max(1, size);
    }

    @Override
    public Duration getOptimalDelay(String queueName) {
        long minDelay = config.getMinProcessingDelay().toMillis();
        long maxDelay = config.getMaxProcessingDelay().toMillis();
        QueueState state = states.get(queueName);
        if (state == null) {
            return Duration.ofMillis(minDelay);
        }

        long now = clock.millis();
        double delay = minDelay;
        double load = loadFactor(state);
        if (load > 0.5) {
            delay += maxDelay * (load - 0.5) * 2;
        }

        double errorRate = state.metrics.getErrorRate(now - config.getMetricsWindow().toMillis());
        if (errorRate > 0.1) {
            delay *= Math.min(errorRate * 10, 5.0);
        }

        if (state.throttling.isActive(now)) {
            delay = Math.max(delay, state.throttling.getCurrentThrottleDelay());
        }

        return Duration.ofMillis(Math.round(Math.min(delay, maxDelay)));
    }

    @Override
    public void updateBacklog(String queueName, long backlog) {
        state(queueName).metrics.setBacklog(backlog);
    }

    /**
     * Evict samples older than the retention window and drop inactive queues.
     *
     * @return Number of dropped queues.
     */
    public int cleanup() {
        long cutoff = clock.millis() - config.getMetricsRetention().toMillis();
        int evicted = 0;
        int dropped = 0;
        for (String queueName : states.keySet()) {
            QueueState state = states.get(queueName);
            if (state == null) {
                continue;
            }
            evicted += state.metrics.evictBefore(cutoff);

            // Removed only if still inactive at removal time.
            boolean[] removed = {false};
            states.computeIfPresent(queueName, (name, current) -> {
                if (current.metrics.getLastActivity() < cutoff) {
                    removed[0] = true;
                    return null;
                }
                return current;
            });
            if (removed[0]) {
                dropped++;
            }
        }

        if (evicted > 0 || dropped > 0) {
            log.debug("Metrics cleanup evicted {} sample(s) and dropped {} inactive queue(s)", evicted, dropped);
        }
        return dropped;
    }

    /**
     * Gets metrics for a queue.
     *
     * @param queueName Queue name.
     * @return QueueMetrics instance or null if not tracked.
     */
    public QueueMetrics getMetrics(String queueName) {
        QueueState state = states.get(queueName);
        return state != null ? state.metrics : null;
    }

    /**
     * Gets throttling state for a queue.
     *
     * @param queueName Queue name.
     * @return AdaptiveThrottling instance or null if not tracked.
     */
    public AdaptiveThrottling getThrottling(String queueName) {
        QueueState state = states.get(queueName);
        return state != null ? state.throttling : null;
    }

    /**
     * Stop the cleanup task.
     */
    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            log.info("Load leveling stopped");
        }
    }

    private void throttle(String queueName, QueueState state, long now, String cause) {
        long window = state.throttling.apply(now, config.getThrottleBackoffMultiplier(), config.getMaxThrottleDelay().toMillis());
        log.warn("Throttling {} for {}ms: {}", queueName, window, cause);
    }

    private double loadFactor(QueueState state) {
        return (double) state.metrics.getCurrentLoad() / config.getMaxConcurrentLoad();
    }

    private QueueState state(String queueName) {
        Objects.requireNonNull(queueName, "queueName");
        QueueState state = states.computeIfAbsent(queueName, name -> new QueueState(
                new QueueMetrics(config.getMaxSamples(), clock.millis()),
                new AdaptiveThrottling(config.getInitialThrottleDelay().toMillis())));
        state.metrics.touch(clock.millis());
        return state;
    }

    /**
     * Metrics and throttling of one queue.
     */
    private static final class QueueState {
        private final QueueMetrics metrics;
        private final AdaptiveThrottling throttling;

        private QueueState(QueueMetrics metrics, AdaptiveThrottling throttling) {
            this.metrics = metrics;
            this.throttling = throttling;
        }
    }
}
