package com.mimecast.leveler.breaker;

import com.mimecast.leveler.config.CircuitBreakerConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Failure count circuit breaker, one lazily created entry per queue.
 * <ul>
 *     <li>CLOSED: always permits. Failures count up, a success resets the count.
 *     At the threshold the breaker opens until now + open duration.</li>
 *     <li>OPEN: permits only once the next attempt time has passed, moving to HALF_OPEN.</li>
 *     <li>HALF_OPEN: permits every call. A success closes, a failure reopens.</li>
 * </ul>
 * <p>HALF_OPEN does not limit concurrent trial calls; callers serialize them if they need to.
 */
public class DefaultQueueCircuitBreaker implements QueueCircuitBreaker {
    private static final Logger log = LogManager.getLogger(DefaultQueueCircuitBreaker.class);

    private final int failureThreshold;
    private final Duration openDuration;
    private final Clock clock;
    private final Map<String, BreakerEntry> entries = new ConcurrentHashMap<>();

    /**
     * Constructs a new DefaultQueueCircuitBreaker instance.
     *
     * @param config Circuit breaker configuration.
     * @param clock  Clock.
     */
    public DefaultQueueCircuitBreaker(CircuitBreakerConfig config, Clock clock) {
        this(config.getFailureThreshold(), config.getOpenDuration(), clock);
    }

    /**
     * Constructs a new DefaultQueueCircuitBreaker instance.
     *
     * @param failureThreshold Failures that open the breaker.
     * @param openDuration     Time an open breaker rejects calls.
     * @param clock            Clock.
     */
    public DefaultQueueCircuitBreaker(int failureThreshold, Duration openDuration, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("Failure threshold must be at least 1: " + failureThreshold);
        }
        this.failureThreshold = failureThreshold;
        this.openDuration = Objects.requireNonNull(openDuration, "openDuration");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public boolean canExecute(String queueName) {
        BreakerEntry entry = entry(queueName);
        switch (entry.getState()) {
            case OPEN:
                if (clock.millis() > entry.getNextAttemptTime()) {
                    if (entry.state().compareAndSet(CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN)) {
                        log.info("Circuit breaker for {} transitioning from OPEN to HALF_OPEN", queueName);
                    }
                    return true;
                }
                return false;

            case HALF_OPEN:
            case CLOSED:
            default:
                return true;
        }
    }

    @Override
    public void recordSuccess(String queueName) {
        BreakerEntry entry = entry(queueName);
        entry.successes().incrementAndGet();

        CircuitBreakerState current = entry.getState();
        if (current == CircuitBreakerState.HALF_OPEN) {
            if (entry.state().compareAndSet(CircuitBreakerState.HALF_OPEN, CircuitBreakerState.CLOSED)) {
                entry.failures().set(0);
                log.info("Circuit breaker for {} closed after successful trial call", queueName);
            }
        } else if (current == CircuitBreakerState.CLOSED) {
            entry.failures().set(0);
        }
    }

    @Override
    public void recordFailure(String queueName, Throwable cause) {
        BreakerEntry entry = entry(queueName);
        int failures = entry.failures().incrementAndGet();
        String reason = cause != null ? cause.getClass().getSimpleName() + ": " + cause.getMessage() : "unspecified";

        CircuitBreakerState current = entry.getState();
        if (current == CircuitBreakerState.HALF_OPEN) {
            if (entry.state().compareAndSet(CircuitBreakerState.HALF_OPEN, CircuitBreakerState.OPEN)) {
                entry.nextAttempt().set(clock.millis() + openDuration.toMillis());
                log.warn("Circuit breaker for {} reopened after failed trial call: {}", queueName, reason);
            }
        } else if (current == CircuitBreakerState.CLOSED && failures >= failureThreshold) {
            entry.nextAttempt().set(clock.millis() + openDuration.toMillis());
            if (entry.state().compareAndSet(CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN)) {
                log.warn("Circuit breaker for {} opened after {} failures for {}ms: {}",
                        queueName, failures, openDuration.toMillis(), reason);
            }
        }
    }

    @Override
    public CircuitBreakerState getState(String queueName) {
        BreakerEntry entry = entries.get(queueName);
        return entry != null ? entry.getState() : CircuitBreakerState.CLOSED;
    }

    @Override
    public void reset(String queueName) {
        if (entries.remove(queueName) != null) {
            log.info("Circuit breaker for {} reset", queueName);
        }
    }

    /**
     * Gets the entry of a queue.
     *
     * @param queueName Queue name.
     * @return BreakerEntry instance or null if never used.
     */
    public BreakerEntry getEntry(String queueName) {
        return entries.get(queueName);
    }

    private BreakerEntry entry(String queueName) {
        Objects.requireNonNull(queueName, "queueName");
        return entries.computeIfAbsent(queueName, name -> new BreakerEntry());
    }
}
