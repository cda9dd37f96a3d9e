package com.mimecast.leveler.processor;

import com.mimecast.leveler.breaker.QueueCircuitBreaker;
import com.mimecast.leveler.config.ProcessorConfig;
import com.mimecast.leveler.leveling.LoadLevelingStrategy;
import com.mimecast.leveler.metrics.LevelerMetrics;
import com.mimecast.leveler.monitor.QueueMonitor;
import com.mimecast.leveler.queue.MessageQueue;
import com.mimecast.leveler.queue.QueueMessage;
import com.mimecast.leveler.queue.QueueStatistics;
import com.mimecast.leveler.queue.StoreMessageQueue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background message processor for one queue.
 * <p>One polling thread asks the strategy and the breaker for permission, receives a batch sized to the free
 * concurrency slots and hands each message to a handler thread. A semaphore of {@code maxConcurrentMessages}
 * permits bounds the handlers; the polling thread only waits on it before dispatch, never on a handler.
 * <p>Each message resolves to:
 * <ul>
 *     <li>complete, when the consumer returns true;</li>
 *     <li>dead-letter, when it is older than the max age, reached the max delivery count or failed permanently;</li>
 *     <li>abandon, for any other failure.</li>
 * </ul>
 * <p>A separate health task logs warnings from queue statistics and runs monitor checks. It only reads.
 * <p>On stop, polling ends immediately and in-flight handlers get the shutdown grace period to finish.
 * Messages still in flight after that remain in the processing list. {@link #signalStop()} and
 * {@link #awaitStop(long)} split this in two so several processors can share one deadline.
 *
 * @param <T> Body type.
 */
public class MessageProcessor<T> {
    private static final Logger log = LogManager.getLogger(MessageProcessor.class);

    /**
     * Dead-letter reason for messages older than the max age.
     */
    public static final String REASON_MAX_AGE = "message exceeded max age";

    private static final long PERMIT_POLL_MILLIS = 100L;

    private final String queueName;
    private final MessageQueue<T> queue;
    private final MessageConsumer<T> consumer;
    private final LoadLevelingStrategy strategy;
    private final QueueCircuitBreaker breaker;
    private final ProcessorConfig config;
    private final Clock clock;
    private final int maxConcurrent;
    private final Semaphore slots;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger processed = new AtomicInteger();
    private volatile CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile QueueMonitor monitor;
    private Thread pollThread;
    private ExecutorService handlers;
    private ScheduledExecutorService healthScheduler;

    /**
     * Constructs a new MessageProcessor instance.
     *
     * @param queue    Queue to consume.
     * @param consumer Message handler.
     * @param strategy Load-leveling strategy.
     * @param breaker  Circuit breaker.
     * @param config   Processor configuration.
     * @param clock    Clock.
     */
    public MessageProcessor(MessageQueue<T> queue, MessageConsumer<T> consumer, LoadLevelingStrategy strategy,
                            QueueCircuitBreaker breaker, ProcessorConfig config, Clock clock) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.queueName = queue.getName();
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.breaker = Objects.requireNonNull(breaker, "breaker");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxConcurrent = config.getMaxConcurrentMessages();
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("Max concurrent messages must be at least 1: " + maxConcurrent);
        }
        this.slots = new Semaphore(maxConcurrent);
    }

    /**
     * Set a monitor to run alert checks from the health task.
     *
     * @param monitor QueueMonitor instance.
     * @return Self.
     */
    public MessageProcessor<T> setMonitor(QueueMonitor monitor) {
        this.monitor = monitor;
        return this;
    }

    /**
     * Start polling and the health task.
     */
    public synchronized void start() {
        if (pollThread != null || !running.compareAndSet(false, true)) {
            return; // Already running or not yet awaited.
        }

        stopSignal = new CountDownLatch(1);
        handlers = Executors.newCachedThreadPool(threadFactory("leveler-handler-" + queueName));
        healthScheduler = Executors.newSingleThreadScheduledExecutor(threadFactory("leveler-health-" + queueName));

        long interval = config.getHealthCheckInterval().toMillis();
        healthScheduler.scheduleAtFixedRate(this::checkHealth, interval, interval, TimeUnit.MILLISECONDS);

        pollThread = threadFactory("leveler-poll-" + queueName).newThread(this::pollLoop);
        pollThread.start();

        LevelerMetrics.initialize(queueName);
        log.info("Message processor started: queue={}, maxConcurrentMessages={}, maxDeliveryCount={}, healthCheckIntervalMillis={}",
                queueName, maxConcurrent, config.getMaxDeliveryCount(), interval);
    }

    /**
     * Stop polling and wait up to the shutdown grace period for in-flight messages.
     *
     * @return true if every in-flight message finished within the grace period.
     */
    public boolean stop() {
        long deadline = System.currentTimeMillis() + config.getShutdownGracePeriod().toMillis();
        signalStop();
        return awaitStop(deadline);
    }

    /**
     * Stop admitting poll iterations. Returns without waiting.
     */
    public synchronized void signalStop() {
        if (running.compareAndSet(true, false)) {
            stopSignal.countDown();
        }
    }

    /**
     * Wait until in-flight messages finish or the deadline passes, then release the threads.
     * <p>Signals stop first if that has not happened yet.
     *
     * @param deadline Epoch millis, as {@link System#currentTimeMillis()}.
     * @return true if every in-flight message finished before the deadline.
     */
    public synchronized boolean awaitStop(long deadline) {
        if (pollThread == null) {
            return true; // Never started or already stopped.
        }
        signalStop();

        try {
            pollThread.join(Math.max(1L, deadline - System.currentTimeMillis()));
            while (slots.availablePermits() < maxConcurrent && System.currentTimeMillis() < deadline) {
                Thread.sleep(PERMIT_POLL_MILLIS);
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while stopping processor for {}", queueName);
            Thread.currentThread().interrupt();
        }

        healthScheduler.shutdownNow();
        pollThread = null;
        int inFlight = getInFlight();
        if (inFlight > 0) {
            handlers.shutdownNow();
            log.warn("Message processor stopped for {} with {} message(s) in flight, left in processing list", queueName, inFlight);
            return false;
        }

        handlers.shutdown();
        log.info("Message processor stopped for {}: processed={}", queueName, processed.get());
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Gets the number of messages being handled.
     *
     * @return Count.
     */
    public int getInFlight() {
        return maxConcurrent - slots.availablePermits();
    }

    /**
     * Gets the number of messages resolved since start.
     *
     * @return Count.
     */
    public int getProcessedCount() {
        return processed.get();
    }

    public String getQueueName() {
        return queueName;
    }

    /**
     * Polling loop, runs until stopped.
     */
    void pollLoop() {
        while (running.get()) {
            try {
                pollOnce();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Processing loop error for {}: {}", queueName, e.getMessage(), e);
                breaker.recordFailure(queueName, e);
                pause(config.getErrorRetryDelay());
            }
        }
        log.debug("Polling stopped for {}", queueName);
    }

    /**
     * One poll iteration.
     *
     * @throws InterruptedException If interrupted while waiting for a slot.
     */
    void pollOnce() throws InterruptedException {
        if (!strategy.shouldProcess(queueName, getInFlight())) {
            pause(strategy.getOptimalDelay(queueName));
            return;
        }

        if (!breaker.canExecute(queueName)) {
            log.debug("Circuit breaker open for {}, cooling down", queueName);
            pause(config.getCircuitBreakerCooldownDelay());
            return;
        }

        // Wait for the first slot, then take what else is free up to the batch size.
        if (!acquireSlot()) {
            return;
        }
        int permits = 1;
        int batchSize = strategy.getOptimalBatchSize(queueName);
        while (permits < batchSize && slots.tryAcquire()) {
            permits++;
        }

        List<QueueMessage<T>> messages;
        try {
            messages = queue.receive(permits, config.getVisibilityTimeout());
        } catch (RuntimeException e) {
            slots.release(permits);
            throw e;
        }

        if (messages.size() < permits) {
            slots.release(permits - messages.size());
        }

        if (messages.isEmpty()) {
            pause(config.getEmptyQueueDelay());
            return;
        }

        for (QueueMessage<T> message : messages) {
            dispatch(message);
        }
    }

    /**
     * Hand a message to a handler thread. The caller holds one slot for it.
     *
     * @param message Message.
     */
    private void dispatch(QueueMessage<T> message) {
        try {
            handlers.execute(() -> {
                try {
                    process(message);
                } finally {
                    slots.release();
                }
            });
        } catch (RejectedExecutionException e) {
            slots.release();
            log.warn("Handler pool rejected message {} on {}, left in processing list", message.getId(), queueName);
        }
    }

    /**
     * Handle one message and resolve it. Never throws.
     *
     * @param message Message.
     */
    void process(QueueMessage<T> message) {
        try {
            Instant now = clock.instant();
            if (Duration.between(message.getEnqueuedTime(), now).compareTo(config.getMaxMessageAge()) > 0) {
                deadLetter(message, REASON_MAX_AGE);
                return;
            }
            if (message.getDeliveryCount() >= config.getMaxDeliveryCount()) {
                deadLetter(message, StoreMessageQueue.REASON_MAX_DELIVERY);
                return;
            }

            boolean success = false;
            Throwable failure = null;
            Instant start = clock.instant();
            try {
                success = consumer.handle(message);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Handler interrupted for message {} on {}, left in processing list", message.getId(), queueName);
                return;
            } catch (Exception e) {
                failure = e;
                log.warn("Handler failed for message {} on {}: {}", message.getId(), queueName, e.getMessage());
            }
            Duration elapsed = Duration.between(start, clock.instant());

            resolve(message, success, failure);

            strategy.recordProcessingTime(queueName, elapsed, success);
            LevelerMetrics.recordProcessingTime(queueName, elapsed);
            if (success) {
                breaker.recordSuccess(queueName);
            } else {
                breaker.recordFailure(queueName, failure);
            }
        } catch (Exception e) {
            log.error("Failed to resolve message {} on {}: {}", message.getId(), queueName, e.getMessage(), e);
            breaker.recordFailure(queueName, e);
        } finally {
            processed.incrementAndGet();
        }
    }

    private void resolve(QueueMessage<T> message, boolean success, Throwable failure) {
        if (success) {
            if (queue.complete(message)) {
                LevelerMetrics.incrementOutcome(queueName, LevelerMetrics.COMPLETED);
            }
        } else if (failure != null && FailureClassifier.isPermanent(failure)) {
            deadLetter(message, FailureClassifier.reason(failure));
        } else if (message.getDeliveryCount() + 1 >= config.getMaxDeliveryCount()) {
            deadLetter(message, StoreMessageQueue.REASON_MAX_DELIVERY);
        } else if (queue.abandon(message)) {
            // The queue dead-letters on its own delivery limit, which may be lower than ours.
            boolean redelivered = message.getProperties().get(QueueMessage.DEAD_LETTER_REASON) == null;
            LevelerMetrics.incrementOutcome(queueName, redelivered ? LevelerMetrics.ABANDONED : LevelerMetrics.DEADLETTERED);
        }
    }

    private void deadLetter(QueueMessage<T> message, String reason) {
        if (queue.deadLetter(message, reason)) {
            LevelerMetrics.incrementOutcome(queueName, LevelerMetrics.DEADLETTERED);
        }
    }

    /**
     * Health task. Reads statistics and logs threshold warnings, never touches processing state.
     */
    void checkHealth() {
        try {
            QueueStatistics stats = queue.getStatistics();

            if (stats.getDeadLetterCount() > config.getDeadLetterWarningThreshold()) {
                log.warn("Queue {} has {} dead-lettered messages", queueName, stats.getDeadLetterCount());
            }
            if (stats.getBacklog() > config.getBacklogWarningThreshold()) {
                log.warn("Queue {} has a backlog of {} messages", queueName, stats.getBacklog());
            }
            int inFlight = getInFlight();
            if (inFlight > maxConcurrent * 0.9) {
                log.warn("Queue {} processor near capacity: {}/{}", queueName, inFlight, maxConcurrent);
            }

            QueueMonitor current = monitor;
            if (current != null) {
                current.checkHealth(queueName);
            }
            log.debug("Health check for {}: active={}, processing={}, deadLetter={}, inFlight={}",
                    queueName, stats.getActiveTotal(), stats.getProcessingCount(), stats.getDeadLetterCount(), inFlight);
        } catch (Exception e) {
            log.error("Health check failed for {}: {}", queueName, e.getMessage());
        }
    }

    /**
     * Wait for a free slot while running.
     *
     * @return true if a slot was acquired.
     * @throws InterruptedException If interrupted.
     */
    private boolean acquireSlot() throws InterruptedException {
        while (running.get()) {
            if (slots.tryAcquire(PERMIT_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Sleep that ends early on stop.
     *
     * @param delay Delay.
     */
    private void pause(Duration delay) {
        try {
            stopSignal.await(Math.max(0L, delay.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory threadFactory(String name) {
        AtomicInteger count = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, name + "-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
