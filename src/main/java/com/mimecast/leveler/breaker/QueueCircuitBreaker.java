package com.mimecast.leveler.breaker;

/**
 * Per queue circuit breaker.
 * <p>Open to half-open is evaluated lazily on {@link #canExecute(String)}, no timer is involved.
 */
public interface QueueCircuitBreaker {

    /**
     * Whether processing of the queue may proceed.
     *
     * @param queueName Queue name.
     * @return true if permitted.
     */
    boolean canExecute(String queueName);

    /**
     * Record a successful operation.
     *
     * @param queueName Queue name.
     */
    void recordSuccess(String queueName);

    /**
     * Record a failed operation.
     *
     * @param queueName Queue name.
     * @param cause     Failure cause, may be null.
     */
    void recordFailure(String queueName, Throwable cause);

    /**
     * Gets the current state.
     *
     * @param queueName Queue name.
     * @return State, CLOSED for unknown queues.
     */
    CircuitBreakerState getState(String queueName);

    /**
     * Return a queue breaker to its initial closed state.
     *
     * @param queueName Queue name.
     */
    void reset(String queueName);
}
