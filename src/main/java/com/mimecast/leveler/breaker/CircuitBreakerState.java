package com.mimecast.leveler.breaker;

/**
 * Circuit breaker states.
 */
public enum CircuitBreakerState {
    CLOSED,    // Normal operation.
    OPEN,      // Failing fast until the next attempt time.
    HALF_OPEN  // Probing whether the queue recovered.
}
