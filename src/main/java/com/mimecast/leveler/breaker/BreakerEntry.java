package com.mimecast.leveler.breaker;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Breaker state of one queue.
 */
public class BreakerEntry {

    private final AtomicReference<CircuitBreakerState> state = new AtomicReference<>(CircuitBreakerState.CLOSED);
    private final AtomicInteger failureCount = new AtomicInteger();
    private final AtomicInteger successCount = new AtomicInteger();
    private final AtomicLong nextAttemptTime = new AtomicLong(0L);

    AtomicReference<CircuitBreakerState> state() {
        return state;
    }

    AtomicInteger failures() {
        return failureCount;
    }

    AtomicInteger successes() {
        return successCount;
    }

    AtomicLong nextAttempt() {
        return nextAttemptTime;
    }

    public CircuitBreakerState getState() {
        return state.get();
    }

    public int getFailureCount() {
        return failureCount.get();
    }

    public int getSuccessCount() {
        return successCount.get();
    }

    /**
     * Gets the time after which an open breaker lets a trial call through.
     *
     * @return Epoch millis, 0 if never opened.
     */
    public long getNextAttemptTime() {
        return nextAttemptTime.get();
    }
}
