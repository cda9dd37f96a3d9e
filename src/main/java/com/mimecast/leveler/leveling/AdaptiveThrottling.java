package com.mimecast.leveler.leveling;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Adaptive throttling state for one queue.
 * <p>The throttle delay grows geometrically on repeated failures and shrinks on sustained success.
 * It also serves as the minimum spacing between admitted processing attempts.
 */
public class AdaptiveThrottling {

    private static final long UNSET = -1L;

    private final AtomicBoolean throttled = new AtomicBoolean(false);
    private final AtomicLong throttleUntil = new AtomicLong(0L);
    private final AtomicLong currentThrottleDelay;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicInteger consecutiveSuccesses = new AtomicInteger();
    private final AtomicLong lastProcessingTime = new AtomicLong(UNSET);

    /**
     * Constructs a new AdaptiveThrottling instance.
     *
     * @param initialDelayMillis Initial throttle delay.
     */
    public AdaptiveThrottling(long initialDelayMillis) {
        this.currentThrottleDelay = new AtomicLong(initialDelayMillis);
    }

    /**
     * Start a throttle window of the current delay, then grow the delay.
     *
     * @param now        Epoch millis.
     * @param multiplier Growth factor.
     * @param maxMillis  Delay ceiling.
     * @return Window length applied.
     */
    long apply(long now, double multiplier, long maxMillis) {
        long delay = currentThrottleDelay.get();
        throttleUntil.set(now + delay);
        throttled.set(true);
        currentThrottleDelay.updateAndGet(d -> Math.min(Math.round(d * multiplier), maxMillis));
        return delay;
    }

    /**
     * Shrink the delay.
     *
     * @param recoveryFactor Divisor.
     * @param floorMillis    Delay floor.
     * @return New delay.
     */
    long reduce(double recoveryFactor, long floorMillis) {
        return currentThrottleDelay.updateAndGet(d -> Math.max(Math.round(d / recoveryFactor), floorMillis));
    }

    /**
     * Is a throttle window active.
     *
     * @param now Epoch millis.
     * @return true while throttled and the window has not passed.
     */
    boolean isActive(long now) {
        return throttled.get() && now < throttleUntil.get();
    }

    /**
     * Clear the throttled flag once the window has passed.
     *
     * @param now Epoch millis.
     * @return true if this call cleared it.
     */
    boolean expire(long now) {
        return now >= throttleUntil.get() && throttled.compareAndSet(true, false);
    }

    /**
     * Claim an admission slot if the spacing since the last one is at least the current delay.
     *
     * @param now Epoch millis.
     * @return true if admitted.
     */
    boolean tryAdmit(long now) {
        long last = lastProcessingTime.get();
        if (last != UNSET && now - last < currentThrottleDelay.get()) {
            return false;
        }
        return lastProcessingTime.compareAndSet(last, now);
    }

    int recordSuccess() {
        consecutiveFailures.set(0);
        return consecutiveSuccesses.incrementAndGet();
    }

    int recordFailure() {
        consecutiveSuccesses.set(0);
        return consecutiveFailures.incrementAndGet();
    }

    void resetSuccesses() {
        consecutiveSuccesses.set(0);
    }

    public boolean isThrottled() {
        return throttled.get();
    }

    public long getThrottleUntil() {
        return throttleUntil.get();
    }

    public long getCurrentThrottleDelay() {
        return currentThrottleDelay.get();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public int getConsecutiveSuccesses() {
        return consecutiveSuccesses.get();
    }

    /**
     * Gets last admission time.
     *
     * @return Epoch millis or -1 if never admitted.
     */
    public long getLastProcessingTime() {
        return lastProcessingTime.get();
    }
}
