package com.mimecast.leveler.queue;

import java.time.Duration;
import java.util.Objects;

/**
 * Redelivery backoff policy.
 * <p>Computes how long an abandoned message waits in the delayed set before it becomes visible again.
 * <p>The wait time for a given delivery count is:
 * <pre>
 *     FIXED:       initialDelay
 *     LINEAR:      min(initialDelay * deliveryCount, maxDelay)
 *     EXPONENTIAL: min(initialDelay * multiplier ^ (deliveryCount - 1), maxDelay)
 * </pre>
 * <p> Example wait times for exponential backoff with 1 second initial delay, multiplier 2 and 60 seconds cap:
 * <ul>
 *     <li>Delivery 1: 1 second</li>
 *     <li>Delivery 2: 2 seconds</li>
 *     <li>Delivery 3: 4 seconds</li>
 *     <li>Delivery 6: 32 seconds</li>
 *     <li>Delivery 7 and above: 60 seconds</li>
 * </ul>
 */
public class RetryPolicy {

    private final BackoffType type;
    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay;

    /**
     * Constructs a new RetryPolicy instance.
     *
     * @param type         Backoff type.
     * @param initialDelay Initial delay.
     * @param multiplier   Exponential multiplier.
     * @param maxDelay     Exponential ceiling.
     */
    public RetryPolicy(BackoffType type, Duration initialDelay, double multiplier, Duration maxDelay) {
        this.type = Objects.requireNonNull(type, "type");
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Backoff delays must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be at least 1: " + multiplier);
        }
        this.multiplier = multiplier;
    }

    /**
     * Default policy: exponential, 1 second initial delay, multiplier 2, 5 minutes cap.
     *
     * @return RetryPolicy instance.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(BackoffType.EXPONENTIAL, Duration.ofSeconds(1), 2.0, Duration.ofMinutes(5));
    }

    /**
     * Get the wait time before the next delivery.
     *
     * @param deliveryCount Delivery count after the failed attempt, values below 1 count as 1.
     * @return Delay.
     */
    public Duration getDelay(int deliveryCount) {
        int count = Math.max(1, deliveryCount);
        switch (type) {
            case FIXED:
                return initialDelay;

            case LINEAR:
                Duration linear = initialDelay.multipliedBy(count);
                return linear.compareTo(maxDelay) > 0 ? maxDelay : linear;

            case EXPONENTIAL:
            default:
                double millis = initialDelay.toMillis() * Math.pow(multiplier, count - 1);
                if (millis >= maxDelay.toMillis()) {
                    return maxDelay;
                }
                return Duration.ofMillis(Math.round(millis));
        }
    }

    public BackoffType getType() {
        return type;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    @Override
    public String toString() {
        return "RetryPolicy{type=" + type + ", initialDelay=" + initialDelay +
                ", multiplier=" + multiplier + ", maxDelay=" + maxDelay + "}";
    }
}
