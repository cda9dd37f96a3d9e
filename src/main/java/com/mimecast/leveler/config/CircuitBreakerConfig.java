package com.mimecast.leveler.config;

import java.time.Duration;
import java.util.Map;

/**
 * Circuit breaker configuration.
 */
public class CircuitBreakerConfig extends BasicConfig {

    /**
     * Constructs a new CircuitBreakerConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public CircuitBreakerConfig(Map map) {
        super(map);
    }

    /**
     * Gets the consecutive failure count that opens the breaker.
     *
     * @return Threshold.
     */
    public int getFailureThreshold() {
        return Math.toIntExact(getLongProperty("failureThreshold", 5L));
    }

    /**
     * Gets how long the breaker stays open before allowing a trial call.
     *
     * @return Duration.
     */
    public Duration getOpenDuration() {
        return getMillisProperty("openDurationMillis", 60_000L);
    }
}
