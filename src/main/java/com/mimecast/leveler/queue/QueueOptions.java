package com.mimecast.leveler.queue;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Send options.
 * <p>Carries priority, time to live, delivery delay and reply metadata for messages being sent.
 */
public class QueueOptions {

    private MessagePriority priority = MessagePriority.NORMAL;
    private Duration timeToLive;
    private Duration delay;
    private String correlationId;
    private String replyTo;
    private String label;
    private final Map<String, String> properties = new HashMap<>();

    /**
     * Gets default options.
     *
     * @return New QueueOptions instance with normal priority and no delay.
     */
    public static QueueOptions defaults() {
        return new QueueOptions();
    }

    public MessagePriority getPriority() {
        return priority;
    }

    /**
     * Sets priority.
     *
     * @param priority Priority.
     * @return Self.
     */
    public QueueOptions setPriority(MessagePriority priority) {
        this.priority = Objects.requireNonNull(priority, "priority");
        return this;
    }

    public Duration getTimeToLive() {
        return timeToLive;
    }

    /**
     * Sets time to live.
     *
     * @param timeToLive Duration after which an undelivered message expires, null for none.
     * @return Self.
     */
    public QueueOptions setTimeToLive(Duration timeToLive) {
        if (timeToLive != null && (timeToLive.isNegative() || timeToLive.isZero())) {
            throw new IllegalArgumentException("Time to live must be positive: " + timeToLive);
        }
        this.timeToLive = timeToLive;
        return this;
    }

    public Duration getDelay() {
        return delay;
    }

    /**
     * Sets delivery delay.
     *
     * @param delay Duration before the message becomes visible, null for immediate.
     * @return Self.
     */
    public QueueOptions setDelay(Duration delay) {
        if (delay != null && delay.isNegative()) {
            throw new IllegalArgumentException("Delay must not be negative: " + delay);
        }
        this.delay = delay;
        return this;
    }

    /**
     * Is delayed.
     *
     * @return true if a positive delay is set.
     */
    public boolean isDelayed() {
        return delay != null && !delay.isZero();
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public QueueOptions setCorrelationId(String correlationId) {
        this.correlationId = correlationId;
        return this;
    }

    public String getReplyTo() {
        return replyTo;
    }

    public QueueOptions setReplyTo(String replyTo) {
        this.replyTo = replyTo;
        return this;
    }

    public String getLabel() {
        return label;
    }

    public QueueOptions setLabel(String label) {
        this.label = label;
        return this;
    }

    public Map<String, String> getProperties() {
        return properties;
    }

    /**
     * Adds a message property.
     *
     * @param name  Property name.
     * @param value Property value.
     * @return Self.
     */
    public QueueOptions addProperty(String name, String value) {
        properties.put(name, value);
        return this;
    }
}
