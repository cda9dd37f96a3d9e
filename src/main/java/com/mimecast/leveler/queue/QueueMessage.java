package com.mimecast.leveler.queue;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Queue message.
 * <p>Wraps a typed body with the delivery metadata the queue tracks for it.
 * <p>A received message carries the exact store entry it was read from as its receipt.
 * Complete, abandon and dead-letter use the receipt to remove that entry from the processing list.
 *
 * @param <T> Body type.
 */
public class QueueMessage<T> {

    /**
     * Dead-letter reason property name.
     */
    public static final String DEAD_LETTER_REASON = "DeadLetterReason";

    /**
     * Dead-letter time property name.
     */
    public static final String DEAD_LETTER_TIME = "DeadLetterTime";

    private final String id;
    private final T body;
    private final Instant enqueuedTime;
    private Instant dequeueTime;
    private int deliveryCount;
    private MessagePriority priority = MessagePriority.NORMAL;
    private String correlationId;
    private String replyTo;
    private String label;
    private Duration timeToLive;
    private Instant expiresAt;
    private final Map<String, String> properties = new HashMap<>();

    // Store entry this message was received from.
    private transient String receipt;

    /**
     * Constructs a new QueueMessage instance.
     *
     * @param id           Unique message id.
     * @param body         Message body.
     * @param enqueuedTime Time the message was sent.
     */
    public QueueMessage(String id, T body, Instant enqueuedTime) {
        this.id = Objects.requireNonNull(id, "id");
        this.body = body;
        this.enqueuedTime = Objects.requireNonNull(enqueuedTime, "enqueuedTime");
    }

    public String getId() {
        return id;
    }

    public T getBody() {
        return body;
    }

    public Instant getEnqueuedTime() {
        return enqueuedTime;
    }

    public Instant getDequeueTime() {
        return dequeueTime;
    }

    public QueueMessage<T> setDequeueTime(Instant dequeueTime) {
        this.dequeueTime = dequeueTime;
        return this;
    }

    public int getDeliveryCount() {
        return deliveryCount;
    }

    /**
     * Sets delivery count.
     *
     * @param deliveryCount Delivery count, may not decrease.
     * @return Self.
     */
    public QueueMessage<T> setDeliveryCount(int deliveryCount) {
        if (deliveryCount < this.deliveryCount) {
            throw new IllegalArgumentException("Delivery count cannot decrease from " + this.deliveryCount + " to " + deliveryCount);
        }
        this.deliveryCount = deliveryCount;
        return this;
    }

    public MessagePriority getPriority() {
        return priority;
    }

    public QueueMessage<T> setPriority(MessagePriority priority) {
        this.priority = Objects.requireNonNull(priority, "priority");
        return this;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public QueueMessage<T> setCorrelationId(String correlationId) {
        this.correlationId = correlationId;
        return this;
    }

    public String getReplyTo() {
        return replyTo;
    }

    public QueueMessage<T> setReplyTo(String replyTo) {
        this.replyTo = replyTo;
        return this;
    }

    public String getLabel() {
        return label;
    }

    public QueueMessage<T> setLabel(String label) {
        this.label = label;
        return this;
    }

    public Duration getTimeToLive() {
        return timeToLive;
    }

    /**
     * Sets time to live and derives the expiry time from the enqueued time.
     *
     * @param timeToLive Time to live, null for none.
     * @return Self.
     */
    public QueueMessage<T> setTimeToLive(Duration timeToLive) {
        this.timeToLive = timeToLive;
        this.expiresAt = timeToLive != null ? enqueuedTime.plus(timeToLive) : null;
        return this;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    QueueMessage<T> setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
        return this;
    }

    /**
     * Is expired.
     *
     * @param now Current time.
     * @return true if an expiry time is set and has passed.
     */
    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public Map<String, String> getProperties() {
        return properties;
    }

    /**
     * Gets the store entry this message was received from.
     *
     * @return Raw entry or null if the message was not received.
     */
    public String getReceipt() {
        return receipt;
    }

    void setReceipt(String receipt) {
        this.receipt = receipt;
    }

    @Override
    public String toString() {
        return "QueueMessage{id=" + id + ", priority=" + priority + ", deliveryCount=" + deliveryCount + "}";
    }
}
