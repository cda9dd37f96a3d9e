package com.mimecast.leveler.queue;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.mimecast.leveler.metrics.LevelerMetrics;
import com.mimecast.leveler.store.QueueStore;
import com.mimecast.leveler.store.StoreBatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Message queue built on a {@link QueueStore}.
 * <p>Uses one list per priority, a processing list, a delayed sorted set, a dead-letter list and a counters hash.
 * See {@link QueueKeys} for the key layout.
 *
 * @param <T> Body type.
 */
public class StoreMessageQueue<T> implements MessageQueue<T> {
    private static final Logger log = LogManager.getLogger(StoreMessageQueue.class);

    /**
     * Dead-letter reason for messages past their expiry time.
     */
    public static final String REASON_EXPIRED = "expired";

    /**
     * Dead-letter reason for messages abandoned too many times.
     */
    public static final String REASON_MAX_DELIVERY = "max delivery count exceeded";

    private static final Gson gson = new Gson();

    private final String name;
    private final Class<T> bodyType;
    private final QueueStore store;
    private final MessageSerializer serializer;
    private final RetryPolicy retryPolicy;
    private final int maxDeliveryCount;
    private final int promotionBatchSize;
    private final Clock clock;
    private final QueueKeys keys;

    /**
     * Constructs a new StoreMessageQueue instance.
     *
     * @param name               Queue name.
     * @param bodyType           Body type.
     * @param store              Backing store.
     * @param serializer         Body serializer.
     * @param retryPolicy        Redelivery backoff.
     * @param maxDeliveryCount   Delivery count at which abandoned messages are dead-lettered.
     * @param promotionBatchSize Maximum delayed messages promoted per receive.
     * @param clock              Clock.
     */
    public StoreMessageQueue(String name, Class<T> bodyType, QueueStore store, MessageSerializer serializer,
                             RetryPolicy retryPolicy, int maxDeliveryCount, int promotionBatchSize, Clock clock) {
        this.keys = new QueueKeys(name);
        this.name = name;
        this.bodyType = Objects.requireNonNull(bodyType, "bodyType");
        this.store = Objects.requireNonNull(store, "store");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (maxDeliveryCount < 1) {
            throw new IllegalArgumentException("Max delivery count must be at least 1: " + maxDeliveryCount);
        }
        if (promotionBatchSize < 1) {
            throw new IllegalArgumentException("Promotion batch size must be at least 1: " + promotionBatchSize);
        }
        this.maxDeliveryCount = maxDeliveryCount;
        this.promotionBatchSize = promotionBatchSize;
    }

    @Override
    public String getName() {
        return name;
    }

    public Class<T> getBodyType() {
        return bodyType;
    }

    public QueueKeys getKeys() {
        return keys;
    }

    @Override
    public String send(T body) {
        return send(body, QueueOptions.defaults());
    }

    @Override
    public String send(T body, QueueOptions options) {
        return sendBatch(Collections.singletonList(body), options).get(0);
    }

    @Override
    public List<String> sendBatch(List<T> bodies, QueueOptions options) {
        Objects.requireNonNull(bodies, "bodies");
        QueueOptions opts = options != null ? options : QueueOptions.defaults();
        if (bodies.isEmpty()) {
            return new ArrayList<>();
        }

        Instant now = clock.instant();
        StoreBatch batch = store.batch();
        List<String> ids = new ArrayList<>(bodies.size());
        for (T body : bodies) {
            QueueMessage<T> message = create(body, opts, now);
            String entry = encode(message);
            if (opts.isDelayed()) {
                batch.addScored(keys.delayed(), entry, now.plus(opts.getDelay()).toEpochMilli());
            } else {
                batch.push(keys.priority(message.getPriority()), entry);
            }
            ids.add(message.getId());
        }
        batch.increment(keys.stats(), QueueKeys.SENT, bodies.size()).execute();
        LevelerMetrics.incrementSent(name, ids.size());

        log.debug("Sent {} message(s) to {}: priority={}, delayed={}", ids.size(), name, opts.getPriority(), opts.isDelayed());
        return ids;
    }

    @Override
    public List<QueueMessage<T>> receive(int maxMessages, Duration visibilityTimeout) {
        if (maxMessages < 1) {
            throw new IllegalArgumentException("Max messages must be at least 1: " + maxMessages);
        }

        promoteDelayed();

        List<QueueMessage<T>> messages = new ArrayList<>();
        for (MessagePriority priority : MessagePriority.RECEIVE_ORDER) {
            while (messages.size() < maxMessages) {
                String entry = store.popAndPush(keys.priority(priority), keys.processing());
                if (entry == null) {
                    break;
                }

                QueueMessage<T> message;
                try {
                    message = decode(entry);
                } catch (MessageFormatException e) {
                    deadLetterMalformed(entry, e);
                    continue;
                }

                Instant now = clock.instant();
                if (message.isExpired(now)) {
                    deadLetter(message, REASON_EXPIRED);
                    continue;
                }

                message.setDequeueTime(now);
                messages.add(message);
            }
        }

        if (!messages.isEmpty()) {
            store.increment(keys.stats(), QueueKeys.RECEIVED, messages.size());
            log.debug("Received {} message(s) from {}", messages.size(), name);
        }
        return messages;
    }

    @Override
    public boolean complete(QueueMessage<T> message) {
        Objects.requireNonNull(message, "message");
        if (!store.remove(keys.processing(), receiptOf(message))) {
            log.debug("Complete ignored, message {} not in processing list of {}", message.getId(), name);
            return false;
        }

        store.increment(keys.stats(), QueueKeys.COMPLETED, 1);
        log.debug("Completed message {} on {}", message.getId(), name);
        return true;
    }

    @Override
    public boolean abandon(QueueMessage<T> message) {
        Objects.requireNonNull(message, "message");
        if (!store.remove(keys.processing(), receiptOf(message))) {
            log.debug("Abandon ignored, message {} not in processing list of {}", message.getId(), name);
            return false;
        }

        message.setDeliveryCount(message.getDeliveryCount() + 1);
        message.setReceipt(null);
        if (message.getDeliveryCount() >= maxDeliveryCount) {
            moveToDeadLetter(message, REASON_MAX_DELIVERY);
            return true;
        }

        Duration delay = retryPolicy.getDelay(message.getDeliveryCount());
        store.batch()
                .addScored(keys.delayed(), encode(message), clock.instant().plus(delay).toEpochMilli())
                .increment(keys.stats(), QueueKeys.ABANDONED, 1)
                .execute();

        log.debug("Abandoned message {} on {}: deliveryCount={}, retryIn={}ms",
                message.getId(), name, message.getDeliveryCount(), delay.toMillis());
        return true;
    }

    @Override
    public boolean deadLetter(QueueMessage<T> message, String reason) {
        Objects.requireNonNull(message, "message");
        if (message.getReceipt() != null && !store.remove(keys.processing(), message.getReceipt())) {
            log.debug("Dead-letter ignored, message {} not in processing list of {}", message.getId(), name);
            return false;
        }

        moveToDeadLetter(message, reason);
        return true;
    }

    @Override
    public QueueStatistics getStatistics() {
        Map<MessagePriority, Long> active = new EnumMap<>(MessagePriority.class);
        for (MessagePriority priority : MessagePriority.values()) {
            active.put(priority, store.length(keys.priority(priority)));
        }

        return new QueueStatistics(name, active,
                store.length(keys.processing()),
                store.scoredCount(keys.delayed()),
                store.length(keys.deadLetter()),
                store.getCounters(keys.stats()),
                clock.instant());
    }

    @Override
    public void purge() {
        store.delete(keys.all());
        log.info("Purged queue {}", name);
    }

    @Override
    public List<QueueMessage<T>> deadLetters(int max) {
        List<QueueMessage<T>> messages = new ArrayList<>();
        for (String entry : store.range(keys.deadLetter(), max)) {
            try {
                messages.add(decode(entry));
            } catch (MessageFormatException e) {
                log.warn("Skipping unreadable dead-letter entry on {}: {}", name, e.getMessage());
            }
        }
        return messages;
    }

    @Override
    public int recoverProcessing() {
        int recovered = 0;
        for (String entry : store.range(keys.processing(), -1)) {
            if (!store.remove(keys.processing(), entry)) {
                continue;
            }

            MessagePriority priority;
            try {
                priority = decode(entry).getPriority();
            } catch (MessageFormatException e) {
                priority = MessagePriority.NORMAL;
            }
            store.push(keys.priority(priority), entry);
            recovered++;
        }

        if (recovered > 0) {
            log.info("Recovered {} in-flight message(s) on {}", recovered, name);
        }
        return recovered;
    }

    /**
     * Move due delayed messages onto their priority lists, at most promotionBatchSize per call.
     *
     * @return Number of promoted messages.
     */
    int promoteDelayed() {
        List<String> due = store.rangeByScore(keys.delayed(), clock.millis(), promotionBatchSize);
        int promoted = 0;
        for (String entry : due) {
            MessagePriority priority = MessagePriority.NORMAL;
            try {
                MessageEnvelope envelope = gson.fromJson(entry, MessageEnvelope.class);
                if (envelope != null) {
                    priority = MessagePriority.fromString(envelope.priority);
                }
            } catch (JsonParseException e) {
                // Unreadable entries are dead-lettered when received.
                log.debug("Promoting unreadable delayed entry on {} as normal priority", name);
            }

            if (store.moveScoredToList(keys.delayed(), entry, keys.priority(priority))) {
                promoted++;
            }
        }

        if (promoted > 0) {
            log.debug("Promoted {} delayed message(s) on {}", promoted, name);
        }
        return promoted;
    }

    private QueueMessage<T> create(T body, QueueOptions options, Instant now) {
        QueueMessage<T> message = new QueueMessage<>(UUID.randomUUID().toString(), body, now)
                .setPriority(options.getPriority())
                .setCorrelationId(options.getCorrelationId())
                .setReplyTo(options.getReplyTo())
                .setLabel(options.getLabel())
                .setTimeToLive(options.getTimeToLive());
        message.getProperties().putAll(options.getProperties());
        return message;
    }

    private void moveToDeadLetter(QueueMessage<T> message, String reason) {
        message.getProperties().put(QueueMessage.DEAD_LETTER_REASON, reason);
        message.getProperties().put(QueueMessage.DEAD_LETTER_TIME, clock.instant().toString());

        store.batch()
                .push(keys.deadLetter(), encode(message))
                .increment(keys.stats(), QueueKeys.DEADLETTERED, 1)
                .execute();

        log.warn("Dead-lettered message {} on {}: reason={}, deliveryCount={}",
                message.getId(), name, reason, message.getDeliveryCount());
    }

    private void deadLetterMalformed(String entry, MessageFormatException e) {
        store.remove(keys.processing(), entry);
        store.batch()
                .push(keys.deadLetter(), entry)
                .increment(keys.stats(), QueueKeys.DEADLETTERED, 1)
                .execute();

        log.warn("Dead-lettered malformed entry on {}: {}", name, e.getMessage());
    }

    private String receiptOf(QueueMessage<T> message) {
        return message.getReceipt() != null ? message.getReceipt() : encode(message);
    }

    /**
     * Encode a message into its store entry.
     *
     * @param message Message.
     * @return JSON envelope.
     */
    String encode(QueueMessage<T> message) {
        MessageEnvelope envelope = new MessageEnvelope();
        envelope.id = message.getId();
        envelope.body = serializer.serialize(message.getBody());
        envelope.contentType = serializer.getContentType();
        envelope.enqueuedTime = message.getEnqueuedTime().toEpochMilli();
        envelope.dequeueTime = message.getDequeueTime() != null ? message.getDequeueTime().toEpochMilli() : null;
        envelope.deliveryCount = message.getDeliveryCount();
        envelope.priority = message.getPriority().name();
        envelope.correlationId = message.getCorrelationId();
        envelope.replyTo = message.getReplyTo();
        envelope.label = message.getLabel();
        envelope.timeToLive = message.getTimeToLive() != null ? message.getTimeToLive().toMillis() : null;
        envelope.expiresAt = message.getExpiresAt() != null ? message.getExpiresAt().toEpochMilli() : null;
        envelope.properties.putAll(message.getProperties());
        return gson.toJson(envelope);
    }

    /**
     * Decode a store entry, keeping it as the message receipt.
     *
     * @param entry JSON envelope.
     * @return Message.
     * @throws MessageFormatException If the entry or its body cannot be read.
     */
    QueueMessage<T> decode(String entry) {
        MessageEnvelope envelope;
        try {
            envelope = gson.fromJson(entry, MessageEnvelope.class);
        } catch (JsonParseException e) {
            throw new MessageFormatException("Unreadable message envelope: " + e.getMessage(), e);
        }
        if (envelope == null || envelope.id == null) {
            throw new MessageFormatException("Message envelope has no id");
        }

        if (envelope.deliveryCount < 0) {
            throw new MessageFormatException("Message envelope has negative delivery count: " + envelope.deliveryCount);
        }

        T body = envelope.body != null ? serializer.deserialize(envelope.body, bodyType) : null;
        QueueMessage<T> message = new QueueMessage<>(envelope.id, body, Instant.ofEpochMilli(envelope.enqueuedTime))
                .setDequeueTime(envelope.dequeueTime != null ? Instant.ofEpochMilli(envelope.dequeueTime) : null)
                .setDeliveryCount(envelope.deliveryCount)
                .setPriority(MessagePriority.fromString(envelope.priority))
                .setCorrelationId(envelope.correlationId)
                .setReplyTo(envelope.replyTo)
                .setLabel(envelope.label)
                .setTimeToLive(envelope.timeToLive != null ? Duration.ofMillis(envelope.timeToLive) : null)
                .setExpiresAt(envelope.expiresAt != null ? Instant.ofEpochMilli(envelope.expiresAt) : null);
        if (envelope.properties != null) {
            message.getProperties().putAll(envelope.properties);
        }
        message.setReceipt(entry);
        return message;
    }
}
