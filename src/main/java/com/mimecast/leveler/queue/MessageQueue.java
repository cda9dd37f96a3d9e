package com.mimecast.leveler.queue;

import java.time.Duration;
import java.util.List;

/**
 * Durable priority message queue.
 * <p>Delivery is at-least-once: a received message stays in the processing list until it is completed,
 * abandoned or dead-lettered, so consumers must be idempotent.
 * <p>Store failures surface as {@link com.mimecast.leveler.store.StoreUnavailableException}.
 *
 * @param <T> Body type.
 */
public interface MessageQueue<T> {

    /**
     * Gets queue name.
     *
     * @return Name.
     */
    String getName();

    /**
     * Send a message with default options.
     *
     * @param body Body.
     * @return Message id.
     */
    String send(T body);

    /**
     * Send a message.
     * <p>Delayed messages go to the delayed set, others to the list of their priority.
     *
     * @param body    Body.
     * @param options Send options.
     * @return Message id.
     */
    String send(T body, QueueOptions options);

    /**
     * Send messages in a single atomic store batch.
     *
     * @param bodies  Bodies.
     * @param options Send options applied to every message.
     * @return Message ids in input order.
     */
    List<String> sendBatch(List<T> bodies, QueueOptions options);

    /**
     * Receive up to {@code maxMessages} messages, highest priority first.
     * <p>Due delayed messages are promoted first. Expired messages are dead-lettered and not returned.
     * Never blocks waiting for messages.
     *
     * @param maxMessages       Maximum messages, at least 1.
     * @param visibilityTimeout Visibility timeout, modeled by the processing list.
     * @return Received messages, possibly empty.
     */
    List<QueueMessage<T>> receive(int maxMessages, Duration visibilityTimeout);

    /**
     * Complete a received message.
     * <p>Completing a message that is no longer in the processing list is a no-op.
     *
     * @param message Message.
     * @return true if the message was removed from the processing list.
     */
    boolean complete(QueueMessage<T> message);

    /**
     * Abandon a received message.
     * <p>Increments the delivery count and schedules redelivery after the retry policy backoff,
     * or dead-letters the message once the maximum delivery count is reached. A dead-lettered message
     * carries {@link QueueMessage#DEAD_LETTER_REASON} in its properties.
     *
     * @param message Message.
     * @return true if the message was found in the processing list.
     */
    boolean abandon(QueueMessage<T> message);

    /**
     * Dead-letter a message.
     * <p>Stamps reason and time into the message properties. Terminal.
     *
     * @param message Message.
     * @param reason  Reason.
     * @return true if the message was moved to the dead-letter list.
     */
    boolean deadLetter(QueueMessage<T> message, String reason);

    /**
     * Gets queue statistics.
     *
     * @return QueueStatistics instance.
     */
    QueueStatistics getStatistics();

    /**
     * Delete every structure of the queue, including the dead-letter list and counters.
     */
    void purge();

    /**
     * Read dead-lettered messages without removing them.
     *
     * @param max Maximum messages, negative for all.
     * @return Messages, oldest first.
     */
    List<QueueMessage<T>> deadLetters(int max);

    /**
     * Move every processing list entry back to its priority list.
     * <p>Only safe when no receiver is active on the queue.
     *
     * @return Number of recovered entries.
     */
    int recoverProcessing();
}
