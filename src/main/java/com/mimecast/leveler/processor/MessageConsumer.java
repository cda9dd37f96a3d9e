package com.mimecast.leveler.processor;

import com.mimecast.leveler.queue.QueueMessage;

/**
 * Message handler.
 * <p>Return true to complete the message, false to abandon it for redelivery.
 * Throw {@link PermanentMessageException}, {@link IllegalArgumentException} or
 * {@link UnsupportedOperationException} to dead-letter it without retry.
 * Any other exception abandons it.
 *
 * @param <T> Body type.
 */
@FunctionalInterface
public interface MessageConsumer<T> {

    /**
     * Handle a message.
     *
     * @param message Message.
     * @return true if handled.
     * @throws Exception On failure.
     */
    boolean handle(QueueMessage<T> message) throws Exception;
}
