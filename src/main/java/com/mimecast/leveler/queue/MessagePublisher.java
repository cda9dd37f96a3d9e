package com.mimecast.leveler.queue;

import java.util.List;
import java.util.Objects;

/**
 * Producer facing publisher.
 * <p>Sends messages to named queues. Producers never see receive, strategy or breaker.
 */
public class MessagePublisher {

    private final QueueRegistry registry;

    /**
     * Constructs a new MessagePublisher instance.
     *
     * @param registry Queue registry.
     */
    public MessagePublisher(QueueRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Publish a message with default options.
     *
     * @param queueName Queue name.
     * @param type      Body type the queue holds.
     * @param message   Body.
     * @param <T>       Body type.
     * @return Message id.
     */
    public <T> String publish(String queueName, Class<T> type, T message) {
        return publish(queueName, type, message, QueueOptions.defaults());
    }

    /**
     * Publish a message.
     *
     * @param queueName Queue name.
     * @param type      Body type the queue holds.
     * @param message   Body.
     * @param options   Send options.
     * @param <T>       Body type.
     * @return Message id.
     */
    public <T> String publish(String queueName, Class<T> type, T message, QueueOptions options) {
        return registry.getQueue(queueName, type).send(message, options);
    }

    /**
     * Publish messages in one batch.
     *
     * @param queueName Queue name.
     * @param type      Body type the queue holds.
     * @param messages  Bodies.
     * @param options   Send options.
     * @param <T>       Body type.
     * @return Message ids.
     */
    public <T> List<String> publishBatch(String queueName, Class<T> type, List<T> messages, QueueOptions options) {
        return registry.getQueue(queueName, type).sendBatch(messages, options);
    }
}
