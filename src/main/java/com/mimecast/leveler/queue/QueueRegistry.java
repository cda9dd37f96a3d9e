package com.mimecast.leveler.queue;

import com.mimecast.leveler.config.QueueConfig;
import com.mimecast.leveler.store.QueueStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Queue registry.
 * <p>Creates one queue per name on first use and hands out the same instance afterwards.
 * <p>A queue name is bound to the body type it was first requested with.
 */
public class QueueRegistry {
    private static final Logger log = LogManager.getLogger(QueueRegistry.class);

    private final QueueStore store;
    private final QueueConfig config;
    private final MessageSerializer serializer;
    private final Clock clock;
    private final Map<String, StoreMessageQueue<?>> queues = new ConcurrentHashMap<>();

    /**
     * Constructs a new QueueRegistry instance.
     *
     * @param store      Backing store.
     * @param config     Queue configuration.
     * @param serializer Body serializer.
     * @param clock      Clock.
     */
    public QueueRegistry(QueueStore store, QueueConfig config, MessageSerializer serializer, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Gets or creates a queue.
     *
     * @param name Queue name.
     * @param type Body type.
     * @param <T>  Body type.
     * @return MessageQueue instance.
     * @throws IllegalArgumentException If the queue exists with a different body type.
     */
    @SuppressWarnings("unchecked")
    public <T> MessageQueue<T> getQueue(String name, Class<T> type) {
        Objects.requireNonNull(type, "type");
        StoreMessageQueue<?> queue = queues.computeIfAbsent(name, n -> {
            log.info("Creating queue {} for {}", n, type.getSimpleName());
            return new StoreMessageQueue<>(n, type, store, serializer, config.getRetryPolicy(),
                    config.getMaxDeliveryCount(), config.getPromotionBatchSize(), clock);
        });

        if (!queue.getBodyType().equals(type)) {
            throw new IllegalArgumentException("Queue " + name + " holds " + queue.getBodyType().getName() +
                    " not " + type.getName());
        }
        return (MessageQueue<T>) queue;
    }

    /**
     * Gets an existing queue regardless of body type.
     *
     * @param name Queue name.
     * @return MessageQueue instance or null.
     */
    public MessageQueue<?> findQueue(String name) {
        return queues.get(name);
    }

    /**
     * Gets registered queue names.
     *
     * @return Sorted names.
     */
    public List<String> getQueueNames() {
        List<String> names = new ArrayList<>(queues.keySet());
        Collections.sort(names);
        return names;
    }

    /**
     * Gets registered queues.
     *
     * @return Queues.
     */
    public Collection<MessageQueue<?>> getQueues() {
        return Collections.unmodifiableCollection(queues.values());
    }

    public QueueStore getStore() {
        return store;
    }
}
