package com.mimecast.leveler.queue;

import org.apache.commons.lang3.StringUtils;

/**
 * Store key layout for one queue.
 * <pre>
 *     name:critical, name:high, name, name:low  priority lists
 *     name:processing                           received, unresolved entries
 *     name:delayed                              sorted set scored by ready time (epoch millis)
 *     name:deadletter                           terminal list
 *     name:stats                                counters hash
 * </pre>
 */
public final class QueueKeys {

    static final String SENT = "messages_sent";
    static final String RECEIVED = "messages_received";
    static final String COMPLETED = "messages_completed";
    static final String ABANDONED = "messages_abandoned";
    static final String DEADLETTERED = "messages_deadlettered";

    private final String name;

    /**
     * Constructs a new QueueKeys instance.
     *
     * @param name Queue name.
     */
    public QueueKeys(String name) {
        if (StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("Queue name must not be blank");
        }
        this.name = name;
    }

    public String priority(MessagePriority priority) {
        return name + priority.getKeySuffix();
    }

    public String processing() {
        return name + ":processing";
    }

    public String delayed() {
        return name + ":delayed";
    }

    public String deadLetter() {
        return name + ":deadletter";
    }

    public String stats() {
        return name + ":stats";
    }

    /**
     * Gets every key of the queue.
     *
     * @return Keys.
     */
    public String[] all() {
        return new String[]{
                priority(MessagePriority.CRITICAL),
                priority(MessagePriority.HIGH),
                priority(MessagePriority.NORMAL),
                priority(MessagePriority.LOW),
                processing(),
                delayed(),
                deadLetter(),
                stats()
        };
    }
}
