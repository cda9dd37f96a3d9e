package com.mimecast.leveler.queue;

import java.util.List;

/**
 * Message priority.
 * <p>Each priority has its own list under the queue name, normal priority uses the bare queue name.
 */
public enum MessagePriority {
    LOW(":low"),
    NORMAL(""),
    HIGH(":high"),
    CRITICAL(":critical");

    /**
     * Order in which priority lists are drained on receive.
     */
    public static final List<MessagePriority> RECEIVE_ORDER = List.of(CRITICAL, HIGH, NORMAL, LOW);

    private final String keySuffix;

    MessagePriority(String keySuffix) {
        this.keySuffix = keySuffix;
    }

    /**
     * Gets the list key suffix.
     *
     * @return Suffix appended to the queue name.
     */
    public String getKeySuffix() {
        return keySuffix;
    }

    /**
     * Parse a priority name, case insensitive.
     *
     * @param value Priority name.
     * @return MessagePriority, NORMAL if null or unknown.
     */
    public static MessagePriority fromString(String value) {
        if (value != null) {
            for (MessagePriority priority : values()) {
                if (priority.name().equalsIgnoreCase(value.trim())) {
                    return priority;
                }
            }
        }
        return NORMAL;
    }
}
