package com.mimecast.leveler.queue;

/**
 * Redelivery backoff type.
 */
public enum BackoffType {
    FIXED,
    LINEAR,
    EXPONENTIAL;

    /**
     * Parse a backoff type name, case insensitive.
     *
     * @param value Type name.
     * @return BackoffType.
     * @throws IllegalArgumentException If the name is unknown.
     */
    public static BackoffType fromString(String value) {
        for (BackoffType type : values()) {
            if (type.name().equalsIgnoreCase(value != null ? value.trim() : "")) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown backoff type: " + value);
    }
}
