package com.mimecast.leveler.monitor;

/**
 * Queue health status, ordered from best to worst.
 */
public enum QueueHealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    /**
     * Gets the worse of two statuses.
     *
     * @param other Other status.
     * @return Worst status.
     */
    public QueueHealthStatus worst(QueueHealthStatus other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
