package com.mimecast.leveler.monitor;

import java.time.Instant;

/**
 * Queue alert.
 */
public class QueueAlert {

    private final String queueName;
    private final QueueAlertType type;
    private final QueueAlertSeverity severity;
    private final String message;
    private final long timestamp;

    /**
     * Constructs a new QueueAlert instance.
     *
     * @param queueName Queue name.
     * @param type      Alert type.
     * @param severity  Severity.
     * @param message   Description.
     * @param timestamp Raise time.
     */
    public QueueAlert(String queueName, QueueAlertType type, QueueAlertSeverity severity, String message, Instant timestamp) {
        this.queueName = queueName;
        this.type = type;
        this.severity = severity;
        this.message = message;
        this.timestamp = timestamp.toEpochMilli();
    }

    public String getQueueName() {
        return queueName;
    }

    public QueueAlertType getType() {
        return type;
    }

    public QueueAlertSeverity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public Instant getTimestamp() {
        return Instant.ofEpochMilli(timestamp);
    }

    @Override
    public String toString() {
        return "QueueAlert{queue=" + queueName + ", type=" + type + ", severity=" + severity + ", message=" + message + "}";
    }
}
