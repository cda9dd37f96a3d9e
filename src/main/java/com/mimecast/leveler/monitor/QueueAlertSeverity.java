package com.mimecast.leveler.monitor;

/**
 * Queue alert severities.
 */
public enum QueueAlertSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
