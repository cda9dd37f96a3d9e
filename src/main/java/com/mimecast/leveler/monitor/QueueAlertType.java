package com.mimecast.leveler.monitor;

/**
 * Queue alert types.
 */
public enum QueueAlertType {
    HIGH_MESSAGE_COUNT,
    DEAD_LETTER_MESSAGES,
    CIRCUIT_BREAKER_OPEN,
    CONNECTION_FAILURE
}
