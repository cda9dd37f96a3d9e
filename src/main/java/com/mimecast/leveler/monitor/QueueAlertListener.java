package com.mimecast.leveler.monitor;

/**
 * Receives alerts raised by the queue monitor.
 */
@FunctionalInterface
public interface QueueAlertListener {

    /**
     * Alert raised.
     *
     * @param alert Alert.
     */
    void onAlert(QueueAlert alert);
}
