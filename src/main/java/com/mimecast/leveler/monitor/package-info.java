/**
 * Queue health and alerts.
 *
 * <p>{@link com.mimecast.leveler.monitor.QueueMonitor} turns statistics and breaker state into a status per queue.
 * {@link com.mimecast.leveler.monitor.MessagingHealthCheck} aggregates them for the health endpoint.
 */
package com.mimecast.leveler.monitor;
