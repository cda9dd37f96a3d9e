/**
 * Micrometer metrics.
 *
 * <p>The Prometheus registry is created by the service endpoint and registered in
 * {@link com.mimecast.leveler.metrics.MetricsRegistry} for use by the queue components.
 */
package com.mimecast.leveler.metrics;
