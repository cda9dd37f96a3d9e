/**
 * HTTP service endpoint for health, queue statistics and Prometheus metrics.
 */
package com.mimecast.leveler.endpoints;
