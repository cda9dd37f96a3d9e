/**
 * Load leveling.
 *
 * <p>Limits how fast a queue is consumed, independent of how fast it is filled.
 * Admission, batch size and poll delay are derived from load, error rate, latency and backlog.
 */
package com.mimecast.leveler.leveling;
