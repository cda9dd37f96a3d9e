/**
 * Configuration of the load leveler.
 *
 * <p>Provides the configuration foundation and typed accessors for each section of {@code leveler.json5}.
 * <br>Files are JSON5 and parsed leniently, so comments and unquoted keys are allowed.
 *
 * <p>Durations are always configured in milliseconds using keys with a {@code Millis} suffix.
 * <br><b>Example:</b>
 * <pre>
 * {
 *   redis: { enabled: true, host: "localhost", port: 6379 },
 *   queue: { maxDeliveryCount: 5, retryPolicy: { backoffType: "exponential", initialDelayMillis: 1000 } },
 *   processor: { maxConcurrentMessages: 10 },
 *   queues: [ "kgv.application.created", "kgv.audit" ]
 * }
 * </pre>
 */
package com.mimecast.leveler.config;
