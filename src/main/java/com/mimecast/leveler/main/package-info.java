/**
 * Server bootstrap and configuration holder.
 *
 * <p>{@link com.mimecast.leveler.main.Server} wires the components from a {@code leveler.json5} file:
 * <pre>
 *     {
 *       redis: { enabled: true, host: "localhost", port: 6379 },
 *       queues: ["leveler.application.created", "leveler.notification"],
 *       endpoint: { port: 8090 }
 *     }
 * </pre>
 */
package com.mimecast.leveler.main;
