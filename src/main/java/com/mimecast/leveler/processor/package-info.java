/**
 * Background message processing.
 *
 * <p>One {@link com.mimecast.leveler.processor.MessageProcessor} per queue polls under control of the
 * load-leveling strategy and the circuit breaker and dispatches messages to a
 * {@link com.mimecast.leveler.processor.MessageConsumer} with bounded concurrency.
 *
 * <p>Failure handling:
 * <ul>
 *     <li>Transient: any handler exception that is not permanent, or a false return. Abandoned with backoff.</li>
 *     <li>Permanent: argument, unsupported operation and format errors. Dead-lettered at once.</li>
 *     <li>Exhausted: the delivery count reached the maximum. Dead-lettered.</li>
 *     <li>Expired: older than the max message age. Dead-lettered without calling the handler.</li>
 *     <li>Store unavailable: counted against the breaker, polling backs off.</li>
 * </ul>
 */
package com.mimecast.leveler.processor;
