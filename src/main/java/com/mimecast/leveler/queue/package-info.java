/**
 * Durable priority message queue.
 *
 * <p>Each queue is a set of store structures keyed by the queue name:
 * four priority lists, a processing list, a delayed sorted set, a dead-letter list and a counters hash.
 *
 * <p>Message lifecycle:
 * <ul>
 *     <li>Send pushes onto the priority list, or into the delayed set when a delay is given.</li>
 *     <li>Receive promotes due delayed entries, then atomically moves entries from the priority lists
 *     onto the processing list, highest priority first.</li>
 *     <li>Complete removes the entry from the processing list.</li>
 *     <li>Abandon moves it back into the delayed set with a {@link com.mimecast.leveler.queue.RetryPolicy} backoff,
 *     or to the dead-letter list once the delivery limit is reached.</li>
 * </ul>
 *
 * <p>A crash between receive and completion leaves the entry in the processing list, where
 * {@link com.mimecast.leveler.queue.MessageQueue#recoverProcessing()} can return it.
 */
package com.mimecast.leveler.queue;
