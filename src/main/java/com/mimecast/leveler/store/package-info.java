/**
 * Backing store adapter.
 *
 * <p>{@link com.mimecast.leveler.store.QueueStore} wraps the few primitives the queues need:
 * list push, atomic pop-and-push between lists, sorted set range and move, and hash counters.
 * <p>{@link com.mimecast.leveler.store.RedisQueueStore} runs them on Redis through a Jedis pool.
 * {@link com.mimecast.leveler.store.InMemoryQueueStore} keeps them in process for tests.
 */
package com.mimecast.leveler.store;
