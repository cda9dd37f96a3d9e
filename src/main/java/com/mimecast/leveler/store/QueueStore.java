package com.mimecast.leveler.store;

import java.io.Closeable;
import java.util.List;
import java.util.Map;

/**
 * Interface for backing store implementations.
 *
 * <p>Defines the keyed list, sorted set and hash primitives the message queue is built from.
 * <p>Lists are FIFO: entries are inserted at the tail with {@link #push} and removed from the head.
 * <p>Every operation throws {@link StoreUnavailableException} when the store cannot serve it.
 */
public interface QueueStore extends Closeable {

    /**
     * Initialize the store connection/resources.
     */
    void initialize();

    /**
     * Check the store responds.
     *
     * @return true if the store is reachable.
     */
    boolean ping();

    /**
     * Insert an entry at the tail of a list.
     *
     * @param key   List key.
     * @param value Entry.
     */
    void push(String key, String value);

    /**
     * Atomically remove the head of the source list and insert it at the tail of the destination list.
     *
     * @param source      Source list key.
     * @param destination Destination list key.
     * @return The moved entry or null if the source is empty.
     */
    String popAndPush(String source, String destination);

    /**
     * Remove one occurrence of an exact entry from a list.
     *
     * @param key   List key.
     * @param value Entry.
     * @return true if an entry was removed.
     */
    boolean remove(String key, String value);

    /**
     * Get the length of a list.
     *
     * @param key List key.
     * @return Number of entries.
     */
    long length(String key);

    /**
     * Read up to {@code max} entries from the head of a list without removing them.
     *
     * @param key List key.
     * @param max Maximum entries, negative for all.
     * @return Entries in head to tail order.
     */
    List<String> range(String key, int max);

    /**
     * Insert or rescore a sorted set member.
     *
     * @param key   Sorted set key.
     * @param value Member.
     * @param score Score.
     */
    void addScored(String key, String value, double score);

    /**
     * Read members with a score lower than or equal to {@code maxScore}, lowest first.
     *
     * @param key      Sorted set key.
     * @param maxScore Inclusive upper bound.
     * @param limit    Maximum members returned.
     * @return Members.
     */
    List<String> rangeByScore(String key, double maxScore, int limit);

    /**
     * Atomically remove a sorted set member and insert it at the tail of a list.
     * <p>Nothing is inserted when the member was already gone.
     *
     * @param sortedKey Sorted set key.
     * @param value     Member.
     * @param listKey   List key.
     * @return true if the member was moved.
     */
    boolean moveScoredToList(String sortedKey, String value, String listKey);

    /**
     * Get the size of a sorted set.
     *
     * @param key Sorted set key.
     * @return Number of members.
     */
    long scoredCount(String key);

    /**
     * Increment a hash counter.
     *
     * @param key   Hash key.
     * @param field Counter field.
     * @param by    Increment.
     * @return Value after increment.
     */
    long increment(String key, String field, long by);

    /**
     * Read all counters of a hash.
     *
     * @param key Hash key.
     * @return Field to value map, empty if missing.
     */
    Map<String, Long> getCounters(String key);

    /**
     * Delete keys of any type.
     *
     * @param keys Keys.
     */
    void delete(String... keys);

    /**
     * Start a write batch.
     *
     * @return StoreBatch instance.
     */
    StoreBatch batch();

    /**
     * Close the store.
     */
    @Override
    void close();
}
