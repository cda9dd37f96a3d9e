package com.mimecast.leveler.store;

/**
 * A group of store writes applied together.
 *
 * <p>Writes are buffered until {@link #execute()}, which applies all of them or none.
 */
public interface StoreBatch {

    /**
     * Queue a tail insert onto a list.
     *
     * @param key   List key.
     * @param value Entry.
     * @return Self.
     */
    StoreBatch push(String key, String value);

    /**
     * Queue a sorted set insert.
     *
     * @param key   Sorted set key.
     * @param value Member.
     * @param score Score.
     * @return Self.
     */
    StoreBatch addScored(String key, String value, double score);

    /**
     * Queue a hash counter increment.
     *
     * @param key   Hash key.
     * @param field Counter field.
     * @param by    Increment.
     * @return Self.
     */
    StoreBatch increment(String key, String field, long by);

    /**
     * Apply all queued writes atomically.
     *
     * @throws StoreUnavailableException If the store rejected the batch.
     */
    void execute();
}
