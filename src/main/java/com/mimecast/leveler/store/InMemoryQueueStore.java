package com.mimecast.leveler.store;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * In-memory implementation of QueueStore for testing or temporary queues.
 * <p>This implementation does not persist data and is lost on application restart.
 * <p>A single lock guards every structure so each operation, and each batch, is atomic.
 * <p>Sorted set members with equal scores are ordered lexicographically, as in Redis.
 */
public class InMemoryQueueStore implements QueueStore {

    private final Object lock = new Object();
    private final Map<String, Deque<String>> lists = new HashMap<>();
    private final Map<String, ScoredSet> sortedSets = new HashMap<>();
    private final Map<String, Map<String, Long>> hashes = new HashMap<>();

    private volatile boolean available = true;

    /**
     * Initialize the store.
     * <p>No initialization needed for in-memory implementation.
     */
    @Override
    public void initialize() {
        // No initialization needed for in-memory implementation.
    }

    /**
     * Simulate an outage.
     * <p>While unavailable every operation throws {@link StoreUnavailableException}.
     *
     * @param available Availability flag.
     */
    public void setAvailable(boolean available) {
        this.available = available;
    }

    @Override
    public boolean ping() {
        return available;
    }

    @Override
    public void push(String key, String value) {
        synchronized (lock) {
            check();
            list(key).addLast(value);
        }
    }

    @Override
    public String popAndPush(String source, String destination) {
        synchronized (lock) {
            check();
            Deque<String> from = lists.get(source);
            if (from == null || from.isEmpty()) {
                return null;
            }
            String value = from.pollFirst();
            list(destination).addLast(value);
            return value;
        }
    }

    @Override
    public boolean remove(String key, String value) {
        synchronized (lock) {
            check();
            Deque<String> list = lists.get(key);
            return list != null && list.removeFirstOccurrence(value);
        }
    }

    @Override
    public long length(String key) {
        synchronized (lock) {
            check();
            Deque<String> list = lists.get(key);
            return list != null ? list.size() : 0;
        }
    }

    @Override
    public List<String> range(String key, int max) {
        synchronized (lock) {
            check();
            List<String> items = new ArrayList<>();
            Deque<String> list = lists.get(key);
            if (list == null) {
                return items;
            }
            for (String value : list) {
                if (max >= 0 && items.size() >= max) {
                    break;
                }
                items.add(value);
            }
            return items;
        }
    }

    @Override
    public void addScored(String key, String value, double score) {
        synchronized (lock) {
            check();
            sortedSets.computeIfAbsent(key, k -> new ScoredSet()).add(value, score);
        }
    }

    @Override
    public List<String> rangeByScore(String key, double maxScore, int limit) {
        synchronized (lock) {
            check();
            List<String> members = new ArrayList<>();
            ScoredSet set = sortedSets.get(key);
            if (set == null) {
                return members;
            }
            for (Scored scored : set.ordered) {
                if (scored.score > maxScore || members.size() >= limit) {
                    break;
                }
                members.add(scored.value);
            }
            return members;
        }
    }

    @Override
    public boolean moveScoredToList(String sortedKey, String value, String listKey) {
        synchronized (lock) {
            check();
            ScoredSet set = sortedSets.get(sortedKey);
            if (set == null || !set.remove(value)) {
                return false;
            }
            list(listKey).addLast(value);
            return true;
        }
    }

    @Override
    public long scoredCount(String key) {
        synchronized (lock) {
            check();
            ScoredSet set = sortedSets.get(key);
            return set != null ? set.scores.size() : 0;
        }
    }

    @Override
    public long increment(String key, String field, long by) {
        synchronized (lock) {
            check();
            return hashes.computeIfAbsent(key, k -> new HashMap<>()).merge(field, by, Long::sum);
        }
    }

    @Override
    public Map<String, Long> getCounters(String key) {
        synchronized (lock) {
            check();
            Map<String, Long> hash = hashes.get(key);
            return hash != null ? new HashMap<>(hash) : new HashMap<>();
        }
    }

    @Override
    public void delete(String... keys) {
        synchronized (lock) {
            check();
            for (String key : keys) {
                lists.remove(key);
                sortedSets.remove(key);
                hashes.remove(key);
            }
        }
    }

    @Override
    public StoreBatch batch() {
        return new InMemoryStoreBatch();
    }

    /**
     * Close the store.
     * <p>For in-memory implementation, this clears all data.
     */
    @Override
    public void close() {
        synchronized (lock) {
            lists.clear();
            sortedSets.clear();
            hashes.clear();
        }
    }

    private void check() {
        if (!available) {
            throw new StoreUnavailableException("In-memory queue store is unavailable");
        }
    }

    private Deque<String> list(String key) {
        return lists.computeIfAbsent(key, k -> new ArrayDeque<>());
    }

    /**
     * Sorted set member.
     */
    private static final class Scored implements Comparable<Scored> {
        private final String value;
        private final double score;

        private Scored(String value, double score) {
            this.value = value;
            this.score = score;
        }

        @Override
        public int compareTo(Scored other) {
            int byScore = Double.compare(score, other.score);
            return byScore != 0 ? byScore : value.compareTo(other.value);
        }
    }

    /**
     * Sorted set keeping a member index for rescoring.
     */
    private static final class ScoredSet {
        private final TreeSet<Scored> ordered = new TreeSet<>();
        private final Map<String, Double> scores = new HashMap<>();

        private void add(String value, double score) {
            Double previous = scores.put(value, score);
            if (previous != null) {
                ordered.remove(new Scored(value, previous));
            }
            ordered.add(new Scored(value, score));
        }

        private boolean remove(String value) {
            Double previous = scores.remove(value);
            if (previous == null) {
                return false;
            }
            ordered.remove(new Scored(value, previous));
            return true;
        }
    }

    /**
     * Batch applied under the store lock.
     */
    private class InMemoryStoreBatch implements StoreBatch {
        private final List<Consumer<InMemoryQueueStore>> operations = new ArrayList<>();

        @Override
        public StoreBatch push(String key, String value) {
            operations.add(store -> store.list(key).addLast(value));
            return this;
        }

        @Override
        public StoreBatch addScored(String key, String value, double score) {
            operations.add(store -> store.sortedSets.computeIfAbsent(key, k -> new ScoredSet()).add(value, score));
            return this;
        }

        @Override
        public StoreBatch increment(String key, String field, long by) {
            operations.add(store -> store.hashes.computeIfAbsent(key, k -> new HashMap<>()).merge(field, by, Long::sum));
            return this;
        }

        @Override
        public void execute() {
            synchronized (lock) {
                check();
                Iterator<Consumer<InMemoryQueueStore>> iterator = operations.iterator();
                while (iterator.hasNext()) {
                    iterator.next().accept(InMemoryQueueStore.this);
                }
            }
        }
    }
}
