package com.mimecast.leveler.store;

import com.mimecast.leveler.config.RedisConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Transaction;
import redis.clients.jedis.args.ListDirection;
import redis.clients.jedis.exceptions.JedisException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Redis implementation of QueueStore.
 * <p>Lists grow to the left: LPUSH inserts at the tail and the head is the rightmost element.
 * <p>Compatible with AWS Elasticache and standard Redis instances.
 */
public class RedisQueueStore implements QueueStore {

    private static final Logger log = LogManager.getLogger(RedisQueueStore.class);

    // Removes a sorted set member and pushes it onto a list only if it was still there.
    private static final String MOVE_SCORED_SCRIPT =
            "if redis.call('zrem', KEYS[1], ARGV[1]) == 1 then " +
                    "redis.call('lpush', KEYS[2], ARGV[1]) " +
                    "return 1 " +
                    "end " +
                    "return 0";

    private final RedisConfig config;
    private JedisPool jedisPool;

    /**
     * Constructs a new RedisQueueStore instance.
     *
     * @param config Redis configuration.
     */
    public RedisQueueStore(RedisConfig config) {
        this.config = config;
    }

    /**
     * Initialize the Redis connection pool.
     */
    @Override
    public void initialize() {
        try {
            JedisPoolConfig poolConfig = new JedisPoolConfig();
            poolConfig.setMaxTotal(config.getMaxTotal());
            poolConfig.setMaxIdle(config.getMaxIdle());
            poolConfig.setMinIdle(config.getMinIdle());
            poolConfig.setTestOnBorrow(true);

            this.jedisPool = new JedisPool(poolConfig, config.getHost(), config.getPort(),
                    config.getTimeoutMillis(), config.getPassword(), config.getDatabase());

            // Test the connection
            try (Jedis jedis = jedisPool.getResource()) {
                jedis.ping();
            }

            log.info("Redis queue store initialized: host={}, port={}, database={}",
                    config.getHost(), config.getPort(), config.getDatabase());
        } catch (JedisException e) {
            log.error("Failed to initialize Redis queue store: {}", e.getMessage(), e);
            throw new StoreUnavailableException("Failed to initialize Redis queue store", e);
        }
    }

    @Override
    public boolean ping() {
        try (Jedis jedis = jedisPool.getResource()) {
            return "PONG".equalsIgnoreCase(jedis.ping());
        } catch (JedisException e) {
            log.warn("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void push(String key, String value) {
        execute("push", jedis -> jedis.lpush(key, value));
    }

    /**
     * Uses LMOVE from the right (head) of the source to the left (tail) of the destination.
     */
    @Override
    public String popAndPush(String source, String destination) {
        return execute("pop and push", jedis -> jedis.lmove(source, destination, ListDirection.RIGHT, ListDirection.LEFT));
    }

    @Override
    public boolean remove(String key, String value) {
        return execute("remove", jedis -> jedis.lrem(key, 1, value) > 0);
    }

    @Override
    public long length(String key) {
        return execute("length", jedis -> jedis.llen(key));
    }

    /**
     * LRANGE returns items from left to right (tail to head) so the result is reversed.
     */
    @Override
    public List<String> range(String key, int max) {
        if (max == 0) {
            return new ArrayList<>();
        }
        return execute("range", jedis -> {
            List<String> data = max < 0 ? jedis.lrange(key, 0, -1) : jedis.lrange(key, -max, -1);
            List<String> items = new ArrayList<>(data);
            Collections.reverse(items);
            return items;
        });
    }

    @Override
    public void addScored(String key, String value, double score) {
        execute("add scored", jedis -> jedis.zadd(key, score, value));
    }

    @Override
    public List<String> rangeByScore(String key, double maxScore, int limit) {
        return execute("range by score", jedis -> jedis.zrangeByScore(key, Double.NEGATIVE_INFINITY, maxScore, 0, limit));
    }

    @Override
    public boolean moveScoredToList(String sortedKey, String value, String listKey) {
        Object result = execute("move scored", jedis -> jedis.eval(MOVE_SCORED_SCRIPT, List.of(sortedKey, listKey), List.of(value)));
        return result instanceof Long && (Long) result == 1L;
    }

    @Override
    public long scoredCount(String key) {
        return execute("scored count", jedis -> jedis.zcard(key));
    }

    @Override
    public long increment(String key, String field, long by) {
        return execute("increment", jedis -> jedis.hincrBy(key, field, by));
    }

    @Override
    public Map<String, Long> getCounters(String key) {
        Map<String, String> raw = execute("get counters", jedis -> jedis.hgetAll(key));
        Map<String, Long> counters = new HashMap<>();
        for (Map.Entry<String, String> entry : raw.entrySet()) {
            try {
                counters.put(entry.getKey(), Long.parseLong(entry.getValue()));
            } catch (NumberFormatException e) {
                log.warn("Ignoring non numeric counter {} in {}: {}", entry.getKey(), key, entry.getValue());
            }
        }
        return counters;
    }

    @Override
    public void delete(String... keys) {
        if (keys.length == 0) {
            return;
        }
        execute("delete", jedis -> jedis.del(keys));
    }

    @Override
    public StoreBatch batch() {
        return new RedisStoreBatch();
    }

    /**
     * Close the Redis connection pool.
     */
    @Override
    public void close() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            try {
                jedisPool.close();
                log.debug("Redis queue store connection pool closed");
            } catch (JedisException e) {
                log.warn("Error closing Redis connection pool: {}", e.getMessage());
            }
        }
    }

    /**
     * Run a command with a pooled connection and translate failures.
     *
     * @param operation Operation name for logging.
     * @param command   Command to run.
     * @param <R>       Result type.
     * @return Command result.
     */
    private <R> R execute(String operation, Function<Jedis, R> command) {
        if (jedisPool == null) {
            throw new StoreUnavailableException("Redis queue store not initialized");
        }
        try (Jedis jedis = jedisPool.getResource()) {
            return command.apply(jedis);
        } catch (JedisException e) {
            log.error("Failed to {}: {}", operation, e.getMessage(), e);
            throw new StoreUnavailableException("Failed to " + operation, e);
        }
    }

    /**
     * Batch applied inside MULTI/EXEC.
     */
    private class RedisStoreBatch implements StoreBatch {
        private final List<Consumer<Transaction>> operations = new ArrayList<>();

        @Override
        public StoreBatch push(String key, String value) {
            operations.add(t -> t.lpush(key, value));
            return this;
        }

        @Override
        public StoreBatch addScored(String key, String value, double score) {
            operations.add(t -> t.zadd(key, score, value));
            return this;
        }

        @Override
        public StoreBatch increment(String key, String field, long by) {
            operations.add(t -> t.hincrBy(key, field, by));
            return this;
        }

        @Override
        public void execute() {
            if (operations.isEmpty()) {
                return;
            }
            List<Object> results = RedisQueueStore.this.execute("execute batch", jedis -> {
                Transaction transaction = jedis.multi();
                for (Consumer<Transaction> operation : operations) {
                    operation.accept(transaction);
                }
                return transaction.exec();
            });
            if (results == null) {
                throw new StoreUnavailableException("Batch of " + operations.size() + " operations was aborted");
            }
        }
    }
}
