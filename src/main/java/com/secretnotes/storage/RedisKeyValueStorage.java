package com.secretnotes.storage;

import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.params.SetParams;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Redis-backed storage implementation.
 * Handles connection pooling and maps client failures to {@link StorageException}.
 *
 * No retries here: a transient failure surfaces immediately and the caller
 * owns the retry policy. Each command is bounded by the pool's socket timeout.
 */
@Slf4j
public class RedisKeyValueStorage implements KeyValueStorage {

    static final String PROBE_KEY = "healthcheck:probe";
    private static final Duration PROBE_TTL = Duration.ofSeconds(5);

    private final JedisPool jedisPool;
    private final String endpoint;

    public RedisKeyValueStorage(String host, int port) {
        this(host, port, 2000, null, 0);
    }

    public RedisKeyValueStorage(String host, int port, int timeoutMs, String password, int database) {
        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(128);
        poolConfig.setMaxIdle(32);
        poolConfig.setMinIdle(0);
        poolConfig.setTestWhileIdle(true);
        poolConfig.setBlockWhenExhausted(true);
        poolConfig.setMaxWait(Duration.ofMillis(timeoutMs));

        String auth = password == null || password.isEmpty() ? null : password;
        this.jedisPool = new JedisPool(poolConfig, host, port, timeoutMs, auth, database);
        this.endpoint = host + ":" + port + "/" + database;
        log.info("Redis storage initialized: {} (timeout {}ms)", endpoint, timeoutMs);
    }

    @Override
    public String get(String key) {
        return execute("GET", () -> {
            try (var jedis = jedisPool.getResource()) {
                return jedis.get(key);
            }
        });
    }

    @Override
    public void set(String key, String value) {
        execute("SET", () -> {
            try (var jedis = jedisPool.getResource()) {
                jedis.set(key, value);
                return null;
            }
        });
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        execute("SET", () -> {
            try (var jedis = jedisPool.getResource()) {
                SetParams params = new SetParams().px(ttl.toMillis());
                jedis.set(key, value, params);
                return null;
            }
        });
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return execute("PEXPIRE", () -> {
            try (var jedis = jedisPool.getResource()) {
                return jedis.pexpire(key, ttl.toMillis()) == 1L;
            }
        });
    }

    @Override
    public Duration ttl(String key) {
        return execute("PTTL", () -> {
            try (var jedis = jedisPool.getResource()) {
                long millis = jedis.pttl(key);
                // -2: no such key, -1: no expiry
                return millis < 0 ? null : Duration.ofMillis(millis);
            }
        });
    }

    @Override
    public Object evalScript(String script, List<String> keys, List<String> args) {
        return execute("EVAL", () -> {
            try (var jedis = jedisPool.getResource()) {
                return jedis.eval(script, keys, args);
            }
        });
    }

    @Override
    public boolean isAvailable() {
        String token = UUID.randomUUID().toString();
        try (var jedis = jedisPool.getResource()) {
            jedis.set(PROBE_KEY, token, new SetParams().px(PROBE_TTL.toMillis()));
            String echoed = jedis.get(PROBE_KEY);
            if (!token.equals(echoed)) {
                log.warn("Redis round-trip mismatch on {}", endpoint);
                return false;
            }
            return true;
        } catch (Exception e) {
            log.warn("Redis health check failed on {}: {}", endpoint, e.getMessage());
            return false;
        }
    }

    private <T> T execute(String command, StorageOperation<T> operation) {
        try {
            return operation.execute();
        } catch (Exception e) {
            log.warn("Storage operation {} failed on {}: {}", command, endpoint, e.getMessage());
            throw new StorageException(command + " failed against " + endpoint, e);
        }
    }

    @FunctionalInterface
    private interface StorageOperation<T> {
        T execute() throws Exception;
    }

    public void close() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
            log.info("Redis connection pool closed");
        }
    }
}
