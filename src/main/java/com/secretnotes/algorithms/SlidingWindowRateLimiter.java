package com.secretnotes.algorithms;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.secretnotes.core.ActionClass;
import com.secretnotes.core.RateLimitConfig;
import com.secretnotes.core.RateLimiter;
import com.secretnotes.storage.KeyValueStorage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Sliding window log implementation.
 *
 * Each (action, identity) pair owns a Redis sorted set of request
 * timestamps. On every request one Lua script:
 * - drops entries that fell out of the trailing window
 * - records the current request
 * - counts what is left
 * - refreshes the key expiry to slightly more than one window
 *
 * The request is admitted iff the count is within the limit. Rejected
 * requests are recorded too, so a client hammering past its limit keeps
 * itself locked out until it backs off for a full window.
 *
 * Exact at window boundaries, unlike a weighted fixed-window counter,
 * at the cost of one set entry per request.
 */
@Slf4j
public class SlidingWindowRateLimiter implements RateLimiter {

    static final String KEY_PREFIX = "rl:";

    // Returns the number of requests in the window, including this one
    static final String WINDOW_SCRIPT =
            "local key = KEYS[1]\n" +
            "local now = tonumber(ARGV[1])\n" +
            "local window = tonumber(ARGV[2])\n" +
            "local member = ARGV[3]\n" +
            "local ttl = tonumber(ARGV[4])\n" +
            "\n" +
            "redis.call('ZREMRANGEBYSCORE', key, '-inf', now - window)\n" +
            "redis.call('ZADD', key, now, member)\n" +
            "local count = redis.call('ZCARD', key)\n" +
            "redis.call('PEXPIRE', key, ttl)\n" +
            "return count";

    private final KeyValueStorage storage;
    private final RateLimitConfig config;
    private final Clock clock;
    private final Cache<String, Long> rejectionCache;

    // Metrics
    private final Counter allowedRequests;
    private final Counter rejectedRequests;
    private final Counter cacheHits;

    public SlidingWindowRateLimiter(
            KeyValueStorage storage,
            RateLimitConfig config,
            Clock clock,
            MeterRegistry meterRegistry) {

        config.validate();
        this.storage = storage;
        this.config = config;
        this.clock = clock;

        // Short TTL to balance Redis load vs accuracy
        if (config.isEnableLocalCache()) {
            this.rejectionCache = Caffeine.newBuilder()
                    .expireAfterWrite(config.getLocalCacheTtl().toMillis(), TimeUnit.MILLISECONDS)
                    .maximumSize(10000)
                    .build();
        } else {
            this.rejectionCache = null;
        }

        this.allowedRequests = Counter.builder("ratelimiter.requests.allowed")
                .description("Number of allowed requests")
                .register(meterRegistry);

        this.rejectedRequests = Counter.builder("ratelimiter.requests.rejected")
                .description("Number of rejected requests")
                .register(meterRegistry);

        this.cacheHits = Counter.builder("ratelimiter.cache.hits")
                .description("Number of local cache hits")
                .register(meterRegistry);

        log.info("SlidingWindow initialized: create={}, read={} per {}",
                config.getCreateLimit(), config.getReadLimit(), config.getWindow());
    }

    @Override
    public boolean tryAcquire(String identity, ActionClass action) {
        return tryAcquire(identity, action, config.limitFor(action));
    }

    @Override
    public boolean tryAcquire(String identity, ActionClass action, long limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }

        String key = windowKey(identity, action);

        // Recently rejected: reject again without a round trip
        if (rejectionCache != null) {
            Long cachedCount = rejectionCache.getIfPresent(key);
            if (cachedCount != null && cachedCount > limit) {
                cacheHits.increment();
                rejectedRequests.increment();
                return false;
            }
        }

        long now = clock.millis();
        long windowMs = config.getWindow().toMillis();
        List<String> keys = Collections.singletonList(key);
        List<String> args = Arrays.asList(
                String.valueOf(now),
                String.valueOf(windowMs),
                uniqueMember(now),
                String.valueOf(windowMs + config.getKeyGrace().toMillis())
        );

        long count = ((Number) storage.evalScript(WINDOW_SCRIPT, keys, args)).longValue();
        boolean allowed = count <= limit;

        if (allowed) {
            allowedRequests.increment();
        } else {
            if (rejectionCache != null) {
                rejectionCache.put(key, count);
            }
            rejectedRequests.increment();
        }

        log.trace("Sliding window for {}: count={}, limit={}, allowed={}", key, count, limit, allowed);
        return allowed;
    }

    /**
     * Generate Redis key for an (action, identity) window
     */
    static String windowKey(String identity, ActionClass action) {
        return KEY_PREFIX + action.keyPart() + ":" + identity;
    }

    // Same-millisecond requests need distinct members or ZADD would collapse them
    private static String uniqueMember(long now) {
        return now + "-" + Long.toHexString(ThreadLocalRandom.current().nextLong());
    }
}
