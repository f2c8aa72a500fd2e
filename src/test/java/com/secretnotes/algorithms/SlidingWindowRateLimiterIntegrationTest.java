package com.secretnotes.algorithms;

import com.secretnotes.core.ActionClass;
import com.secretnotes.core.RateLimitConfig;
import com.secretnotes.storage.RedisKeyValueStorage;
import com.secretnotes.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Sliding window behavior against a real Redis, with a controllable clock.
 */
@Testcontainers(disabledWithoutDocker = true)
class SlidingWindowRateLimiterIntegrationTest {

    @Container
    private static final GenericContainer<?> REDIS =
            new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

    private static RedisKeyValueStorage storage;

    private MutableClock clock;
    private SlidingWindowRateLimiter rateLimiter;
    private String identity;

    @BeforeAll
    static void setup() {
        storage = new RedisKeyValueStorage(REDIS.getHost(), REDIS.getMappedPort(6379));
    }

    @AfterAll
    static void teardown() {
        storage.close();
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-10-19T12:00:00Z"));
        RateLimitConfig config = RateLimitConfig.builder()
                .createLimit(3)
                .readLimit(50)
                .window(Duration.ofMinutes(1))
                .enableLocalCache(false)
                .build();
        rateLimiter = new SlidingWindowRateLimiter(storage, config, clock, new SimpleMeterRegistry());
        // fresh identity per test so windows never leak between tests
        identity = "198.51.100." + UUID.randomUUID();
    }

    @Test
    @DisplayName("Should admit exactly the limit within one window and reject the next")
    void admitsLimitThenRejects() {
        for (int i = 0; i < 3; i++) {
            assertTrue(rateLimiter.tryAcquire(identity, ActionClass.CREATE), "request " + (i + 1));
            clock.advance(Duration.ofSeconds(5));
        }
        assertFalse(rateLimiter.tryAcquire(identity, ActionClass.CREATE));
    }

    @Test
    @DisplayName("Should restore the budget once the window has fully rolled over")
    void budgetReturnsAfterWindow() {
        for (int i = 0; i < 3; i++) {
            assertTrue(rateLimiter.tryAcquire(identity, ActionClass.CREATE));
        }
        assertFalse(rateLimiter.tryAcquire(identity, ActionClass.CREATE));

        clock.advance(Duration.ofSeconds(59));
        assertFalse(rateLimiter.tryAcquire(identity, ActionClass.CREATE));

        clock.advance(Duration.ofSeconds(61));
        assertTrue(rateLimiter.tryAcquire(identity, ActionClass.CREATE));
    }

    @Test
    @DisplayName("Should slide rather than reset on fixed boundaries")
    void windowSlides() {
        assertTrue(rateLimiter.tryAcquire(identity, ActionClass.CREATE));
        assertTrue(rateLimiter.tryAcquire(identity, ActionClass.CREATE));
        clock.advance(Duration.ofSeconds(30));
        assertTrue(rateLimiter.tryAcquire(identity, ActionClass.CREATE));

        // the first two fall out, the third is still inside the window
        clock.advance(Duration.ofSeconds(31));
        assertTrue(rateLimiter.tryAcquire(identity, ActionClass.CREATE));
        assertTrue(rateLimiter.tryAcquire(identity, ActionClass.CREATE));
        assertFalse(rateLimiter.tryAcquire(identity, ActionClass.CREATE));
    }

    @Test
    @DisplayName("Should keep create and read budgets separate")
    void budgetsArePerActionClass() {
        for (int i = 0; i < 3; i++) {
            assertTrue(rateLimiter.tryAcquire(identity, ActionClass.CREATE));
        }
        assertFalse(rateLimiter.tryAcquire(identity, ActionClass.CREATE));
        assertTrue(rateLimiter.tryAcquire(identity, ActionClass.READ));
        assertTrue(rateLimiter.tryAcquire("other-" + identity, ActionClass.CREATE));
    }

    @Test
    @DisplayName("Should count every concurrent request exactly once")
    void concurrentCallersNeitherUnderNorOvercount() throws Exception {
        int threads = 20;
        int requestsPerThread = 5;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < threads; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int j = 0; j < requestsPerThread; j++) {
                    if (rateLimiter.tryAcquire(identity, ActionClass.READ)) {
                        admitted.incrementAndGet();
                    }
                }
                return null;
            }));
        }

        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // clock is frozen: all 100 requests share one millisecond and one window
        assertEquals(50, admitted.get());
    }

    @Test
    @DisplayName("Should let idle window keys expire shortly after the window")
    void idleKeysExpire() {
        rateLimiter.tryAcquire(identity, ActionClass.READ);

        Duration ttl = storage.ttl(SlidingWindowRateLimiter.windowKey(identity, ActionClass.READ));
        assertNotNull(ttl);
        assertTrue(ttl.compareTo(Duration.ofSeconds(60)) > 0);
        assertTrue(ttl.compareTo(Duration.ofSeconds(61)) <= 0);
    }
}
