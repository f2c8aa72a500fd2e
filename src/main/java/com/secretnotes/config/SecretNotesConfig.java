package com.secretnotes.config;

import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.secretnotes.ClientIdentityResolver;
import com.secretnotes.algorithms.SlidingWindowRateLimiter;
import com.secretnotes.core.NoteConfig;
import com.secretnotes.core.NoteStore;
import com.secretnotes.core.RateLimitConfig;
import com.secretnotes.core.RateLimiter;
import com.secretnotes.notes.ScriptedNoteStore;
import com.secretnotes.storage.KeyValueStorage;
import com.secretnotes.storage.RedisKeyValueStorage;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Spring configuration for the note store, rate limiter and their shared Redis handle
 */
@Slf4j
@Configuration
public class SecretNotesConfig {

    @Value("${redis.host:localhost}")
    private String redisHost;

    @Value("${redis.port:6379}")
    private int redisPort;

    @Value("${redis.password:}")
    private String redisPassword;

    @Value("${redis.database:0}")
    private int redisDatabase;

    @Value("${redis.timeout-ms:2000}")
    private int redisTimeoutMs;

    @Value("${notes.size-limit-bytes:83886080}")
    private long sizeLimitBytes;

    @Value("${notes.meta-limit-bytes:4096}")
    private long metaLimitBytes;

    @Value("${notes.max-views:100}")
    private int maxViews;

    @Value("${notes.max-expiration:360}")
    private int maxExpiration;

    @Value("${notes.allow-advanced:true}")
    private boolean allowAdvanced;

    @Value("${notes.id-length:32}")
    private int idLength;

    @Value("${notes.trusted-ip-header:CF-Connecting-IP}")
    private String trustedIpHeader;

    @Value("${ratelimit.create-per-minute:20}")
    private long createPerMinute;

    @Value("${ratelimit.read-per-minute:60}")
    private long readPerMinute;

    @Value("${ratelimit.local-cache-ttl-ms:100}")
    private long localCacheTtlMs;

    @Bean(destroyMethod = "close")
    public KeyValueStorage keyValueStorage() {
        log.info("Initializing Redis storage at {}:{}", redisHost, redisPort);
        RedisKeyValueStorage storage = new RedisKeyValueStorage(
                redisHost, redisPort, redisTimeoutMs, redisPassword, redisDatabase);
        if (!storage.isAvailable()) {
            log.error("Cannot reach Redis at {}:{}; requests will fail until it is up", redisHost, redisPort);
        }
        return storage;
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public NoteConfig noteConfig() {
        NoteConfig config = NoteConfig.builder()
                .sizeLimitBytes(sizeLimitBytes)
                .metaLimitBytes(metaLimitBytes)
                .maxViews(maxViews)
                .maxExpirationMinutes(maxExpiration)
                .allowAdvanced(allowAdvanced)
                .idLength(idLength)
                .build();
        config.validate();
        return config;
    }

    /**
     * 60 second sliding window, separate budgets for create and read
     */
    @Bean
    public RateLimitConfig rateLimitConfig() {
        return RateLimitConfig.builder()
                .createLimit(createPerMinute)
                .readLimit(readPerMinute)
                .window(Duration.ofMinutes(1))
                .enableLocalCache(localCacheTtlMs > 0)
                .localCacheTtl(Duration.ofMillis(Math.max(localCacheTtlMs, 1)))
                .build();
    }

    @Bean
    public NoteStore noteStore(
            KeyValueStorage storage,
            NoteConfig noteConfig,
            ObjectMapper objectMapper,
            Clock clock,
            MeterRegistry meterRegistry) {

        return new ScriptedNoteStore(storage, noteConfig, objectMapper, clock, meterRegistry);
    }

    @Bean
    public RateLimiter rateLimiter(
            KeyValueStorage storage,
            RateLimitConfig rateLimitConfig,
            Clock clock,
            MeterRegistry meterRegistry) {

        return new SlidingWindowRateLimiter(storage, rateLimitConfig, clock, meterRegistry);
    }

    @Bean
    public ClientIdentityResolver clientIdentityResolver() {
        return new ClientIdentityResolver(trustedIpHeader);
    }

    /**
     * Jackson caps string values at 20M chars by default; notes may be larger
     */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer noteSizeCustomizer() {
        int maxStringLength = (int) Math.min(Integer.MAX_VALUE,
                Math.max(StreamReadConstraints.DEFAULT_MAX_STRING_LEN, sizeLimitBytes * 2));
        return builder -> builder.postConfigurer(mapper -> mapper.getFactory().setStreamReadConstraints(
                StreamReadConstraints.builder().maxStringLength(maxStringLength).build()));
    }
}
