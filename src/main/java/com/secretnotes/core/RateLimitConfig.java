package com.secretnotes.core;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for rate limiting behavior.
 * Immutable to prevent accidental modifications after creation.
 */
@Value
@Builder
public class RateLimitConfig {

    /**
     * Requests per window for note creation
     */
    @Builder.Default
    long createLimit = 20;

    /**
     * Requests per window for preview and consume
     */
    @Builder.Default
    long readLimit = 60;

    /**
     * Trailing window the limits apply to
     */
    @Builder.Default
    Duration window = Duration.ofMinutes(1);

    /**
     * Extra lifetime of an idle window key beyond the window itself
     */
    @Builder.Default
    Duration keyGrace = Duration.ofSeconds(1);

    /**
     * Remember recent rejections locally to avoid hammering Redis during bursts.
     * Only ever rejects; admission always goes to the store.
     */
    @Builder.Default
    boolean enableLocalCache = true;

    @Builder.Default
    Duration localCacheTtl = Duration.ofMillis(100);

    public long limitFor(ActionClass action) {
        return action == ActionClass.CREATE ? createLimit : readLimit;
    }

    public void validate() {
        if (createLimit <= 0 || readLimit <= 0) {
            throw new IllegalArgumentException("rate limits must be positive");
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be a positive duration");
        }
        if (keyGrace == null || keyGrace.isNegative()) {
            throw new IllegalArgumentException("keyGrace cannot be negative");
        }
        if (enableLocalCache && (localCacheTtl == null || localCacheTtl.isNegative() || localCacheTtl.isZero())) {
            throw new IllegalArgumentException("localCacheTtl must be positive when the local cache is enabled");
        }
    }

    public static RateLimitConfig perMinute(long createLimit, long readLimit) {
        return RateLimitConfig.builder()
                .createLimit(createLimit)
                .readLimit(readLimit)
                .window(Duration.ofMinutes(1))
                .build();
    }
}
