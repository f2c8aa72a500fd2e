package com.secretnotes.core;

import lombok.Builder;
import lombok.Value;

/**
 * Limits and policy switches for note creation.
 */
@Value
@Builder
public class NoteConfig {

    /**
     * Maximum size of note contents, in UTF-8 bytes
     */
    @Builder.Default
    long sizeLimitBytes = 80L * 1024 * 1024;

    /**
     * Maximum size of the meta string, in UTF-8 bytes
     */
    @Builder.Default
    long metaLimitBytes = 4 * 1024;

    @Builder.Default
    int maxViews = 100;

    /**
     * Upper bound for time-based expiry, in minutes
     */
    @Builder.Default
    int maxExpirationMinutes = 360;

    /**
     * When false every note is forced to a single view and requested expiry is ignored
     */
    @Builder.Default
    boolean allowAdvanced = true;

    @Builder.Default
    int idLength = 32;

    public void validate() {
        if (sizeLimitBytes <= 0 || metaLimitBytes <= 0) {
            throw new IllegalArgumentException("size limits must be positive");
        }
        if (maxViews < 1) {
            throw new IllegalArgumentException("maxViews must be at least 1");
        }
        if (maxExpirationMinutes < 1) {
            throw new IllegalArgumentException("maxExpirationMinutes must be at least 1");
        }
        // below ~16 chars (96 bits) ids become enumerable
        if (idLength < 16) {
            throw new IllegalArgumentException("idLength must be at least 16");
        }
    }
}
