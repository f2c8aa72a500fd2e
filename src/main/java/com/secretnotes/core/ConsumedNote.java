package com.secretnotes.core;

import lombok.Value;

/**
 * Result of a successful consume.
 */
@Value
public class ConsumedNote {
    String contents;
    String meta;

    /**
     * Views left after this read, or null for a time-limited note
     */
    Integer remainingViews;
}
