package com.secretnotes.core;

import lombok.Builder;
import lombok.Value;

/**
 * Creation input. At least one of views / expirationMinutes must be set.
 */
@Value
@Builder
public class NoteRequest {
    String contents;
    String meta;
    Integer views;
    Integer expirationMinutes;
}
