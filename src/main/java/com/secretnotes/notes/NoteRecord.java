package com.secretnotes.notes;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Stored form of a note, serialized as JSON under {@code note:{id}}.
 * {@code views} is omitted for purely time-limited notes so the consume
 * script can tell the two policies apart.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class NoteRecord {
    String contents;
    String meta;
    Integer views;
    long created;
}
