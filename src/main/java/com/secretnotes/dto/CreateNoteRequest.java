package com.secretnotes.dto;

import com.secretnotes.core.NoteRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of POST /api/notes. {@code expiration} is in minutes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateNoteRequest {
    private String contents;
    private String meta;
    private Integer views;
    private Integer expiration;

    public NoteRequest toNoteRequest() {
        return NoteRequest.builder()
                .contents(contents)
                .meta(meta)
                .views(views)
                .expirationMinutes(expiration)
                .build();
    }
}
