package com.secretnotes.notes;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Generates unguessable, URL-safe note identifiers.
 * Draws {@code length} random bytes and keeps the first {@code length}
 * characters of their base64url encoding, i.e. six bits of entropy per character.
 */
public class NoteIdGenerator {

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final SecureRandom random;
    private final int length;

    public NoteIdGenerator(int length) {
        this(new SecureRandom(), length);
    }

    NoteIdGenerator(SecureRandom random, int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("length must be positive");
        }
        this.random = random;
        this.length = length;
    }

    public String nextId() {
        byte[] bytes = new byte[length];
        random.nextBytes(bytes);
        return ENCODER.encodeToString(bytes).substring(0, length);
    }
}
