package com.secretnotes.core;

/**
 * Owns the note lifecycle: creation, metadata preview and atomic consumption.
 * Implementations hold no process-local state; all coordination between
 * concurrent callers happens in the backing store.
 */
public interface NoteStore {

    /**
     * Validate and persist a note.
     *
     * @return the freshly generated identifier
     * @throws com.secretnotes.exception.PayloadTooLargeException contents over the byte limit
     * @throws com.secretnotes.exception.InvalidMetaException meta over the byte limit
     * @throws com.secretnotes.exception.InvalidPolicyException missing or out-of-range views / expiration
     */
    String create(NoteRequest request);

    /**
     * Return the meta string without consuming a view.
     *
     * @throws com.secretnotes.exception.NoteNotFoundException if the note is absent
     */
    String preview(String id);

    /**
     * Read the note and, in the same atomic step, decrement or delete it.
     *
     * @throws com.secretnotes.exception.NoteNotFoundException if the note is absent
     */
    ConsumedNote consume(String id);
}
