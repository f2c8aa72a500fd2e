package com.secretnotes.exception;

/**
 * Exception thrown when a note is absent.
 * Deliberately carries no id and no reason: expired, consumed and
 * never-issued notes are indistinguishable.
 */
public class NoteNotFoundException extends NoteException {

    public NoteNotFoundException() {
        super(ErrorKind.NOT_FOUND, "Note not found or already deleted");
    }
}
