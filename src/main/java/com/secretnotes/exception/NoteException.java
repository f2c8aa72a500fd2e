package com.secretnotes.exception;

/**
 * Base exception for rejected note requests.
 * These are ordinary request outcomes, not process failures.
 */
public class NoteException extends RuntimeException {

    private final ErrorKind kind;

    public NoteException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
