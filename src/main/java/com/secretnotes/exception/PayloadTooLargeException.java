package com.secretnotes.exception;

/**
 * Exception thrown when note contents exceed the configured byte limit
 */
public class PayloadTooLargeException extends NoteException {

    public PayloadTooLargeException(long limitBytes) {
        super(ErrorKind.PAYLOAD_TOO_LARGE, "Note too large (limit " + limitBytes + " bytes)");
    }
}
