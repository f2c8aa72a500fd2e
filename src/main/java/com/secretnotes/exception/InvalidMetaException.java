package com.secretnotes.exception;

/**
 * Exception thrown when note metadata exceeds the configured byte limit
 */
public class InvalidMetaException extends NoteException {

    public InvalidMetaException(long limitBytes) {
        super(ErrorKind.INVALID_META, "meta exceeds " + limitBytes + " bytes");
    }
}
