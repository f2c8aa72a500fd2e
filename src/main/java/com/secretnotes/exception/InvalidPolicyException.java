package com.secretnotes.exception;

/**
 * Exception thrown when the requested view count or expiration is missing or out of range
 */
public class InvalidPolicyException extends NoteException {

    public InvalidPolicyException(String message) {
        super(ErrorKind.INVALID_POLICY, message);
    }
}
