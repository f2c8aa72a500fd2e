package com.secretnotes.exception;

import com.secretnotes.core.ActionClass;

/**
 * Exception thrown when a client exceeds its budget for an action class
 */
public class RateLimitedException extends NoteException {

    public RateLimitedException(ActionClass action) {
        super(ErrorKind.RATE_LIMITED, "Too many " + action.keyPart() + " requests - slow down");
    }
}
