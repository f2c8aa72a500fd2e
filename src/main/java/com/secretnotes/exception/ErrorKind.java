package com.secretnotes.exception;

/**
 * Rejection reasons a note operation can report.
 * The transport layer decides how each one is presented.
 */
public enum ErrorKind {
    PAYLOAD_TOO_LARGE,
    INVALID_META,
    INVALID_POLICY,
    NOT_FOUND,
    RATE_LIMITED
}
