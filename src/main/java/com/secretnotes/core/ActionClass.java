package com.secretnotes.core;

/**
 * Budget classes for rate limiting. Preview and consume share READ.
 */
public enum ActionClass {
    CREATE("create"),
    READ("read");

    private final String keyPart;

    ActionClass(String keyPart) {
        this.keyPart = keyPart;
    }

    public String keyPart() {
        return keyPart;
    }
}
