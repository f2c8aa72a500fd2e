package com.secretnotes.storage;

import java.time.Duration;
import java.util.List;

/**
 * Abstraction over the shared key-value store (Redis or anything offering
 * the same primitives plus server-side scripting).
 * Every call may block on network I/O and throws {@link StorageException}
 * when the store cannot be reached.
 */
public interface KeyValueStorage {

    /**
     * @return the stored value, or null if the key does not exist
     */
    String get(String key);

    void set(String key, String value);

    /**
     * Write a value and its time-to-live in a single command.
     */
    void set(String key, String value, Duration ttl);

    /**
     * @return true if the key existed and the TTL was applied
     */
    boolean expire(String key, Duration ttl);

    /**
     * Remaining time-to-live of a key.
     *
     * @return null if the key is missing or has no expiry
     */
    Duration ttl(String key);

    /**
     * Execute Lua script atomically.
     * The script runs as one indivisible step relative to every other client.
     */
    Object evalScript(String script, List<String> keys, List<String> args);

    /**
     * Liveness probe. Performs a real write-then-read round trip,
     * not just a protocol ping.
     */
    boolean isAvailable();
}
