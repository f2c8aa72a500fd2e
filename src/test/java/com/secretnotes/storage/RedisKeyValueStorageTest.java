package com.secretnotes.storage;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Failure behavior with nothing listening on the other end.
 */
class RedisKeyValueStorageTest {

    private RedisKeyValueStorage storage;

    @BeforeEach
    void setUp() {
        // port 1 is reserved and never runs Redis
        storage = new RedisKeyValueStorage("127.0.0.1", 1, 300, null, 0);
    }

    @AfterEach
    void tearDown() {
        storage.close();
    }

    @Test
    @DisplayName("Should report unavailable when the round trip fails")
    void shouldReportUnavailable() {
        assertFalse(storage.isAvailable());
    }

    @Test
    @DisplayName("Should wrap connection failures in StorageException")
    void shouldWrapConnectionFailures() {
        StorageException ex = assertThrows(StorageException.class, () -> storage.get("note:x"));
        assertNotNull(ex.getCause());

        assertThrows(StorageException.class, () -> storage.set("note:x", "v", Duration.ofSeconds(5)));
        assertThrows(StorageException.class,
                () -> storage.evalScript("return 1", List.of("k"), List.of()));
    }
}
