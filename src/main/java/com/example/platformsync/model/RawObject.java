package com.example.platformsync.model;

import java.time.Instant;

/**
 * Bytes of one listed object, as fetched during a single run.
 */
public record RawObject(
        String key,
        byte[] bytes,
        Instant fetchedAt) {
}
