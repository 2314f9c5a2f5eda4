package com.example.platformsync.model;

/**
 * Result of processing one listed object.
 */
public record ObjectOutcome(
        String key,
        Status status,
        String reason) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        SKIPPED
    }

    public static ObjectOutcome succeeded(String key) {
        return new ObjectOutcome(key, Status.SUCCEEDED, null);
    }

    public static ObjectOutcome failed(String key, String reason) {
        return new ObjectOutcome(key, Status.FAILED, reason);
    }

    public static ObjectOutcome skipped(String key, String reason) {
        return new ObjectOutcome(key, Status.SKIPPED, reason);
    }
}
