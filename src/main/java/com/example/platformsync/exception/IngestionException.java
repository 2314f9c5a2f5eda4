package com.example.platformsync.exception;

/**
 * Base type for every failure raised while syncing platform objects.
 * The message doubles as the {@code reason} written to the per-object failure log.
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
