package com.example.platformsync.exception;

/**
 * The document store cannot be reached at all. Aborts the current run; the next tick retries.
 */
public class StoreUnavailableException extends IngestionException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
