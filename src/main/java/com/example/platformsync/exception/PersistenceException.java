package com.example.platformsync.exception;

/**
 * The document store rejected a single record. The rest of the run carries on.
 */
public class PersistenceException extends IngestionException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
