package com.example.platformsync.exception;

public class ObjectStoreException extends IngestionException {

    public ObjectStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
