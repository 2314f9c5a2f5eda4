package com.example.platformsync.exception;

import lombok.Getter;

/**
 * The object disappeared between listing and fetching (or archiving).
 * Treated as a skip, never as a pipeline error.
 */
@Getter
public class ObjectNotFoundException extends IngestionException {

    private final String key;

    public ObjectNotFoundException(String key, Throwable cause) {
        super("Object not found: " + key, cause);
        this.key = key;
    }
}
