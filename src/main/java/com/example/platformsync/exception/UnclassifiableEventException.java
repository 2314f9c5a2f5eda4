package com.example.platformsync.exception;

public class UnclassifiableEventException extends IngestionException {

    public UnclassifiableEventException(String message) {
        super(message);
    }
}
