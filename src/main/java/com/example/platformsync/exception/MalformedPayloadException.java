package com.example.platformsync.exception;

public class MalformedPayloadException extends IngestionException {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
