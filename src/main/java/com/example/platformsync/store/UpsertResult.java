package com.example.platformsync.store;

public enum UpsertResult {
    INSERTED,
    REPLACED
}
