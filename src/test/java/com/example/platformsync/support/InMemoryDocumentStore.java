package com.example.platformsync.support;

import com.example.platformsync.exception.StoreUnavailableException;
import com.example.platformsync.store.DocumentStoreClient;
import com.example.platformsync.store.UpsertResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Document store keyed by the exact upsert filter, mirroring replaceOne(upsert=true).
 */
public class InMemoryDocumentStore implements DocumentStoreClient {

    private final Map<String, Map<Map<String, Object>, Map<String, Object>>> collections = new ConcurrentHashMap<>();
    private volatile boolean unavailable;

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    @Override
    public UpsertResult upsert(String collectionName, Map<String, Object> filter, Map<String, Object> document) {
        if (unavailable) {
            throw new StoreUnavailableException("store down", null);
        }
        Map<String, Object> previous = collection(collectionName)
                .put(new LinkedHashMap<>(filter), new LinkedHashMap<>(document));
        return previous == null ? UpsertResult.INSERTED : UpsertResult.REPLACED;
    }

    @Override
    public boolean exists(String collectionName, Map<String, Object> filter) {
        if (unavailable) {
            throw new StoreUnavailableException("store down", null);
        }
        return collection(collectionName).values().stream()
                .anyMatch(document -> document.entrySet().containsAll(filter.entrySet()));
    }

    public List<Map<String, Object>> documents(String collectionName) {
        return new ArrayList<>(collection(collectionName).values());
    }

    public Map<String, Object> find(String collectionName, Map<String, Object> filter) {
        return collection(collectionName).get(filter);
    }

    private Map<Map<String, Object>, Map<String, Object>> collection(String name) {
        return collections.computeIfAbsent(name, n -> new ConcurrentHashMap<>());
    }
}
