package com.example.platformsync.store;

import com.example.platformsync.exception.PersistenceException;
import com.example.platformsync.exception.StoreUnavailableException;

import java.util.Map;

/**
 * Keyed writes into the document store shared with the rest of the backend.
 */
public interface DocumentStoreClient {

    /**
     * Insert-or-replace the single document matching {@code filter}. Replaces the whole document;
     * never merges fields and never creates a second document for the same filter.
     *
     * @throws PersistenceException       if the store rejected this document
     * @throws StoreUnavailableException  if the store could not be reached
     */
    UpsertResult upsert(String collectionName, Map<String, Object> filter, Map<String, Object> document);

    /**
     * Whether any document in {@code collectionName} matches every entry of {@code filter}.
     */
    boolean exists(String collectionName, Map<String, Object> filter);
}
