package com.example.platformsync.store;

import com.example.platformsync.exception.PersistenceException;
import com.example.platformsync.exception.StoreUnavailableException;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.BasicQuery;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class MongoDocumentStoreClient implements DocumentStoreClient {

    private final MongoTemplate mongoTemplate;

    @Override
    public UpsertResult upsert(String collectionName, Map<String, Object> filter, Map<String, Object> document) {
        try {
            // replaceOne with upsert is atomic per key; concurrent writers on the same key are serialized by Mongo
            UpdateResult result = mongoTemplate.execute(collectionName, collection -> collection.replaceOne(
                    new Document(filter),
                    new Document(document),
                    new ReplaceOptions().upsert(true)));

            if (result != null && result.getUpsertedId() != null) {
                log.debug("Inserted into {}: {}", collectionName, filter);
                return UpsertResult.INSERTED;
            }
            log.debug("Replaced in {}: {}", collectionName, filter);
            return UpsertResult.REPLACED;
        } catch (DataAccessResourceFailureException e) {
            throw new StoreUnavailableException("Document store unreachable while writing to " + collectionName, e);
        } catch (DataAccessException e) {
            throw new PersistenceException("Document store rejected upsert into " + collectionName
                    + " for " + filter + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(String collectionName, Map<String, Object> filter) {
        try {
            return mongoTemplate.exists(new BasicQuery(new Document(filter)), collectionName);
        } catch (DataAccessResourceFailureException e) {
            throw new StoreUnavailableException("Document store unreachable while reading " + collectionName, e);
        } catch (DataAccessException e) {
            throw new PersistenceException("Lookup failed in " + collectionName + " for " + filter, e);
        }
    }
}
