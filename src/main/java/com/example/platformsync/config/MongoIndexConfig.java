package com.example.platformsync.config;

import com.example.platformsync.model.IngestedRecord;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.List;

/**
 * Creates the unique composite-key index on every event collection so the store itself
 * guarantees one record per (stage, work_order, document_number, idlpn).
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class MongoIndexConfig {

    static final String INDEX_NAME = "composite_key_uq";

    private final MongoTemplate mongoTemplate;
    private final SyncProperties properties;

    @PostConstruct
    public void setupCompositeKeyIndexes() {
        // Mongo may still be starting when the app boots
        int maxRetries = 10;
        int retryDelayMs = 2000;

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try {
                log.info("Ensuring composite key indexes (attempt {}/{})", attempt, maxRetries);
                for (String collection : collections()) {
                    ensureCompositeKeyIndex(collection);
                }
                log.info("Composite key indexes in place on {}", collections());
                return;
            } catch (Exception e) {
                log.warn("Failed to ensure composite key indexes (attempt {}/{}): {}",
                        attempt, maxRetries, e.getMessage());
                if (attempt < maxRetries) {
                    try {
                        Thread.sleep(retryDelayMs);
                        retryDelayMs = Math.min(retryDelayMs * 2, 30000);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                } else {
                    log.error("Failed to ensure composite key indexes after {} attempts", maxRetries, e);
                }
            }
        }
    }

    void ensureCompositeKeyIndex(String collection) {
        Index index = new Index()
                .on(IngestedRecord.STAGE, Sort.Direction.ASC)
                .on(IngestedRecord.WORK_ORDER, Sort.Direction.ASC)
                .on(IngestedRecord.DOCUMENT_NUMBER, Sort.Direction.ASC)
                .on(IngestedRecord.IDLPN, Sort.Direction.ASC)
                .unique()
                .named(INDEX_NAME);
        mongoTemplate.indexOps(collection).ensureIndex(index);
    }

    private List<String> collections() {
        return List.of(properties.getCollections().getDeclarePt(), properties.getCollections().getConsumirVasot());
    }
}
