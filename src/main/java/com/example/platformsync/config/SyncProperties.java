package com.example.platformsync.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

/**
 * Configuration for the platform event sync, bound from {@code app.sync.*}.
 * Every value is sourced from the environment (see application.yml).
 */
@Data
@Slf4j
public class SyncProperties {

    public static final long MIN_INTERVAL_SECONDS = 60;

    private boolean enabled = true;

    private long intervalSeconds = 300;

    private long initialDelaySeconds = 10;

    /**
     * Deployment stage tag stamped on every record and part of its composite key.
     */
    private String stage;

    private int workers = 4;

    private long shutdownGraceSeconds = 60;

    private boolean skipAlreadyIngested = false;

    private ObjectStore objectStore = new ObjectStore();

    private Collections collections = new Collections();

    @Data
    public static class ObjectStore {
        private String endpoint = "https://s3.amazonaws.com";
        private String region = "us-east-1";
        private String accessKey;
        private String secretKey;
        private String bucket;
        private String sourcePrefix;
        private String successPrefix;
        private String errorPrefix;
        private String suffix = ".json";
    }

    @Data
    public static class Collections {
        private String declarePt = "declare_pt_events";
        private String consumirVasot = "consume_vasot_events";
    }

    /**
     * Fails fast on missing or inconsistent settings and fills in derived defaults.
     * Runs once at startup, never mid-run.
     */
    @PostConstruct
    public void validate() {
        require(objectStore.getBucket(), "app.sync.object-store.bucket");
        require(objectStore.getSourcePrefix(), "app.sync.object-store.source-prefix");
        require(stage, "app.sync.stage");
        require(collections.getDeclarePt(), "app.sync.collections.declare-pt");
        require(collections.getConsumirVasot(), "app.sync.collections.consumir-vasot");

        String source = asPrefix(objectStore.getSourcePrefix());
        objectStore.setSourcePrefix(source);
        objectStore.setSuccessPrefix(StringUtils.hasText(objectStore.getSuccessPrefix())
                ? asPrefix(objectStore.getSuccessPrefix())
                : source + "PROCESSED/");
        objectStore.setErrorPrefix(StringUtils.hasText(objectStore.getErrorPrefix())
                ? asPrefix(objectStore.getErrorPrefix())
                : source + "PROCESSED/ERRORS/");

        // an archive prefix at or above the source prefix would hide every listed key from processing
        if (source.startsWith(objectStore.getSuccessPrefix()) || source.startsWith(objectStore.getErrorPrefix())) {
            throw new IllegalStateException("Archive prefixes must not contain the source prefix " + source
                    + ": success=" + objectStore.getSuccessPrefix() + " error=" + objectStore.getErrorPrefix());
        }
        if (objectStore.getSuccessPrefix().equals(objectStore.getErrorPrefix())) {
            throw new IllegalStateException("Success and error prefixes must differ: " + objectStore.getSuccessPrefix());
        }
        if (workers < 1) {
            throw new IllegalStateException("app.sync.workers must be at least 1, got " + workers);
        }
        if (intervalSeconds < MIN_INTERVAL_SECONDS) {
            log.warn("app.sync.interval-seconds={} is below the {}s floor, clamping to {}s",
                    intervalSeconds, MIN_INTERVAL_SECONDS, MIN_INTERVAL_SECONDS);
            intervalSeconds = MIN_INTERVAL_SECONDS;
        }
        if (initialDelaySeconds < 0) {
            initialDelaySeconds = 0;
        }

        log.info("Platform sync configured: bucket={} source={} success={} error={} stage={} interval={}s workers={}",
                objectStore.getBucket(), source, objectStore.getSuccessPrefix(), objectStore.getErrorPrefix(),
                stage, intervalSeconds, workers);
    }

    public long getIntervalMillis() {
        return Math.max(intervalSeconds, MIN_INTERVAL_SECONDS) * 1000;
    }

    public long getInitialDelayMillis() {
        return Math.max(initialDelaySeconds, 0) * 1000;
    }

    private static void require(String value, String name) {
        if (!StringUtils.hasText(value)) {
            throw new IllegalStateException("Missing required configuration: " + name);
        }
    }

    private static String asPrefix(String prefix) {
        String trimmed = prefix.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.endsWith("/") ? trimmed : trimmed + "/";
    }
}
