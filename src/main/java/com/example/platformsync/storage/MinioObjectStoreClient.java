package com.example.platformsync.storage;

import com.example.platformsync.config.SyncProperties;
import com.example.platformsync.exception.ArchiveException;
import com.example.platformsync.exception.ObjectNotFoundException;
import com.example.platformsync.exception.ObjectStoreException;
import com.example.platformsync.model.RawObject;
import io.minio.BucketExistsArgs;
import io.minio.CopyObjectArgs;
import io.minio.CopySource;
import io.minio.GetObjectArgs;
import io.minio.GetObjectResponse;
import io.minio.ListObjectsArgs;
import io.minio.MinioClient;
import io.minio.RemoveObjectArgs;
import io.minio.Result;
import io.minio.errors.ErrorResponseException;
import io.minio.messages.Item;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

@Service
@RequiredArgsConstructor
@Slf4j
public class MinioObjectStoreClient implements ObjectStoreClient {

    private static final Set<String> NOT_FOUND_CODES = Set.of("NoSuchKey", "NoSuchObject");

    private final MinioClient minioClient;
    private final SyncProperties properties;
    private final Clock clock;

    @PostConstruct
    public void init() {
        String bucket = bucket();
        try {
            boolean found = minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build());
            if (found) {
                log.info("Object store bucket available: {}", bucket);
            } else {
                log.warn("Object store bucket does not exist yet: {}", bucket);
            }
        } catch (Exception e) {
            log.warn("Could not check object store bucket {}: {}", bucket, e.getMessage());
        }
    }

    @Override
    public Stream<String> list(String prefix) {
        log.info("Listing objects in s3://{}/{}", bucket(), prefix);
        Iterable<Result<Item>> results = minioClient.listObjects(
                ListObjectsArgs.builder()
                        .bucket(bucket())
                        .prefix(prefix)
                        .recursive(true)
                        .build());

        return StreamSupport.stream(results.spliterator(), false)
                .map(this::unwrap)
                .filter(item -> !item.isDir() && !item.objectName().endsWith("/"))
                .map(Item::objectName);
    }

    @Override
    public RawObject fetch(String key) {
        log.debug("Reading s3://{}/{}", bucket(), key);
        try (GetObjectResponse response = minioClient.getObject(
                GetObjectArgs.builder()
                        .bucket(bucket())
                        .object(key)
                        .build())) {
            return new RawObject(key, response.readAllBytes(), Instant.now(clock));
        } catch (ErrorResponseException e) {
            if (isNotFound(e)) {
                throw new ObjectNotFoundException(key, e);
            }
            throw new ObjectStoreException("Failed to fetch " + key, e);
        } catch (Exception e) {
            throw new ObjectStoreException("Failed to fetch " + key, e);
        }
    }

    @Override
    public String move(String sourceKey, String destPrefix) {
        String destKey = archiveKey(properties.getObjectStore().getSourcePrefix(), sourceKey, destPrefix);

        try {
            minioClient.copyObject(
                    CopyObjectArgs.builder()
                            .bucket(bucket())
                            .object(destKey)
                            .source(
                                    CopySource.builder()
                                            .bucket(bucket())
                                            .object(sourceKey)
                                            .build())
                            .build());
        } catch (ErrorResponseException e) {
            if (isNotFound(e)) {
                throw new ObjectNotFoundException(sourceKey, e);
            }
            throw new ArchiveException(sourceKey, destKey, false, e);
        } catch (Exception e) {
            throw new ArchiveException(sourceKey, destKey, false, e);
        }

        // copy landed; from here on a failure leaves the object under both prefixes
        try {
            minioClient.removeObject(
                    RemoveObjectArgs.builder()
                            .bucket(bucket())
                            .object(sourceKey)
                            .build());
        } catch (Exception e) {
            throw new ArchiveException(sourceKey, destKey, true, e);
        }

        log.info("Moved s3://{}/{} to {}", bucket(), sourceKey, destKey);
        return destKey;
    }

    /**
     * Destination key for {@code key} under {@code destPrefix}. The path below {@code sourcePrefix}
     * is preserved; keys outside it keep only their file name.
     */
    public static String archiveKey(String sourcePrefix, String key, String destPrefix) {
        String relative = key.startsWith(sourcePrefix)
                ? key.substring(sourcePrefix.length())
                : key.substring(key.lastIndexOf('/') + 1);
        String base = destPrefix.endsWith("/") ? destPrefix : destPrefix + "/";
        return base + relative;
    }

    private Item unwrap(Result<Item> result) {
        try {
            return result.get();
        } catch (Exception e) {
            throw new ObjectStoreException("Failed to list objects in bucket " + bucket(), e);
        }
    }

    private static boolean isNotFound(ErrorResponseException e) {
        return e.errorResponse() != null && NOT_FOUND_CODES.contains(e.errorResponse().code());
    }

    private String bucket() {
        return properties.getObjectStore().getBucket();
    }
}
