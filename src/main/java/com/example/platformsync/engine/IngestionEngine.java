package com.example.platformsync.engine;

import com.example.platformsync.classify.EventClassifier;
import com.example.platformsync.config.SyncProperties;
import com.example.platformsync.exception.ArchiveException;
import com.example.platformsync.exception.IngestionException;
import com.example.platformsync.exception.ObjectNotFoundException;
import com.example.platformsync.exception.StoreUnavailableException;
import com.example.platformsync.model.EventKind;
import com.example.platformsync.model.IngestedRecord;
import com.example.platformsync.model.ObjectOutcome;
import com.example.platformsync.model.ParsedEvent;
import com.example.platformsync.model.RawObject;
import com.example.platformsync.model.RunSummary;
import com.example.platformsync.parse.EventParser;
import com.example.platformsync.storage.ObjectStoreClient;
import com.example.platformsync.store.DocumentStoreClient;
import com.example.platformsync.store.UpsertResult;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Runs one sync pass over the platform prefix: list, fetch, parse, classify, upsert, archive.
 *
 * <p>Every object is handled on its own: a failure is turned into an archive decision for that
 * object and never stops the rest of the batch. Only an unreachable document store ends the run
 * early, by throwing {@link StoreUnavailableException} once in-flight objects have settled.</p>
 *
 * <p>At most {@code app.sync.workers} objects are in flight at once, whatever the size of the
 * listing. An object's archive move always runs on the same worker, right after its own upsert.</p>
 */
@Service
@Slf4j
public class IngestionEngine {

    static final String MDC_OBJECT_KEY = "objectKey";

    private static final Pattern IDLPN_IN_FILE_NAME =
            Pattern.compile("_(?<idlpn>[^_/]+)\\.json$", Pattern.CASE_INSENSITIVE);

    private final ObjectStoreClient objectStore;
    private final DocumentStoreClient documentStore;
    private final EventParser parser;
    private final EventClassifier classifier;
    private final SyncProperties properties;
    private final TaskExecutor workerExecutor;
    private final Clock clock;

    private volatile boolean stopRequested;

    public IngestionEngine(ObjectStoreClient objectStore,
                           DocumentStoreClient documentStore,
                           EventParser parser,
                           EventClassifier classifier,
                           SyncProperties properties,
                           @Qualifier("ingestionWorkerExecutor") TaskExecutor workerExecutor,
                           Clock clock) {
        this.objectStore = objectStore;
        this.documentStore = documentStore;
        this.parser = parser;
        this.classifier = classifier;
        this.properties = properties;
        this.workerExecutor = workerExecutor;
        this.clock = clock;
    }

    public RunSummary runOnce() {
        SyncProperties.ObjectStore store = properties.getObjectStore();
        long startedAt = System.nanoTime();
        log.info("Starting platform sync run on s3://{}/{}", store.getBucket(), store.getSourcePrefix());

        Tally tally = new Tally();
        int workers = properties.getWorkers();
        Semaphore inFlight = new Semaphore(workers);
        AtomicReference<StoreUnavailableException> unavailable = new AtomicReference<>();

        try (Stream<String> keys = objectStore.list(store.getSourcePrefix())) {
            Iterator<String> pending = keys.filter(this::isPending).iterator();
            try {
                while (!stopRequested && unavailable.get() == null && pending.hasNext()) {
                    String key = pending.next();
                    try {
                        inFlight.acquire();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        log.warn("Platform sync run interrupted, not submitting {}", key);
                        break;
                    }
                    submit(key, tally, inFlight, unavailable);
                }
            } finally {
                // let in-flight objects finish their upsert and archive move
                inFlight.acquireUninterruptibly(workers);
                inFlight.release(workers);
            }
        } catch (RuntimeException e) {
            RunSummary partial = tally.toSummary(elapsedSince(startedAt));
            log.error("Platform sync run failed: succeeded={} failed={} skipped={} elapsedMs={} error={}",
                    partial.succeeded(), partial.failed(), partial.skipped(), partial.elapsed().toMillis(),
                    e.getMessage());
            throw e;
        }

        RunSummary summary = tally.toSummary(elapsedSince(startedAt));
        if (unavailable.get() != null) {
            log.error("Platform sync run aborted, document store unavailable: succeeded={} failed={} skipped={} elapsedMs={}",
                    summary.succeeded(), summary.failed(), summary.skipped(), summary.elapsed().toMillis());
            throw unavailable.get();
        }
        if (stopRequested) {
            log.info("Platform sync run stopped early on shutdown");
        }
        log.info("Platform sync run finished: succeeded={} failed={} skipped={} elapsedMs={}",
                summary.succeeded(), summary.failed(), summary.skipped(), summary.elapsed().toMillis());
        return summary;
    }

    /**
     * Stops the current run from picking up further objects. Objects already being processed
     * complete normally.
     */
    public void requestStop() {
        stopRequested = true;
    }

    private void submit(String key, Tally tally, Semaphore inFlight,
                        AtomicReference<StoreUnavailableException> unavailable) {
        Runnable task = () -> {
            try {
                tally.record(processObject(key));
            } catch (StoreUnavailableException e) {
                unavailable.compareAndSet(null, e);
            } finally {
                inFlight.release();
            }
        };
        try {
            workerExecutor.execute(task);
        } catch (TaskRejectedException e) {
            log.warn("Worker pool rejected {}, processing on the run thread", key);
            task.run();
        }
    }

    ObjectOutcome processObject(String key) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_OBJECT_KEY, key)) {
            SyncProperties.ObjectStore store = properties.getObjectStore();

            if (properties.isSkipAlreadyIngested() && alreadyIngested(key)) {
                log.info("Object already ingested, archiving without reading: key={}", key);
                archive(key, store.getSuccessPrefix());
                return ObjectOutcome.skipped(key, "already ingested");
            }

            String reason;
            try {
                RawObject raw = objectStore.fetch(key);
                ParsedEvent event = parser.parse(raw);
                EventKind kind = classifier.classify(event);
                IngestedRecord record = IngestedRecord.of(event, kind, properties.getStage(), Instant.now(clock));

                UpsertResult result = documentStore.upsert(
                        collectionFor(kind), record.compositeKey(), record.toDocument());
                log.info("Stored {} event {} ({})", kind, record.compositeKey(), result);

                archive(key, store.getSuccessPrefix());
                return ObjectOutcome.succeeded(key);
            } catch (ObjectNotFoundException e) {
                log.info("Object vanished before it could be read, skipping: key={}", key);
                return ObjectOutcome.skipped(key, e.getMessage());
            } catch (StoreUnavailableException e) {
                log.warn("Document store unavailable, leaving object in place: key={}", key);
                throw e;
            } catch (IngestionException e) {
                reason = e.getMessage();
            } catch (RuntimeException e) {
                log.error("Unexpected error processing {}", key, e);
                reason = "Unexpected error: " + e;
            }

            log.warn("Object failed: key={} reason={}", key, reason);
            archive(key, store.getErrorPrefix());
            return ObjectOutcome.failed(key, reason);
        }
    }

    /**
     * Moves {@code key} under {@code destPrefix}. A failed move is logged and the object is left
     * where it is; it will be listed again next run.
     */
    private void archive(String key, String destPrefix) {
        try {
            objectStore.move(key, destPrefix);
        } catch (ObjectNotFoundException e) {
            log.warn("Object vanished before it could be archived: key={}", key);
        } catch (ArchiveException e) {
            if (e.isDuplicated()) {
                log.warn("Archive copy {} written but source not deleted, will be re-ingested next run: key={}",
                        e.getDestinationKey(), key, e);
            } else {
                log.error("Failed to archive to {}, leaving in place: key={}", destPrefix, key, e);
            }
        } catch (RuntimeException e) {
            log.error("Failed to archive to {}, leaving in place: key={}", destPrefix, key, e);
        }
    }

    private boolean alreadyIngested(String key) {
        Matcher matcher = IDLPN_IN_FILE_NAME.matcher(key);
        if (!matcher.find()) {
            return false;
        }
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put(IngestedRecord.STAGE, properties.getStage());
        filter.put(IngestedRecord.IDLPN, matcher.group("idlpn"));

        try {
            for (String collection : allCollections()) {
                if (documentStore.exists(collection, filter)) {
                    return true;
                }
            }
            return false;
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (IngestionException e) {
            log.warn("Already-ingested lookup failed, processing normally: key={} reason={}", key, e.getMessage());
            return false;
        }
    }

    boolean isPending(String key) {
        SyncProperties.ObjectStore store = properties.getObjectStore();
        if (key.endsWith("/")
                || key.startsWith(store.getSuccessPrefix())
                || key.startsWith(store.getErrorPrefix())) {
            return false;
        }
        String suffix = store.getSuffix();
        return suffix == null || suffix.isEmpty()
                || key.toLowerCase(Locale.ROOT).endsWith(suffix.toLowerCase(Locale.ROOT));
    }

    private String collectionFor(EventKind kind) {
        return switch (kind) {
            case DECLARE_PT -> properties.getCollections().getDeclarePt();
            case CONSUMIR_VASOT -> properties.getCollections().getConsumirVasot();
        };
    }

    private List<String> allCollections() {
        return List.of(properties.getCollections().getDeclarePt(), properties.getCollections().getConsumirVasot());
    }

    private static Duration elapsedSince(long startedAt) {
        return Duration.ofNanos(System.nanoTime() - startedAt);
    }

    private static final class Tally {
        private final AtomicInteger succeeded = new AtomicInteger();
        private final AtomicInteger failed = new AtomicInteger();
        private final AtomicInteger skipped = new AtomicInteger();

        void record(ObjectOutcome outcome) {
            switch (outcome.status()) {
                case SUCCEEDED -> succeeded.incrementAndGet();
                case FAILED -> failed.incrementAndGet();
                case SKIPPED -> skipped.incrementAndGet();
            }
        }

        RunSummary toSummary(Duration elapsed) {
            return new RunSummary(succeeded.get(), failed.get(), skipped.get(), elapsed);
        }
    }
}
