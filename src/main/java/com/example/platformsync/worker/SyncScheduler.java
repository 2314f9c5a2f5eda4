package com.example.platformsync.worker;

import com.example.platformsync.config.SyncProperties;
import com.example.platformsync.engine.IngestionEngine;
import com.example.platformsync.model.RunSummary;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives {@link IngestionEngine#runOnce()} on a fixed interval.
 *
 * <p>Single-flight: a tick that finds a run still active is skipped outright, not queued.
 * Any error escaping a run is logged and the loop keeps ticking. There is intentionally no
 * backoff and no retry ceiling; a transient outage clears on a later tick.</p>
 */
@Component
@Slf4j
public class SyncScheduler {

    private final IngestionEngine engine;
    private final SyncProperties properties;
    private final TaskExecutor runExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong skippedTicks = new AtomicLong();
    private volatile boolean stopping;
    private volatile RunSummary lastSummary;

    public SyncScheduler(IngestionEngine engine,
                         SyncProperties properties,
                         @Qualifier("syncRunExecutor") TaskExecutor runExecutor) {
        this.engine = engine;
        this.properties = properties;
        this.runExecutor = runExecutor;
    }

    /**
     * Interval is read from {@link SyncProperties#getIntervalMillis()}, which never goes below the
     * 60s floor.
     */
    @Scheduled(fixedRateString = "#{@syncProperties.intervalMillis}",
            initialDelayString = "#{@syncProperties.initialDelayMillis}")
    public void scheduledTick() {
        if (!properties.isEnabled()) {
            log.debug("Platform sync disabled, ignoring tick");
            return;
        }
        tick();
    }

    /**
     * Starts a run unless one is already active.
     *
     * @return true if a run was started
     */
    public boolean tick() {
        if (stopping) {
            return false;
        }
        if (!running.compareAndSet(false, true)) {
            long skipped = skippedTicks.incrementAndGet();
            log.warn("Previous platform sync run still active, skipping tick (skippedTicks={})", skipped);
            return false;
        }
        try {
            runExecutor.execute(this::runGuarded);
            return true;
        } catch (TaskRejectedException e) {
            running.set(false);
            log.error("Could not start platform sync run", e);
            return false;
        }
    }

    private void runGuarded() {
        try {
            lastSummary = engine.runOnce();
        } catch (Exception e) {
            log.error("Platform sync run failed, retrying on next tick", e);
        } finally {
            running.set(false);
        }
    }

    @PreDestroy
    public void stop() {
        stopping = true;
        engine.requestStop();
        if (running.get()) {
            log.info("Shutdown requested, letting the active platform sync run finish its in-flight objects");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getSkippedTicks() {
        return skippedTicks.get();
    }

    public RunSummary getLastSummary() {
        return lastSummary;
    }
}
