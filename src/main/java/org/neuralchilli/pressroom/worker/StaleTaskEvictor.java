package org.neuralchilli.pressroom.worker;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.neuralchilli.pressroom.config.PipelineConfig;
import org.neuralchilli.pressroom.core.TaskRecordStore;
import org.neuralchilli.pressroom.domain.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically deletes finished task records older than the retention TTL.
 * Records that are PENDING or RUNNING are never evicted.
 */
@ApplicationScoped
public class StaleTaskEvictor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StaleTaskEvictor.class);

    @Inject
    TaskRecordStore store;

    @Inject
    PipelineConfig config;

    private ScheduledExecutorService scheduler;

    void onStart(@Observes StartupEvent event) {
        Duration interval = config.retention().sweepInterval();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "stale-task-evictor");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Stale task eviction scheduled every {}s (ttl: {}s)",
                interval.toSeconds(), config.retention().ttl().toSeconds());
    }

    void onStop(@Observes ShutdownEvent event) {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    @Override
    public void run() {
        try {
            evictStale();
        } catch (Exception e) {
            log.error("Stale task eviction error", e);
        }
    }

    /**
     * Delete terminal records last updated before now minus the TTL.
     *
     * @return number of records deleted
     */
    public int evictStale() {
        return evictOlderThan(Instant.now().minus(config.retention().ttl()));
    }

    int evictOlderThan(Instant cutoff) {
        List<TaskRecord> stale = store.findEvictable(cutoff);

        if (stale.isEmpty()) {
            log.debug("No stale tasks found");
            return 0;
        }

        int evicted = 0;
        for (TaskRecord task : stale) {
            try {
                if (store.delete(task.id())) {
                    evicted++;
                    log.debug("Evicted task {} ({}, last updated {})", task.id(), task.status(), task.updatedAt());
                }
            } catch (Exception e) {
                log.error("Failed to evict task {}", task.id(), e);
            }
        }

        log.info("Stale task eviction: {} of {} evicted", evicted, stale.size());
        return evicted;
    }
}
