package org.neuralchilli.pressroom.worker;

import com.hazelcast.collection.IQueue;
import com.hazelcast.collection.ItemEvent;
import com.hazelcast.collection.ItemListener;
import com.hazelcast.core.HazelcastInstance;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.neuralchilli.pressroom.config.PipelineConfig;
import org.neuralchilli.pressroom.core.PipelineOrchestrator;
import org.neuralchilli.pressroom.core.TaskNotFoundException;
import org.neuralchilli.pressroom.monitoring.PipelineMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed pool of worker threads pulling task IDs from the Hazelcast work
 * queue. Submissions beyond the pool's capacity wait in the queue.
 * <p>
 * Idle workers sleep on a condition and are woken by a queue item
 * listener, with a short fallback poll in case a signal is missed.
 */
@ApplicationScoped
public class PipelineWorkerPool {

    private static final Logger log = LoggerFactory.getLogger(PipelineWorkerPool.class);

    public static final String QUEUE_NAME = "pipeline-queue";

    private static final long FALLBACK_POLL_MILLIS = 1000;

    @Inject
    HazelcastInstance hazelcast;

    @Inject
    PipelineOrchestrator orchestrator;

    @Inject
    PipelineMonitor monitor;

    @Inject
    PipelineConfig config;

    private IQueue<UUID> workQueue;
    private ExecutorService executorService;
    private volatile boolean running = false;
    private int workerThreads;
    private UUID queueListenerId;

    // Tasks currently being executed, forced to CANCELLED if shutdown times out
    private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

    // Coordination primitives for event-driven wakeup
    private final Lock wakeLock = new ReentrantLock();
    private final Condition workAvailable = wakeLock.newCondition();
    private final AtomicInteger waitingThreads = new AtomicInteger(0);

    @PostConstruct
    void init() {
        workQueue = hazelcast.getQueue(QUEUE_NAME);
        log.info("PipelineWorkerPool initialized");
    }

    void onStart(@Observes StartupEvent event) {
        PipelineConfig.Worker worker = config.worker();
        if (worker.enabled()) {
            start(worker.threads());
        } else {
            log.info("Worker pool disabled, tasks will stay queued");
        }
    }

    void onStop(@Observes ShutdownEvent event) {
        stop();
    }

    /**
     * Queue a task for execution.
     *
     * @return false if the queue is at capacity
     */
    public boolean enqueue(UUID taskId) {
        boolean accepted = workQueue.offer(taskId);
        if (accepted) {
            log.debug("Queued task {} (queue size: {})", taskId, workQueue.size());
        }
        return accepted;
    }

    /**
     * Remove a task that has not been picked up yet.
     *
     * @return true if it was still queued
     */
    public boolean withdraw(UUID taskId) {
        boolean removed = workQueue.remove(taskId);
        if (removed) {
            log.debug("Withdrew task {} from queue", taskId);
        }
        return removed;
    }

    /**
     * Start the worker pool with specified thread count.
     */
    public void start(int threads) {
        if (running) {
            log.warn("Worker pool already running");
            return;
        }

        this.workerThreads = threads;
        this.running = true;

        String workerId = config.worker().id();
        log.info("Starting worker pool: {} threads, worker ID: {}", workerThreads, workerId);

        this.executorService = Executors.newFixedThreadPool(
                workerThreads,
                new WorkerThreadFactory(workerId)
        );

        registerQueueListener();

        for (int i = 0; i < workerThreads; i++) {
            executorService.submit(this::workerLoop);
        }

        log.info("Worker pool started: {} threads active", workerThreads);
    }

    private void registerQueueListener() {
        ItemListener<UUID> listener = new ItemListener<UUID>() {
            @Override
            public void itemAdded(ItemEvent<UUID> event) {
                wakeLock.lock();
                try {
                    if (waitingThreads.get() > 0) {
                        workAvailable.signal();
                        log.trace("Signaled work available to waiting thread");
                    }
                } finally {
                    wakeLock.unlock();
                }
            }

            @Override
            public void itemRemoved(ItemEvent<UUID> event) {
                // Not needed
            }
        };

        queueListenerId = workQueue.addItemListener(listener, false);
    }

    private void workerLoop() {
        String threadName = Thread.currentThread().getName();
        log.info("[{}] Worker thread started", threadName);

        while (running) {
            try {
                UUID taskId = workQueue.poll();

                if (taskId == null) {
                    wakeLock.lock();
                    try {
                        waitingThreads.incrementAndGet();
                        try {
                            workAvailable.await(FALLBACK_POLL_MILLIS, TimeUnit.MILLISECONDS);
                        } finally {
                            waitingThreads.decrementAndGet();
                        }
                    } finally {
                        wakeLock.unlock();
                    }

                    if (!running) {
                        break;
                    }
                    taskId = workQueue.poll();
                }

                if (taskId != null) {
                    executeTask(taskId, threadName);
                }

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("[{}] Worker thread interrupted, exiting", threadName);
                break;
            } catch (Exception e) {
                log.error("[{}] Error in worker loop", threadName, e);
            }
        }

        log.info("[{}] Worker thread stopped", threadName);
    }

    private void executeTask(UUID taskId, String threadName) {
        inFlight.add(taskId);
        Instant start = Instant.now();
        try {
            boolean executed = orchestrator.execute(taskId);
            if (executed) {
                log.info("[{}] Finished task {} ({}ms)",
                        threadName, taskId, Duration.between(start, Instant.now()).toMillis());
            }
        } catch (Exception e) {
            log.error("[{}] Exception executing task {}", threadName, taskId, e);
        } finally {
            inFlight.remove(taskId);
        }
    }

    /**
     * Stop the pool. In-flight tasks get the configured shutdown timeout to
     * finish; after that they, and anything still queued, are cancelled.
     */
    public void stop() {
        if (!running) {
            return;
        }

        log.info("Stopping worker pool gracefully...");
        running = false;

        wakeLock.lock();
        try {
            workAvailable.signalAll();
        } finally {
            wakeLock.unlock();
        }

        if (queueListenerId != null) {
            try {
                workQueue.removeItemListener(queueListenerId);
            } catch (Exception e) {
                log.warn("Error unregistering queue listener", e);
            }
        }

        Duration timeout = config.worker().shutdownTimeout();
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Worker pool did not drain in {}s, cancelling {} in-flight task(s)",
                        timeout.toSeconds(), inFlight.size());
                inFlight.forEach(this::cancelQuietly);
                executorService.shutdownNow();
                if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                    log.error("Worker pool did not terminate after forced shutdown");
                }
            }
        } catch (InterruptedException e) {
            inFlight.forEach(this::cancelQuietly);
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }

        int cancelled = cancelQueued();
        if (cancelled > 0) {
            log.warn("Cancelled {} queued task(s) that never started", cancelled);
        }

        log.info("Worker pool stopped");
        monitor.logSummary();
    }

    private int cancelQueued() {
        int count = 0;
        UUID taskId;
        while ((taskId = workQueue.poll()) != null) {
            cancelQuietly(taskId);
            count++;
        }
        return count;
    }

    private void cancelQuietly(UUID taskId) {
        try {
            orchestrator.forceCancel(taskId);
        } catch (TaskNotFoundException e) {
            log.debug("Task {} already gone, nothing to cancel", taskId);
        } catch (Exception e) {
            log.error("Failed to cancel task {} during shutdown", taskId, e);
        }
    }

    public boolean isRunning() {
        return running;
    }

    public WorkerPoolStats getStats() {
        return new WorkerPoolStats(
                workerThreads,
                waitingThreads.get(),
                inFlight.size(),
                workQueue.size(),
                running
        );
    }

    /**
     * Thread factory for creating named worker threads.
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);
        private final String workerId;

        WorkerThreadFactory(String workerId) {
            this.workerId = workerId;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName(workerId + "-thread-" + counter.incrementAndGet());
            t.setDaemon(false);
            return t;
        }
    }

    /**
     * Worker pool statistics.
     */
    public record WorkerPoolStats(
            int totalThreads,
            int waitingThreads,
            int inFlightTasks,
            int queueSize,
            boolean running
    ) {
        public double utilization() {
            return totalThreads > 0 ? (double) inFlightTasks / totalThreads : 0.0;
        }
    }
}
