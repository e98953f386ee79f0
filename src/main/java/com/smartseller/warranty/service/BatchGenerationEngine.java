package com.smartseller.warranty.service;

import com.smartseller.warranty.domain.model.BarcodeBatch;
import com.smartseller.warranty.domain.model.BarcodeBatch.BatchStatus;
import com.smartseller.warranty.domain.model.BarcodeBatch.BatchStep;
import com.smartseller.warranty.domain.model.CollisionRecord;
import com.smartseller.warranty.domain.model.WarrantyBarcode;
import com.smartseller.warranty.domain.model.WarrantyBarcode.BarcodeStatus;
import com.smartseller.warranty.exception.DuplicateBarcodeException;
import com.smartseller.warranty.infrastructure.lock.RedisDistributedLock;
import com.smartseller.warranty.infrastructure.messaging.KafkaProducerService;
import com.smartseller.warranty.infrastructure.messaging.NotificationSink;
import com.smartseller.warranty.infrastructure.messaging.events.WarrantyEvent;
import com.smartseller.warranty.infrastructure.metrics.WarrantyMetricsService;
import com.smartseller.warranty.repository.BarcodeBatchRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Batch generation engine.
 *
 * Architecture:
 * - A bounded queue holds the unresolved slot indexes of a batch
 * - A fixed-size worker pool draws candidates and runs collision detection per slot
 * - Workers hand their {@link SlotResult}s to a single aggregator through a blocking queue
 * - The aggregator is the only writer of the batch row: it stages results and commits them in
 *   chunks under the per-batch Redis lock, so counters only ever grow
 *
 * Failure handling:
 * - Unique index rejection at commit: offending slots are re-resolved as DUPLICATE_IN_STORE
 * - Transient store failure or lock not acquired: retried with exponential backoff up to the
 *   batch's max_retries, each retry counted in retry_count
 * - Any other store failure: the batch is marked FAILED with last_error
 * - Failed slots beyond the configured threshold abort the batch to FAILED
 *
 * Cancellation is cooperative: workers check the run's flag between slots, and a forced cancel
 * also interrupts them. The chunk being committed always finishes.
 *
 * @author Warranty Platform Team
 */
@Service
public class BatchGenerationEngine {

    private static final Logger logger = LoggerFactory.getLogger(BatchGenerationEngine.class);

    private static final Object WORKER_DONE = new Object();
    private static final String LOCK_PREFIX = "lock:batch:";

    private final WarrantyRecordStore recordStore;
    private final BarcodeBatchRepository batchRepository;
    private final CollisionDetector collisionDetector;
    private final RedisDistributedLock distributedLock;
    private final NotificationSink notificationSink;
    private final KafkaProducerService kafkaProducerService;
    private final WarrantyMetricsService metricsService;
    private final BatchProgressTracker progressTracker;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    private final Map<String, BatchRun> runs = new ConcurrentHashMap<>();

    @Value("${warranty.batch.worker-threads:4}")
    private int workerThreads;

    @Value("${warranty.batch.chunk-size:500}")
    private int chunkSize;

    @Value("${warranty.batch.failure-threshold-percent:10}")
    private int failureThresholdPercent;

    @Value("${warranty.batch.flush-interval-ms:250}")
    private long flushIntervalMs;

    @Value("${warranty.batch.commit-backoff-ms:100}")
    private long commitBackoffMs;

    @Value("${warranty.batch.lock.expiry-seconds:30}")
    private long lockExpirySeconds;

    @Value("${warranty.batch.lock.wait-ms:2000}")
    private long lockWaitMs;

    private ExecutorService workerPool;
    private ExecutorService aggregatorPool;

    public BatchGenerationEngine(
            WarrantyRecordStore recordStore,
            BarcodeBatchRepository batchRepository,
            CollisionDetector collisionDetector,
            RedisDistributedLock distributedLock,
            NotificationSink notificationSink,
            KafkaProducerService kafkaProducerService,
            WarrantyMetricsService metricsService,
            BatchProgressTracker progressTracker,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.recordStore = recordStore;
        this.batchRepository = batchRepository;
        this.collisionDetector = collisionDetector;
        this.distributedLock = distributedLock;
        this.notificationSink = notificationSink;
        this.kafkaProducerService = kafkaProducerService;
        this.metricsService = metricsService;
        this.progressTracker = progressTracker;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    @PostConstruct
    void startPools() {
        workerPool = Executors.newFixedThreadPool(workerThreads, new CustomizableThreadFactory("batch-worker-"));
        aggregatorPool = Executors.newCachedThreadPool(new CustomizableThreadFactory("batch-aggregator-"));
        logger.info("Batch engine started with {} workers, chunk size {}", workerThreads, chunkSize);
    }

    @PreDestroy
    void stopPools() {
        runs.values().forEach(run -> run.cancel(true));
        workerPool.shutdownNow();
        aggregatorPool.shutdownNow();
    }

    /**
     * Start generating an IN_PROGRESS batch on this instance.
     *
     * @param batchId Batch ID
     * @return false if the batch is already running here
     */
    public boolean submit(String batchId) {
        BatchRun run = new BatchRun(batchId);
        if (runs.putIfAbsent(batchId, run) != null) {
            logger.debug("Batch {} is already running", batchId);
            return false;
        }
        try {
            aggregatorPool.submit(() -> aggregate(run));
        } catch (RejectedExecutionException e) {
            runs.remove(batchId);
            throw e;
        }
        logger.info("Submitted batch {} for generation", batchId);
        return true;
    }

    public boolean isRunning(String batchId) {
        return runs.containsKey(batchId);
    }

    /**
     * Ask a running batch to stop. Workers finish their current slot unless forced.
     */
    public void requestCancel(String batchId, boolean force) {
        BatchRun run = runs.get(batchId);
        if (run == null) {
            return;
        }
        run.cancel(force);
        logger.info("Cancellation requested for running batch {} (force={})", batchId, force);
    }

    private void aggregate(BatchRun run) {
        String batchId = run.batchId;
        try {
            BarcodeBatch batch = batchRepository.findById(batchId).orElse(null);
            if (batch == null || batch.getStatus() != BatchStatus.IN_PROGRESS) {
                logger.warn("Batch {} is not in progress, nothing to generate", batchId);
                return;
            }
            updateStep(batchId, BatchStep.GENERATING);

            GenerationContext context = GenerationContext.forBatch(batch);
            int firstSlot = batch.getGeneratedCount();
            int requested = batch.getRequestedQuantity();
            int remaining = Math.max(0, requested - firstSlot);

            BlockingQueue<Integer> slots = new ArrayBlockingQueue<>(Math.max(1, remaining));
            for (int slot = firstSlot; slot < requested; slot++) {
                slots.add(slot);
            }
            BlockingQueue<Object> results = new LinkedBlockingQueue<>();

            int workers = Math.max(1, Math.min(workerThreads, remaining));
            for (int i = 0; i < workers; i++) {
                run.workers.add(workerPool.submit(() -> work(run, context, slots, results)));
            }
            logger.info("Batch {} generating {} slots from slot {} with {} workers",
                    batchId, remaining, firstSlot, workers);

            collect(run, context, batch, results, workers);
            finish(run);
        } catch (RuntimeException e) {
            logger.error("Batch {} generation aborted", batchId, e);
            metricsService.recordError("BATCH_GENERATION_ERROR", "aggregate");
            failBatch(batchId, "Generation aborted: " + e.getMessage());
        } finally {
            runs.remove(batchId);
            progressTracker.clear(batchId);
        }
    }

    private void work(BatchRun run, GenerationContext context, BlockingQueue<Integer> slots, BlockingQueue<Object> results) {
        try {
            while (!run.isStopped() && !Thread.currentThread().isInterrupted()) {
                Integer slot = slots.poll();
                if (slot == null) {
                    break;
                }
                SlotResult result;
                try {
                    result = collisionDetector.resolveSlot(context, slot);
                } catch (RuntimeException e) {
                    if (run.isStopped()) {
                        logger.debug("Batch {} slot {} abandoned on cancellation", context.getBatchId(), slot);
                        break;
                    }
                    logger.error("Batch {} slot {} failed", context.getBatchId(), slot, e);
                    result = SlotResult.failed(slot, 0, List.of(), "Slot " + slot + " failed: " + e.getMessage());
                }
                results.add(result);
            }
        } finally {
            results.add(WORKER_DONE);
        }
    }

    private void collect(BatchRun run, GenerationContext context, BarcodeBatch batch,
                         BlockingQueue<Object> results, int workers) {
        List<SlotResult> staged = new ArrayList<>();
        int finishedWorkers = 0;
        while (finishedWorkers < workers) {
            Object item;
            try {
                item = results.poll(flushIntervalMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                run.cancel(true);
                break;
            }
            if (item == WORKER_DONE) {
                finishedWorkers++;
            } else if (item != null) {
                staged.add((SlotResult) item);
            } else if (run.allWorkersDone() && results.isEmpty()) {
                // Workers cancelled before they started never report back
                break;
            }

            boolean idle = item == null || item == WORKER_DONE;
            if (!run.aborted.get() && (staged.size() >= chunkSize || (idle && !staged.isEmpty()))) {
                if (!commitChunk(run, context, batch, staged)) {
                    run.abort();
                }
                staged.clear();
            }
        }
        if (!staged.isEmpty() && !run.aborted.get()) {
            if (!commitChunk(run, context, batch, staged)) {
                run.abort();
            }
        }
    }

    /**
     * Commit one chunk of slot results.
     *
     * @return false if the batch was failed and generation must stop
     */
    private boolean commitChunk(BatchRun run, GenerationContext context, BarcodeBatch template, List<SlotResult> staged) {
        String batchId = run.batchId;
        String lockKey = LOCK_PREFIX + batchId;
        List<SlotResult> pending = new ArrayList<>(staged);
        int transientFailures = 0;

        while (true) {
            String token = distributedLock.acquireLockWithRetry(lockKey,
                    Duration.ofSeconds(lockExpirySeconds), Duration.ofMillis(lockWaitMs), Duration.ofMillis(50));
            if (token == null) {
                transientFailures++;
                logger.warn("Batch {} could not acquire {} (attempt {})", batchId, lockKey, transientFailures);
                if (!backoff(batchId, transientFailures, context.getMaxRetries())) {
                    return false;
                }
                continue;
            }

            long startTime = System.currentTimeMillis();
            try {
                ChunkParts parts = ChunkParts.of(pending, template, clock.instant());
                BarcodeBatch updated = recordStore.commitChunk(batchId, parts.barcodes, parts.collisions,
                        parts.failedSlots, parts.lastError);

                metricsService.recordBarcodesCommitted(parts.barcodes.size());
                metricsService.recordChunkCommitLatency(System.currentTimeMillis() - startTime);
                progressTracker.record(batchId, updated.getGeneratedCount(), clock.instant());
                logger.debug("Batch {} committed chunk: {} barcodes, {} failed slots, progress {}%",
                        batchId, parts.barcodes.size(), parts.failedSlots, updated.progressPercent());

                if (exceedsFailureThreshold(updated)) {
                    failBatch(batchId, String.format("Failure threshold exceeded: %d of %d slots failed",
                            updated.getFailedCount(), updated.getRequestedQuantity()));
                    return false;
                }
                return true;

            } catch (DuplicateBarcodeException e) {
                logger.warn("Batch {} chunk rejected {} duplicate barcodes, regenerating", batchId, e.getDuplicates().size());
                pending = reresolve(context, pending, e.getDuplicates());

            } catch (TransientDataAccessException e) {
                transientFailures++;
                logger.warn("Batch {} chunk commit failed transiently (attempt {}): {}",
                        batchId, transientFailures, e.getMessage());
                if (!backoff(batchId, transientFailures, context.getMaxRetries())) {
                    return false;
                }

            } catch (DataAccessException e) {
                logger.error("Batch {} chunk commit failed permanently", batchId, e);
                failBatch(batchId, "Chunk commit failed: " + e.getMostSpecificCause().getMessage());
                return false;

            } finally {
                distributedLock.releaseLock(lockKey, token);
            }
        }
    }

    private List<SlotResult> reresolve(GenerationContext context, List<SlotResult> pending, Set<String> duplicates) {
        List<SlotResult> next = new ArrayList<>(pending.size());
        for (SlotResult result : pending) {
            if (result.isAccepted() && duplicates.contains(result.getBarcode())) {
                next.add(collisionDetector.resolveRejected(context, result));
            } else {
                next.add(result);
            }
        }
        return next;
    }

    /**
     * Count a transient failure and sleep before the next attempt.
     *
     * @return false once the retry budget is spent (the batch is then failed)
     */
    private boolean backoff(String batchId, int failures, int maxRetries) {
        if (failures > maxRetries) {
            failBatch(batchId, String.format("Chunk commit failed after %d retries", maxRetries));
            return false;
        }
        try {
            recordStore.incrementRetryCount(batchId);
        } catch (DataAccessException e) {
            logger.warn("Could not record retry for batch {}: {}", batchId, e.getMessage());
        }
        metricsService.recordChunkRetry();

        long sleepMillis = commitBackoffMs * (1L << Math.min(failures - 1, 6));
        try {
            Thread.sleep(sleepMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failBatch(batchId, "Interrupted while retrying chunk commit");
            return false;
        }
        return true;
    }

    private boolean exceedsFailureThreshold(BarcodeBatch batch) {
        return (long) batch.getFailedCount() * 100 > (long) batch.getRequestedQuantity() * failureThresholdPercent;
    }

    private void finish(BatchRun run) {
        String batchId = run.batchId;
        updateStep(batchId, BatchStep.FINALIZING);

        BarcodeBatch finished = transactionTemplate.execute(status -> {
            BarcodeBatch batch = batchRepository.findByIdForUpdate(batchId).orElse(null);
            if (batch == null || batch.getStatus() != BatchStatus.IN_PROGRESS) {
                if (batch != null && batch.getCurrentStep() != BatchStep.DONE) {
                    batch.setCurrentStep(BatchStep.DONE);
                    batchRepository.save(batch);
                }
                return null;
            }
            Instant now = clock.instant();
            if (batch.getGeneratedCount() >= batch.getRequestedQuantity()) {
                batch.setStatus(BatchStatus.COMPLETED);
                batch.setCompletedAt(now);
            } else {
                batch.setStatus(BatchStatus.FAILED);
                batch.setLastError(String.format("Generation stopped with %d of %d slots resolved",
                        batch.getGeneratedCount(), batch.getRequestedQuantity()));
            }
            batch.setCurrentStep(BatchStep.DONE);
            batch.setUpdatedAt(now);
            return batchRepository.save(batch);
        });

        if (finished == null) {
            return;
        }
        metricsService.recordBatchFinished(finished.getStatus().name());
        logger.info("Batch {} finished as {}: {} successful, {} failed, {} collisions, {} retries",
                finished.getBatchNumber(), finished.getStatus(), finished.getSuccessfulCount(),
                finished.getFailedCount(), finished.getCollisionCount(), finished.getRetryCount());

        boolean completed = finished.getStatus() == BatchStatus.COMPLETED;
        publishBatchEvent(finished, completed ? WarrantyEvent.EventType.BATCH_COMPLETED : WarrantyEvent.EventType.BATCH_FAILED);
        if (completed && Boolean.TRUE.equals(finished.getNotifyOnComplete())) {
            Map<String, Object> payload = new HashMap<>();
            payload.put("batchId", finished.getBatchId());
            payload.put("batchNumber", finished.getBatchNumber());
            payload.put("successful", finished.getSuccessfulCount());
            payload.put("failed", finished.getFailedCount());
            notificationSink.notify(finished.getCreatedBy(), "batch-completed", payload);
        }
    }

    private void failBatch(String batchId, String error) {
        try {
            BarcodeBatch failed = transactionTemplate.execute(status -> {
                BarcodeBatch batch = batchRepository.findByIdForUpdate(batchId).orElse(null);
                if (batch == null || batch.isTerminal()) {
                    return null;
                }
                batch.setStatus(BatchStatus.FAILED);
                batch.setLastError(error);
                batch.setCurrentStep(BatchStep.DONE);
                batch.setUpdatedAt(clock.instant());
                return batchRepository.save(batch);
            });
            if (failed != null) {
                logger.error("Batch {} failed: {}", failed.getBatchNumber(), error);
                metricsService.recordBatchFinished(BatchStatus.FAILED.name());
                publishBatchEvent(failed, WarrantyEvent.EventType.BATCH_FAILED);
            }
        } catch (DataAccessException e) {
            // Row stays IN_PROGRESS; the recovery scheduler will pick it up again
            logger.error("Could not mark batch {} as failed ({})", batchId, error, e);
        }
    }

    private void updateStep(String batchId, BatchStep step) {
        transactionTemplate.executeWithoutResult(status -> batchRepository.findByIdForUpdate(batchId)
                .filter(batch -> batch.getStatus() == BatchStatus.IN_PROGRESS)
                .ifPresent(batch -> {
                    batch.setCurrentStep(step);
                    batch.setUpdatedAt(clock.instant());
                    batchRepository.save(batch);
                }));
    }

    private void publishBatchEvent(BarcodeBatch batch, WarrantyEvent.EventType type) {
        kafkaProducerService.publishEvent(new WarrantyEvent(type, "BarcodeBatch", batch.getBatchId(),
                batch.getCreatedBy(), clock.instant())
                .with("batchNumber", batch.getBatchNumber())
                .with("successful", batch.getSuccessfulCount())
                .with("failed", batch.getFailedCount())
                .with("lastError", batch.getLastError()));
    }

    /**
     * Entities and counts derived from a list of slot results.
     */
    private static final class ChunkParts {
        private final List<WarrantyBarcode> barcodes = new ArrayList<>();
        private final List<CollisionRecord> collisions = new ArrayList<>();
        private int failedSlots;
        private String lastError;

        static ChunkParts of(List<SlotResult> results, BarcodeBatch batch, Instant now) {
            ChunkParts parts = new ChunkParts();
            for (SlotResult result : results) {
                parts.collisions.addAll(result.getCollisions());
                if (result.isAccepted()) {
                    parts.barcodes.add(WarrantyBarcode.builder()
                            .barcodeNumber(result.getBarcode())
                            .productId(batch.getProductId())
                            .storefrontId(batch.getStorefrontId())
                            .batchId(batch.getBatchId())
                            .status(BarcodeStatus.GENERATED)
                            .warrantyPeriodMonths(batch.getExpiryMonths())
                            .generationAttempt(result.getAttempt())
                            .createdBy(batch.getCreatedBy())
                            .createdAt(now)
                            .build());
                } else {
                    parts.failedSlots++;
                    parts.lastError = result.getError();
                }
            }
            return parts;
        }
    }

    /**
     * Control state of one running batch on this instance.
     */
    private static final class BatchRun {
        private final String batchId;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final AtomicBoolean aborted = new AtomicBoolean(false);
        private final List<Future<?>> workers = new CopyOnWriteArrayList<>();

        private BatchRun(String batchId) {
            this.batchId = batchId;
        }

        boolean isStopped() {
            return cancelled.get() || aborted.get();
        }

        void cancel(boolean force) {
            cancelled.set(true);
            if (force) {
                workers.forEach(worker -> worker.cancel(true));
            }
        }

        boolean allWorkersDone() {
            return workers.stream().allMatch(Future::isDone);
        }

        void abort() {
            aborted.set(true);
        }
    }
}
