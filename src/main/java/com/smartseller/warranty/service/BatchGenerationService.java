package com.smartseller.warranty.service;

import com.smartseller.warranty.domain.model.BarcodeBatch;
import com.smartseller.warranty.domain.model.BarcodeBatch.BatchStatus;
import com.smartseller.warranty.domain.model.BarcodeBatch.BatchStep;
import com.smartseller.warranty.domain.model.CollisionRecord;
import com.smartseller.warranty.domain.model.Priority;
import com.smartseller.warranty.domain.model.WarrantyBarcode;
import com.smartseller.warranty.exception.ForbiddenException;
import com.smartseller.warranty.exception.InvalidArgumentException;
import com.smartseller.warranty.exception.InvalidArgumentException.FieldViolation;
import com.smartseller.warranty.exception.InvalidStateException;
import com.smartseller.warranty.exception.ResourceNotFoundException;
import com.smartseller.warranty.infrastructure.catalog.ProductCatalog;
import com.smartseller.warranty.infrastructure.messaging.KafkaProducerService;
import com.smartseller.warranty.infrastructure.messaging.events.WarrantyEvent;
import com.smartseller.warranty.repository.BarcodeBatchRepository;
import com.smartseller.warranty.repository.CollisionRecordRepository;
import com.smartseller.warranty.security.Actor;
import lombok.Builder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Batch generation service: the public contract of barcode issuance.
 *
 * Lifecycle:
 * <pre>
 * pending --start--> in_progress --finish--> completed
 *    |                    |
 *    +--cancel------------+--cancel--> cancelled
 *                         +--abort---> failed
 * </pre>
 *
 * This service owns the user-driven transitions (create, start, cancel). The generation itself,
 * finish and abort belong to {@link BatchGenerationEngine}.
 *
 * @author Warranty Platform Team
 */
@Service
public class BatchGenerationService {

    private static final Logger logger = LoggerFactory.getLogger(BatchGenerationService.class);

    static final int MAX_QUANTITY = 100_000;
    static final int MAX_EXPIRY_MONTHS = 120;
    static final int MAX_RETRIES_LIMIT = 10;
    static final int DEFAULT_MAX_RETRIES = 3;

    private final BarcodeBatchRepository batchRepository;
    private final CollisionRecordRepository collisionRepository;
    private final WarrantyRecordStore recordStore;
    private final BatchGenerationEngine engine;
    private final BatchProgressTracker progressTracker;
    private final NumberSequenceService numberSequenceService;
    private final ProductCatalog productCatalog;
    private final KafkaProducerService kafkaProducerService;
    private final Clock clock;
    private final SecureRandom seedSource = new SecureRandom();

    public BatchGenerationService(
            BarcodeBatchRepository batchRepository,
            CollisionRecordRepository collisionRepository,
            WarrantyRecordStore recordStore,
            BatchGenerationEngine engine,
            BatchProgressTracker progressTracker,
            NumberSequenceService numberSequenceService,
            ProductCatalog productCatalog,
            KafkaProducerService kafkaProducerService,
            Clock clock
    ) {
        this.batchRepository = batchRepository;
        this.collisionRepository = collisionRepository;
        this.recordStore = recordStore;
        this.engine = engine;
        this.progressTracker = progressTracker;
        this.numberSequenceService = numberSequenceService;
        this.productCatalog = productCatalog;
        this.kafkaProducerService = kafkaProducerService;
        this.clock = clock;
    }

    /**
     * Create a batch in PENDING.
     *
     * @throws ForbiddenException if the caller is not an administrator
     * @throws InvalidArgumentException on out-of-range input or an unknown product
     */
    @Transactional
    public BarcodeBatch createBatch(CreateBatchCommand command, Actor actor) {
        requireAdmin(actor);
        validate(command);

        int maxRetries = command.maxRetries == null ? DEFAULT_MAX_RETRIES : command.maxRetries;
        Instant now = clock.instant();
        BarcodeBatch batch = BarcodeBatch.builder()
                .batchNumber(numberSequenceService.next(NumberSequenceService.BATCH))
                .productId(command.productId)
                .storefrontId(command.storefrontId)
                .requestedQuantity(command.quantity)
                .prefix(command.prefix)
                .expiryMonths(command.expiryMonths)
                .priority(command.priority == null ? Priority.NORMAL : command.priority)
                .maxRetries(maxRetries)
                .description(command.description)
                .tags(command.tags)
                .notes(command.notes)
                .notifyOnComplete(Boolean.TRUE.equals(command.notifyOnComplete))
                .entropySeed(seedSource.nextLong())
                .status(BatchStatus.PENDING)
                .currentStep(BatchStep.QUEUED)
                .createdBy(actor.getActorId())
                .createdAt(now)
                .updatedAt(now)
                .build();

        BarcodeBatch saved = batchRepository.save(batch);
        logger.info("Created batch {} for product {}: {} x {} ({} months)",
                saved.getBatchNumber(), saved.getProductId(), saved.getRequestedQuantity(),
                saved.getPrefix(), saved.getExpiryMonths());
        return saved;
    }

    /**
     * Start a PENDING batch. Starting an IN_PROGRESS batch returns it unchanged.
     *
     * @throws InvalidStateException if the batch is terminal
     */
    @Transactional
    public BarcodeBatch startBatch(String batchId, Actor actor) {
        requireAdmin(actor);
        BarcodeBatch batch = lockBatch(batchId);

        if (batch.getStatus() == BatchStatus.IN_PROGRESS) {
            logger.debug("Batch {} already started", batch.getBatchNumber());
            return batch;
        }
        if (batch.getStatus() != BatchStatus.PENDING) {
            throw new InvalidStateException("BarcodeBatch", batchId, batch.getStatus().name(), List.of(),
                    "Batch " + batch.getBatchNumber() + " is " + batch.getStatus() + " and cannot be started");
        }

        Instant now = clock.instant();
        batch.setStatus(BatchStatus.IN_PROGRESS);
        batch.setStartedAt(now);
        batch.setUpdatedAt(now);
        BarcodeBatch saved = batchRepository.save(batch);

        AfterCommit.run(() -> engine.submit(batchId));
        logger.info("Batch {} started by {}", saved.getBatchNumber(), actor);
        return saved;
    }

    /**
     * Cancel a PENDING or IN_PROGRESS batch. Committed barcodes remain.
     *
     * @param force also interrupt in-flight slot generation
     * @throws InvalidStateException if the batch is terminal
     */
    @Transactional
    public BarcodeBatch cancelBatch(String batchId, String reason, boolean force, Actor actor) {
        requireAdmin(actor);
        BarcodeBatch batch = lockBatch(batchId);

        if (batch.isTerminal()) {
            throw new InvalidStateException("BarcodeBatch", batchId, batch.getStatus().name(), List.of(),
                    "Batch " + batch.getBatchNumber() + " is already " + batch.getStatus());
        }

        Instant now = clock.instant();
        batch.setStatus(BatchStatus.CANCELLED);
        batch.setCancelledAt(now);
        batch.setCancelledBy(actor.getActorId());
        batch.setCancellationReason(reason);
        batch.setUpdatedAt(now);
        if (!engine.isRunning(batchId)) {
            batch.setCurrentStep(BatchStep.DONE);
        }
        BarcodeBatch saved = batchRepository.save(batch);

        AfterCommit.run(() -> {
            engine.requestCancel(batchId, force);
            kafkaProducerService.publishEvent(new WarrantyEvent(WarrantyEvent.EventType.BATCH_CANCELLED,
                    "BarcodeBatch", batchId, actor.getActorId(), now)
                    .with("batchNumber", saved.getBatchNumber())
                    .with("reason", reason));
        });
        logger.info("Batch {} cancelled by {} (force={}): {}", saved.getBatchNumber(), actor, force, reason);
        return saved;
    }

    @Transactional(readOnly = true)
    public BarcodeBatch getBatch(String batchId) {
        return batchRepository.findById(batchId)
                .orElseThrow(() -> new ResourceNotFoundException("BarcodeBatch", batchId));
    }

    /**
     * Progress snapshot for polling.
     */
    @Transactional(readOnly = true)
    public BatchProgress getProgress(String batchId) {
        BarcodeBatch batch = getBatch(batchId);
        Instant now = clock.instant();
        boolean active = batch.getStatus() == BatchStatus.IN_PROGRESS;
        Double rate = active ? progressTracker.rate(batchId) : null;
        Instant eta = active ? progressTracker.estimateCompletion(batchId, batch.remainingSlots(), now) : null;
        return new BatchProgress(batch, rate, eta);
    }

    @Transactional(readOnly = true)
    public Page<BarcodeBatch> listBatches(BatchFilter filter, Pageable pageable) {
        return batchRepository.search(filter.status, filter.priority, filter.productId, filter.storefrontId,
                filter.createdBy, filter.createdFrom, filter.createdTo, pageable);
    }

    @Transactional(readOnly = true)
    public Page<CollisionRecord> listCollisions(String batchId, Pageable pageable) {
        getBatch(batchId);
        return collisionRepository.findByBatchIdOrderByDetectedAtAsc(batchId, pageable);
    }

    @Transactional(readOnly = true)
    public Page<WarrantyBarcode> listBarcodes(String batchId, Pageable pageable) {
        getBatch(batchId);
        return recordStore.listByBatch(batchId, pageable);
    }

    /**
     * Resubmit IN_PROGRESS batches that stopped reporting progress and are not running here.
     *
     * @param staleAfter Time without progress after which a batch is considered abandoned
     * @return Number of batches resubmitted
     */
    public int resumeStaleBatches(Duration staleAfter) {
        Instant cutoff = clock.instant().minus(staleAfter);
        int resumed = 0;
        for (BarcodeBatch batch : batchRepository.findByStatusAndUpdatedAtBefore(BatchStatus.IN_PROGRESS, cutoff)) {
            if (engine.isRunning(batch.getBatchId())) {
                continue;
            }
            if (engine.submit(batch.getBatchId())) {
                logger.info("Resumed stale batch {} from slot {}", batch.getBatchNumber(), batch.getGeneratedCount());
                resumed++;
            }
        }
        return resumed;
    }

    private void validate(CreateBatchCommand command) {
        List<FieldViolation> violations = new ArrayList<>();
        if (command.productId == null || command.productId.isBlank()) {
            violations.add(new FieldViolation("productId", "Product is required", command.productId));
        } else if (productCatalog.lookupProduct(command.productId).isEmpty()) {
            violations.add(new FieldViolation("productId", "Unknown product", command.productId));
        }
        if (command.storefrontId == null || command.storefrontId.isBlank()) {
            violations.add(new FieldViolation("storefrontId", "Storefront is required", command.storefrontId));
        }
        if (command.quantity == null || command.quantity < 1 || command.quantity > MAX_QUANTITY) {
            violations.add(new FieldViolation("quantity", "Quantity must be between 1 and " + MAX_QUANTITY,
                    command.quantity));
        }
        if (!BarcodeFormat.isValidPrefix(command.prefix)) {
            violations.add(new FieldViolation("prefix", "Prefix must be 2-10 upper-case letters", command.prefix));
        }
        if (command.expiryMonths == null || command.expiryMonths < 1 || command.expiryMonths > MAX_EXPIRY_MONTHS) {
            violations.add(new FieldViolation("expiryMonths", "Expiry months must be between 1 and " + MAX_EXPIRY_MONTHS,
                    command.expiryMonths));
        }
        if (command.maxRetries != null && (command.maxRetries < 0 || command.maxRetries > MAX_RETRIES_LIMIT)) {
            violations.add(new FieldViolation("maxRetries", "Max retries must be between 0 and " + MAX_RETRIES_LIMIT,
                    command.maxRetries));
        }
        if (!violations.isEmpty()) {
            throw new InvalidArgumentException(violations);
        }
    }

    private BarcodeBatch lockBatch(String batchId) {
        return batchRepository.findByIdForUpdate(batchId)
                .orElseThrow(() -> new ResourceNotFoundException("BarcodeBatch", batchId));
    }

    private static void requireAdmin(Actor actor) {
        if (!actor.isAdmin()) {
            throw new ForbiddenException("Batch operations require the ADMIN role");
        }
    }

    /**
     * Input of batch creation.
     */
    @Builder
    public static class CreateBatchCommand {
        private final String productId;
        private final String storefrontId;
        private final Integer quantity;
        private final String prefix;
        private final Integer expiryMonths;
        private final Priority priority;
        private final Integer maxRetries;
        private final String description;
        private final String tags;
        private final String notes;
        private final Boolean notifyOnComplete;
    }

    /**
     * Filters of batch listing; null fields do not filter.
     */
    @Builder
    public static class BatchFilter {
        private final BatchStatus status;
        private final Priority priority;
        private final String productId;
        private final String storefrontId;
        private final String createdBy;
        private final Instant createdFrom;
        private final Instant createdTo;
    }

    /**
     * Progress snapshot of a batch.
     */
    public static class BatchProgress {
        private final BarcodeBatch batch;
        private final Double generationRate;
        private final Instant estimatedCompletion;

        public BatchProgress(BarcodeBatch batch, Double generationRate, Instant estimatedCompletion) {
            this.batch = batch;
            this.generationRate = generationRate;
            this.estimatedCompletion = estimatedCompletion;
        }

        public BarcodeBatch getBatch() { return batch; }
        public Double getGenerationRate() { return generationRate; }
        public Instant getEstimatedCompletion() { return estimatedCompletion; }
    }
}
