package com.smartseller.warranty.service;

import com.smartseller.warranty.domain.model.CollisionRecord;
import com.smartseller.warranty.domain.model.CollisionRecord.CollisionType;
import com.smartseller.warranty.domain.model.CollisionRecord.Resolution;
import com.smartseller.warranty.infrastructure.metrics.WarrantyMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Collision detection and resolution for batch slots.
 *
 * A candidate is checked against the strings already accepted by the batch, then against the
 * persisted unique index. Every hit produces a {@link CollisionRecord}: REGENERATED while the slot
 * still has budget (max_retries regenerations after the first attempt), DROPPED on the last one.
 * A slot whose budget runs out is reported as failed.
 *
 * @author Warranty Platform Team
 */
@Service
public class CollisionDetector {

    private static final Logger logger = LoggerFactory.getLogger(CollisionDetector.class);

    private final BarcodeGenerator generator;
    private final WarrantyRecordStore recordStore;
    private final WarrantyMetricsService metricsService;
    private final Clock clock;

    public CollisionDetector(
            BarcodeGenerator generator,
            WarrantyRecordStore recordStore,
            WarrantyMetricsService metricsService,
            Clock clock
    ) {
        this.generator = generator;
        this.recordStore = recordStore;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Resolve a slot from its first attempt.
     */
    public SlotResult resolveSlot(GenerationContext context, int slotIndex) {
        return resolveFrom(context, slotIndex, 0, new ArrayList<>());
    }

    /**
     * Re-resolve a slot whose accepted string was rejected by the unique index at commit time.
     * The rejected string is recorded as a DUPLICATE_IN_STORE collision of its attempt and
     * generation resumes from the next attempt.
     */
    public SlotResult resolveRejected(GenerationContext context, SlotResult rejected) {
        List<CollisionRecord> collisions = new ArrayList<>(rejected.getCollisions());
        int attempt = rejected.getAttempt();
        boolean budgetLeft = attempt < context.getMaxRetries();
        collisions.add(collision(context, rejected.getSlotIndex(), attempt, rejected.getBarcode(),
                CollisionType.DUPLICATE_IN_STORE, budgetLeft));
        if (!budgetLeft) {
            return exhausted(context, rejected.getSlotIndex(), attempt, collisions);
        }
        return resolveFrom(context, rejected.getSlotIndex(), attempt + 1, collisions);
    }

    private SlotResult resolveFrom(GenerationContext context, int slotIndex, int firstAttempt,
                                   List<CollisionRecord> collisions) {
        int maxRetries = context.getMaxRetries();
        for (int attempt = firstAttempt; attempt <= maxRetries; attempt++) {
            long counter = BarcodeFormat.counterFor(slotIndex, attempt, maxRetries);
            String candidate = generator.generate(context.getPrefix(), context.getYear(), context.getSeed(), counter);
            boolean budgetLeft = attempt < maxRetries;

            if (!context.tryAccept(candidate)) {
                collisions.add(collision(context, slotIndex, attempt, candidate,
                        CollisionType.DUPLICATE_IN_BATCH, budgetLeft));
                continue;
            }
            if (recordStore.exists(candidate)) {
                context.release(candidate);
                collisions.add(collision(context, slotIndex, attempt, candidate,
                        CollisionType.DUPLICATE_IN_STORE, budgetLeft));
                continue;
            }
            return SlotResult.accepted(slotIndex, candidate, attempt, collisions);
        }
        return exhausted(context, slotIndex, maxRetries, collisions);
    }

    private SlotResult exhausted(GenerationContext context, int slotIndex, int attempt,
                                 List<CollisionRecord> collisions) {
        String error = String.format("Slot %d exhausted %d retries after %d collisions",
                slotIndex, context.getMaxRetries(), collisions.size());
        logger.warn("Batch {}: {}", context.getBatchId(), error);
        metricsService.recordSlotFailure();
        return SlotResult.failed(slotIndex, attempt, collisions, error);
    }

    private CollisionRecord collision(GenerationContext context, int slotIndex, int attempt, String candidate,
                                      CollisionType type, boolean budgetLeft) {
        Instant now = clock.instant();
        CollisionRecord record = CollisionRecord.builder()
                .batchId(context.getBatchId())
                .candidateBarcode(candidate)
                .collisionType(type)
                .slotIndex(slotIndex)
                .attempt(attempt)
                .detectedAt(now)
                .build();
        record.resolve(budgetLeft ? Resolution.REGENERATED : Resolution.DROPPED, now);
        metricsService.recordCollision(type.name());
        logger.debug("Batch {} slot {} attempt {}: {} on {}", context.getBatchId(), slotIndex, attempt, type, candidate);
        return record;
    }
}
