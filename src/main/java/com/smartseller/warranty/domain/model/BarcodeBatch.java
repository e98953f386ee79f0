package com.smartseller.warranty.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Barcode batch entity representing an administrator-initiated bulk issuance.
 *
 * Counters:
 * - generatedCount: slots resolved so far (committed or failed)
 * - successfulCount: barcodes committed to the store
 * - failedCount / errorCount: slots that exhausted their retry budget
 * - collisionCount: collision records written for this batch
 * - retryCount: transient store failures retried during chunk commits
 *
 * Invariants: successful + failed <= generated <= requested; counters never decrease.
 *
 * @author Warranty Platform Team
 */
@Entity
@Table(name = "barcode_batches", indexes = {
    @Index(name = "idx_batch_number", columnList = "batch_number", unique = true),
    @Index(name = "idx_batch_status_created", columnList = "status, created_at"),
    @Index(name = "idx_batch_product", columnList = "product_id"),
    @Index(name = "idx_batch_storefront", columnList = "storefront_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BarcodeBatch {

    @Id
    @Column(name = "batch_id", nullable = false, length = 36)
    private String batchId;

    /**
     * Human-readable number, BATCH-YYYY-NNNNNN.
     */
    @Column(name = "batch_number", nullable = false, unique = true, length = 20)
    private String batchNumber;

    @Column(name = "product_id", nullable = false, length = 36)
    private String productId;

    @Column(name = "storefront_id", nullable = false, length = 36)
    private String storefrontId;

    @Column(name = "requested_quantity", nullable = false)
    private Integer requestedQuantity;

    @Column(name = "generated_count", nullable = false)
    @Builder.Default
    private Integer generatedCount = 0;

    @Column(name = "successful_count", nullable = false)
    @Builder.Default
    private Integer successfulCount = 0;

    @Column(name = "failed_count", nullable = false)
    @Builder.Default
    private Integer failedCount = 0;

    @Column(name = "error_count", nullable = false)
    @Builder.Default
    private Integer errorCount = 0;

    @Column(name = "collision_count", nullable = false)
    @Builder.Default
    private Integer collisionCount = 0;

    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private Integer retryCount = 0;

    @Column(name = "max_retries", nullable = false)
    @Builder.Default
    private Integer maxRetries = 3;

    @Column(name = "prefix", nullable = false, length = 10)
    private String prefix;

    @Column(name = "description", length = 1000)
    private String description;

    @Column(name = "expiry_months", nullable = false)
    private Integer expiryMonths;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 10)
    @Builder.Default
    private Priority priority = Priority.NORMAL;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BatchStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_step", nullable = false, length = 20)
    @Builder.Default
    private BatchStep currentStep = BatchStep.QUEUED;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    @Column(name = "notify_on_complete", nullable = false)
    @Builder.Default
    private Boolean notifyOnComplete = false;

    /**
     * Comma-separated tags.
     */
    @Column(name = "tags", length = 500)
    private String tags;

    @Column(name = "notes", length = 2000)
    private String notes;

    /**
     * Entropy seed drawn once per batch; a resumed batch keeps producing the same candidate space.
     */
    @Column(name = "entropy_seed", nullable = false)
    private Long entropySeed;

    @Column(name = "created_by", nullable = false, length = 36)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "cancelled_by", length = 36)
    private String cancelledBy;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (batchId == null) {
            batchId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        if (status == null) {
            status = BatchStatus.PENDING;
        }
    }

    /**
     * Progress percentage (0-100). Exactly 100 once completed.
     */
    public int progressPercent() {
        if (status == BatchStatus.COMPLETED) {
            return 100;
        }
        if (requestedQuantity == null || requestedQuantity == 0) {
            return 0;
        }
        return (int) Math.min(100, (long) generatedCount * 100 / requestedQuantity);
    }

    public int remainingSlots() {
        return Math.max(0, requestedQuantity - generatedCount);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Collision rate as a percentage of all candidates drawn.
     */
    public double collisionRate() {
        int attempts = generatedCount + failedCount + collisionCount;
        if (attempts == 0) {
            return 0.0;
        }
        return (double) collisionCount / attempts * 100.0;
    }

    public double successRate() {
        if (requestedQuantity == null || requestedQuantity == 0) {
            return 0.0;
        }
        return (double) successfulCount / requestedQuantity * 100.0;
    }

    public String performanceScore() {
        double success = successRate();
        double collisions = collisionRate();
        if (success >= 99.0 && collisions <= 1.0) {
            return "EXCELLENT";
        }
        if (success >= 95.0 && collisions <= 5.0) {
            return "GOOD";
        }
        if (success >= 85.0) {
            return "FAIR";
        }
        return "POOR";
    }

    /**
     * Batch lifecycle status.
     */
    public enum BatchStatus {
        PENDING,
        IN_PROGRESS,
        COMPLETED,
        CANCELLED,
        FAILED;

        public boolean isTerminal() {
            return this == COMPLETED || this == CANCELLED || this == FAILED;
        }
    }

    /**
     * Coarse step reported by progress observation.
     */
    public enum BatchStep {
        QUEUED,
        GENERATING,
        FINALIZING,
        DONE
    }
}
