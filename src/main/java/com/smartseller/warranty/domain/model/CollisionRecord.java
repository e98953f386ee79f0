package com.smartseller.warranty.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A generated candidate that duplicated an accepted or persisted barcode.
 * Owned by its batch. A record reaches at most one terminal resolution.
 *
 * @author Warranty Platform Team
 */
@Entity
@Table(name = "barcode_collisions", indexes = {
    @Index(name = "idx_collision_batch", columnList = "batch_id, detected_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollisionRecord {

    @Id
    @Column(name = "collision_id", nullable = false, length = 36)
    private String collisionId;

    @Column(name = "batch_id", nullable = false, length = 36)
    private String batchId;

    @Column(name = "candidate_barcode", nullable = false, length = 32)
    private String candidateBarcode;

    @Enumerated(EnumType.STRING)
    @Column(name = "collision_type", nullable = false, length = 30)
    private CollisionType collisionType;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution", length = 20)
    private Resolution resolution;

    @Column(name = "slot_index", nullable = false)
    private Integer slotIndex;

    @Column(name = "attempt", nullable = false)
    private Integer attempt;

    @Column(name = "detected_at", nullable = false)
    private Instant detectedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @PrePersist
    protected void onCreate() {
        if (collisionId == null) {
            collisionId = UUID.randomUUID().toString();
        }
        if (detectedAt == null) {
            detectedAt = Instant.now();
        }
    }

    public boolean isResolved() {
        return resolution != null;
    }

    /**
     * Record the terminal resolution of this collision.
     *
     * @throws IllegalStateException if the collision was already resolved
     */
    public void resolve(Resolution resolution, Instant resolvedAt) {
        if (this.resolution != null) {
            throw new IllegalStateException(
                    "Collision " + collisionId + " already resolved as " + this.resolution);
        }
        this.resolution = resolution;
        this.resolvedAt = resolvedAt;
    }

    public enum CollisionType {
        /**
         * Candidate already accepted by another slot of the same batch.
         */
        DUPLICATE_IN_BATCH,

        /**
         * Candidate already persisted in the barcode store.
         */
        DUPLICATE_IN_STORE
    }

    public enum Resolution {
        REGENERATED,
        DROPPED
    }
}
