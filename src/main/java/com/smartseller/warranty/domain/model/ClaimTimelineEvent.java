package com.smartseller.warranty.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit log entry of a claim's lifecycle.
 * Rows are only ever inserted; (claim_id, sequence) is unique and sequence grows by one per claim.
 *
 * @author Warranty Platform Team
 */
@Entity
@Table(name = "claim_timeline_events",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_timeline_claim_sequence", columnNames = {"claim_id", "sequence"})
    },
    indexes = {
        @Index(name = "idx_timeline_claim_time", columnList = "claim_id, occurred_at, sequence")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClaimTimelineEvent {

    @Id
    @Column(name = "event_id", nullable = false, length = 36)
    private String eventId;

    @Column(name = "claim_id", nullable = false, length = 36, updatable = false)
    private String claimId;

    @Column(name = "sequence", nullable = false, updatable = false)
    private Long sequence;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 30, updatable = false)
    private EventType eventType;

    @Column(name = "description", nullable = false, length = 2000, updatable = false)
    private String description;

    @Column(name = "actor_id", nullable = false, length = 36, updatable = false)
    private String actorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "actor_type", nullable = false, length = 20, updatable = false)
    private ActorType actorType;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(name = "visible_to_customer", nullable = false, updatable = false)
    private Boolean visibleToCustomer;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", length = 20, updatable = false)
    private ClaimStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", length = 20, updatable = false)
    private ClaimStatus toStatus;

    @PrePersist
    protected void onCreate() {
        if (eventId == null) {
            eventId = UUID.randomUUID().toString();
        }
    }

    public enum EventType {
        SUBMITTED,
        VALIDATED,
        REJECTED,
        ASSIGNED,
        REPAIR_STARTED,
        REPAIR_COMPLETED,
        QUALITY_REJECTED,
        CUSTOMER_APPROVED,
        COMPLETED,
        NOTE_ADDED,
        ATTACHMENT_UPLOADED,
        STATUS_UPDATED
    }
}
