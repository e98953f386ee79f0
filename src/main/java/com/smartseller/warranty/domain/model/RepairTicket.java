package com.smartseller.warranty.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Repair ticket entity: the technician-owned child workflow of a claim.
 *
 * A claim has at most one live (non-cancelled) ticket. Quality-check rejection reopens the same
 * ticket instead of spawning a new one, so labor and parts are accounted on a single row.
 *
 * @author Warranty Platform Team
 */
@Entity
@Table(name = "repair_tickets", indexes = {
    @Index(name = "idx_ticket_number", columnList = "ticket_number", unique = true),
    @Index(name = "idx_ticket_claim", columnList = "claim_id"),
    @Index(name = "idx_ticket_technician_status", columnList = "technician_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RepairTicket {

    @Id
    @Column(name = "ticket_id", nullable = false, length = 36)
    private String ticketId;

    /**
     * Human-readable number, RPR-YYYY-NNNNNN.
     */
    @Column(name = "ticket_number", nullable = false, unique = true, length = 20)
    private String ticketNumber;

    @Column(name = "claim_id", nullable = false, length = 36)
    private String claimId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private TicketStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 10)
    @Builder.Default
    private Priority priority = Priority.NORMAL;

    @Column(name = "technician_id", length = 36)
    private String technicianId;

    @Column(name = "assigned_at")
    private Instant assignedAt;

    @Column(name = "estimated_hours", precision = 7, scale = 2)
    private BigDecimal estimatedHours;

    @Column(name = "actual_hours", precision = 7, scale = 2)
    private BigDecimal actualHours;

    @Column(name = "estimated_completion_date")
    private LocalDate estimatedCompletionDate;

    @Column(name = "actual_completion_date")
    private Instant actualCompletionDate;

    @Column(name = "description", nullable = false, length = 2000)
    private String description;

    @Column(name = "required_parts", length = 2000)
    private String requiredParts;

    @Column(name = "used_parts", length = 2000)
    private String usedParts;

    @Column(name = "special_instructions", length = 2000)
    private String specialInstructions;

    @Column(name = "repair_notes", length = 4000)
    private String repairNotes;

    @Column(name = "test_results", length = 4000)
    private String testResults;

    @Column(name = "labor_cost", precision = 12, scale = 2)
    private BigDecimal laborCost;

    @Column(name = "parts_cost", precision = 12, scale = 2)
    private BigDecimal partsCost;

    /**
     * labor + parts, written once per completion round.
     */
    @Column(name = "total_cost", precision = 12, scale = 2)
    private BigDecimal totalCost;

    @Enumerated(EnumType.STRING)
    @Column(name = "quality_check_status", nullable = false, length = 20)
    @Builder.Default
    private QualityCheckStatus qualityCheckStatus = QualityCheckStatus.PENDING;

    @Column(name = "quality_checked_by", length = 36)
    private String qualityCheckedBy;

    @Column(name = "quality_checked_at")
    private Instant qualityCheckedAt;

    @Column(name = "quality_notes", length = 2000)
    private String qualityNotes;

    @Column(name = "customer_approval_required", nullable = false)
    @Builder.Default
    private Boolean customerApprovalRequired = false;

    @Enumerated(EnumType.STRING)
    @Column(name = "customer_approval_status", nullable = false, length = 20)
    @Builder.Default
    private CustomerApprovalStatus customerApprovalStatus = CustomerApprovalStatus.NOT_REQUIRED;

    @Column(name = "customer_approved_at")
    private Instant customerApprovedAt;

    @Column(name = "customer_approval_notes", length = 2000)
    private String customerApprovalNotes;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (ticketId == null) {
            ticketId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
        if (status == null) {
            status = TicketStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isLive() {
        return status != TicketStatus.CANCELLED;
    }

    /**
     * Whether the ticket lets its claim move to repaired or replaced: work completed,
     * quality approved, and customer approval either not required or granted.
     */
    public boolean isResolvable() {
        return status == TicketStatus.COMPLETED
                && qualityCheckStatus == QualityCheckStatus.APPROVED
                && (customerApprovalStatus == CustomerApprovalStatus.NOT_REQUIRED
                    || customerApprovalStatus == CustomerApprovalStatus.APPROVED);
    }

    /**
     * Record the completion of a repair round.
     *
     * @throws IllegalStateException if this round already has a total cost
     */
    public void recordCompletion(BigDecimal laborCost, BigDecimal partsCost, Instant at) {
        if (this.totalCost != null) {
            throw new IllegalStateException("Ticket " + ticketNumber + " already has a total cost");
        }
        this.laborCost = laborCost;
        this.partsCost = partsCost;
        this.totalCost = laborCost.add(partsCost);
        this.actualCompletionDate = at;
        this.status = TicketStatus.COMPLETED;
    }

    /**
     * Reopen after a rejected quality check: back to IN_PROGRESS with a fresh QA round.
     */
    public void reopen() {
        this.status = TicketStatus.IN_PROGRESS;
        this.qualityCheckStatus = QualityCheckStatus.PENDING;
        this.totalCost = null;
        this.actualCompletionDate = null;
    }

    public enum TicketStatus {
        PENDING,
        ASSIGNED,
        IN_PROGRESS,
        COMPLETED,
        CANCELLED
    }

    public enum QualityCheckStatus {
        PENDING,
        APPROVED,
        REJECTED
    }

    public enum CustomerApprovalStatus {
        NOT_REQUIRED,
        PENDING,
        APPROVED,
        REJECTED
    }
}
