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
 * Warranty claim entity: a customer's formal report of an issue against an activated barcode.
 *
 * Status changes go through {@link #applyTransition} so previousStatus and the status audit
 * fields always describe the latest move. The timeline lives in its own table.
 *
 * Product and storefront references are copied from the barcode at submission so claim
 * queries do not depend on the barcode lifecycle.
 *
 * @author Warranty Platform Team
 */
@Entity
@Table(name = "warranty_claims", indexes = {
    @Index(name = "idx_claim_number", columnList = "claim_number", unique = true),
    @Index(name = "idx_claim_status_date", columnList = "status, claim_date"),
    @Index(name = "idx_claim_barcode", columnList = "barcode_id"),
    @Index(name = "idx_claim_customer", columnList = "customer_id"),
    @Index(name = "idx_claim_technician", columnList = "assigned_technician_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WarrantyClaim {

    @Id
    @Column(name = "claim_id", nullable = false, length = 36)
    private String claimId;

    /**
     * Human-readable number, WAR-YYYY-NNNNNN.
     */
    @Column(name = "claim_number", nullable = false, unique = true, length = 20)
    private String claimNumber;

    @Column(name = "barcode_id", nullable = false, length = 36)
    private String barcodeId;

    @Column(name = "barcode_number", nullable = false, length = 32)
    private String barcodeNumber;

    @Column(name = "customer_id", nullable = false, length = 36)
    private String customerId;

    @Column(name = "product_id", nullable = false, length = 36)
    private String productId;

    @Column(name = "storefront_id", length = 36)
    private String storefrontId;

    @Enumerated(EnumType.STRING)
    @Column(name = "issue_category", nullable = false, length = 20)
    private IssueCategory issueCategory;

    @Column(name = "issue_description", nullable = false, length = 2000)
    private String issueDescription;

    @Column(name = "issue_date")
    private LocalDate issueDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 10)
    private Severity severity;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 10)
    @Builder.Default
    private Priority priority = Priority.NORMAL;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ClaimStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_status", length = 20)
    private ClaimStatus previousStatus;

    /**
     * Status held when the claim was disputed; resolve may return to it.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "status_before_dispute", length = 20)
    private ClaimStatus statusBeforeDispute;

    @Column(name = "status_updated_at")
    private Instant statusUpdatedAt;

    @Column(name = "status_updated_by", length = 36)
    private String statusUpdatedBy;

    @Column(name = "claim_date", nullable = false)
    private Instant claimDate;

    @Column(name = "validated_at")
    private Instant validatedAt;

    @Column(name = "validated_by", length = 36)
    private String validatedBy;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "estimated_completion_date")
    private LocalDate estimatedCompletionDate;

    @Column(name = "actual_completion_date")
    private Instant actualCompletionDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution_type", length = 10)
    private ResolutionType resolutionType;

    @Column(name = "resolution_notes", length = 2000)
    private String resolutionNotes;

    @Column(name = "replacement_product_id", length = 36)
    private String replacementProductId;

    @Column(name = "repair_cost", nullable = false, precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal repairCost = BigDecimal.ZERO;

    @Column(name = "shipping_cost", nullable = false, precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal shippingCost = BigDecimal.ZERO;

    @Column(name = "replacement_cost", nullable = false, precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal replacementCost = BigDecimal.ZERO;

    // Customer contact snapshot taken at submission
    @Column(name = "customer_name", length = 255)
    private String customerName;

    @Column(name = "customer_email", length = 255)
    private String customerEmail;

    @Column(name = "customer_phone", length = 50)
    private String customerPhone;

    @Column(name = "pickup_address", length = 500)
    private String pickupAddress;

    @Column(name = "customer_notes", length = 2000)
    private String customerNotes;

    @Column(name = "admin_notes", length = 2000)
    private String adminNotes;

    @Column(name = "internal_notes", length = 2000)
    private String internalNotes;

    @Column(name = "rejection_reason", length = 1000)
    private String rejectionReason;

    @Column(name = "assigned_technician_id", length = 36)
    private String assignedTechnicianId;

    @Column(name = "shipping_provider", length = 100)
    private String shippingProvider;

    @Column(name = "tracking_number", length = 100)
    private String trackingNumber;

    @Column(name = "shipped_at")
    private Instant shippedAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "customer_rating")
    private Integer customerRating;

    @Column(name = "customer_feedback", length = 2000)
    private String customerFeedback;

    /**
     * Comma-separated tags.
     */
    @Column(name = "tags", length = 500)
    private String tags;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (claimId == null) {
            claimId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
        if (status == null) {
            status = ClaimStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Total cost, always repair + shipping + replacement. Never stored.
     */
    public BigDecimal getTotalCost() {
        return nullToZero(repairCost).add(nullToZero(shippingCost)).add(nullToZero(replacementCost));
    }

    /**
     * Move the claim to a new status and record who did it and when.
     */
    public void applyTransition(ClaimStatus target, String actorId, Instant at) {
        this.previousStatus = this.status;
        this.status = target;
        this.statusUpdatedAt = at;
        this.statusUpdatedBy = actorId;
    }

    /**
     * Write the resolution fields. They are written exactly once.
     *
     * @throws IllegalStateException if the claim already carries a resolution
     */
    public void recordResolution(ResolutionType type, String notes, Instant at) {
        if (this.resolutionType != null || this.completedAt != null) {
            throw new IllegalStateException("Claim " + claimNumber + " is already resolved");
        }
        this.resolutionType = type;
        this.resolutionNotes = notes;
        this.completedAt = at;
        this.actualCompletionDate = at;
    }

    private static BigDecimal nullToZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
