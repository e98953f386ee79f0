package com.smartseller.warranty.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Warranty barcode entity: the warranty entitlement of one physical unit.
 * Barcodes are:
 * - GENERATED: issued by a batch, not yet bound to a customer
 * - ACTIVE: bound to a customer, warranty clock running
 * - CLAIMED: consumed by a completed replacement claim
 * - EXPIRED: projected on read once the expiry passes (never written by a clock tick)
 * - REVOKED: withdrawn by an administrator
 *
 * The stored truth is activatedAt and warrantyPeriodMonths. Expiry is fixed once at
 * activation; days remaining, claimability and the human-readable period are computed on read.
 *
 * @author Warranty Platform Team
 */
@Entity
@Table(name = "warranty_barcodes", indexes = {
    @Index(name = "idx_barcode_number", columnList = "barcode_number", unique = true),
    @Index(name = "idx_barcode_batch", columnList = "batch_id"),
    @Index(name = "idx_barcode_product_status", columnList = "product_id, status"),
    @Index(name = "idx_barcode_customer", columnList = "customer_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WarrantyBarcode {

    @Id
    @Column(name = "barcode_id", nullable = false, length = 36)
    private String barcodeId;

    /**
     * Globally unique barcode string, e.g. WB-2024-0K3J9Z2QXA.
     */
    @Column(name = "barcode_number", nullable = false, unique = true, length = 32)
    private String barcodeNumber;

    @Column(name = "product_id", nullable = false, length = 36)
    private String productId;

    @Column(name = "storefront_id", length = 36)
    private String storefrontId;

    /**
     * Owning batch; null for barcodes created one at a time.
     */
    @Column(name = "batch_id", length = 36)
    private String batchId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BarcodeStatus status;

    @Column(name = "warranty_period_months", nullable = false)
    private Integer warrantyPeriodMonths;

    @Column(name = "activated_at")
    private Instant activatedAt;

    @Column(name = "expiry_date")
    private Instant expiryDate;

    @Column(name = "customer_id", length = 36)
    private String customerId;

    /**
     * Customer e-mail captured at activation, used by public lookup-by-email.
     */
    @Column(name = "customer_email", length = 255)
    private String customerEmail;

    @Column(name = "purchase_date")
    private LocalDate purchaseDate;

    @Column(name = "purchase_retailer", length = 255)
    private String purchaseRetailer;

    @Column(name = "purchase_invoice", length = 100)
    private String purchaseInvoice;

    @Column(name = "serial_number", length = 100)
    private String serialNumber;

    @Column(name = "purchase_price", precision = 12, scale = 2)
    private BigDecimal purchasePrice;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Column(name = "revocation_reason", length = 500)
    private String revocationReason;

    /**
     * Generation attempt (0-based) that produced the accepted string.
     */
    @Column(name = "generation_attempt")
    private Integer generationAttempt;

    @Column(name = "created_by", length = 36)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (barcodeId == null) {
            barcodeId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
        if (status == null) {
            status = BarcodeStatus.GENERATED;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Compute the expiry of a warranty activated at the given instant.
     * Months are added on the UTC calendar so that Jan 31 + 1 month lands on the last day of February.
     *
     * @param activatedAt Activation timestamp
     * @param periodMonths Warranty period in months
     * @return Expiry timestamp
     */
    public static Instant computeExpiry(Instant activatedAt, int periodMonths) {
        return activatedAt.atZone(ZoneOffset.UTC).plusMonths(periodMonths).toInstant();
    }

    public boolean isExpiredAt(Instant now) {
        return expiryDate != null && expiryDate.isBefore(now);
    }

    /**
     * Whole days until expiry, never negative. Zero for barcodes that were never activated.
     */
    public long daysRemainingAt(Instant now) {
        if (expiryDate == null) {
            return 0;
        }
        return Math.max(0, Duration.between(now, expiryDate).toDays());
    }

    public boolean canClaimAt(Instant now) {
        return status == BarcodeStatus.ACTIVE && !isExpiredAt(now);
    }

    /**
     * Status as observed at the given instant: an ACTIVE barcode past its expiry reads as EXPIRED.
     */
    public BarcodeStatus effectiveStatusAt(Instant now) {
        if (status == BarcodeStatus.ACTIVE && isExpiredAt(now)) {
            return BarcodeStatus.EXPIRED;
        }
        return status;
    }

    public String warrantyPeriodLabel() {
        return describePeriod(warrantyPeriodMonths);
    }

    /**
     * Human-readable warranty period, e.g. "1 month", "18 months", "2 years".
     */
    public static String describePeriod(Integer months) {
        if (months == null || months <= 0) {
            return "No warranty";
        }
        if (months % 12 == 0) {
            int years = months / 12;
            return years == 1 ? "1 year" : years + " years";
        }
        return months == 1 ? "1 month" : months + " months";
    }

    /**
     * Barcode lifecycle status.
     */
    public enum BarcodeStatus {
        GENERATED,
        ACTIVE,
        CLAIMED,
        EXPIRED,
        REVOKED;

        /**
         * Whether the store may move a barcode from this status to the target.
         * EXPIRED is a projection and is never written.
         */
        public boolean canMoveTo(BarcodeStatus target) {
            switch (this) {
                case GENERATED:
                    return target == ACTIVE || target == REVOKED;
                case ACTIVE:
                    return target == CLAIMED || target == REVOKED;
                default:
                    return false;
            }
        }
    }
}
