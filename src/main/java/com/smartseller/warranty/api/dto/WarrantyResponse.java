package com.smartseller.warranty.api.dto;

import com.smartseller.warranty.domain.model.WarrantyBarcode;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Authenticated warranty detail: the barcode with its activation data and derived fields.
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class WarrantyResponse {

    private String barcodeId;
    private String barcodeNumber;
    private String productId;
    private String storefrontId;
    private String batchId;
    private String status;
    private Integer warrantyPeriodMonths;
    private String warrantyPeriod;
    private Instant activatedAt;
    private Instant expiryDate;
    private long daysRemaining;
    private boolean expired;
    private boolean canClaim;
    private String customerId;
    private String customerEmail;
    private LocalDate purchaseDate;
    private String purchaseRetailer;
    private String purchaseInvoice;
    private String serialNumber;
    private BigDecimal purchasePrice;
    private Instant revokedAt;
    private String revocationReason;
    private Instant createdAt;

    /**
     * @param barcode Barcode entity
     * @param now Instant the derived fields are computed at
     */
    public static WarrantyResponse fromEntity(WarrantyBarcode barcode, Instant now) {
        WarrantyResponse response = new WarrantyResponse();
        response.setBarcodeId(barcode.getBarcodeId());
        response.setBarcodeNumber(barcode.getBarcodeNumber());
        response.setProductId(barcode.getProductId());
        response.setStorefrontId(barcode.getStorefrontId());
        response.setBatchId(barcode.getBatchId());
        response.setStatus(barcode.effectiveStatusAt(now).name().toLowerCase());
        response.setWarrantyPeriodMonths(barcode.getWarrantyPeriodMonths());
        response.setWarrantyPeriod(barcode.warrantyPeriodLabel());
        response.setActivatedAt(barcode.getActivatedAt());
        response.setExpiryDate(barcode.getExpiryDate());
        response.setDaysRemaining(barcode.daysRemainingAt(now));
        response.setExpired(barcode.isExpiredAt(now));
        response.setCanClaim(barcode.canClaimAt(now));
        response.setCustomerId(barcode.getCustomerId());
        response.setCustomerEmail(barcode.getCustomerEmail());
        response.setPurchaseDate(barcode.getPurchaseDate());
        response.setPurchaseRetailer(barcode.getPurchaseRetailer());
        response.setPurchaseInvoice(barcode.getPurchaseInvoice());
        response.setSerialNumber(barcode.getSerialNumber());
        response.setPurchasePrice(barcode.getPurchasePrice());
        response.setRevokedAt(barcode.getRevokedAt());
        response.setRevocationReason(barcode.getRevocationReason());
        response.setCreatedAt(barcode.getCreatedAt());
        return response;
    }
}
