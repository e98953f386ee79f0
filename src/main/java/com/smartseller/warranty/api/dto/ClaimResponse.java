package com.smartseller.warranty.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.smartseller.warranty.domain.model.ClaimAttachment;
import com.smartseller.warranty.domain.model.ClaimAttachment.ScanStatus;
import com.smartseller.warranty.domain.model.WarrantyClaim;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Response DTO for warranty claims. The customer view omits admin and internal notes.
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class ClaimResponse {

    private String claimId;
    private String claimNumber;
    private String barcodeNumber;
    private String customerId;
    private String productId;
    private String storefrontId;
    private String issueCategory;
    private String issueDescription;
    private LocalDate issueDate;
    private String severity;
    private String priority;
    private String status;
    private String previousStatus;
    private List<String> allowedActions;
    private Instant statusUpdatedAt;
    private Instant claimDate;
    private Instant validatedAt;
    private Instant completedAt;
    private LocalDate estimatedCompletionDate;
    private String resolutionType;
    private String resolutionNotes;
    private String replacementProductId;
    private BigDecimal repairCost;
    private BigDecimal shippingCost;
    private BigDecimal replacementCost;
    private BigDecimal totalCost;
    private String customerName;
    private String customerEmail;
    private String customerPhone;
    private String pickupAddress;
    private String customerNotes;
    private String rejectionReason;
    private String assignedTechnicianId;
    private String shippingProvider;
    private String trackingNumber;
    private Instant shippedAt;
    private Instant deliveredAt;
    private Integer customerRating;
    private String customerFeedback;
    private String tags;
    private Instant createdAt;

    // Detail views only; customers see scanned-clean files
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<AttachmentResponse> attachments;

    // Staff view only
    private String adminNotes;
    private String internalNotes;
    private String validatedBy;

    /**
     * @param claim Claim entity
     * @param staffView whether admin and internal notes are included
     */
    public static ClaimResponse fromEntity(WarrantyClaim claim, boolean staffView) {
        ClaimResponse response = new ClaimResponse();
        response.setClaimId(claim.getClaimId());
        response.setClaimNumber(claim.getClaimNumber());
        response.setBarcodeNumber(claim.getBarcodeNumber());
        response.setCustomerId(claim.getCustomerId());
        response.setProductId(claim.getProductId());
        response.setStorefrontId(claim.getStorefrontId());
        response.setIssueCategory(lower(claim.getIssueCategory()));
        response.setIssueDescription(claim.getIssueDescription());
        response.setIssueDate(claim.getIssueDate());
        response.setSeverity(lower(claim.getSeverity()));
        response.setPriority(lower(claim.getPriority()));
        response.setStatus(lower(claim.getStatus()));
        response.setPreviousStatus(lower(claim.getPreviousStatus()));
        response.setAllowedActions(claim.getStatus().allowedActions().stream()
                .map(action -> action.name().toLowerCase())
                .collect(Collectors.toList()));
        response.setStatusUpdatedAt(claim.getStatusUpdatedAt());
        response.setClaimDate(claim.getClaimDate());
        response.setValidatedAt(claim.getValidatedAt());
        response.setCompletedAt(claim.getCompletedAt());
        response.setEstimatedCompletionDate(claim.getEstimatedCompletionDate());
        response.setResolutionType(lower(claim.getResolutionType()));
        response.setResolutionNotes(claim.getResolutionNotes());
        response.setReplacementProductId(claim.getReplacementProductId());
        response.setRepairCost(claim.getRepairCost());
        response.setShippingCost(claim.getShippingCost());
        response.setReplacementCost(claim.getReplacementCost());
        response.setTotalCost(claim.getTotalCost());
        response.setCustomerName(claim.getCustomerName());
        response.setCustomerEmail(claim.getCustomerEmail());
        response.setCustomerPhone(claim.getCustomerPhone());
        response.setPickupAddress(claim.getPickupAddress());
        response.setCustomerNotes(claim.getCustomerNotes());
        response.setRejectionReason(claim.getRejectionReason());
        response.setAssignedTechnicianId(claim.getAssignedTechnicianId());
        response.setShippingProvider(claim.getShippingProvider());
        response.setTrackingNumber(claim.getTrackingNumber());
        response.setShippedAt(claim.getShippedAt());
        response.setDeliveredAt(claim.getDeliveredAt());
        response.setCustomerRating(claim.getCustomerRating());
        response.setCustomerFeedback(claim.getCustomerFeedback());
        response.setTags(claim.getTags());
        response.setCreatedAt(claim.getCreatedAt());
        if (staffView) {
            response.setAdminNotes(claim.getAdminNotes());
            response.setInternalNotes(claim.getInternalNotes());
            response.setValidatedBy(claim.getValidatedBy());
        }
        return response;
    }

    /**
     * Detail view with attachments. Files that have not passed the malware scan are only
     * rendered in the staff view.
     */
    public static ClaimResponse fromEntity(WarrantyClaim claim, List<ClaimAttachment> attachments, boolean staffView) {
        ClaimResponse response = fromEntity(claim, staffView);
        response.setAttachments(attachments.stream()
                .filter(attachment -> staffView || attachment.getScanStatus() == ScanStatus.PASSED)
                .map(AttachmentResponse::fromEntity)
                .collect(Collectors.toList()));
        return response;
    }

    private static String lower(Enum<?> value) {
        return value != null ? value.name().toLowerCase() : null;
    }
}
