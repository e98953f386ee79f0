package com.smartseller.warranty.api.dto;

import com.smartseller.warranty.domain.model.RepairTicket;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Response DTO for repair tickets.
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class TicketResponse {

    private String ticketId;
    private String ticketNumber;
    private String claimId;
    private String status;
    private String priority;
    private String technicianId;
    private Instant assignedAt;
    private BigDecimal estimatedHours;
    private BigDecimal actualHours;
    private LocalDate estimatedCompletionDate;
    private Instant actualCompletionDate;
    private String description;
    private String requiredParts;
    private String usedParts;
    private String specialInstructions;
    private String repairNotes;
    private String testResults;
    private BigDecimal laborCost;
    private BigDecimal partsCost;
    private BigDecimal totalCost;
    private String qualityCheckStatus;
    private String qualityCheckedBy;
    private Instant qualityCheckedAt;
    private String qualityNotes;
    private boolean customerApprovalRequired;
    private String customerApprovalStatus;
    private Instant customerApprovedAt;
    private String customerApprovalNotes;
    private Instant startedAt;
    private Instant createdAt;

    public static TicketResponse fromEntity(RepairTicket ticket) {
        TicketResponse response = new TicketResponse();
        response.setTicketId(ticket.getTicketId());
        response.setTicketNumber(ticket.getTicketNumber());
        response.setClaimId(ticket.getClaimId());
        response.setStatus(ticket.getStatus().name().toLowerCase());
        response.setPriority(ticket.getPriority().name().toLowerCase());
        response.setTechnicianId(ticket.getTechnicianId());
        response.setAssignedAt(ticket.getAssignedAt());
        response.setEstimatedHours(ticket.getEstimatedHours());
        response.setActualHours(ticket.getActualHours());
        response.setEstimatedCompletionDate(ticket.getEstimatedCompletionDate());
        response.setActualCompletionDate(ticket.getActualCompletionDate());
        response.setDescription(ticket.getDescription());
        response.setRequiredParts(ticket.getRequiredParts());
        response.setUsedParts(ticket.getUsedParts());
        response.setSpecialInstructions(ticket.getSpecialInstructions());
        response.setRepairNotes(ticket.getRepairNotes());
        response.setTestResults(ticket.getTestResults());
        response.setLaborCost(ticket.getLaborCost());
        response.setPartsCost(ticket.getPartsCost());
        response.setTotalCost(ticket.getTotalCost());
        response.setQualityCheckStatus(ticket.getQualityCheckStatus().name().toLowerCase());
        response.setQualityCheckedBy(ticket.getQualityCheckedBy());
        response.setQualityCheckedAt(ticket.getQualityCheckedAt());
        response.setQualityNotes(ticket.getQualityNotes());
        response.setCustomerApprovalRequired(Boolean.TRUE.equals(ticket.getCustomerApprovalRequired()));
        response.setCustomerApprovalStatus(ticket.getCustomerApprovalStatus().name().toLowerCase());
        response.setCustomerApprovedAt(ticket.getCustomerApprovedAt());
        response.setCustomerApprovalNotes(ticket.getCustomerApprovalNotes());
        response.setStartedAt(ticket.getStartedAt());
        response.setCreatedAt(ticket.getCreatedAt());
        return response;
    }
}
