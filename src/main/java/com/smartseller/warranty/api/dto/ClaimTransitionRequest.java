package com.smartseller.warranty.api.dto;

import com.smartseller.warranty.domain.model.Priority;
import com.smartseller.warranty.domain.model.ResolutionType;
import com.smartseller.warranty.service.WarrantyClaimService.ClaimTransitionCommand;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Request DTO shared by all claim transitions. Each action reads the fields it needs;
 * requestKey makes the call idempotent.
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class ClaimTransitionRequest {

    @Size(max = 2000)
    private String notes;

    @Size(max = 1000)
    private String reason;

    @Size(max = 2000)
    private String repairNotes;

    private String technicianId;

    private LocalDate estimatedCompletionDate;

    private Priority priority;

    private String replacementProductId;

    @Size(max = 100)
    private String shippingProvider;

    @Size(max = 100)
    private String trackingNumber;

    private ResolutionType resolutionType;

    @Size(max = 2000)
    private String resolutionNotes;

    private boolean resolveToCompleted;

    @Size(max = 128)
    private String requestKey;

    public ClaimTransitionCommand toCommand() {
        return ClaimTransitionCommand.builder()
                .notes(notes)
                .reason(reason)
                .repairNotes(repairNotes)
                .technicianId(technicianId)
                .estimatedCompletionDate(estimatedCompletionDate)
                .priority(priority)
                .replacementProductId(replacementProductId)
                .shippingProvider(shippingProvider)
                .trackingNumber(trackingNumber)
                .resolutionType(resolutionType)
                .resolutionNotes(resolutionNotes)
                .resolveToCompleted(resolveToCompleted)
                .requestKey(requestKey)
                .build();
    }

    /**
     * Body-less transitions.
     */
    public static ClaimTransitionCommand toCommand(ClaimTransitionRequest request) {
        return request != null ? request.toCommand() : ClaimTransitionCommand.empty();
    }
}
