package com.smartseller.warranty.api.dto;

import com.smartseller.warranty.domain.model.Priority;
import com.smartseller.warranty.service.RepairTicketService.CreateTicketCommand;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Request DTO for opening a repair ticket on an assigned claim.
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class CreateTicketRequest {

    private Priority priority;

    @DecimalMin(value = "0.1", message = "Estimated hours must be at least 0.1")
    @DecimalMax(value = "1000", message = "Estimated hours must be at most 1000")
    private BigDecimal estimatedHours;

    private LocalDate estimatedCompletionDate;

    @NotBlank(message = "Description is required")
    @Size(min = 10, max = 2000)
    private String description;

    @Size(max = 2000)
    private String requiredParts;

    @Size(max = 2000)
    private String specialInstructions;

    private Boolean customerApprovalRequired;

    public CreateTicketCommand toCommand() {
        return CreateTicketCommand.builder()
                .priority(priority)
                .estimatedHours(estimatedHours)
                .estimatedCompletionDate(estimatedCompletionDate)
                .description(description)
                .requiredParts(requiredParts)
                .specialInstructions(specialInstructions)
                .customerApprovalRequired(customerApprovalRequired)
                .build();
    }
}
