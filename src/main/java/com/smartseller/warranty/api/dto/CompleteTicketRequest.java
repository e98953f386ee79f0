package com.smartseller.warranty.api.dto;

import com.smartseller.warranty.service.RepairTicketService.CompleteTicketCommand;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Request DTO for completing a repair round.
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class CompleteTicketRequest {

    @PositiveOrZero
    private BigDecimal actualHours;

    @Size(max = 2000)
    private String usedParts;

    @Size(max = 2000)
    private String repairNotes;

    @Size(max = 2000)
    private String testResults;

    @NotNull(message = "Labor cost is required")
    @PositiveOrZero
    private BigDecimal laborCost;

    @NotNull(message = "Parts cost is required")
    @PositiveOrZero
    private BigDecimal partsCost;

    public CompleteTicketCommand toCommand() {
        return CompleteTicketCommand.builder()
                .actualHours(actualHours)
                .usedParts(usedParts)
                .repairNotes(repairNotes)
                .testResults(testResults)
                .laborCost(laborCost)
                .partsCost(partsCost)
                .build();
    }
}
