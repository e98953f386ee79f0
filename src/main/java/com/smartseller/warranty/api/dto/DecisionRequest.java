package com.smartseller.warranty.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Approve or reject, with optional notes (quality check, customer approval).
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class DecisionRequest {

    @NotNull(message = "Decision is required")
    private Boolean approved;

    @Size(max = 2000)
    private String notes;
}
