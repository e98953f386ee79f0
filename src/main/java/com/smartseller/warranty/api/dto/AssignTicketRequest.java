package com.smartseller.warranty.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Request DTO for assigning or reassigning a ticket's technician.
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class AssignTicketRequest {

    @NotBlank(message = "Technician ID is required")
    private String technicianId;

    private LocalDate estimatedCompletionDate;
}
