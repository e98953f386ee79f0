package com.smartseller.warranty.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Note or information request on a claim. visibleToCustomer is ignored for customers.
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class NoteRequest {

    @NotBlank(message = "Message is required")
    @Size(max = 2000)
    private String message;

    private boolean visibleToCustomer;
}
