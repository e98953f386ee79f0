package com.smartseller.warranty.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO carrying a mandatory free-text reason (revocation, rejection).
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class ReasonRequest {

    @NotBlank(message = "Reason is required")
    @Size(max = 1000)
    private String reason;

    private String requestKey;
}
