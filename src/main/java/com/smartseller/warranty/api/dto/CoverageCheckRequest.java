package com.smartseller.warranty.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Public coverage check for a reported issue.
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class CoverageCheckRequest {

    @NotBlank(message = "Barcode is required")
    private String barcode;

    @NotBlank(message = "Issue type is required")
    @Size(max = 100)
    private String issueType;

    @Size(max = 2000)
    private String description;
}
