package com.smartseller.warranty.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Customer rating and feedback on a completed claim.
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class FeedbackRequest {

    @NotNull(message = "Rating is required")
    @Min(1)
    @Max(5)
    private Integer rating;

    @Size(max = 2000)
    private String feedback;
}
