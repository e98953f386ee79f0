package com.smartseller.warranty.api.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for cancelling a batch.
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class CancelBatchRequest {

    @Size(max = 1000)
    private String reason;

    private boolean force;
}
