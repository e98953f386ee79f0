package com.smartseller.warranty.api.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Bulk status update over up to 100 claims.
 *
 * @author Warranty Platform Team
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class BulkStatusUpdateRequest extends StatusUpdateRequest {

    @NotEmpty(message = "At least one claim id is required")
    @Size(max = 100, message = "At most 100 claims per bulk update")
    private List<String> claimIds;
}
