package com.smartseller.warranty.api.dto;

import com.smartseller.warranty.domain.model.ClaimAction;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Generic status update: the action plus its transition data.
 *
 * @author Warranty Platform Team
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class StatusUpdateRequest extends ClaimTransitionRequest {

    @NotNull(message = "Action is required")
    private ClaimAction action;
}
