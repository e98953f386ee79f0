package com.smartseller.warranty.api.dto;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Cost update on a claim; absent fields stay unchanged.
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class CostUpdateRequest {

    @PositiveOrZero
    private BigDecimal repairCost;

    @PositiveOrZero
    private BigDecimal shippingCost;

    @PositiveOrZero
    private BigDecimal replacementCost;
}
