package com.smartseller.warranty.service;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of checking one reported issue against a warranty's coverage.
 *
 * @author Warranty Platform Team
 */
@Value
@Builder
public class CoverageDecision {

    boolean covered;
    String coverageType;
    BigDecimal estimatedCost;
    String message;
    List<String> recommendations;
    List<String> nextSteps;
}
