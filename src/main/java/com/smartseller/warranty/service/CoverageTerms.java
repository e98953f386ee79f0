package com.smartseller.warranty.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * What a warranty covers, as shown to the public.
 *
 * @author Warranty Platform Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoverageTerms {

    private String coverageType;
    private List<String> coveredComponents;
    private List<String> excludedComponents;
    private boolean repairCoverage;
    private boolean replacementCoverage;
    private boolean laborCoverage;
    private boolean partsCoverage;
    private BigDecimal maxClaimAmount;
    private List<String> terms;
}
