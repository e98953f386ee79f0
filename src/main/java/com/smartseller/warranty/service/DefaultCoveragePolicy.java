package com.smartseller.warranty.service;

import com.smartseller.warranty.domain.model.WarrantyBarcode;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Single comprehensive plan applied to every product: hardware, software, battery and screen
 * are covered, water damage and physical abuse are not.
 *
 * @author Warranty Platform Team
 */
@Component
public class DefaultCoveragePolicy implements CoveragePolicy {

    static final List<String> COVERED_COMPONENTS = List.of("hardware", "software", "battery", "screen");
    static final List<String> EXCLUDED_ISSUES = List.of("water_damage", "physical_abuse");
    static final BigDecimal OUT_OF_COVERAGE_ESTIMATE = new BigDecimal("150.00");

    @Override
    public CoverageTerms termsFor(WarrantyBarcode barcode) {
        return CoverageTerms.builder()
                .coverageType("comprehensive")
                .coveredComponents(COVERED_COMPONENTS)
                .excludedComponents(EXCLUDED_ISSUES)
                .repairCoverage(true)
                .replacementCoverage(true)
                .laborCoverage(true)
                .partsCoverage(true)
                .terms(List.of("Must provide proof of purchase", "Damage must be reported within 30 days"))
                .build();
    }

    @Override
    public CoverageDecision evaluate(WarrantyBarcode barcode, String issueType, Instant now) {
        String normalized = issueType == null ? "" : issueType.trim().toLowerCase(Locale.ROOT);
        if (barcode.canClaimAt(now) && !EXCLUDED_ISSUES.contains(normalized)) {
            return CoverageDecision.builder()
                    .covered(true)
                    .coverageType("full")
                    .estimatedCost(BigDecimal.ZERO.setScale(2))
                    .message("This issue is fully covered under your warranty")
                    .recommendations(List.of("Contact authorized service center", "Backup your data before repair"))
                    .nextSteps(List.of("Submit warranty claim", "Schedule repair appointment"))
                    .build();
        }
        String message = barcode.canClaimAt(now)
                ? "This issue is not covered under your warranty"
                : "Your warranty is not active for this product";
        return CoverageDecision.builder()
                .covered(false)
                .coverageType("not_covered")
                .estimatedCost(OUT_OF_COVERAGE_ESTIMATE)
                .message(message)
                .recommendations(List.of("Consider extended warranty for future coverage",
                        "Review warranty terms and conditions"))
                .nextSteps(List.of("Contact customer service for paid repair options",
                        "Get quote from authorized service center"))
                .build();
    }
}
