package com.smartseller.warranty.service;

import com.smartseller.warranty.domain.model.WarrantyBarcode;

import java.time.Instant;

/**
 * Decides what a warranty covers and whether a reported issue falls under it.
 *
 * @author Warranty Platform Team
 */
public interface CoveragePolicy {

    CoverageTerms termsFor(WarrantyBarcode barcode);

    /**
     * @param issueType Free-form issue type, e.g. "hardware_failure" or "water_damage"
     * @param now Evaluation instant; an expired or inactive warranty covers nothing
     */
    CoverageDecision evaluate(WarrantyBarcode barcode, String issueType, Instant now);
}
