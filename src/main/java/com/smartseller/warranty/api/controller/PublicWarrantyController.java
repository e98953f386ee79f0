package com.smartseller.warranty.api.controller;

import com.smartseller.warranty.api.dto.CoverageCheckRequest;
import com.smartseller.warranty.service.PublicWarrantyService;
import com.smartseller.warranty.service.PublicWarrantyService.CoverageCheckResult;
import com.smartseller.warranty.service.PublicWarrantyService.LookupResult;
import com.smartseller.warranty.service.PublicWarrantyService.ValidationResult;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * Unauthenticated warranty checks for customers and retail partners.
 * Unknown and revoked barcodes look the same to callers.
 *
 * @author Warranty Platform Team
 */
@RestController
@RequestMapping("/api/v1/public/warranty")
public class PublicWarrantyController {

    private static final Logger logger = LoggerFactory.getLogger(PublicWarrantyController.class);

    private final PublicWarrantyService publicWarrantyService;

    public PublicWarrantyController(PublicWarrantyService publicWarrantyService) {
        this.publicWarrantyService = publicWarrantyService;
    }

    /**
     * Validate a barcode, optionally checking it belongs to a SKU.
     * Always 200; validity is in the body.
     */
    @GetMapping("/validate")
    public ResponseEntity<ValidationResult> validate(
            @RequestParam String barcode,
            @RequestParam(required = false) String sku
    ) {
        logger.debug("Public validation for barcode {}", barcode);
        return ResponseEntity.ok(publicWarrantyService.validate(barcode, sku));
    }

    /**
     * Find warranties by product facts when the barcode is lost.
     */
    @GetMapping("/lookup")
    public ResponseEntity<LookupResult> lookup(
            @RequestParam String sku,
            @RequestParam(required = false) String serialNumber,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate purchaseDate,
            @RequestParam(required = false) String email
    ) {
        return ResponseEntity.ok(publicWarrantyService.lookupByProduct(sku, serialNumber, purchaseDate, email));
    }

    @PostMapping("/coverage")
    public ResponseEntity<CoverageCheckResult> checkCoverage(@Valid @RequestBody CoverageCheckRequest request) {
        return ResponseEntity.ok(publicWarrantyService.checkCoverage(request.getBarcode(), request.getIssueType(),
                request.getDescription()));
    }
}
