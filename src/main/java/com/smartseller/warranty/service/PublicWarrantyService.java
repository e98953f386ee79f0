package com.smartseller.warranty.service;

import com.smartseller.warranty.domain.model.WarrantyBarcode;
import com.smartseller.warranty.domain.model.WarrantyBarcode.BarcodeStatus;
import com.smartseller.warranty.exception.DependencyFailureException;
import com.smartseller.warranty.exception.InvalidArgumentException;
import com.smartseller.warranty.exception.ResourceNotFoundException;
import com.smartseller.warranty.infrastructure.cache.RedisCacheService;
import com.smartseller.warranty.infrastructure.catalog.ProductCatalog;
import com.smartseller.warranty.infrastructure.catalog.ProductSummary;
import com.smartseller.warranty.infrastructure.metrics.WarrantyMetricsService;
import com.smartseller.warranty.repository.WarrantyBarcodeRepository;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Unauthenticated warranty lookups for shoppers and retailers.
 *
 * Nothing returned here identifies a customer. Unknown, revoked and malformed barcodes are
 * reported identically as not_found so the public cannot probe barcode history.
 *
 * @author Warranty Platform Team
 */
@Service
public class PublicWarrantyService {

    private static final Logger logger = LoggerFactory.getLogger(PublicWarrantyService.class);

    static final String STATUS_NOT_FOUND = "not_found";
    static final String STATUS_NOT_ACTIVATED = "not_activated";
    static final String NOT_FOUND_MESSAGE = "No warranty found for the provided barcode";

    private final WarrantyRecordStore recordStore;
    private final WarrantyBarcodeRepository barcodeRepository;
    private final ProductCatalog productCatalog;
    private final CoveragePolicy coveragePolicy;
    private final RedisCacheService cacheService;
    private final WarrantyMetricsService metricsService;
    private final Clock clock;

    public PublicWarrantyService(
            WarrantyRecordStore recordStore,
            WarrantyBarcodeRepository barcodeRepository,
            ProductCatalog productCatalog,
            CoveragePolicy coveragePolicy,
            RedisCacheService cacheService,
            WarrantyMetricsService metricsService,
            Clock clock
    ) {
        this.recordStore = recordStore;
        this.barcodeRepository = barcodeRepository;
        this.productCatalog = productCatalog;
        this.coveragePolicy = coveragePolicy;
        this.cacheService = cacheService;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Validate a barcode, read-through the Redis cache.
     * Never throws for an unknown barcode; the result carries valid=false instead.
     *
     * @param barcodeNumber Barcode string as printed
     * @param sku Optional SKU the barcode must belong to
     */
    @Transactional(readOnly = true)
    public ValidationResult validate(String barcodeNumber, String sku) {
        long startTime = System.currentTimeMillis();
        Instant now = clock.instant();
        String normalized = barcodeNumber == null ? "" : barcodeNumber.trim().toUpperCase(Locale.ROOT);

        if (!BarcodeFormat.isValid(normalized)) {
            return finish(notFound(normalized, now), startTime);
        }

        Optional<ValidationResult> cached = cacheService.getValidation(normalized, sku, ValidationResult.class)
                .filter(hit -> isCurrent(hit, now));
        if (cached.isPresent()) {
            metricsService.recordCacheHit("validation");
            return finish(cached.get(), startTime);
        }
        metricsService.recordCacheMiss("validation");

        ValidationResult result = evaluate(normalized, sku, now);
        if (!STATUS_NOT_FOUND.equals(result.getStatus())) {
            cacheService.putValidation(normalized, sku, result);
        }
        return finish(result, startTime);
    }

    /**
     * Activated warranties of a product, optionally narrowed by serial number, purchase date
     * and the e-mail captured at activation.
     */
    @Transactional(readOnly = true)
    public LookupResult lookupByProduct(String sku, String serialNumber, LocalDate purchaseDate, String customerEmail) {
        if (sku == null || sku.isBlank()) {
            throw new InvalidArgumentException("sku", "Product SKU is required", sku);
        }
        Instant now = clock.instant();
        Optional<ProductSummary> product = productCatalog.lookupBySku(sku.trim());
        if (product.isEmpty()) {
            return LookupResult.builder()
                    .found(false)
                    .warranties(List.of())
                    .message("No warranties found for this product")
                    .searchTime(now)
                    .build();
        }

        List<WarrantyInfo> warranties = barcodeRepository.findForProductLookup(product.get().getProductId(),
                        BarcodeStatus.GENERATED, blankToNull(serialNumber), purchaseDate, blankToNull(customerEmail))
                .stream()
                .filter(barcode -> barcode.getStatus() != BarcodeStatus.REVOKED)
                .map(barcode -> toWarrantyInfo(barcode, now))
                .collect(Collectors.toList());

        return LookupResult.builder()
                .found(!warranties.isEmpty())
                .warranties(warranties)
                .product(toProductInfo(product.get()))
                .message(warranties.isEmpty()
                        ? "No warranties found for this product"
                        : "Found " + warranties.size() + " warranties for this product")
                .searchTime(now)
                .build();
    }

    /**
     * Whether the reported issue would be covered.
     *
     * @throws ResourceNotFoundException for unknown, revoked, malformed or not yet activated barcodes
     */
    @Transactional(readOnly = true)
    public CoverageCheckResult checkCoverage(String barcodeNumber, String issueType, String description) {
        if (issueType == null || issueType.isBlank()) {
            throw new InvalidArgumentException("issueType", "Issue type is required", issueType);
        }
        String normalized = barcodeNumber == null ? "" : barcodeNumber.trim().toUpperCase(Locale.ROOT);
        WarrantyBarcode barcode = Optional.of(normalized)
                .filter(BarcodeFormat::isValid)
                .flatMap(recordStore::getByString)
                .filter(found -> found.getStatus() != BarcodeStatus.REVOKED && found.getStatus() != BarcodeStatus.GENERATED)
                .orElseThrow(() -> new ResourceNotFoundException("WarrantyBarcode", normalized, NOT_FOUND_MESSAGE));

        Instant now = clock.instant();
        CoverageDecision decision = coveragePolicy.evaluate(barcode, issueType, now);
        logger.debug("Coverage check for {} issue {} ({}): covered={}",
                normalized, issueType, description == null ? "no description" : description.length() + " chars",
                decision.isCovered());

        return CoverageCheckResult.builder()
                .covered(decision.isCovered())
                .barcodeNumber(normalized)
                .issueType(issueType)
                .coverageType(decision.getCoverageType())
                .estimatedCost(decision.getEstimatedCost())
                .coverage(coveragePolicy.termsFor(barcode))
                .recommendations(decision.getRecommendations())
                .nextSteps(decision.getNextSteps())
                .message(decision.getMessage())
                .checkedAt(now)
                .build();
    }

    private ValidationResult evaluate(String barcodeNumber, String sku, Instant now) {
        Optional<WarrantyBarcode> found = recordStore.getByString(barcodeNumber);
        if (found.isEmpty() || found.get().getStatus() == BarcodeStatus.REVOKED) {
            return notFound(barcodeNumber, now);
        }
        WarrantyBarcode barcode = found.get();
        if (barcode.getStatus() == BarcodeStatus.GENERATED) {
            return ValidationResult.builder()
                    .valid(false)
                    .barcodeNumber(barcodeNumber)
                    .status(STATUS_NOT_ACTIVATED)
                    .message("Warranty has not been activated")
                    .validationTime(now)
                    .build();
        }

        ProductSummary product = lookupProduct(barcode.getProductId());
        if (sku != null && !sku.isBlank() && (product == null || !sku.trim().equalsIgnoreCase(product.getSku()))) {
            return notFound(barcodeNumber, now);
        }

        BarcodeStatus effective = barcode.effectiveStatusAt(now);
        String message;
        switch (effective) {
            case ACTIVE:
                message = "Warranty is valid and active";
                break;
            case EXPIRED:
                message = "Warranty has expired";
                break;
            case CLAIMED:
                message = "Warranty has already been claimed";
                break;
            default:
                message = "Warranty barcode is inactive";
        }

        return ValidationResult.builder()
                .valid(barcode.canClaimAt(now))
                .barcodeNumber(barcodeNumber)
                .status(effective.name().toLowerCase(Locale.ROOT))
                .message(message)
                .product(product == null ? null : toProductInfo(product))
                .warranty(toWarrantyInfo(barcode, now))
                .coverage(coveragePolicy.termsFor(barcode))
                .validationTime(now)
                .build();
    }

    /**
     * A cached response is stale once the expiry instant it reports as still ahead has passed.
     */
    private static boolean isCurrent(ValidationResult cached, Instant now) {
        WarrantyInfo warranty = cached.getWarranty();
        if (warranty == null || warranty.getExpiryDate() == null || warranty.isExpired()) {
            return true;
        }
        return warranty.getExpiryDate().isAfter(now);
    }

    private ProductSummary lookupProduct(String productId) {
        try {
            return productCatalog.lookupProduct(productId).orElse(null);
        } catch (DependencyFailureException e) {
            logger.warn("Product catalog unavailable, validating without product summary for {}", productId);
            return null;
        }
    }

    private ValidationResult finish(ValidationResult result, long startTime) {
        metricsService.recordPublicValidation(result.getStatus());
        metricsService.recordPublicValidationLatency(System.currentTimeMillis() - startTime);
        return result;
    }

    private static ValidationResult notFound(String barcodeNumber, Instant now) {
        return ValidationResult.builder()
                .valid(false)
                .barcodeNumber(barcodeNumber)
                .status(STATUS_NOT_FOUND)
                .message(NOT_FOUND_MESSAGE)
                .validationTime(now)
                .build();
    }

    private static WarrantyInfo toWarrantyInfo(WarrantyBarcode barcode, Instant now) {
        return WarrantyInfo.builder()
                .barcodeNumber(barcode.getBarcodeNumber())
                .status(barcode.effectiveStatusAt(now).name().toLowerCase(Locale.ROOT))
                .active(barcode.getStatus() == BarcodeStatus.ACTIVE)
                .activatedAt(barcode.getActivatedAt())
                .expiryDate(barcode.getExpiryDate())
                .daysRemaining(barcode.daysRemainingAt(now))
                .warrantyPeriod(barcode.warrantyPeriodLabel())
                .expired(barcode.isExpiredAt(now))
                .canClaim(barcode.canClaimAt(now))
                .build();
    }

    private static ProductInfo toProductInfo(ProductSummary product) {
        return ProductInfo.builder()
                .productId(product.getProductId())
                .sku(product.getSku())
                .name(product.getName())
                .brand(product.getBrand())
                .category(product.getCategory())
                .description(product.getDescription())
                .imageUrl(product.getImageUrl())
                .build();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    /**
     * Public validation response. Cached as JSON, so it stays a plain bean.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ValidationResult {
        private boolean valid;
        private String barcodeNumber;
        private String status;
        private String message;
        private ProductInfo product;
        private WarrantyInfo warranty;
        private CoverageTerms coverage;
        private Instant validationTime;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProductInfo {
        private String productId;
        private String sku;
        private String name;
        private String brand;
        private String category;
        private String description;
        private String imageUrl;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WarrantyInfo {
        private String barcodeNumber;
        private String status;
        private boolean active;
        private Instant activatedAt;
        private Instant expiryDate;
        private long daysRemaining;
        private String warrantyPeriod;
        private boolean expired;
        private boolean canClaim;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LookupResult {
        private boolean found;
        private List<WarrantyInfo> warranties;
        private ProductInfo product;
        private String message;
        private Instant searchTime;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CoverageCheckResult {
        private boolean covered;
        private String barcodeNumber;
        private String issueType;
        private String coverageType;
        private BigDecimal estimatedCost;
        private CoverageTerms coverage;
        private List<String> recommendations;
        private List<String> nextSteps;
        private String message;
        private Instant checkedAt;
    }
}
