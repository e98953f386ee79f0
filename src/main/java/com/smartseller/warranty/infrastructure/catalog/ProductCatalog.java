package com.smartseller.warranty.infrastructure.catalog;

import java.util.Optional;

/**
 * Read-only product lookup capability.
 *
 * @author Warranty Platform Team
 */
public interface ProductCatalog {

    /**
     * @param productId Product reference
     * @return Product summary, empty if the catalog does not know the product
     */
    Optional<ProductSummary> lookupProduct(String productId);

    Optional<ProductSummary> lookupBySku(String sku);
}
