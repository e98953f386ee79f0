package com.smartseller.warranty.infrastructure.catalog;

import com.smartseller.warranty.exception.DependencyFailureException;
import com.smartseller.warranty.infrastructure.cache.RedisCacheService;
import com.smartseller.warranty.repository.CatalogProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Product catalog backed by the replicated catalog_products table, cache-first through Redis.
 *
 * @author Warranty Platform Team
 */
@Component
public class JpaProductCatalog implements ProductCatalog {

    private static final Logger logger = LoggerFactory.getLogger(JpaProductCatalog.class);

    private final CatalogProductRepository catalogProductRepository;
    private final RedisCacheService cacheService;

    public JpaProductCatalog(CatalogProductRepository catalogProductRepository, RedisCacheService cacheService) {
        this.catalogProductRepository = catalogProductRepository;
        this.cacheService = cacheService;
    }

    @Override
    public Optional<ProductSummary> lookupProduct(String productId) {
        Optional<ProductSummary> cached = cacheService.getProduct(productId, ProductSummary.class);
        if (cached.isPresent()) {
            return cached;
        }

        try {
            Optional<ProductSummary> product = catalogProductRepository.findById(productId)
                    .map(ProductSummary::fromEntity);
            product.ifPresent(summary -> cacheService.putProduct(productId, summary));
            return product;
        } catch (DataAccessResourceFailureException e) {
            logger.error("Product read model unavailable for product {}", productId, e);
            throw new DependencyFailureException("product-catalog", "Product lookup unavailable", e);
        }
    }

    @Override
    public Optional<ProductSummary> lookupBySku(String sku) {
        try {
            return catalogProductRepository.findBySku(sku).map(ProductSummary::fromEntity);
        } catch (DataAccessResourceFailureException e) {
            logger.error("Product read model unavailable for SKU {}", sku, e);
            throw new DependencyFailureException("product-catalog", "Product lookup unavailable", e);
        }
    }
}
