package com.smartseller.warranty.repository;

import com.smartseller.warranty.domain.model.CatalogProduct;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for the product read model.
 *
 * @author Warranty Platform Team
 */
@Repository
public interface CatalogProductRepository extends JpaRepository<CatalogProduct, String> {

    Optional<CatalogProduct> findBySku(String sku);
}
