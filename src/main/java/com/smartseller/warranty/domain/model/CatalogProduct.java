package com.smartseller.warranty.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Read-only replica of catalog products, maintained by the catalog service.
 * The warranty service never writes this table outside of tests.
 *
 * @author Warranty Platform Team
 */
@Entity
@Table(name = "catalog_products", indexes = {
    @Index(name = "idx_catalog_sku", columnList = "sku", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogProduct {

    @Id
    @Column(name = "product_id", nullable = false, length = 36)
    private String productId;

    @Column(name = "sku", nullable = false, unique = true, length = 100)
    private String sku;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "brand", length = 100)
    private String brand;

    @Column(name = "category", length = 100)
    private String category;

    @Column(name = "description", length = 2000)
    private String description;

    @Column(name = "base_price", precision = 12, scale = 2)
    private BigDecimal basePrice;

    @Column(name = "image_url", length = 1000)
    private String imageUrl;

    @Column(name = "storefront_id", length = 36)
    private String storefrontId;
}
