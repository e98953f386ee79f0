package com.smartseller.warranty.infrastructure.catalog;

import com.smartseller.warranty.domain.model.CatalogProduct;

import java.math.BigDecimal;

/**
 * Product facts the warranty service reads from the catalog.
 *
 * @author Warranty Platform Team
 */
public class ProductSummary {

    private String productId;
    private String name;
    private String sku;
    private String brand;
    private String category;
    private String description;
    private BigDecimal basePrice;
    private String imageUrl;

    public ProductSummary() {
    }

    public static ProductSummary fromEntity(CatalogProduct product) {
        ProductSummary summary = new ProductSummary();
        summary.setProductId(product.getProductId());
        summary.setName(product.getName());
        summary.setSku(product.getSku());
        summary.setBrand(product.getBrand());
        summary.setCategory(product.getCategory());
        summary.setDescription(product.getDescription());
        summary.setBasePrice(product.getBasePrice());
        summary.setImageUrl(product.getImageUrl());
        return summary;
    }

    public String getProductId() { return productId; }
    public void setProductId(String productId) { this.productId = productId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getSku() { return sku; }
    public void setSku(String sku) { this.sku = sku; }

    public String getBrand() { return brand; }
    public void setBrand(String brand) { this.brand = brand; }

    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public BigDecimal getBasePrice() { return basePrice; }
    public void setBasePrice(BigDecimal basePrice) { this.basePrice = basePrice; }

    public String getImageUrl() { return imageUrl; }
    public void setImageUrl(String imageUrl) { this.imageUrl = imageUrl; }
}
