package com.smartseller.warranty.testutil;

import com.smartseller.warranty.domain.model.CatalogProduct;
import com.smartseller.warranty.domain.model.CustomerProfile;
import com.smartseller.warranty.domain.model.WarrantyBarcode;
import com.smartseller.warranty.domain.model.WarrantyBarcode.BarcodeStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Fixture builders shared by the service and API tests.
 */
public final class WarrantyTestData {

    public static final String PRODUCT_ID = "prod-0001";
    public static final String PRODUCT_SKU = "SKU-PHONE-001";
    public static final String STOREFRONT_ID = "store-001";
    public static final String CUSTOMER_ID = "cust-001";
    public static final String CUSTOMER_EMAIL = "jane@example.com";

    private WarrantyTestData() {
    }

    public static CatalogProduct product() {
        return CatalogProduct.builder()
                .productId(PRODUCT_ID)
                .sku(PRODUCT_SKU)
                .name("Aurora X2 Smartphone")
                .brand("Aurora")
                .category("Phones")
                .description("6.1 inch smartphone")
                .basePrice(new BigDecimal("499.00"))
                .storefrontId(STOREFRONT_ID)
                .build();
    }

    public static CustomerProfile customer() {
        return CustomerProfile.builder()
                .customerId(CUSTOMER_ID)
                .email(CUSTOMER_EMAIL)
                .fullName("Jane Doe")
                .phone("+1-555-0100")
                .address("12 Harbour Street")
                .build();
    }

    /**
     * A freshly issued barcode that nobody has activated.
     */
    public static WarrantyBarcode generatedBarcode(String barcodeNumber) {
        return WarrantyBarcode.builder()
                .barcodeId(UUID.randomUUID().toString())
                .barcodeNumber(barcodeNumber)
                .productId(PRODUCT_ID)
                .storefrontId(STOREFRONT_ID)
                .batchId("seed-batch")
                .status(BarcodeStatus.GENERATED)
                .warrantyPeriodMonths(12)
                .generationAttempt(0)
                .createdBy("seed")
                .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
                .build();
    }

    /**
     * A barcode bound to {@link #CUSTOMER_ID}, activated at the given instant.
     */
    public static WarrantyBarcode activeBarcode(String barcodeNumber, Instant activatedAt, int periodMonths) {
        WarrantyBarcode barcode = generatedBarcode(barcodeNumber);
        barcode.setStatus(BarcodeStatus.ACTIVE);
        barcode.setWarrantyPeriodMonths(periodMonths);
        barcode.setActivatedAt(activatedAt);
        barcode.setExpiryDate(activatedAt.atZone(ZoneOffset.UTC).plusMonths(periodMonths).toInstant());
        barcode.setCustomerId(CUSTOMER_ID);
        barcode.setCustomerEmail(CUSTOMER_EMAIL);
        barcode.setSerialNumber("SN-" + barcodeNumber.substring(barcodeNumber.length() - 4));
        return barcode;
    }

    /**
     * An active barcode whose 12-month term ended a month ago.
     */
    public static WarrantyBarcode expiredBarcode(String barcodeNumber) {
        Instant activatedAt = Instant.now().minus(395, ChronoUnit.DAYS);
        return activeBarcode(barcodeNumber, activatedAt, 12);
    }
}
