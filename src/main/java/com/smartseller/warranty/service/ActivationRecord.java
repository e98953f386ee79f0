package com.smartseller.warranty.service;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Values written to a barcode when it is activated.
 *
 * @author Warranty Platform Team
 */
@Value
@Builder
public class ActivationRecord {
    Instant activatedAt;
    int periodMonths;
    String customerId;
    String customerEmail;
    LocalDate purchaseDate;
    String retailer;
    String invoiceNumber;
    String serialNumber;
    BigDecimal purchasePrice;
}
