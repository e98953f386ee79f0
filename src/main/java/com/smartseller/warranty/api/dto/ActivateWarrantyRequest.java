package com.smartseller.warranty.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.PastOrPresent;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Request DTO for activating a warranty barcode.
 * Customers may omit customerId; it defaults to the caller.
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class ActivateWarrantyRequest {

    private String customerId;

    @Email(message = "Customer e-mail is malformed")
    private String customerEmail;

    @Size(max = 255)
    private String retailer;

    @Size(max = 100)
    private String invoiceNumber;

    @Size(max = 100)
    private String serialNumber;

    @PastOrPresent(message = "Purchase date cannot be in the future")
    private LocalDate purchaseDate;

    @PositiveOrZero(message = "Purchase price cannot be negative")
    private BigDecimal purchasePrice;
}
