package com.smartseller.warranty.api.dto;

import com.smartseller.warranty.domain.model.Priority;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating a barcode batch.
 * Range checks are repeated in the service; these give early field errors.
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class CreateBatchRequest {

    @NotBlank(message = "Product ID is required")
    private String productId;

    private String storefrontId;

    @NotNull(message = "Quantity is required")
    @Min(value = 1, message = "Quantity must be at least 1")
    @Max(value = 100000, message = "Quantity must be at most 100000")
    private Integer quantity;

    @NotBlank(message = "Prefix is required")
    private String prefix;

    @NotNull(message = "Expiry months is required")
    @Min(value = 1, message = "Expiry months must be at least 1")
    @Max(value = 120, message = "Expiry months must be at most 120")
    private Integer expiryMonths;

    private Priority priority;

    @Min(value = 0, message = "Max retries cannot be negative")
    @Max(value = 10, message = "Max retries must be at most 10")
    private Integer maxRetries;

    @Size(max = 1000)
    private String description;

    @Size(max = 500)
    private String tags;

    @Size(max = 2000)
    private String notes;

    private Boolean notifyOnComplete;
}
