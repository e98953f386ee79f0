package com.smartseller.warranty.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Scanner verdict delivered over HTTP instead of Kafka.
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class ScanResultRequest {

    @NotNull(message = "Verdict is required")
    private Boolean passed;

    @Size(max = 1000)
    private String detail;
}
