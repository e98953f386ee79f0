package com.smartseller.warranty.api.dto;

import com.smartseller.warranty.domain.model.BarcodeBatch;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for batch summaries, including the derived progress fields.
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class BatchResponse {

    private String batchId;
    private String batchNumber;
    private String productId;
    private String storefrontId;
    private String prefix;
    private String description;
    private Integer requestedQuantity;
    private Integer generatedCount;
    private Integer successfulCount;
    private Integer failedCount;
    private Integer errorCount;
    private Integer collisionCount;
    private Integer retryCount;
    private Integer maxRetries;
    private Integer expiryMonths;
    private String priority;
    private String status;
    private String currentStep;
    private String lastError;
    private int progressPercent;
    private double collisionRate;
    private double successRate;
    private String performanceScore;
    private String createdBy;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private Instant cancelledAt;
    private String cancellationReason;

    // Present on progress reads only
    private Double generationRate;
    private Instant estimatedCompletion;

    /**
     * Create response from BarcodeBatch entity.
     *
     * @param batch BarcodeBatch entity
     * @return BatchResponse
     */
    public static BatchResponse fromEntity(BarcodeBatch batch) {
        BatchResponse response = new BatchResponse();
        response.setBatchId(batch.getBatchId());
        response.setBatchNumber(batch.getBatchNumber());
        response.setProductId(batch.getProductId());
        response.setStorefrontId(batch.getStorefrontId());
        response.setPrefix(batch.getPrefix());
        response.setDescription(batch.getDescription());
        response.setRequestedQuantity(batch.getRequestedQuantity());
        response.setGeneratedCount(batch.getGeneratedCount());
        response.setSuccessfulCount(batch.getSuccessfulCount());
        response.setFailedCount(batch.getFailedCount());
        response.setErrorCount(batch.getErrorCount());
        response.setCollisionCount(batch.getCollisionCount());
        response.setRetryCount(batch.getRetryCount());
        response.setMaxRetries(batch.getMaxRetries());
        response.setExpiryMonths(batch.getExpiryMonths());
        response.setPriority(batch.getPriority().name().toLowerCase());
        response.setStatus(batch.getStatus().name().toLowerCase());
        response.setCurrentStep(batch.getCurrentStep().name().toLowerCase());
        response.setLastError(batch.getLastError());
        response.setProgressPercent(batch.progressPercent());
        response.setCollisionRate(batch.collisionRate());
        response.setSuccessRate(batch.successRate());
        response.setPerformanceScore(batch.performanceScore());
        response.setCreatedBy(batch.getCreatedBy());
        response.setCreatedAt(batch.getCreatedAt());
        response.setStartedAt(batch.getStartedAt());
        response.setCompletedAt(batch.getCompletedAt());
        response.setCancelledAt(batch.getCancelledAt());
        response.setCancellationReason(batch.getCancellationReason());
        return response;
    }
}
