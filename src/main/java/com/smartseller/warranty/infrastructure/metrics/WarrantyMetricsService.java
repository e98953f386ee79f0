package com.smartseller.warranty.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Metrics service for the warranty subsystem.
 * Publishes custom metrics through Micrometer (CloudWatch in production).
 *
 * Key Metrics:
 * - Batch generation throughput, collisions and retries
 * - Activation outcomes
 * - Claim submissions and transitions
 * - Public validation outcomes and cache hit/miss rates
 * - Error rates
 *
 * @author Warranty Platform Team
 */
@Service
public class WarrantyMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(WarrantyMetricsService.class);

    private final MeterRegistry meterRegistry;

    // Metric name prefixes
    private static final String METRIC_PREFIX = "warranty.";
    private static final String BATCH_PREFIX = METRIC_PREFIX + "batch.";
    private static final String BARCODE_PREFIX = METRIC_PREFIX + "barcode.";
    private static final String CLAIM_PREFIX = METRIC_PREFIX + "claim.";
    private static final String PUBLIC_PREFIX = METRIC_PREFIX + "public.";
    private static final String CACHE_PREFIX = METRIC_PREFIX + "cache.";

    public WarrantyMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record barcodes committed by one chunk.
     *
     * @param count Number of barcodes persisted
     */
    public void recordBarcodesCommitted(int count) {
        Counter.builder(BATCH_PREFIX + "barcodes.committed")
                .description("Barcodes persisted by batch generation")
                .register(meterRegistry)
                .increment(count);
    }

    /**
     * Record a collision detected during generation.
     *
     * @param collisionType DUPLICATE_IN_BATCH or DUPLICATE_IN_STORE
     */
    public void recordCollision(String collisionType) {
        Counter.builder(BATCH_PREFIX + "collision")
                .tag("type", collisionType)
                .description("Barcode collisions detected")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a slot that exhausted its regeneration budget.
     */
    public void recordSlotFailure() {
        Counter.builder(BATCH_PREFIX + "slot.failed")
                .description("Batch slots dropped after exhausting retries")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a transient chunk-commit failure that will be retried.
     */
    public void recordChunkRetry() {
        Counter.builder(BATCH_PREFIX + "chunk.retry")
                .description("Chunk commits retried after transient store failures")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record chunk commit latency.
     *
     * @param durationMs Duration in milliseconds
     */
    public void recordChunkCommitLatency(long durationMs) {
        Timer.builder(BATCH_PREFIX + "chunk.latency")
                .description("Chunk commit latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record a batch reaching a terminal state.
     *
     * @param status COMPLETED, FAILED or CANCELLED
     */
    public void recordBatchFinished(String status) {
        Counter.builder(BATCH_PREFIX + "finished")
                .tag("status", status)
                .description("Batches reaching a terminal state")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded batch finished with status: {}", status);
    }

    /**
     * Record an activation attempt outcome.
     *
     * @param outcome "success", "conflict" or "rejected"
     */
    public void recordActivation(String outcome) {
        Counter.builder(BARCODE_PREFIX + "activation")
                .tag("outcome", outcome)
                .description("Warranty activation attempts")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a submitted claim.
     *
     * @param issueCategory Issue category of the claim
     */
    public void recordClaimSubmitted(String issueCategory) {
        Counter.builder(CLAIM_PREFIX + "submitted")
                .tag("issue_category", issueCategory)
                .description("Warranty claims submitted")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a committed claim transition.
     *
     * @param action Claim action applied
     */
    public void recordClaimTransition(String action) {
        Counter.builder(CLAIM_PREFIX + "transition")
                .tag("action", action)
                .description("Claim transitions applied")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a transition rejected by the state machine.
     *
     * @param action Claim action attempted
     */
    public void recordClaimTransitionRejected(String action) {
        Counter.builder(CLAIM_PREFIX + "transition.rejected")
                .tag("action", action)
                .description("Claim transitions rejected")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded rejected claim transition: {}", action);
    }

    /**
     * Record a public validation outcome.
     *
     * @param status Public status returned (e.g. "active", "not_found")
     */
    public void recordPublicValidation(String status) {
        Counter.builder(PUBLIC_PREFIX + "validation")
                .tag("status", status)
                .description("Public barcode validations")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record public validation latency.
     *
     * @param durationMs Duration in milliseconds
     */
    public void recordPublicValidationLatency(long durationMs) {
        Timer.builder(PUBLIC_PREFIX + "validation.latency")
                .description("Public validation latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record cache hit.
     *
     * @param cacheType Type of cache (e.g., "validation", "product")
     */
    public void recordCacheHit(String cacheType) {
        Counter.builder(CACHE_PREFIX + "hit")
                .tag("cache_type", cacheType)
                .description("Cache hits")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record cache miss.
     *
     * @param cacheType Type of cache
     */
    public void recordCacheMiss(String cacheType) {
        Counter.builder(CACHE_PREFIX + "miss")
                .tag("cache_type", cacheType)
                .description("Cache misses")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record an unexpected error.
     *
     * @param errorType Error type
     * @param operation Operation in which it occurred
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "error")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("Application errors")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded error: {} in operation: {}", errorType, operation);
    }
}
