package com.smartseller.warranty.infrastructure.scheduler;

import com.smartseller.warranty.infrastructure.metrics.WarrantyMetricsService;
import com.smartseller.warranty.service.BatchGenerationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Scheduled job that resumes abandoned batch generation.
 *
 * A batch stays IN_PROGRESS in the database when the instance generating it dies. This job finds
 * IN_PROGRESS batches whose updated_at is older than the stale threshold and that are not running
 * on this instance, and resubmits them. Generation restarts from the resolved-slot count; strings
 * already persisted are caught by collision detection.
 *
 * @author Warranty Platform Team
 */
@Service
public class BatchRecoveryScheduler {

    private static final Logger logger = LoggerFactory.getLogger(BatchRecoveryScheduler.class);

    private final BatchGenerationService batchGenerationService;
    private final WarrantyMetricsService metricsService;

    @Value("${warranty.batch.recovery.enabled:true}")
    private boolean schedulerEnabled;

    @Value("${warranty.batch.recovery.stale-after-seconds:300}")
    private long staleAfterSeconds;

    public BatchRecoveryScheduler(BatchGenerationService batchGenerationService, WarrantyMetricsService metricsService) {
        this.batchGenerationService = batchGenerationService;
        this.metricsService = metricsService;
    }

    @Scheduled(fixedDelayString = "${warranty.batch.recovery.interval-ms:60000}")
    public void resumeStaleBatches() {
        if (!schedulerEnabled) {
            logger.debug("Batch recovery scheduler is disabled");
            return;
        }
        try {
            int resumed = batchGenerationService.resumeStaleBatches(Duration.ofSeconds(staleAfterSeconds));
            if (resumed > 0) {
                logger.info("Resumed {} stale batches", resumed);
            }
        } catch (RuntimeException e) {
            logger.error("Error in batch recovery scheduler", e);
            metricsService.recordError("BATCH_RECOVERY_ERROR", "resumeStaleBatches");
        }
    }
}
