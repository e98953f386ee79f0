package com.smartseller.warranty.infrastructure.scheduler;

import com.smartseller.warranty.infrastructure.metrics.WarrantyMetricsService;
import com.smartseller.warranty.service.BatchGenerationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for BatchRecoveryScheduler.
 */
@ExtendWith(MockitoExtension.class)
class BatchRecoverySchedulerTest {

    @Mock
    private BatchGenerationService batchGenerationService;

    @Mock
    private WarrantyMetricsService metricsService;

    private BatchRecoveryScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new BatchRecoveryScheduler(batchGenerationService, metricsService);
        ReflectionTestUtils.setField(scheduler, "schedulerEnabled", true);
        ReflectionTestUtils.setField(scheduler, "staleAfterSeconds", 300L);
    }

    @Test
    @DisplayName("resumeStaleBatches - Uses the configured stale threshold")
    void resumeStaleBatches_PassesThreshold() {
        // Arrange
        when(batchGenerationService.resumeStaleBatches(any(Duration.class))).thenReturn(2);

        // Act
        scheduler.resumeStaleBatches();

        // Assert
        verify(batchGenerationService).resumeStaleBatches(Duration.ofMinutes(5));
        verifyNoInteractions(metricsService);
    }

    @Test
    @DisplayName("resumeStaleBatches - Disabled: Should not touch batches")
    void resumeStaleBatches_Disabled() {
        // Arrange
        ReflectionTestUtils.setField(scheduler, "schedulerEnabled", false);

        // Act
        scheduler.resumeStaleBatches();

        // Assert
        verifyNoInteractions(batchGenerationService);
    }

    @Test
    @DisplayName("resumeStaleBatches - Store failure: Should record error and not propagate")
    void resumeStaleBatches_StoreFailure() {
        // Arrange
        when(batchGenerationService.resumeStaleBatches(any(Duration.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        // Act / Assert
        assertDoesNotThrow(() -> scheduler.resumeStaleBatches());
        verify(metricsService).recordError("BATCH_RECOVERY_ERROR", "resumeStaleBatches");
    }
}
