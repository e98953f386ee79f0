package com.smartseller.warranty.service;

import com.smartseller.warranty.domain.model.BarcodeBatch;
import com.smartseller.warranty.domain.model.BarcodeBatch.BatchStatus;
import com.smartseller.warranty.domain.model.BarcodeBatch.BatchStep;
import com.smartseller.warranty.domain.model.CollisionRecord;
import com.smartseller.warranty.domain.model.CollisionRecord.CollisionType;
import com.smartseller.warranty.domain.model.CollisionRecord.Resolution;
import com.smartseller.warranty.infrastructure.cache.RedisCacheService;
import com.smartseller.warranty.infrastructure.lock.RedisDistributedLock;
import com.smartseller.warranty.infrastructure.messaging.KafkaProducerService;
import com.smartseller.warranty.repository.BarcodeBatchRepository;
import com.smartseller.warranty.repository.CatalogProductRepository;
import com.smartseller.warranty.repository.CollisionRecordRepository;
import com.smartseller.warranty.repository.WarrantyBarcodeRepository;
import com.smartseller.warranty.security.Actor;
import com.smartseller.warranty.security.Role;
import com.smartseller.warranty.service.BatchGenerationService.CreateBatchCommand;
import com.smartseller.warranty.testutil.WarrantyTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Batch issuance with a scripted candidate generator, to force store and in-batch collisions.
 */
@SpringBootTest
@DisplayName("Batch Collision Integration Tests")
class BatchCollisionIntegrationTest {

    private static final Actor ADMIN = Actor.of("admin-1", Role.ADMIN);
    private static final String SEEDED = "WB-2024-COLLIDE01";
    private static final int MAX_RETRIES = 3;

    private final EntropyBarcodeGenerator realGenerator = new EntropyBarcodeGenerator();

    @Autowired
    private BatchGenerationService batchService;

    @Autowired
    private WarrantyRecordStore recordStore;

    @Autowired
    private BarcodeBatchRepository batchRepository;

    @Autowired
    private WarrantyBarcodeRepository barcodeRepository;

    @Autowired
    private CollisionRecordRepository collisionRepository;

    @Autowired
    private CatalogProductRepository productRepository;

    @MockBean
    private BarcodeGenerator generator;

    @MockBean
    private KafkaProducerService kafkaProducerService;

    @MockBean
    private RedisCacheService redisCacheService;

    @MockBean
    private RedisDistributedLock distributedLock;

    @BeforeEach
    void setUp() {
        collisionRepository.deleteAll();
        barcodeRepository.deleteAll();
        batchRepository.deleteAll();
        productRepository.deleteAll();
        productRepository.save(WarrantyTestData.product());

        when(distributedLock.acquireLockWithRetry(anyString(), any(), any(), any())).thenReturn("token");
        when(distributedLock.releaseLock(anyString(), anyString())).thenReturn(true);
    }

    private BarcodeBatch runBatch(int quantity) {
        BarcodeBatch created = batchService.createBatch(CreateBatchCommand.builder()
                .productId(WarrantyTestData.PRODUCT_ID)
                .storefrontId(WarrantyTestData.STOREFRONT_ID)
                .quantity(quantity)
                .prefix("WB")
                .expiryMonths(24)
                .maxRetries(MAX_RETRIES)
                .build(), ADMIN);
        batchService.startBatch(created.getBatchId(), ADMIN);
        await().atMost(Duration.ofSeconds(30))
                .pollInterval(Duration.ofMillis(50))
                .until(() -> batchRepository.findById(created.getBatchId())
                        .map(b -> b.getCurrentStep() == BatchStep.DONE).orElse(false));
        return batchRepository.findById(created.getBatchId()).orElseThrow();
    }

    @Test
    @DisplayName("Store collision on slot 7 is regenerated and the batch still completes")
    void storeCollision_Regenerated() {
        // Given
        recordStore.createBarcode(WarrantyTestData.generatedBarcode(SEEDED));
        long slotSevenFirstCounter = BarcodeFormat.counterFor(7, 0, MAX_RETRIES);
        when(generator.generate(anyString(), anyInt(), anyLong(), anyLong())).thenAnswer(invocation -> {
            long counter = invocation.getArgument(3);
            if (counter == slotSevenFirstCounter) {
                return SEEDED;
            }
            return realGenerator.generate(invocation.getArgument(0), invocation.getArgument(1),
                    invocation.getArgument(2), counter);
        });

        // When
        BarcodeBatch finished = runBatch(100);

        // Then
        assertThat(finished.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(finished.getSuccessfulCount()).isEqualTo(100);
        assertThat(finished.getCollisionCount()).isGreaterThanOrEqualTo(1);

        List<CollisionRecord> slotSeven = collisionRepository.findByBatchIdAndSlotIndex(finished.getBatchId(), 7);
        assertThat(slotSeven).hasSize(1);
        CollisionRecord record = slotSeven.get(0);
        assertThat(record.getCandidateBarcode()).isEqualTo(SEEDED);
        assertThat(record.getCollisionType()).isEqualTo(CollisionType.DUPLICATE_IN_STORE);
        assertThat(record.getResolution()).isEqualTo(Resolution.REGENERATED);
        assertThat(record.getAttempt()).isZero();

        assertThat(barcodeRepository.findByBarcodeNumber(SEEDED).orElseThrow().getBatchId()).isEqualTo("seed-batch");
        assertThat(barcodeRepository.countByBatchId(finished.getBatchId())).isEqualTo(100);
    }

    @Test
    @DisplayName("Exhausted slots beyond the failure threshold fail the batch")
    void exhaustedSlots_FailBatch() {
        // Given
        when(generator.generate(anyString(), anyInt(), anyLong(), anyLong())).thenReturn("WB-2024-SAMESAME01");

        // When
        BarcodeBatch finished = runBatch(40);

        // Then
        assertThat(finished.getStatus()).isEqualTo(BatchStatus.FAILED);
        assertThat(finished.getLastError()).isNotBlank();
        assertThat(finished.getFailedCount()).isGreaterThan(0);
        assertThat(finished.getSuccessfulCount()).isLessThanOrEqualTo(1);
        assertThat(barcodeRepository.countByBatchId(finished.getBatchId()))
                .isEqualTo(finished.getSuccessfulCount().longValue());
        assertThat(collisionRepository.countByBatchId(finished.getBatchId())).isGreaterThan(0);
    }
}
