package com.smartseller.warranty.repository;

import com.smartseller.warranty.domain.model.BarcodeBatch;
import com.smartseller.warranty.domain.model.BarcodeBatch.BatchStatus;
import com.smartseller.warranty.domain.model.Priority;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for BarcodeBatch entity.
 *
 * @author Warranty Platform Team
 */
@Repository
public interface BarcodeBatchRepository extends JpaRepository<BarcodeBatch, String> {

    /**
     * Find batch with pessimistic write lock.
     * Every counter or status change goes through this lock so progress never moves backwards.
     *
     * @param batchId Batch ID
     * @return Optional containing the locked batch
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM BarcodeBatch b WHERE b.batchId = :batchId")
    Optional<BarcodeBatch> findByIdForUpdate(@Param("batchId") String batchId);

    Optional<BarcodeBatch> findByBatchNumber(String batchNumber);

    @Query("SELECT b FROM BarcodeBatch b WHERE " +
           "(:status IS NULL OR b.status = :status) " +
           "AND (:priority IS NULL OR b.priority = :priority) " +
           "AND (:productId IS NULL OR b.productId = :productId) " +
           "AND (:storefrontId IS NULL OR b.storefrontId = :storefrontId) " +
           "AND (:createdBy IS NULL OR b.createdBy = :createdBy) " +
           "AND (:createdFrom IS NULL OR b.createdAt >= :createdFrom) " +
           "AND (:createdTo IS NULL OR b.createdAt < :createdTo)")
    Page<BarcodeBatch> search(
            @Param("status") BatchStatus status,
            @Param("priority") Priority priority,
            @Param("productId") String productId,
            @Param("storefrontId") String storefrontId,
            @Param("createdBy") String createdBy,
            @Param("createdFrom") Instant createdFrom,
            @Param("createdTo") Instant createdTo,
            Pageable pageable
    );

    /**
     * In-progress batches that have not reported progress since the cutoff.
     */
    List<BarcodeBatch> findByStatusAndUpdatedAtBefore(BatchStatus status, Instant cutoff);
}
