package com.smartseller.warranty.repository;

import com.smartseller.warranty.domain.model.CollisionRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for CollisionRecord entity.
 *
 * @author Warranty Platform Team
 */
@Repository
public interface CollisionRecordRepository extends JpaRepository<CollisionRecord, String> {

    Page<CollisionRecord> findByBatchIdOrderByDetectedAtAsc(String batchId, Pageable pageable);

    List<CollisionRecord> findByBatchIdAndSlotIndex(String batchId, Integer slotIndex);

    long countByBatchId(String batchId);
}
