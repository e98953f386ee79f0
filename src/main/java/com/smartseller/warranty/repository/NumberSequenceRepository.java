package com.smartseller.warranty.repository;

import com.smartseller.warranty.domain.model.NumberSequence;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for per-year number sequences.
 *
 * @author Warranty Platform Team
 */
@Repository
public interface NumberSequenceRepository extends JpaRepository<NumberSequence, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM NumberSequence s WHERE s.sequenceKey = :sequenceKey")
    Optional<NumberSequence> findByKeyForUpdate(@Param("sequenceKey") String sequenceKey);
}
