package com.smartseller.warranty.repository;

import com.smartseller.warranty.domain.model.ClaimTimelineEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the append-only claim timeline.
 * Callers only insert and read; there are no update or delete paths.
 *
 * @author Warranty Platform Team
 */
@Repository
public interface ClaimTimelineEventRepository extends JpaRepository<ClaimTimelineEvent, String> {

    List<ClaimTimelineEvent> findByClaimIdOrderBySequenceAsc(String claimId);

    List<ClaimTimelineEvent> findByClaimIdAndVisibleToCustomerTrueOrderBySequenceAsc(String claimId);

    Optional<ClaimTimelineEvent> findFirstByClaimIdOrderBySequenceDesc(String claimId);
}
