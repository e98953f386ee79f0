package com.smartseller.warranty.repository;

import com.smartseller.warranty.domain.model.ClaimStatus;
import com.smartseller.warranty.domain.model.Priority;
import com.smartseller.warranty.domain.model.Severity;
import com.smartseller.warranty.domain.model.WarrantyClaim;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

/**
 * Repository interface for WarrantyClaim entity.
 * Concurrent writers are resolved by the @Version column on the claim row.
 *
 * @author Warranty Platform Team
 */
@Repository
public interface WarrantyClaimRepository extends JpaRepository<WarrantyClaim, String> {

    Optional<WarrantyClaim> findByClaimNumber(String claimNumber);

    /**
     * Whether the barcode already has a claim outside the given (terminal) statuses.
     */
    boolean existsByBarcodeIdAndStatusNotIn(String barcodeId, Collection<ClaimStatus> statuses);

    Page<WarrantyClaim> findByCustomerIdOrderByClaimDateDesc(String customerId, Pageable pageable);

    @Query("SELECT c FROM WarrantyClaim c WHERE " +
           "(:status IS NULL OR c.status = :status) " +
           "AND (:priority IS NULL OR c.priority = :priority) " +
           "AND (:severity IS NULL OR c.severity = :severity) " +
           "AND (:customerId IS NULL OR c.customerId = :customerId) " +
           "AND (:technicianId IS NULL OR c.assignedTechnicianId = :technicianId) " +
           "AND (:storefrontId IS NULL OR c.storefrontId = :storefrontId) " +
           "AND (:claimFrom IS NULL OR c.claimDate >= :claimFrom) " +
           "AND (:claimTo IS NULL OR c.claimDate < :claimTo)")
    Page<WarrantyClaim> search(
            @Param("status") ClaimStatus status,
            @Param("priority") Priority priority,
            @Param("severity") Severity severity,
            @Param("customerId") String customerId,
            @Param("technicianId") String technicianId,
            @Param("storefrontId") String storefrontId,
            @Param("claimFrom") Instant claimFrom,
            @Param("claimTo") Instant claimTo,
            Pageable pageable
    );
}
