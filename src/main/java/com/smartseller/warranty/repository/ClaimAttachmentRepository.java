package com.smartseller.warranty.repository;

import com.smartseller.warranty.domain.model.ClaimAttachment;
import com.smartseller.warranty.domain.model.ClaimAttachment.ScanStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for ClaimAttachment entity.
 *
 * @author Warranty Platform Team
 */
@Repository
public interface ClaimAttachmentRepository extends JpaRepository<ClaimAttachment, String> {

    List<ClaimAttachment> findByClaimIdOrderByUploadedAtAsc(String claimId);

    List<ClaimAttachment> findByClaimIdAndScanStatusOrderByUploadedAtAsc(String claimId, ScanStatus scanStatus);
}
