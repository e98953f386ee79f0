package com.smartseller.warranty.repository;

import com.smartseller.warranty.domain.model.ClaimRequestKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository interface for claim transition idempotency keys.
 *
 * @author Warranty Platform Team
 */
@Repository
public interface ClaimRequestKeyRepository extends JpaRepository<ClaimRequestKey, String> {
}
