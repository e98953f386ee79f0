package com.smartseller.warranty.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Idempotency record for claim transitions. A replayed request key returns the stored
 * outcome instead of applying the transition again.
 *
 * @author Warranty Platform Team
 */
@Entity
@Table(name = "claim_request_keys")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClaimRequestKey {

    @Id
    @Column(name = "request_key", nullable = false, length = 255)
    private String requestKey;

    @Column(name = "claim_id", nullable = false, length = 36)
    private String claimId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, length = 20)
    private ClaimAction action;

    @Enumerated(EnumType.STRING)
    @Column(name = "result_status", nullable = false, length = 20)
    private ClaimStatus resultStatus;

    @Column(name = "actor_id", nullable = false, length = 36)
    private String actorId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
