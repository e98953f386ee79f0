package com.smartseller.warranty.api.dto;

import com.smartseller.warranty.domain.model.CollisionRecord;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for collision records of a batch.
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class CollisionResponse {

    private String collisionId;
    private String candidateBarcode;
    private String collisionType;
    private String resolution;
    private Integer slotIndex;
    private Integer attempt;
    private Instant detectedAt;
    private Instant resolvedAt;

    public static CollisionResponse fromEntity(CollisionRecord record) {
        CollisionResponse response = new CollisionResponse();
        response.setCollisionId(record.getCollisionId());
        response.setCandidateBarcode(record.getCandidateBarcode());
        response.setCollisionType(record.getCollisionType().name().toLowerCase());
        response.setResolution(record.getResolution().name().toLowerCase());
        response.setSlotIndex(record.getSlotIndex());
        response.setAttempt(record.getAttempt());
        response.setDetectedAt(record.getDetectedAt());
        response.setResolvedAt(record.getResolvedAt());
        return response;
    }
}
