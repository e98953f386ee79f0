package com.smartseller.warranty.infrastructure.messaging.events;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Domain event published to the warranty-events topic for downstream consumers
 * (analytics, CRM, audit). Keyed by aggregate id so events of one barcode, batch or claim
 * stay ordered on a partition.
 *
 * Event Types:
 * - BARCODE_ACTIVATED / BARCODE_REVOKED / BARCODE_CLAIMED
 * - BATCH_COMPLETED / BATCH_FAILED / BATCH_CANCELLED
 * - CLAIM_SUBMITTED / CLAIM_STATUS_CHANGED
 *
 * @author Warranty Platform Team
 */
public class WarrantyEvent {

    private EventType eventType;
    private String aggregateType;
    private String aggregateId;
    private String actorId;
    private Instant occurredAt;
    private Map<String, Object> attributes = new HashMap<>();

    /**
     * Default constructor for deserialization.
     */
    public WarrantyEvent() {
    }

    public WarrantyEvent(EventType eventType, String aggregateType, String aggregateId,
                         String actorId, Instant occurredAt) {
        this.eventType = eventType;
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.actorId = actorId;
        this.occurredAt = occurredAt;
    }

    public WarrantyEvent with(String key, Object value) {
        if (value != null) {
            attributes.put(key, value);
        }
        return this;
    }

    // Getters and setters
    public EventType getEventType() { return eventType; }
    public void setEventType(EventType eventType) { this.eventType = eventType; }

    public String getAggregateType() { return aggregateType; }
    public void setAggregateType(String aggregateType) { this.aggregateType = aggregateType; }

    public String getAggregateId() { return aggregateId; }
    public void setAggregateId(String aggregateId) { this.aggregateId = aggregateId; }

    public String getActorId() { return actorId; }
    public void setActorId(String actorId) { this.actorId = actorId; }

    public Instant getOccurredAt() { return occurredAt; }
    public void setOccurredAt(Instant occurredAt) { this.occurredAt = occurredAt; }

    public Map<String, Object> getAttributes() { return attributes; }
    public void setAttributes(Map<String, Object> attributes) { this.attributes = attributes; }

    public enum EventType {
        BARCODE_ACTIVATED,
        BARCODE_REVOKED,
        BARCODE_CLAIMED,
        BATCH_COMPLETED,
        BATCH_FAILED,
        BATCH_CANCELLED,
        CLAIM_SUBMITTED,
        CLAIM_STATUS_CHANGED
    }
}
