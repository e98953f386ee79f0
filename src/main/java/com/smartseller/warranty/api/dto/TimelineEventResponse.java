package com.smartseller.warranty.api.dto;

import com.smartseller.warranty.domain.model.ClaimTimelineEvent;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One claim timeline entry.
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class TimelineEventResponse {

    private String eventId;
    private Long sequence;
    private String eventType;
    private String description;
    private String actorId;
    private String actorType;
    private Instant occurredAt;
    private boolean visibleToCustomer;
    private String fromStatus;
    private String toStatus;

    public static TimelineEventResponse fromEntity(ClaimTimelineEvent event) {
        TimelineEventResponse response = new TimelineEventResponse();
        response.setEventId(event.getEventId());
        response.setSequence(event.getSequence());
        response.setEventType(event.getEventType().name().toLowerCase());
        response.setDescription(event.getDescription());
        response.setActorId(event.getActorId());
        response.setActorType(event.getActorType() != null ? event.getActorType().name().toLowerCase() : null);
        response.setOccurredAt(event.getOccurredAt());
        response.setVisibleToCustomer(Boolean.TRUE.equals(event.getVisibleToCustomer()));
        response.setFromStatus(event.getFromStatus() != null ? event.getFromStatus().name().toLowerCase() : null);
        response.setToStatus(event.getToStatus() != null ? event.getToStatus().name().toLowerCase() : null);
        return response;
    }
}
