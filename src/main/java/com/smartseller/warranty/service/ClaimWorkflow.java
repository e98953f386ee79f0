package com.smartseller.warranty.service;

import com.smartseller.warranty.domain.model.ClaimAction;
import com.smartseller.warranty.domain.model.ClaimRequestKey;
import com.smartseller.warranty.domain.model.ClaimStatus;
import com.smartseller.warranty.domain.model.ClaimTimelineEvent;
import com.smartseller.warranty.domain.model.ClaimTimelineEvent.EventType;
import com.smartseller.warranty.domain.model.IssueCategory;
import com.smartseller.warranty.domain.model.Priority;
import com.smartseller.warranty.domain.model.Severity;
import com.smartseller.warranty.domain.model.WarrantyClaim;
import com.smartseller.warranty.exception.ConflictException;
import com.smartseller.warranty.exception.InvalidTransitionException;
import com.smartseller.warranty.infrastructure.metrics.WarrantyMetricsService;
import com.smartseller.warranty.repository.ClaimRequestKeyRepository;
import com.smartseller.warranty.repository.ClaimTimelineEventRepository;
import com.smartseller.warranty.repository.WarrantyClaimRepository;
import com.smartseller.warranty.security.Actor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Shared transition executor for claims. Both the claim service and the repair ticket service
 * move claims through here so every status change writes the same audit fields, timeline entry
 * and metrics.
 *
 * Callers are expected to run inside a transaction.
 *
 * @author Warranty Platform Team
 */
@Component
public class ClaimWorkflow {

    private static final Logger logger = LoggerFactory.getLogger(ClaimWorkflow.class);

    private static final Map<ClaimAction, EventType> EVENT_TYPES = new EnumMap<>(ClaimAction.class);

    static {
        EVENT_TYPES.put(ClaimAction.VALIDATE, EventType.VALIDATED);
        EVENT_TYPES.put(ClaimAction.REJECT, EventType.REJECTED);
        EVENT_TYPES.put(ClaimAction.ASSIGN, EventType.ASSIGNED);
        EVENT_TYPES.put(ClaimAction.START, EventType.REPAIR_STARTED);
        EVENT_TYPES.put(ClaimAction.REPAIR, EventType.REPAIR_COMPLETED);
        EVENT_TYPES.put(ClaimAction.REPLACE, EventType.REPAIR_COMPLETED);
        EVENT_TYPES.put(ClaimAction.COMPLETE, EventType.COMPLETED);
    }

    private final WarrantyClaimRepository claimRepository;
    private final ClaimTimelineEventRepository timelineRepository;
    private final ClaimRequestKeyRepository requestKeyRepository;
    private final WarrantyMetricsService metricsService;
    private final Clock clock;

    public ClaimWorkflow(
            WarrantyClaimRepository claimRepository,
            ClaimTimelineEventRepository timelineRepository,
            ClaimRequestKeyRepository requestKeyRepository,
            WarrantyMetricsService metricsService,
            Clock clock
    ) {
        this.claimRepository = claimRepository;
        this.timelineRepository = timelineRepository;
        this.requestKeyRepository = requestKeyRepository;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Check that the action is legal from the claim's current status.
     *
     * @return the table target of the action
     * @throws InvalidTransitionException if the table has no such edge
     */
    public ClaimStatus requireAllowed(WarrantyClaim claim, ClaimAction action) {
        return claim.getStatus().next(action).orElseThrow(() -> {
            metricsService.recordClaimTransitionRejected(action.name());
            return new InvalidTransitionException(claim.getClaimId(), claim.getStatus(), action);
        });
    }

    /**
     * Apply a transition, persist the claim and append its timeline entry.
     *
     * @param target explicit target, or null to use the transition table
     */
    public WarrantyClaim transition(WarrantyClaim claim, ClaimAction action, ClaimStatus target,
                                    Actor actor, String description) {
        ClaimStatus tableTarget = requireAllowed(claim, action);
        ClaimStatus resolvedTarget = target != null ? target : tableTarget;
        ClaimStatus from = claim.getStatus();

        Instant now = clock.instant();
        claim.applyTransition(resolvedTarget, actor.getActorId(), now);
        WarrantyClaim saved = claimRepository.save(claim);

        EventType eventType = EVENT_TYPES.getOrDefault(action, EventType.STATUS_UPDATED);
        append(saved.getClaimId(), eventType, description, actor, true, from, resolvedTarget);
        metricsService.recordClaimTransition(action.name());

        logger.info("Claim {} moved {} -> {} by {} ({})",
                saved.getClaimNumber(), from, resolvedTarget, actor, action);
        return saved;
    }

    /**
     * Append a timeline entry. Sequence grows by one per claim and the timestamp never goes
     * backwards, even if the clock does.
     */
    public ClaimTimelineEvent append(String claimId, EventType eventType, String description, Actor actor,
                                     boolean visibleToCustomer, ClaimStatus fromStatus, ClaimStatus toStatus) {
        Optional<ClaimTimelineEvent> last = timelineRepository.findFirstByClaimIdOrderBySequenceDesc(claimId);
        long sequence = last.map(event -> event.getSequence() + 1).orElse(1L);
        Instant occurredAt = clock.instant();
        if (last.isPresent() && last.get().getOccurredAt().isAfter(occurredAt)) {
            occurredAt = last.get().getOccurredAt();
        }

        ClaimTimelineEvent event = ClaimTimelineEvent.builder()
                .claimId(claimId)
                .sequence(sequence)
                .eventType(eventType)
                .description(description)
                .actorId(actor.getActorId())
                .actorType(actor.getActorType())
                .occurredAt(occurredAt)
                .visibleToCustomer(visibleToCustomer)
                .fromStatus(fromStatus)
                .toStatus(toStatus)
                .build();
        return timelineRepository.save(event);
    }

    /**
     * Whether this request key was already applied to the same claim and action.
     *
     * @return true for a replay, false for a fresh or absent key
     * @throws ConflictException if the key was used for a different claim or action
     */
    public boolean isReplay(String requestKey, String claimId, ClaimAction action) {
        if (requestKey == null || requestKey.isBlank()) {
            return false;
        }
        Optional<ClaimRequestKey> stored = requestKeyRepository.findById(requestKey);
        if (stored.isEmpty()) {
            return false;
        }
        ClaimRequestKey key = stored.get();
        if (!key.getClaimId().equals(claimId) || key.getAction() != action) {
            throw new ConflictException("request_key_reused",
                    "Request key " + requestKey + " was already used for a different operation");
        }
        logger.debug("Replaying request key {} for claim {}", requestKey, claimId);
        return true;
    }

    public void remember(String requestKey, WarrantyClaim claim, ClaimAction action, Actor actor) {
        if (requestKey == null || requestKey.isBlank()) {
            return;
        }
        requestKeyRepository.save(ClaimRequestKey.builder()
                .requestKey(requestKey)
                .claimId(claim.getClaimId())
                .action(action)
                .resultStatus(claim.getStatus())
                .actorId(actor.getActorId())
                .createdAt(clock.instant())
                .build());
    }

    /**
     * Priority assigned when a claim is validated.
     */
    public static Priority priorityFor(Severity severity, IssueCategory category) {
        if (severity == Severity.CRITICAL) {
            return Priority.HIGH;
        }
        if (severity == Severity.HIGH
                && (category == IssueCategory.DEFECT || category == IssueCategory.MALFUNCTION)) {
            return Priority.HIGH;
        }
        if (severity == Severity.MEDIUM) {
            return Priority.NORMAL;
        }
        return Priority.LOW;
    }
}
