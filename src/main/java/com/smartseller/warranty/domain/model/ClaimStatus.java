package com.smartseller.warranty.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Warranty claim status and its transition table.
 *
 * <pre>
 * pending    --validate--> validated
 * pending    --reject----> rejected
 * pending    --cancel----> cancelled
 * validated  --assign----> assigned
 * validated  --cancel----> cancelled
 * assigned   --start-----> in_repair
 * in_repair  --repair----> repaired
 * in_repair  --replace---> replaced
 * repaired   --ship------> shipped
 * replaced   --ship------> shipped
 * shipped    --deliver---> delivered
 * delivered  --complete--> completed
 * any non-terminal --dispute--> disputed
 * disputed   --resolve---> prior status or completed
 * </pre>
 *
 * RESOLVE has no fixed target; {@link #next(ClaimAction)} reports it as legal from DISPUTED
 * and leaves the target to the caller.
 *
 * @author Warranty Platform Team
 */
public enum ClaimStatus {
    PENDING("Pending Review"),
    VALIDATED("Validated"),
    REJECTED("Rejected"),
    ASSIGNED("Assigned to Technician"),
    IN_REPAIR("In Repair"),
    REPAIRED("Repaired"),
    REPLACED("Replaced"),
    SHIPPED("Shipped"),
    DELIVERED("Delivered"),
    COMPLETED("Completed"),
    CANCELLED("Cancelled"),
    DISPUTED("Disputed");

    private static final Map<ClaimStatus, Map<ClaimAction, ClaimStatus>> TRANSITIONS =
            new EnumMap<>(ClaimStatus.class);

    static {
        for (ClaimStatus status : values()) {
            TRANSITIONS.put(status, new EnumMap<>(ClaimAction.class));
        }
        TRANSITIONS.get(PENDING).put(ClaimAction.VALIDATE, VALIDATED);
        TRANSITIONS.get(PENDING).put(ClaimAction.REJECT, REJECTED);
        TRANSITIONS.get(PENDING).put(ClaimAction.CANCEL, CANCELLED);
        TRANSITIONS.get(VALIDATED).put(ClaimAction.ASSIGN, ASSIGNED);
        TRANSITIONS.get(VALIDATED).put(ClaimAction.CANCEL, CANCELLED);
        TRANSITIONS.get(ASSIGNED).put(ClaimAction.START, IN_REPAIR);
        TRANSITIONS.get(IN_REPAIR).put(ClaimAction.REPAIR, REPAIRED);
        TRANSITIONS.get(IN_REPAIR).put(ClaimAction.REPLACE, REPLACED);
        TRANSITIONS.get(REPAIRED).put(ClaimAction.SHIP, SHIPPED);
        TRANSITIONS.get(REPLACED).put(ClaimAction.SHIP, SHIPPED);
        TRANSITIONS.get(SHIPPED).put(ClaimAction.DELIVER, DELIVERED);
        TRANSITIONS.get(DELIVERED).put(ClaimAction.COMPLETE, COMPLETED);
        for (ClaimStatus status : values()) {
            if (!status.isTerminal() && status != DISPUTED) {
                TRANSITIONS.get(status).put(ClaimAction.DISPUTE, DISPUTED);
            }
        }
        // Placeholder target; the resolver picks the prior status or COMPLETED.
        TRANSITIONS.get(DISPUTED).put(ClaimAction.RESOLVE, DISPUTED);
    }

    private final String displayName;

    ClaimStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return this == REJECTED || this == COMPLETED || this == CANCELLED;
    }

    /**
     * Target status of applying the action from this status, if legal.
     */
    public Optional<ClaimStatus> next(ClaimAction action) {
        return Optional.ofNullable(TRANSITIONS.get(this).get(action));
    }

    public boolean allows(ClaimAction action) {
        return TRANSITIONS.get(this).containsKey(action);
    }

    public Set<ClaimAction> allowedActions() {
        Set<ClaimAction> actions = TRANSITIONS.get(this).keySet();
        return actions.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(ClaimAction.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(actions));
    }

    /**
     * Customer-facing hints about what happens next.
     */
    public List<String> nextActionHints() {
        switch (this) {
            case PENDING:
                return List.of("Wait for claim review", "Upload additional documents if requested");
            case VALIDATED:
                return List.of("Wait for technician assignment");
            case ASSIGNED:
                return List.of("Technician will contact you", "Prepare device for pickup");
            case IN_REPAIR:
                return List.of("Repair in progress", "You will be notified when complete");
            case REPAIRED:
            case REPLACED:
                return List.of("Device ready for shipping");
            case SHIPPED:
                return List.of("Track your shipment", "Prepare to receive device");
            case DELIVERED:
                return List.of("Verify device functionality", "Rate your experience");
            case COMPLETED:
                return List.of("Claim completed", "Rate your experience");
            case REJECTED:
                return List.of("Review rejection reason", "Contact support if you disagree");
            case DISPUTED:
                return List.of("An agent is reviewing your dispute");
            default:
                return List.of();
        }
    }
}
