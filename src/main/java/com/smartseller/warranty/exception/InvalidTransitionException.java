package com.smartseller.warranty.exception;

import com.smartseller.warranty.domain.model.ClaimAction;
import com.smartseller.warranty.domain.model.ClaimStatus;

import java.util.stream.Collectors;

/**
 * Exception thrown when a claim action is outside the transition table for the claim's status.
 *
 * @author Warranty Platform Team
 */
public class InvalidTransitionException extends InvalidStateException {

    private final String attemptedAction;

    public InvalidTransitionException(String claimId, ClaimStatus current, ClaimAction attempted) {
        super("WarrantyClaim", claimId, current.name(),
                current.allowedActions().stream().map(Enum::name).collect(Collectors.toList()),
                String.format("Cannot %s a claim in status %s", attempted.name(), current.name()));
        this.attemptedAction = attempted.name();
    }

    public String getAttemptedAction() {
        return attemptedAction;
    }
}
