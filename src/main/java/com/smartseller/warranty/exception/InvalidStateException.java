package com.smartseller.warranty.exception;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Exception thrown when an operation is not permitted from the resource's current state.
 * Reports the current state and the actions that would be legal from it.
 *
 * @author Warranty Platform Team
 */
public class InvalidStateException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;
    private final String currentState;
    private final List<String> allowedActions;

    public InvalidStateException(String resourceType, String resourceId, String currentState,
                                 Collection<String> allowedActions, String message) {
        super(message);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
        this.currentState = currentState;
        this.allowedActions = new ArrayList<>(allowedActions);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }

    public String getCurrentState() {
        return currentState;
    }

    public List<String> getAllowedActions() {
        return allowedActions;
    }
}
