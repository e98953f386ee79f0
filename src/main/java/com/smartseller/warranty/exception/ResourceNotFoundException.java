package com.smartseller.warranty.exception;

/**
 * Exception thrown when a referenced barcode, batch, claim, ticket or attachment does not exist,
 * or exists but must not be disclosed to the caller.
 *
 * @author Warranty Platform Team
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        this(resourceType, resourceId, resourceType + " not found: " + resourceId);
    }

    /**
     * @param message Caller-facing message; public endpoints pass a generic one
     */
    public ResourceNotFoundException(String resourceType, String resourceId, String message) {
        super(message);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
