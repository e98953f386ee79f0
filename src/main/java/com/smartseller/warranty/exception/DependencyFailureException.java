package com.smartseller.warranty.exception;

/**
 * Exception thrown when a collaborator the operation cannot proceed without is unavailable.
 *
 * @author Warranty Platform Team
 */
public class DependencyFailureException extends RuntimeException {

    private final String dependency;

    public DependencyFailureException(String dependency, String message, Throwable cause) {
        super(message, cause);
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }
}
