package com.smartseller.warranty.domain.model;

/**
 * Terminal disposition of a completed claim.
 *
 * @author Warranty Platform Team
 */
public enum ResolutionType {
    REPAIR,
    REPLACE,
    REFUND
}
