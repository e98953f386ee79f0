package com.smartseller.warranty.domain.model;

/**
 * Category of the issue reported on a warranty claim.
 *
 * @author Warranty Platform Team
 */
public enum IssueCategory {
    HARDWARE,
    SOFTWARE,
    PERFORMANCE,
    DEFECT,
    MALFUNCTION,
    DAMAGE,
    OTHER
}
