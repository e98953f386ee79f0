package com.smartseller.warranty.domain.model;

/**
 * Customer-reported severity of a claimed issue.
 *
 * @author Warranty Platform Team
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
