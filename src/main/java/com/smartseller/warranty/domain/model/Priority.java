package com.smartseller.warranty.domain.model;

/**
 * Work priority shared by batches, claims and repair tickets.
 *
 * @author Warranty Platform Team
 */
public enum Priority {
    LOW,
    NORMAL,
    HIGH,
    URGENT
}
