package com.smartseller.warranty.domain.model;

/**
 * Actions that move a warranty claim between statuses.
 * Legal (status, action) pairs live in {@link ClaimStatus}.
 *
 * @author Warranty Platform Team
 */
public enum ClaimAction {
    VALIDATE,
    REJECT,
    CANCEL,
    ASSIGN,
    START,
    REPAIR,
    REPLACE,
    SHIP,
    DELIVER,
    COMPLETE,
    DISPUTE,
    RESOLVE
}
