package com.smartseller.warranty.domain.model;

/**
 * Kind of actor recorded against timeline events and state changes.
 *
 * @author Warranty Platform Team
 */
public enum ActorType {
    CUSTOMER,
    AGENT,
    TECHNICIAN,
    SYSTEM
}
