package com.smartseller.warranty.security;

import com.smartseller.warranty.domain.model.ActorType;

/**
 * Roles asserted by the API gateway in the X-Actor-Role header.
 *
 * @author Warranty Platform Team
 */
public enum Role {
    ADMIN(ActorType.AGENT),
    AGENT(ActorType.AGENT),
    TECHNICIAN(ActorType.TECHNICIAN),
    CUSTOMER(ActorType.CUSTOMER);

    private final ActorType actorType;

    Role(ActorType actorType) {
        this.actorType = actorType;
    }

    public ActorType getActorType() {
        return actorType;
    }

    public String authority() {
        return "ROLE_" + name();
    }
}
