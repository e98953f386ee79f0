package com.smartseller.warranty.security;

import com.smartseller.warranty.domain.model.ActorType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Verified caller identity handed to every service operation.
 * The service trusts it as given; authentication happens upstream.
 *
 * @author Warranty Platform Team
 */
public final class Actor {

    private static final Actor SYSTEM = new Actor("system", ActorType.SYSTEM, EnumSet.noneOf(Role.class));

    private final String actorId;
    private final ActorType actorType;
    private final Set<Role> roles;

    public Actor(String actorId, ActorType actorType, Set<Role> roles) {
        this.actorId = Objects.requireNonNull(actorId, "actorId");
        this.actorType = Objects.requireNonNull(actorType, "actorType");
        this.roles = roles.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(Role.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(roles));
    }

    /**
     * Build an actor from its roles; the actor type follows the most privileged role.
     */
    public static Actor of(String actorId, Role... roles) {
        EnumSet<Role> roleSet = EnumSet.noneOf(Role.class);
        Collections.addAll(roleSet, roles);
        ActorType type = ActorType.CUSTOMER;
        if (roleSet.contains(Role.ADMIN) || roleSet.contains(Role.AGENT)) {
            type = ActorType.AGENT;
        } else if (roleSet.contains(Role.TECHNICIAN)) {
            type = ActorType.TECHNICIAN;
        }
        return new Actor(actorId, type, roleSet);
    }

    public static Actor system() {
        return SYSTEM;
    }

    public String getActorId() {
        return actorId;
    }

    public ActorType getActorType() {
        return actorType;
    }

    public Set<Role> getRoles() {
        return roles;
    }

    public boolean hasRole(Role role) {
        return roles.contains(role);
    }

    public boolean isAdmin() {
        return roles.contains(Role.ADMIN);
    }

    /**
     * Agents and administrators: the back-office staff.
     */
    public boolean isStaff() {
        return roles.contains(Role.ADMIN) || roles.contains(Role.AGENT);
    }

    public boolean isSystem() {
        return actorType == ActorType.SYSTEM;
    }

    @Override
    public String toString() {
        return actorType + ":" + actorId;
    }
}
