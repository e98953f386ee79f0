package com.smartseller.warranty.security;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility class for turning the security context into the {@link Actor} services expect.
 *
 * @author Warranty Platform Team
 */
public class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * Get the currently authenticated actor ID.
     *
     * @return Actor ID from authentication context, or null if not authenticated
     */
    public static String getCurrentActorId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken) {
            return null;
        }
        return authentication.getName();
    }

    /**
     * Build the actor for the current request.
     *
     * @return Current actor
     * @throws AccessDeniedException if the request is not authenticated
     */
    public static Actor currentActor() {
        String actorId = getCurrentActorId();
        if (actorId == null) {
            throw new AccessDeniedException("Caller not authenticated");
        }

        List<Role> roles = new ArrayList<>();
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        for (GrantedAuthority authority : authentication.getAuthorities()) {
            String name = authority.getAuthority();
            if (name != null && name.startsWith("ROLE_")) {
                try {
                    roles.add(Role.valueOf(name.substring("ROLE_".length())));
                } catch (IllegalArgumentException e) {
                    // Authorities outside the warranty role set carry no meaning here
                    continue;
                }
            }
        }
        return Actor.of(actorId, roles.toArray(new Role[0]));
    }

    public static boolean hasRole(Role role) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return false;
        }
        return authentication.getAuthorities().stream()
                .anyMatch(authority -> role.authority().equals(authority.getAuthority()));
    }
}
