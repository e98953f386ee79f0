package com.smartseller.warranty.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Authentication filter that reads the caller identity asserted by the API gateway.
 *
 * Header-based Authentication:
 * - X-Actor-Id: actor identifier (required for authenticated requests)
 * - X-Actor-Role: comma-separated roles (ADMIN, AGENT, TECHNICIAN, CUSTOMER); defaults to CUSTOMER
 *
 * The gateway validates tokens; this service trusts the headers it forwards.
 * Unknown role names are dropped.
 *
 * @author Warranty Platform Team
 */
public class HeaderAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(HeaderAuthenticationFilter.class);

    static final String ACTOR_ID_HEADER = "X-Actor-Id";
    static final String ACTOR_ROLE_HEADER = "X-Actor-Role";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String actorId = request.getHeader(ACTOR_ID_HEADER);

        if (actorId != null && !actorId.isBlank()) {
            String roleHeader = request.getHeader(ACTOR_ROLE_HEADER);
            if (roleHeader == null || roleHeader.isBlank()) {
                roleHeader = Role.CUSTOMER.name();
            }

            List<SimpleGrantedAuthority> authorities = new ArrayList<>();
            for (String raw : roleHeader.split(",")) {
                String name = raw.trim().toUpperCase();
                if (name.startsWith("ROLE_")) {
                    name = name.substring("ROLE_".length());
                }
                try {
                    authorities.add(new SimpleGrantedAuthority(Role.valueOf(name).authority()));
                } catch (IllegalArgumentException e) {
                    logger.warn("Ignoring unknown role '{}' for actor {}", raw, actorId);
                }
            }

            UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(actorId, null, authorities);
            SecurityContextHolder.getContext().setAuthentication(authentication);

            logger.debug("Authenticated actor: {} with roles: {}", actorId, authorities);
        } else {
            logger.debug("No {} header found, request will be unauthenticated", ACTOR_ID_HEADER);
        }

        filterChain.doFilter(request, response);
    }
}
