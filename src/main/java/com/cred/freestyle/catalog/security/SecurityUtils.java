package com.cred.freestyle.catalog.security;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Helpers for reading the caller identity from the security context.
 *
 * @author Catalog Team
 */
public class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * Get the currently authenticated user ID.
     *
     * @return User ID from authentication context, or null if not authenticated
     */
    public static String getCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication != null && authentication.isAuthenticated()
                && !(authentication instanceof AnonymousAuthenticationToken)) {
            Object principal = authentication.getPrincipal();
            if (principal instanceof String) {
                return (String) principal;
            }
        }

        return null;
    }

    /**
     * Build the actor for visibility checks.
     *
     * @return Current actor, or null if not authenticated
     */
    public static Actor currentActor() {
        String userId = getCurrentUserId();
        if (userId == null) {
            return null;
        }

        Set<String> organizations = SecurityContextHolder.getContext().getAuthentication().getAuthorities().stream()
            .map(GrantedAuthority::getAuthority)
            .filter(authority -> authority.startsWith(HeaderAuthenticationFilter.ORGANIZATION_PREFIX))
            .map(authority -> authority.substring(HeaderAuthenticationFilter.ORGANIZATION_PREFIX.length()))
            .collect(Collectors.toSet());

        return new Actor(userId, organizations, isAdmin());
    }

    /**
     * Check if the current user has a specific role.
     *
     * @param role Role to check (without ROLE_ prefix)
     * @return true if user has the role, false otherwise
     */
    public static boolean hasRole(String role) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            return false;
        }

        String roleWithPrefix = role.startsWith(HeaderAuthenticationFilter.ROLE_PREFIX)
            ? role : HeaderAuthenticationFilter.ROLE_PREFIX + role;

        return authentication.getAuthorities().stream()
            .anyMatch(authority -> authority.getAuthority().equals(roleWithPrefix));
    }

    public static boolean isAdmin() {
        return hasRole("ADMIN");
    }

    /**
     * Verify that the current user may create or edit aggregates for the given owner:
     * the owner itself, an organization the user belongs to, or an admin.
     *
     * @param ownerId Owner of the aggregate
     * @throws AccessDeniedException if access is denied
     */
    public static void verifyOwnerAccess(String ownerId) {
        Actor actor = currentActor();

        if (actor == null) {
            throw new AccessDeniedException("User not authenticated");
        }

        if (actor.isAdmin() || actor.getId().equals(ownerId) || actor.isMemberOf(ownerId)) {
            return;
        }

        throw new AccessDeniedException(
            "Access denied: User " + actor.getId() + " cannot manage catalog items of owner " + ownerId
        );
    }

    /**
     * Verify that the current user is an admin.
     *
     * @throws AccessDeniedException if access is denied
     */
    public static void verifyAdminAccess() {
        if (!isAdmin()) {
            throw new AccessDeniedException("Access denied: Admin role required");
        }
    }
}
