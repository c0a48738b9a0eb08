package com.cred.freestyle.catalog.security;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Caller identity used for visibility decisions: the user id, the organization
 * accounts the user belongs to, and whether the user is an administrator.
 *
 * @author Catalog Team
 */
public class Actor {

    private final String id;
    private final Set<String> organizationIds;
    private final boolean admin;

    public Actor(String id, Set<String> organizationIds, boolean admin) {
        this.id = id;
        this.organizationIds = Collections.unmodifiableSet(new LinkedHashSet<>(organizationIds));
        this.admin = admin;
    }

    public static Actor user(String id) {
        return new Actor(id, Collections.emptySet(), false);
    }

    public String getId() {
        return id;
    }

    public Set<String> getOrganizationIds() {
        return organizationIds;
    }

    public boolean isAdmin() {
        return admin;
    }

    public boolean isMemberOf(String organizationId) {
        return organizationIds.contains(organizationId);
    }

    @Override
    public String toString() {
        return "Actor{id='" + id + "', organizations=" + organizationIds + ", admin=" + admin + "}";
    }
}
