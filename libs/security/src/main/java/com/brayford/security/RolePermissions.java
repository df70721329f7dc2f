package com.brayford.security;

import static com.brayford.security.Permissions.*;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps each {@link OrganizationRole} to its default capability set.
 *
 * <p>This table is the single source of truth for what a role can do when the member carries no
 * custom override. It is built once at class load and never mutated.
 */
public final class RolePermissions {

    private static final Set<Capability> OWNER_PERMISSIONS = Set.of(Capability.ALL);

    /** Everything except deleting or transferring the organization and anything billing. */
    private static final Set<Capability> ADMIN_PERMISSIONS = orderedSet(List.of(
            ORG_UPDATE,
            USERS_INVITE, USERS_VIEW, USERS_UPDATE_ROLE, USERS_UPDATE_ACCESS, USERS_REMOVE,
            BRANDS_CREATE, BRANDS_VIEW, BRANDS_UPDATE, BRANDS_DELETE, BRANDS_MANAGE_TEAM,
            EVENTS_CREATE, EVENTS_VIEW, EVENTS_UPDATE, EVENTS_PUBLISH,
            EVENTS_DELETE, EVENTS_MANAGE_MODULES, EVENTS_MODERATE,
            ANALYTICS_VIEW_ORG, ANALYTICS_VIEW_BRAND, ANALYTICS_VIEW_EVENT, ANALYTICS_EXPORT));

    /** Event work inside granted brands; no team or brand administration. */
    private static final Set<Capability> MEMBER_PERMISSIONS = orderedSet(List.of(
            USERS_VIEW,
            BRANDS_VIEW, BRANDS_UPDATE,
            EVENTS_CREATE, EVENTS_VIEW, EVENTS_UPDATE, EVENTS_PUBLISH,
            EVENTS_DELETE, EVENTS_MANAGE_MODULES, EVENTS_MODERATE,
            ANALYTICS_VIEW_BRAND, ANALYTICS_VIEW_EVENT, ANALYTICS_EXPORT));

    private static final Map<OrganizationRole, Set<Capability>> ROLE_PERMISSIONS = buildTable();

    private RolePermissions() {
        // utility class
    }

    /** Default capabilities for the role. The returned set is unmodifiable. */
    public static Set<Capability> forRole(OrganizationRole role) {
        return ROLE_PERMISSIONS.get(role);
    }

    /** Whether the role's default set grants the capability (the wildcard grants everything). */
    public static boolean roleHas(OrganizationRole role, Capability capability) {
        for (Capability granted : forRole(role)) {
            if (granted.covers(capability)) {
                return true;
            }
        }
        return false;
    }

    private static Map<OrganizationRole, Set<Capability>> buildTable() {
        var table = new EnumMap<OrganizationRole, Set<Capability>>(OrganizationRole.class);
        table.put(OrganizationRole.OWNER, OWNER_PERMISSIONS);
        table.put(OrganizationRole.ADMIN, ADMIN_PERMISSIONS);
        table.put(OrganizationRole.MEMBER, MEMBER_PERMISSIONS);
        return Collections.unmodifiableMap(table);
    }

    private static Set<Capability> orderedSet(List<Capability> capabilities) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(capabilities));
    }
}
