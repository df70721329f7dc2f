package com.brayford.security;

import java.util.ArrayList;
import java.util.List;

/**
 * The permission catalog: every capability that can be granted to an organization member.
 *
 * <p>Grouped by resource family. Role presets live in {@link RolePermissions}.
 */
public final class Permissions {

    // ---- Organization management ----
    public static final Capability.Specific ORG_UPDATE = Capability.of("org", "update");
    public static final Capability.Specific ORG_DELETE = Capability.of("org", "delete");
    public static final Capability.Specific ORG_TRANSFER = Capability.of("org", "transfer");
    public static final Capability.Specific ORG_VIEW_BILLING = Capability.of("org", "view_billing");
    public static final Capability.Specific ORG_MANAGE_BILLING = Capability.of("org", "manage_billing");
    public static final Capability.Specific ORG_VIEW_SETTINGS = Capability.of("org", "view_settings");

    // ---- User and team management ----
    public static final Capability.Specific USERS_INVITE = Capability.of("users", "invite");
    public static final Capability.Specific USERS_VIEW = Capability.of("users", "view");
    public static final Capability.Specific USERS_UPDATE_ROLE = Capability.of("users", "update_role");
    public static final Capability.Specific USERS_UPDATE_ACCESS = Capability.of("users", "update_access");
    public static final Capability.Specific USERS_REMOVE = Capability.of("users", "remove");

    // ---- Brand management ----
    public static final Capability.Specific BRANDS_CREATE = Capability.of("brands", "create");
    public static final Capability.Specific BRANDS_VIEW = Capability.of("brands", "view");
    public static final Capability.Specific BRANDS_UPDATE = Capability.of("brands", "update");
    public static final Capability.Specific BRANDS_DELETE = Capability.of("brands", "delete");
    public static final Capability.Specific BRANDS_MANAGE_TEAM = Capability.of("brands", "manage_team");

    // ---- Event management ----
    public static final Capability.Specific EVENTS_CREATE = Capability.of("events", "create");
    public static final Capability.Specific EVENTS_VIEW = Capability.of("events", "view");
    public static final Capability.Specific EVENTS_UPDATE = Capability.of("events", "update");
    public static final Capability.Specific EVENTS_PUBLISH = Capability.of("events", "publish");
    public static final Capability.Specific EVENTS_DELETE = Capability.of("events", "delete");
    public static final Capability.Specific EVENTS_MANAGE_MODULES = Capability.of("events", "manage_modules");
    public static final Capability.Specific EVENTS_MODERATE = Capability.of("events", "moderate");

    // ---- Analytics and reporting ----
    public static final Capability.Specific ANALYTICS_VIEW_ORG = Capability.of("analytics", "view_org");
    public static final Capability.Specific ANALYTICS_VIEW_BRAND = Capability.of("analytics", "view_brand");
    public static final Capability.Specific ANALYTICS_VIEW_EVENT = Capability.of("analytics", "view_event");
    public static final Capability.Specific ANALYTICS_EXPORT = Capability.of("analytics", "export");

    public static final List<Capability.Specific> ORGANIZATION_PERMISSIONS = List.of(
            ORG_UPDATE, ORG_DELETE, ORG_TRANSFER, ORG_VIEW_BILLING, ORG_MANAGE_BILLING, ORG_VIEW_SETTINGS);

    public static final List<Capability.Specific> USER_MANAGEMENT_PERMISSIONS = List.of(
            USERS_INVITE, USERS_VIEW, USERS_UPDATE_ROLE, USERS_UPDATE_ACCESS, USERS_REMOVE);

    public static final List<Capability.Specific> BRAND_MANAGEMENT_PERMISSIONS = List.of(
            BRANDS_CREATE, BRANDS_VIEW, BRANDS_UPDATE, BRANDS_DELETE, BRANDS_MANAGE_TEAM);

    public static final List<Capability.Specific> EVENT_MANAGEMENT_PERMISSIONS = List.of(
            EVENTS_CREATE, EVENTS_VIEW, EVENTS_UPDATE, EVENTS_PUBLISH,
            EVENTS_DELETE, EVENTS_MANAGE_MODULES, EVENTS_MODERATE);

    public static final List<Capability.Specific> ANALYTICS_PERMISSIONS = List.of(
            ANALYTICS_VIEW_ORG, ANALYTICS_VIEW_BRAND, ANALYTICS_VIEW_EVENT, ANALYTICS_EXPORT);

    /** Every specific capability in the catalog. Does not include the wildcard. */
    public static final List<Capability.Specific> ALL_PERMISSIONS = concat(
            ORGANIZATION_PERMISSIONS,
            USER_MANAGEMENT_PERMISSIONS,
            BRAND_MANAGEMENT_PERMISSIONS,
            EVENT_MANAGEMENT_PERMISSIONS,
            ANALYTICS_PERMISSIONS);

    private Permissions() {
        // constants only
    }

    /** Whether the capability is a catalog entry or the wildcard. */
    public static boolean isKnown(Capability capability) {
        return capability instanceof Capability.All || ALL_PERMISSIONS.contains(capability);
    }

    @SafeVarargs
    private static List<Capability.Specific> concat(List<Capability.Specific>... groups) {
        var all = new ArrayList<Capability.Specific>();
        for (List<Capability.Specific> group : groups) {
            all.addAll(group);
        }
        return List.copyOf(all);
    }
}
