package cloud.rentdesk.sdk.permission;

import cloud.rentdesk.sdk.context.UserContext;

import java.util.Collection;
import java.util.logging.Logger;

/**
 * Client-side permission checks for the active context. The datastore's row-level rules remain authoritative;
 * these checks only decide what to offer.
 *
 * <p>
 * Evaluation order: platform admins pass everything, no context passes nothing, owners pass everything, tenants
 * pass the fixed {@link Permissions#TENANT_PERMISSIONS} set, and staff pass what their role grants.
 * </p>
 */
public final class PermissionEvaluator {

    private static final Logger LOGGER = Logger.getLogger(PermissionEvaluator.class.getName());

    private PermissionEvaluator() {
    }

    public static boolean hasPermission(UserContext context, boolean platformAdmin, String permission) {
        if (permission != null && !Permissions.isKnown(permission)) {
            LOGGER.fine(() -> "[rentdesk-sdk] checking unknown permission " + permission);
        }
        if (platformAdmin) {
            return true;
        }
        if (context == null || context.contextType() == null) {
            return false;
        }
        switch (context.contextType()) {
            case OWNER:
                return true;
            case TENANT:
                return permission != null && Permissions.TENANT_PERMISSIONS.contains(permission);
            case STAFF:
                return context.hasPermission(permission);
            default:
                return false;
        }
    }

    /**
     * @return {@code true} when at least one permission is granted; an empty collection grants nothing.
     */
    public static boolean hasAny(UserContext context, boolean platformAdmin, Collection<String> permissions) {
        if (permissions == null) {
            return false;
        }
        for (String permission : permissions) {
            if (hasPermission(context, platformAdmin, permission)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return {@code true} when every permission is granted; an empty collection is trivially granted.
     */
    public static boolean hasAll(UserContext context, boolean platformAdmin, Collection<String> permissions) {
        if (permissions == null) {
            return true;
        }
        for (String permission : permissions) {
            if (!hasPermission(context, platformAdmin, permission)) {
                return false;
            }
        }
        return true;
    }
}
