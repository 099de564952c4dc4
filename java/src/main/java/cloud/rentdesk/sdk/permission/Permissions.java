package cloud.rentdesk.sdk.permission;

import java.util.Set;

/**
 * Catalogue of permission names understood by the platform, as {@code resource.action} strings.
 */
public final class Permissions {

    public static final String PROPERTIES_VIEW = "properties.view";
    public static final String PROPERTIES_CREATE = "properties.create";
    public static final String PROPERTIES_EDIT = "properties.edit";
    public static final String PROPERTIES_DELETE = "properties.delete";

    public static final String ROOMS_VIEW = "rooms.view";
    public static final String ROOMS_CREATE = "rooms.create";
    public static final String ROOMS_EDIT = "rooms.edit";
    public static final String ROOMS_DELETE = "rooms.delete";

    public static final String TENANTS_VIEW = "tenants.view";
    public static final String TENANTS_CREATE = "tenants.create";
    public static final String TENANTS_EDIT = "tenants.edit";
    public static final String TENANTS_DELETE = "tenants.delete";

    public static final String PAYMENTS_VIEW = "payments.view";
    public static final String PAYMENTS_CREATE = "payments.create";
    public static final String PAYMENTS_EDIT = "payments.edit";
    public static final String PAYMENTS_DELETE = "payments.delete";

    public static final String BILLS_VIEW = "bills.view";
    public static final String BILLS_CREATE = "bills.create";
    public static final String BILLS_EDIT = "bills.edit";
    public static final String BILLS_DELETE = "bills.delete";

    public static final String METER_READINGS_VIEW = "meter_readings.view";
    public static final String METER_READINGS_CREATE = "meter_readings.create";
    public static final String METER_READINGS_EDIT = "meter_readings.edit";

    public static final String COMPLAINTS_VIEW = "complaints.view";
    public static final String COMPLAINTS_CREATE = "complaints.create";
    public static final String COMPLAINTS_EDIT = "complaints.edit";
    public static final String COMPLAINTS_RESOLVE = "complaints.resolve";

    public static final String NOTICES_VIEW = "notices.view";
    public static final String NOTICES_CREATE = "notices.create";
    public static final String NOTICES_EDIT = "notices.edit";
    public static final String NOTICES_DELETE = "notices.delete";

    public static final String VISITORS_VIEW = "visitors.view";
    public static final String VISITORS_CREATE = "visitors.create";

    public static final String REPORTS_VIEW = "reports.view";
    public static final String REPORTS_EXPORT = "reports.export";

    public static final String EXIT_CLEARANCE_INITIATE = "exit_clearance.initiate";
    public static final String EXIT_CLEARANCE_PROCESS = "exit_clearance.process";
    public static final String EXIT_CLEARANCE_APPROVE = "exit_clearance.approve";

    public static final String STAFF_VIEW = "staff.view";
    public static final String STAFF_CREATE = "staff.create";
    public static final String STAFF_EDIT = "staff.edit";
    public static final String STAFF_DELETE = "staff.delete";

    public static final String SETTINGS_VIEW = "settings.view";
    public static final String SETTINGS_EDIT = "settings.edit";

    public static final String PROFILE_VIEW = "profile.view";
    public static final String PROFILE_EDIT = "profile.edit";

    /**
     * Fixed grant of every tenant context, independent of roles.
     */
    public static final Set<String> TENANT_PERMISSIONS = Set.of(
        PROFILE_VIEW,
        PROFILE_EDIT,
        PAYMENTS_VIEW,
        COMPLAINTS_VIEW,
        COMPLAINTS_CREATE,
        NOTICES_VIEW
    );

    private static final Set<String> ALL = Set.of(
        PROPERTIES_VIEW, PROPERTIES_CREATE, PROPERTIES_EDIT, PROPERTIES_DELETE,
        ROOMS_VIEW, ROOMS_CREATE, ROOMS_EDIT, ROOMS_DELETE,
        TENANTS_VIEW, TENANTS_CREATE, TENANTS_EDIT, TENANTS_DELETE,
        PAYMENTS_VIEW, PAYMENTS_CREATE, PAYMENTS_EDIT, PAYMENTS_DELETE,
        BILLS_VIEW, BILLS_CREATE, BILLS_EDIT, BILLS_DELETE,
        METER_READINGS_VIEW, METER_READINGS_CREATE, METER_READINGS_EDIT,
        COMPLAINTS_VIEW, COMPLAINTS_CREATE, COMPLAINTS_EDIT, COMPLAINTS_RESOLVE,
        NOTICES_VIEW, NOTICES_CREATE, NOTICES_EDIT, NOTICES_DELETE,
        VISITORS_VIEW, VISITORS_CREATE,
        REPORTS_VIEW, REPORTS_EXPORT,
        EXIT_CLEARANCE_INITIATE, EXIT_CLEARANCE_PROCESS, EXIT_CLEARANCE_APPROVE,
        STAFF_VIEW, STAFF_CREATE, STAFF_EDIT, STAFF_DELETE,
        SETTINGS_VIEW, SETTINGS_EDIT,
        PROFILE_VIEW, PROFILE_EDIT
    );

    private Permissions() {
    }

    public static boolean isKnown(String permission) {
        return permission != null && ALL.contains(permission);
    }

    public static Set<String> all() {
        return ALL;
    }
}
