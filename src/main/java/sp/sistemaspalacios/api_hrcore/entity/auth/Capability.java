package sp.sistemaspalacios.api_hrcore.entity.auth;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Capability {
    PROFILE_READ_OWN("profile:read_own"),
    PROFILE_READ_TEAM("profile:read_team"),
    PROFILE_READ_ALL("profile:read_all"),
    PROFILE_CREATE("profile:create"),
    PROFILE_UPDATE("profile:update"),
    PROFILE_DELETE("profile:delete"),
    LEAVE_REQUEST("leave:request"),
    LEAVE_READ_OWN("leave:read_own"),
    LEAVE_READ_TEAM("leave:read_team"),
    LEAVE_READ_ALL("leave:read_all"),
    LEAVE_APPROVE("leave:approve"),
    // approve or reject any employee's leave regardless of reporting line
    LEAVE_APPROVE_ANY("leave:approve_any"),
    LEAVE_REJECT("leave:reject"),
    LEAVE_REVOKE("leave:revoke"),
    LEAVE_CONFIGURE("leave:configure"),
    ATTENDANCE_READ_OWN("attendance:read_own"),
    ATTENDANCE_READ_TEAM("attendance:read_team"),
    ATTENDANCE_READ_ALL("attendance:read_all"),
    ATTENDANCE_REGULARIZE_APPROVE("attendance:regularize_approve"),
    ATTENDANCE_CONFIGURE("attendance:configure"),
    NOTIFICATION_READ_OWN("notification:read_own"),
    NOTIFICATION_READ_ALL("notification:read_all"),
    NOTIFICATION_SEND("notification:send"),
    DASHBOARD_TEAM("dashboard:team"),
    DASHBOARD_HR("dashboard:hr"),
    DASHBOARD_SYSTEM("dashboard:system"),
    AUDIT_READ("audit:read"),
    SYSTEM_CONFIGURE("system:configure"),
    SYSTEM_MANAGE_USERS("system:manage_users");

    private final String value;

    Capability(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
