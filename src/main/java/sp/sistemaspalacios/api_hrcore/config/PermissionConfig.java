package sp.sistemaspalacios.api_hrcore.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import sp.sistemaspalacios.api_hrcore.entity.auth.Capability;
import sp.sistemaspalacios.api_hrcore.entity.auth.UserRole;
import sp.sistemaspalacios.api_hrcore.service.auth.PermissionTable;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static sp.sistemaspalacios.api_hrcore.entity.auth.Capability.*;

@Configuration
public class PermissionConfig {

    @Bean
    public PermissionTable permissionTable() {
        return new PermissionTable(defaultGrants());
    }

    public static Map<UserRole, Set<Capability>> defaultGrants() {
        Map<UserRole, Set<Capability>> grants = new EnumMap<>(UserRole.class);

        grants.put(UserRole.EMPLOYEE, EnumSet.of(
                PROFILE_READ_OWN, LEAVE_REQUEST, LEAVE_READ_OWN,
                ATTENDANCE_READ_OWN, NOTIFICATION_READ_OWN));

        grants.put(UserRole.MANAGER, EnumSet.of(
                PROFILE_READ_OWN, PROFILE_READ_TEAM,
                LEAVE_REQUEST, LEAVE_READ_OWN, LEAVE_READ_TEAM, LEAVE_APPROVE, LEAVE_REJECT,
                ATTENDANCE_READ_OWN, ATTENDANCE_READ_TEAM, ATTENDANCE_REGULARIZE_APPROVE,
                NOTIFICATION_READ_OWN, DASHBOARD_TEAM));

        grants.put(UserRole.HR_ADMIN, EnumSet.of(
                PROFILE_READ_ALL, PROFILE_CREATE, PROFILE_UPDATE,
                LEAVE_READ_ALL, LEAVE_APPROVE, LEAVE_APPROVE_ANY, LEAVE_REJECT, LEAVE_REVOKE, LEAVE_CONFIGURE,
                ATTENDANCE_READ_ALL, ATTENDANCE_REGULARIZE_APPROVE, ATTENDANCE_CONFIGURE,
                NOTIFICATION_READ_ALL, NOTIFICATION_SEND, DASHBOARD_HR, AUDIT_READ));

        grants.put(UserRole.SYSTEM_ADMIN, EnumSet.of(
                PROFILE_READ_ALL, PROFILE_CREATE, PROFILE_UPDATE, PROFILE_DELETE,
                LEAVE_READ_ALL, LEAVE_APPROVE, LEAVE_REJECT, LEAVE_REVOKE, LEAVE_CONFIGURE,
                ATTENDANCE_READ_ALL, ATTENDANCE_REGULARIZE_APPROVE, ATTENDANCE_CONFIGURE,
                NOTIFICATION_READ_ALL, NOTIFICATION_SEND, DASHBOARD_HR, DASHBOARD_SYSTEM,
                AUDIT_READ, SYSTEM_CONFIGURE, SYSTEM_MANAGE_USERS));

        return grants;
    }
}
