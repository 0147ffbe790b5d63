package sp.sistemaspalacios.api_hrcore.service.auth;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_hrcore.entity.auth.Capability;
import sp.sistemaspalacios.api_hrcore.entity.auth.RoleAssignment;
import sp.sistemaspalacios.api_hrcore.entity.employee.Employee;
import sp.sistemaspalacios.api_hrcore.repository.auth.RoleAssignmentRepository;

import java.util.Objects;

/**
 * Answers "may this actor decide for this employee". Reporting line comes from
 * the employee master, roles from active role assignments.
 */
@Service
@RequiredArgsConstructor
public class ApprovalAuthorityService {

    private final RoleAssignmentRepository roleAssignmentRepository;
    private final PermissionTable permissionTable;

    /** Direct manager, L2 manager or HR admin. */
    @Transactional(readOnly = true)
    public boolean canApproveLeave(Long actorId, Employee employee) {
        return Objects.equals(employee.getReportingManagerId(), actorId)
                || Objects.equals(employee.getL2ManagerId(), actorId)
                || isHrAdmin(actorId);
    }

    /** Direct manager or HR admin. */
    @Transactional(readOnly = true)
    public boolean canRejectLeave(Long actorId, Employee employee) {
        return Objects.equals(employee.getReportingManagerId(), actorId)
                || isHrAdmin(actorId);
    }

    @Transactional(readOnly = true)
    public boolean isHrAdmin(Long actorId) {
        return hasCapability(actorId, Capability.LEAVE_APPROVE_ANY);
    }

    @Transactional(readOnly = true)
    public boolean hasCapability(Long actorId, Capability capability) {
        if (actorId == null) {
            return false;
        }
        return roleAssignmentRepository.findByEmployeeIdAndIsActiveTrue(actorId).stream()
                .map(RoleAssignment::getRole)
                .anyMatch(role -> permissionTable.grants(role, capability));
    }
}
