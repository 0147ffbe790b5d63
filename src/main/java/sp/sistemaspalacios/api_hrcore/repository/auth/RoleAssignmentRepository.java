package sp.sistemaspalacios.api_hrcore.repository.auth;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_hrcore.entity.auth.RoleAssignment;

import java.util.List;

@Repository
public interface RoleAssignmentRepository extends JpaRepository<RoleAssignment, Long> {

    List<RoleAssignment> findByEmployeeIdAndIsActiveTrue(Long employeeId);
}
