package sp.sistemaspalacios.api_hrcore.repository.employee;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_hrcore.entity.employee.Employee;

import java.util.List;
import java.util.Optional;

@Repository
public interface EmployeeRepository extends JpaRepository<Employee, Long> {

    Optional<Employee> findByIdAndIsActiveTrue(Long id);

    List<Employee> findByReportingManagerIdAndIsActiveTrue(Long reportingManagerId);

    // null filters match everyone
    @Query("SELECT e FROM Employee e WHERE e.isActive = true " +
            "AND (:departmentId IS NULL OR e.departmentId = :departmentId) " +
            "AND (:locationId IS NULL OR e.locationId = :locationId)")
    List<Employee> findActiveByDepartmentAndLocation(@Param("departmentId") Long departmentId,
                                                     @Param("locationId") Long locationId);
}
