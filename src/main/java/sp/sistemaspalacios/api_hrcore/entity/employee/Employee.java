package sp.sistemaspalacios.api_hrcore.entity.employee;

import jakarta.persistence.*;
import lombok.Data;

/**
 * Read-only view of the employee master. Maintained by the core HR module.
 */
@Entity
@Table(name = "employees")
@Data
public class Employee {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_code", unique = true)
    private String employeeCode;

    @Column(name = "first_name")
    private String firstName;

    @Column(name = "last_name")
    private String lastName;

    @Enumerated(EnumType.STRING)
    private Gender gender;

    @Column(name = "reporting_manager_id")
    private Long reportingManagerId;

    @Column(name = "l2_manager_id")
    private Long l2ManagerId;

    @Column(name = "department_id")
    private Long departmentId;

    @Column(name = "location_id")
    private Long locationId;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;

    public String getDisplayName() {
        String first = firstName != null ? firstName : "";
        String last = lastName != null ? lastName : "";
        return (first + " " + last).trim();
    }
}
