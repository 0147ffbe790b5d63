package sp.sistemaspalacios.api_hrcore.entity.auth;

import jakarta.persistence.*;
import lombok.Data;

@Entity
@Table(name = "role_assignments")
@Data
public class RoleAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role_name", nullable = false)
    private UserRole role;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;
}
