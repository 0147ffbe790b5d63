package sp.sistemaspalacios.api_hrcore.entity.leave;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Compensatory day off for working on a weekly off or holiday. Approval is one-way.
 */
@Entity
@Table(name = "comp_off_grants",
        uniqueConstraints = @UniqueConstraint(name = "uq_comp_off_emp_date",
                columnNames = {"employee_id", "work_date"}))
@Data
public class CompOffGrant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @Column(name = "work_date", nullable = false)
    private LocalDate workDate;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String reason;

    // null until approved
    @Column(name = "granted_by")
    private Long grantedBy;

    @Column(name = "expires_at")
    private LocalDate expiresAt;

    @Column(name = "is_used", nullable = false)
    private Boolean isUsed = false;

    @Column(name = "leave_request_id")
    private Long leaveRequestId;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    public void touch(LocalDateTime now) {
        if (this.createdAt == null) {
            this.createdAt = now;
        }
    }

    public boolean isApproved() {
        return grantedBy != null;
    }
}
