package sp.sistemaspalacios.api_hrcore.entity.attendance;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One row per employee and day. Created lazily on the first clock-in or on a
 * regularization for a day without activity; never deleted.
 */
@Entity
@Table(name = "attendance_records",
        uniqueConstraints = @UniqueConstraint(name = "uq_attendance_employee_date",
                columnNames = {"employee_id", "attendance_date"}))
@Data
public class AttendanceRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @Column(name = "attendance_date", nullable = false)
    private LocalDate attendanceDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AttendanceStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "arrival_status")
    private ArrivalStatus arrivalStatus;

    @Column(name = "shift_policy_id")
    private Long shiftPolicyId;

    @Column(name = "first_clock_in")
    private LocalDateTime firstClockIn;

    @Column(name = "last_clock_out")
    private LocalDateTime lastClockOut;

    @Column(name = "total_work_minutes")
    private Integer totalWorkMinutes;

    @Column(name = "effective_work_minutes")
    private Integer effectiveWorkMinutes;

    @Column(name = "overtime_minutes", nullable = false)
    private Integer overtimeMinutes = 0;

    @Column(name = "is_regularized", nullable = false)
    private Boolean isRegularized = false;

    @Column(nullable = false)
    private String source = "system";

    @Column(columnDefinition = "TEXT")
    private String remarks;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /** Stamps creation (first call only) and last update with the caller's clock. */
    public void touch(LocalDateTime now) {
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        this.updatedAt = now;
    }
}
