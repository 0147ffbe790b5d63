package sp.sistemaspalacios.api_hrcore.entity.attendance;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

@Entity
@Table(name = "clock_entries")
@Data
public class ClockEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @Column(name = "attendance_record_id")
    private Long attendanceRecordId;

    @Column(name = "clock_in", nullable = false)
    private LocalDateTime clockIn;

    // null while the entry is open
    @Column(name = "clock_out")
    private LocalDateTime clockOut;

    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    @Column(nullable = false)
    private String source = "web";

    public boolean isOpen() {
        return clockOut == null;
    }
}
