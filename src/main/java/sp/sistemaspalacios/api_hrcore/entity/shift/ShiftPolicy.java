package sp.sistemaspalacios.api_hrcore.entity.shift;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Shift definition. Never deleted once attendance references it, only deactivated.
 */
@Entity
@Table(name = "shift_policies")
@Data
public class ShiftPolicy {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "grace_minutes", nullable = false)
    private Integer graceMinutes = 15;

    @Column(name = "half_day_minutes", nullable = false)
    private Integer halfDayMinutes = 240;

    @Column(name = "full_day_minutes", nullable = false)
    private Integer fullDayMinutes = 480;

    @Column(name = "is_night_shift", nullable = false)
    private Boolean isNightShift = false;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;

    // administered by SQL; database defaults fill the audit columns
    @Column(name = "created_at", insertable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", insertable = false, updatable = false)
    private LocalDateTime updatedAt;
}
