package sp.sistemaspalacios.api_hrcore.entity.shift;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDate;

@Entity
@Table(name = "employee_shift_assignments")
@Data
public class ShiftAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "shift_policy_id", nullable = false)
    private ShiftPolicy shiftPolicy;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "weekly_off_policy_id", nullable = false)
    private WeeklyOffPolicy weeklyOffPolicy;

    @Column(name = "effective_from", nullable = false)
    private LocalDate effectiveFrom;

    // null = open-ended
    @Column(name = "effective_to")
    private LocalDate effectiveTo;

    public boolean covers(LocalDate date) {
        return !effectiveFrom.isAfter(date) && (effectiveTo == null || !effectiveTo.isBefore(date));
    }
}
