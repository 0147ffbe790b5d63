package sp.sistemaspalacios.api_hrcore.entity.leave;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Balance of one leave type for one employee and year. The current balance is
 * always derived from its inputs and never stored.
 */
@Entity
@Table(name = "leave_balances",
        uniqueConstraints = @UniqueConstraint(name = "uq_leave_balance",
                columnNames = {"employee_id", "leave_type_id", "leave_year"}))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaveBalance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @Column(name = "leave_type_id", nullable = false)
    private Long leaveTypeId;

    @Column(name = "leave_year", nullable = false)
    private Integer leaveYear;

    @Builder.Default
    @Column(name = "opening_balance", precision = 5, scale = 1, nullable = false)
    private BigDecimal openingBalance = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 5, scale = 1, nullable = false)
    private BigDecimal accrued = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 5, scale = 1, nullable = false)
    private BigDecimal used = BigDecimal.ZERO;

    @Builder.Default
    @Column(name = "carry_forwarded", precision = 5, scale = 1, nullable = false)
    private BigDecimal carryForwarded = BigDecimal.ZERO;

    @Builder.Default
    @Column(precision = 5, scale = 1, nullable = false)
    private BigDecimal adjusted = BigDecimal.ZERO;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    public BigDecimal getCurrentBalance() {
        return openingBalance
                .add(accrued)
                .add(carryForwarded)
                .add(adjusted)
                .subtract(used);
    }

    public void touch(LocalDateTime now) {
        this.updatedAt = now;
    }
}
