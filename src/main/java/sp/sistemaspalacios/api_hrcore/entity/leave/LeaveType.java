package sp.sistemaspalacios.api_hrcore.entity.leave;

import jakarta.persistence.*;
import lombok.*;
import sp.sistemaspalacios.api_hrcore.entity.employee.Gender;

import java.math.BigDecimal;

@Entity
@Table(name = "leave_types")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaveType {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 10)
    private String code;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Builder.Default
    @Column(name = "default_balance", precision = 5, scale = 1, nullable = false)
    private BigDecimal defaultBalance = BigDecimal.ZERO;

    @Builder.Default
    @Column(name = "max_carry_forward", precision = 5, scale = 1, nullable = false)
    private BigDecimal maxCarryForward = BigDecimal.ZERO;

    @Builder.Default
    @Column(name = "is_paid", nullable = false)
    private Boolean isPaid = true;

    @Builder.Default
    @Column(name = "requires_approval", nullable = false)
    private Boolean requiresApproval = true;

    @Builder.Default
    @Column(name = "min_days_notice", nullable = false)
    private Integer minDaysNotice = 0;

    // null = unbounded
    @Column(name = "max_consecutive_days")
    private Integer maxConsecutiveDays;

    // null = any gender
    @Enumerated(EnumType.STRING)
    @Column(name = "applicable_gender")
    private Gender applicableGender;

    @Builder.Default
    @Column(name = "is_sandwich_applicable", nullable = false)
    private Boolean sandwichApplicable = false;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;

    public boolean isApplicableTo(Gender gender) {
        return applicableGender == null || gender == null || applicableGender == gender;
    }
}
