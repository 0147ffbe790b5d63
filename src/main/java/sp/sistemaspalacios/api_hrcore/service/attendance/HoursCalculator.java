package sp.sistemaspalacios.api_hrcore.service.attendance;

import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_hrcore.dto.attendance.HoursBreakdown;
import sp.sistemaspalacios.api_hrcore.entity.attendance.AttendanceStatus;
import sp.sistemaspalacios.api_hrcore.entity.shift.ShiftPolicy;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Worked hours for a day, from first clock-in to last clock-out.
 * <p>
 * A fixed one hour lunch break is deducted from the total. Thresholds come
 * from the shift, or 8h full day / 4h half day when there is none. All values
 * are hours at two decimals and never negative.
 */
@Component
public class HoursCalculator {

    static final BigDecimal LUNCH_HOURS = BigDecimal.ONE;
    static final BigDecimal DEFAULT_FULL_DAY_HOURS = new BigDecimal("8");
    static final BigDecimal DEFAULT_HALF_DAY_HOURS = new BigDecimal("4");

    private static final BigDecimal SECONDS_PER_HOUR = new BigDecimal("3600");
    private static final BigDecimal MINUTES_PER_HOUR = new BigDecimal("60");

    public HoursBreakdown compute(LocalDateTime firstClockIn, LocalDateTime lastClockOut, ShiftPolicy shift) {
        long seconds = Math.max(0, Duration.between(firstClockIn, lastClockOut).getSeconds());
        BigDecimal total = BigDecimal.valueOf(seconds).divide(SECONDS_PER_HOUR, 2, RoundingMode.HALF_UP);
        BigDecimal effective = total.subtract(LUNCH_HOURS).max(BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP);

        BigDecimal fullDay = shift != null ? minutesToHours(shift.getFullDayMinutes()) : DEFAULT_FULL_DAY_HOURS;
        BigDecimal halfDay = shift != null ? minutesToHours(shift.getHalfDayMinutes()) : DEFAULT_HALF_DAY_HOURS;

        BigDecimal overtime = effective.subtract(fullDay).max(BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP);

        AttendanceStatus status;
        if (effective.compareTo(halfDay) < 0) {
            status = AttendanceStatus.ABSENT;
        } else if (effective.compareTo(fullDay) < 0) {
            status = AttendanceStatus.HALF_DAY;
        } else {
            status = AttendanceStatus.PRESENT;
        }

        return new HoursBreakdown(total, effective, overtime, status);
    }

    public int toMinutes(BigDecimal hours) {
        return hours.multiply(MINUTES_PER_HOUR).setScale(0, RoundingMode.HALF_UP).intValueExact();
    }

    private BigDecimal minutesToHours(int minutes) {
        return BigDecimal.valueOf(minutes).divide(MINUTES_PER_HOUR, 4, RoundingMode.HALF_UP);
    }
}
