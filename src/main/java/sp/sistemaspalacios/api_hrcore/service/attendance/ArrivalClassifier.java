package sp.sistemaspalacios.api_hrcore.service.attendance;

import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_hrcore.entity.attendance.ArrivalStatus;
import sp.sistemaspalacios.api_hrcore.entity.shift.ShiftPolicy;

import java.time.Duration;
import java.time.LocalDateTime;

@Component
public class ArrivalClassifier {

    static final Duration LATE_LIMIT = Duration.ofMinutes(30);
    static final Duration HALF_DAY_PENALTY_LIMIT = Duration.ofMinutes(120);

    /**
     * Classifies a clock-in against the shift start of the clock-in's own date.
     * Without a shift every arrival is on time.
     */
    public ArrivalStatus classify(LocalDateTime clockIn, ShiftPolicy shift) {
        if (shift == null) {
            return ArrivalStatus.ON_TIME;
        }
        Duration diff = delayAfterStart(clockIn, shift);

        if (diff.compareTo(Duration.ofMinutes(shift.getGraceMinutes())) <= 0) {
            return ArrivalStatus.ON_TIME;
        }
        if (diff.compareTo(LATE_LIMIT) <= 0) {
            return ArrivalStatus.LATE;
        }
        return ArrivalStatus.VERY_LATE;
    }

    /**
     * Arrivals more than two hours after shift start are downgraded to half day.
     */
    public boolean exceedsHalfDayPenalty(LocalDateTime clockIn, ShiftPolicy shift) {
        return shift != null && delayAfterStart(clockIn, shift).compareTo(HALF_DAY_PENALTY_LIMIT) > 0;
    }

    // negative for early arrivals
    private Duration delayAfterStart(LocalDateTime clockIn, ShiftPolicy shift) {
        LocalDateTime shiftStart = clockIn.toLocalDate().atTime(shift.getStartTime());
        return Duration.between(shiftStart, clockIn);
    }
}
