package sp.sistemaspalacios.api_hrcore.service.attendance;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sp.sistemaspalacios.api_hrcore.dto.attendance.HoursBreakdown;
import sp.sistemaspalacios.api_hrcore.entity.attendance.AttendanceStatus;
import sp.sistemaspalacios.api_hrcore.entity.shift.ShiftPolicy;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HoursCalculator")
class HoursCalculatorTest {

    private final HoursCalculator calculator = new HoursCalculator();

    private static final LocalDateTime NINE = LocalDateTime.of(2026, 3, 10, 9, 0);

    private ShiftPolicy shift(int halfDayMinutes, int fullDayMinutes) {
        ShiftPolicy shift = new ShiftPolicy();
        shift.setStartTime(LocalTime.of(9, 0));
        shift.setEndTime(LocalTime.of(18, 0));
        shift.setHalfDayMinutes(halfDayMinutes);
        shift.setFullDayMinutes(fullDayMinutes);
        return shift;
    }

    @Test
    @DisplayName("Nine hours on a 09:00-18:00 shift: 9.0 total, 8.0 effective, no overtime, present")
    void nineHoursIsPresent() {
        HoursBreakdown hours = calculator.compute(NINE, NINE.plusHours(9), shift(240, 480));

        assertThat(hours.getTotalHours()).isEqualByComparingTo("9.00");
        assertThat(hours.getEffectiveHours()).isEqualByComparingTo("8.00");
        assertThat(hours.getOvertimeHours()).isEqualByComparingTo("0");
        assertThat(hours.getStatus()).isEqualTo(AttendanceStatus.PRESENT);
    }

    @Test
    @DisplayName("Overtime is effective hours beyond the full-day threshold")
    void overtime() {
        HoursBreakdown hours = calculator.compute(NINE, NINE.plusHours(11).plusMinutes(30), shift(240, 480));

        assertThat(hours.getEffectiveHours()).isEqualByComparingTo("10.50");
        assertThat(hours.getOvertimeHours()).isEqualByComparingTo("2.50");
    }

    @Test
    @DisplayName("Between half and full day thresholds is half day, below half is absent")
    void thresholds() {
        assertThat(calculator.compute(NINE, NINE.plusHours(6), shift(240, 480)).getStatus())
                .isEqualTo(AttendanceStatus.HALF_DAY);
        assertThat(calculator.compute(NINE, NINE.plusHours(5), shift(240, 480)).getStatus())
                .isEqualTo(AttendanceStatus.HALF_DAY);
        assertThat(calculator.compute(NINE, NINE.plusHours(4).plusMinutes(59), shift(240, 480)).getStatus())
                .isEqualTo(AttendanceStatus.ABSENT);
    }

    @Test
    @DisplayName("Defaults to 8h / 4h thresholds without a shift")
    void defaultsWithoutShift() {
        assertThat(calculator.compute(NINE, NINE.plusHours(9), null).getStatus()).isEqualTo(AttendanceStatus.PRESENT);
        assertThat(calculator.compute(NINE, NINE.plusHours(8), null).getStatus()).isEqualTo(AttendanceStatus.HALF_DAY);
        assertThat(calculator.compute(NINE, NINE.plusHours(4), null).getStatus()).isEqualTo(AttendanceStatus.ABSENT);
    }

    @Test
    @DisplayName("Short sessions never go negative")
    void neverNegative() {
        HoursBreakdown hours = calculator.compute(NINE, NINE.plusMinutes(20), null);

        assertThat(hours.getTotalHours()).isEqualByComparingTo("0.33");
        assertThat(hours.getEffectiveHours()).isEqualByComparingTo("0");
        assertThat(hours.getOvertimeHours()).isEqualByComparingTo("0");
        assertThat(hours.getStatus()).isEqualTo(AttendanceStatus.ABSENT);

        HoursBreakdown reversed = calculator.compute(NINE, NINE.minusHours(1), null);
        assertThat(reversed.getTotalHours()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Total is rounded to two decimals and converts back to whole minutes")
    void roundingAndMinutes() {
        HoursBreakdown hours = calculator.compute(NINE, NINE.plusHours(8).plusMinutes(10), null);

        assertThat(hours.getTotalHours()).isEqualByComparingTo("8.17");
        assertThat(calculator.toMinutes(hours.getTotalHours())).isEqualTo(490);
        assertThat(calculator.toMinutes(new BigDecimal("7.17"))).isEqualTo(430);
    }

    @Test
    @DisplayName("Same inputs always give the same breakdown")
    void idempotent() {
        ShiftPolicy shift = shift(240, 480);
        assertThat(calculator.compute(NINE, NINE.plusHours(7), shift))
                .isEqualTo(calculator.compute(NINE, NINE.plusHours(7), shift));
    }
}
