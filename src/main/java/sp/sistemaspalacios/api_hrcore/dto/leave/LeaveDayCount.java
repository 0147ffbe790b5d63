package sp.sistemaspalacios.api_hrcore.dto.leave;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_hrcore.entity.leave.DayClassification;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LeaveDayCount {

    private BigDecimal totalDays;
    // ordered by date
    private Map<LocalDate, DayClassification> days;

    public static LeaveDayCount zero() {
        return new LeaveDayCount(BigDecimal.ZERO, new LinkedHashMap<>());
    }

    /**
     * Day ledger as persisted on the leave request: ISO date to classification value.
     */
    public Map<String, String> toDayDetails() {
        Map<String, String> details = new LinkedHashMap<>();
        days.forEach((date, classification) -> details.put(date.toString(), classification.getValue()));
        return details;
    }
}
