package sp.sistemaspalacios.api_hrcore.service.leave;

import org.springframework.stereotype.Component;
import sp.sistemaspalacios.api_hrcore.dto.leave.LeaveDayCount;
import sp.sistemaspalacios.api_hrcore.entity.leave.DayClassification;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveDayType;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Expands a leave range into a per-date ledger.
 * <p>
 * Working days are dates that are neither a weekly off nor a holiday. With the
 * sandwich rule on, an off day strictly between the first and the last working
 * day of the range is charged as a full day. Leading and trailing off days are
 * never charged.
 */
@Component
public class LeaveDayCounter {

    public LeaveDayCount count(LocalDate fromDate,
                               LocalDate toDate,
                               Map<LocalDate, LeaveDayType> overrides,
                               Set<DayOfWeek> weeklyOffs,
                               Set<LocalDate> holidays,
                               boolean sandwichRule) {
        if (fromDate.isAfter(toDate)) {
            return LeaveDayCount.zero();
        }
        Map<LocalDate, LeaveDayType> dayTypes = overrides != null ? overrides : Collections.emptyMap();

        List<LocalDate> dates = new ArrayList<>();
        for (LocalDate d = fromDate; !d.isAfter(toDate); d = d.plusDays(1)) {
            dates.add(d);
        }

        int sandwichStart = -1;
        int sandwichEnd = -1;
        for (int i = 0; i < dates.size(); i++) {
            if (isWorkingDay(dates.get(i), weeklyOffs, holidays)) {
                if (sandwichStart < 0) {
                    sandwichStart = i;
                }
                sandwichEnd = i;
            }
        }

        Map<LocalDate, DayClassification> days = new LinkedHashMap<>();
        BigDecimal total = BigDecimal.ZERO;

        for (int i = 0; i < dates.size(); i++) {
            LocalDate date = dates.get(i);
            boolean weeklyOff = weeklyOffs.contains(date.getDayOfWeek());
            boolean holiday = holidays.contains(date);

            DayClassification classification;
            if (weeklyOff || holiday) {
                boolean sandwiched = sandwichRule && sandwichStart < i && i < sandwichEnd;
                if (sandwiched) {
                    classification = DayClassification.FULL_DAY;
                } else {
                    classification = weeklyOff ? DayClassification.WEEKEND : DayClassification.HOLIDAY;
                }
            } else {
                LeaveDayType dayType = dayTypes.getOrDefault(date, LeaveDayType.FULL_DAY);
                classification = DayClassification.of(dayType);
            }

            days.put(date, classification);
            total = total.add(classification.getContribution());
        }

        return new LeaveDayCount(total, days);
    }

    private boolean isWorkingDay(LocalDate date, Set<DayOfWeek> weeklyOffs, Set<LocalDate> holidays) {
        return !weeklyOffs.contains(date.getDayOfWeek()) && !holidays.contains(date);
    }
}
