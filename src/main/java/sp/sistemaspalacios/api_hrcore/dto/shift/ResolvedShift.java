package sp.sistemaspalacios.api_hrcore.dto.shift;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_hrcore.entity.shift.ShiftPolicy;
import sp.sistemaspalacios.api_hrcore.entity.shift.WeeklyOffPolicy;

/**
 * Shift and weekly-off policy in force for an employee on a date. Both are null
 * when the employee has no covering assignment.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResolvedShift {

    private ShiftPolicy shiftPolicy;
    private WeeklyOffPolicy weeklyOffPolicy;

    public static ResolvedShift none() {
        return new ResolvedShift(null, null);
    }

    public boolean hasShift() {
        return shiftPolicy != null;
    }
}
