package sp.sistemaspalacios.api_hrcore.dto.attendance;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_hrcore.entity.attendance.AttendanceStatus;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HoursBreakdown {

    private BigDecimal totalHours;
    private BigDecimal effectiveHours;
    private BigDecimal overtimeHours;
    private AttendanceStatus status;
}
