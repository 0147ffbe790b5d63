package sp.sistemaspalacios.api_hrcore.dto.attendance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttendanceSummary {

    private int present;
    private int absent;
    private int halfDay;
    private int late;
    private int veryLate;
    private BigDecimal avgHours;
    private BigDecimal totalOvertime;
}
