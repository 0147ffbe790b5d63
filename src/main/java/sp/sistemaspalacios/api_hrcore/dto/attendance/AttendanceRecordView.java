package sp.sistemaspalacios.api_hrcore.dto.attendance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_hrcore.entity.attendance.ArrivalStatus;
import sp.sistemaspalacios.api_hrcore.entity.attendance.AttendanceStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttendanceRecordView {

    private Long id;
    private Long employeeId;
    private LocalDate date;
    private LocalDateTime firstClockIn;
    private LocalDateTime lastClockOut;
    private BigDecimal totalHours;
    private BigDecimal effectiveHours;
    private BigDecimal overtimeHours;
    private AttendanceStatus status;
    private ArrivalStatus arrivalStatus;
    private Long shiftPolicyId;
    private String shiftName;
    private Boolean isRegularized;
    private String source;
    private String remarks;
    // only filled for single-day lookups
    private List<ClockEntryView> clockEntries;
}
