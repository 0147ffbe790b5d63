package sp.sistemaspalacios.api_hrcore.dto.leave;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaveCalendarEntry {

    private Long leaveRequestId;
    private Long employeeId;
    private String employeeName;
    private Long departmentId;
    private Long leaveTypeId;
    private String leaveTypeCode;
    private String leaveTypeName;
    private LocalDate startDate;
    private LocalDate endDate;
    private BigDecimal totalDays;
    private LeaveStatus status;
    private Map<String, String> dayDetails;
}
