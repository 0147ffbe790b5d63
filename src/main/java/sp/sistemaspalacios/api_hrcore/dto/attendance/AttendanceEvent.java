package sp.sistemaspalacios.api_hrcore.dto.attendance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_hrcore.entity.attendance.ArrivalStatus;
import sp.sistemaspalacios.api_hrcore.entity.attendance.AttendanceStatus;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttendanceEvent {

    private Long clockEntryId;
    private Long attendanceId;
    private LocalDateTime timestamp;
    private AttendanceStatus status;
    private ArrivalStatus arrivalStatus;
}
