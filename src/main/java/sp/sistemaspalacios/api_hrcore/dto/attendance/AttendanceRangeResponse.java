package sp.sistemaspalacios.api_hrcore.dto.attendance;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AttendanceRangeResponse {

    private List<AttendanceRecordView> data;
    private AttendanceSummary summary;
}
