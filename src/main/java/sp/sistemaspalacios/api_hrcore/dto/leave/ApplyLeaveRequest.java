package sp.sistemaspalacios.api_hrcore.dto.leave;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveDayType;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApplyLeaveRequest {

    @NotNull
    private Long leaveTypeId;

    @NotNull
    private LocalDate fromDate;

    @NotNull
    private LocalDate toDate;

    // half-day overrides; dates without an entry are full days
    private Map<LocalDate, LeaveDayType> dayDetails = new LinkedHashMap<>();

    @Size(max = 1000)
    private String reason;
}
