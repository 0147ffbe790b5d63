package sp.sistemaspalacios.api_hrcore.dto.attendance;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import sp.sistemaspalacios.api_hrcore.entity.attendance.AttendanceStatus;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegularizationSubmitRequest {

    @NotNull
    private LocalDate date;

    // defaults to present
    private AttendanceStatus requestedStatus;

    @NotBlank
    @Size(max = 1000)
    private String reason;
}
