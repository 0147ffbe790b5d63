package sp.sistemaspalacios.api_hrcore.dto.attendance;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClockEntryView {

    private Long id;
    private LocalDateTime clockIn;
    private LocalDateTime clockOut;
    private Integer durationMinutes;
    private String source;
}
