package sp.sistemaspalacios.api_hrcore.dto.leave;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LeaveCalendarView {

    private int month;
    private int year;
    private List<LeaveCalendarEntry> entries;
    private int totalEntries;
}
