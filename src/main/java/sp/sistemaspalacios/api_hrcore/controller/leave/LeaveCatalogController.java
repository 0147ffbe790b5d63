package sp.sistemaspalacios.api_hrcore.controller.leave;

import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_hrcore.dto.leave.LeaveCalendarView;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveType;
import sp.sistemaspalacios.api_hrcore.service.leave.LeaveQueryService;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/leave")
public class LeaveCatalogController {

    private final LeaveQueryService leaveQueryService;
    private final Clock clock;

    public LeaveCatalogController(LeaveQueryService leaveQueryService, Clock clock) {
        this.leaveQueryService = leaveQueryService;
        this.clock = clock;
    }

    // Tipos de permiso activos
    @GetMapping("/types")
    public List<LeaveType> leaveTypes() {
        return leaveQueryService.listLeaveTypes();
    }

    // Calendario del equipo (por defecto el mes actual)
    @GetMapping("/calendar")
    public LeaveCalendarView calendar(@RequestParam(value = "year", required = false) Integer year,
                                      @RequestParam(value = "month", required = false) Integer month,
                                      @RequestParam(value = "departmentId", required = false) Long departmentId,
                                      @RequestParam(value = "locationId", required = false) Long locationId) {
        LocalDate today = LocalDate.now(clock);
        return leaveQueryService.getCalendar(year != null ? year : today.getYear(),
                month != null ? month : today.getMonthValue(), departmentId, locationId);
    }
}
