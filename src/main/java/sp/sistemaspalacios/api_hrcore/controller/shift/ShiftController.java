package sp.sistemaspalacios.api_hrcore.controller.shift;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_hrcore.dto.shift.ResolvedShift;
import sp.sistemaspalacios.api_hrcore.entity.shift.ShiftPolicy;
import sp.sistemaspalacios.api_hrcore.service.shift.ShiftResolverService;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/api/shifts")
public class ShiftController {

    private final ShiftResolverService shiftResolverService;

    public ShiftController(ShiftResolverService shiftResolverService) {
        this.shiftResolverService = shiftResolverService;
    }

    @GetMapping
    public List<ShiftPolicy> listShiftPolicies(
            @RequestParam(value = "activeOnly", defaultValue = "true") boolean activeOnly) {
        return shiftResolverService.listShiftPolicies(activeOnly);
    }

    // Turno vigente de un empleado en una fecha
    @GetMapping("/resolve")
    public ResolvedShift resolve(@RequestParam("employeeId") Long employeeId,
                                 @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return shiftResolverService.resolveShift(employeeId, date);
    }

    @GetMapping("/weekly-offs")
    public Set<DayOfWeek> weeklyOffs(@RequestParam("employeeId") Long employeeId,
                                     @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return shiftResolverService.weeklyOffDays(employeeId, date);
    }
}
