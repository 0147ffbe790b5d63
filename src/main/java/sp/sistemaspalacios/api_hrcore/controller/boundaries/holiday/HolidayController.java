package sp.sistemaspalacios.api_hrcore.controller.boundaries.holiday;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_hrcore.entity.boundaries.holiday.Holiday;
import sp.sistemaspalacios.api_hrcore.service.boundaries.holiday.HolidayLookupService;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

@RestController
@RequestMapping("/api/holidays")
public class HolidayController {

    private final HolidayLookupService holidayLookupService;

    public HolidayController(HolidayLookupService holidayLookupService) {
        this.holidayLookupService = holidayLookupService;
    }

    // Festivos de calendarios activos, opcionalmente por anio y sede
    @GetMapping
    public List<Holiday> listHolidays(@RequestParam(value = "year", required = false) Integer year,
                                      @RequestParam(value = "locationId", required = false) Long locationId) {
        return holidayLookupService.listHolidays(year, locationId);
    }

    // Fechas festivas obligatorias que aplican a un empleado
    @GetMapping("/dates")
    public Set<LocalDate> holidayDates(@RequestParam("employeeId") Long employeeId,
                                       @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                       @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return new TreeSet<>(holidayLookupService.holidayDates(employeeId, from, to));
    }
}
