package sp.sistemaspalacios.api_hrcore.service.boundaries.holiday;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_hrcore.entity.boundaries.holiday.Holiday;
import sp.sistemaspalacios.api_hrcore.entity.employee.Employee;
import sp.sistemaspalacios.api_hrcore.repository.boundaries.holiday.HolidayRepository;
import sp.sistemaspalacios.api_hrcore.repository.employee.EmployeeRepository;

import java.time.LocalDate;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class HolidayLookupService {

    private final HolidayRepository holidayRepository;
    private final EmployeeRepository employeeRepository;

    /**
     * Mandatory holiday dates in [from, to] for the employee's location. Global
     * calendars (no location) always apply; optional holidays never do.
     */
    @Transactional(readOnly = true)
    public Set<LocalDate> holidayDates(Long employeeId, LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            return Collections.emptySet();
        }
        Long locationId = employeeRepository.findById(employeeId)
                .map(Employee::getLocationId)
                .orElse(null);

        List<LocalDate> dates = locationId != null
                ? holidayRepository.findMandatoryDatesForLocation(locationId, from, to)
                : holidayRepository.findMandatoryGlobalDates(from, to);

        log.debug("Holidays for employee {} (location {}) in {}..{}: {}", employeeId, locationId, from, to, dates);
        return new HashSet<>(dates);
    }

    @Transactional(readOnly = true)
    public List<Holiday> listHolidays(Integer year, Long locationId) {
        return holidayRepository.findActiveHolidays(year, locationId);
    }
}
