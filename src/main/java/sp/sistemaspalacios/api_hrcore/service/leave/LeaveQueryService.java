package sp.sistemaspalacios.api_hrcore.service.leave;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_hrcore.dto.leave.LeaveCalendarEntry;
import sp.sistemaspalacios.api_hrcore.dto.leave.LeaveCalendarView;
import sp.sistemaspalacios.api_hrcore.entity.employee.Employee;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveRequest;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveStatus;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveType;
import sp.sistemaspalacios.api_hrcore.exception.BusinessValidationException;
import sp.sistemaspalacios.api_hrcore.repository.employee.EmployeeRepository;
import sp.sistemaspalacios.api_hrcore.repository.leave.LeaveRequestRepository;
import sp.sistemaspalacios.api_hrcore.repository.leave.LeaveTypeRepository;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only leave views: the leave type catalogue and the team calendar.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeaveQueryService {

    private static final Set<LeaveStatus> CALENDAR_STATUSES = EnumSet.of(LeaveStatus.PENDING, LeaveStatus.APPROVED);

    private final LeaveTypeRepository leaveTypeRepository;
    private final LeaveRequestRepository leaveRequestRepository;
    private final EmployeeRepository employeeRepository;

    @Transactional(readOnly = true)
    public List<LeaveType> listLeaveTypes() {
        return leaveTypeRepository.findByIsActiveTrueOrderByNameAsc();
    }

    /**
     * Pending and approved requests of active employees overlapping the month,
     * optionally narrowed to a department and/or location, ordered by start date.
     */
    @Transactional(readOnly = true)
    public LeaveCalendarView getCalendar(int year, int month, Long departmentId, Long locationId) {
        if (month < 1 || month > 12) {
            throw new BusinessValidationException("month", "Month must be between 1 and 12.");
        }
        YearMonth period = YearMonth.of(year, month);
        LocalDate monthStart = period.atDay(1);
        LocalDate monthEnd = period.atEndOfMonth();

        Map<Long, Employee> employees = employeeRepository.findActiveByDepartmentAndLocation(departmentId, locationId)
                .stream()
                .collect(Collectors.toMap(Employee::getId, Function.identity()));
        if (employees.isEmpty()) {
            return new LeaveCalendarView(month, year, List.of(), 0);
        }

        List<LeaveRequest> requests = leaveRequestRepository.findOverlappingForEmployees(
                employees.keySet(), CALENDAR_STATUSES, monthStart, monthEnd);

        Map<Long, LeaveType> types = leaveTypeRepository.findAllById(requests.stream()
                        .map(LeaveRequest::getLeaveTypeId)
                        .collect(Collectors.toSet()))
                .stream()
                .collect(Collectors.toMap(LeaveType::getId, Function.identity()));

        List<LeaveCalendarEntry> entries = requests.stream()
                .map(r -> toEntry(r, employees.get(r.getEmployeeId()), types.get(r.getLeaveTypeId())))
                .collect(Collectors.toList());

        log.info("📅 Leave calendar {} - Department: {}, Location: {}, Entries: {}",
                period, departmentId, locationId, entries.size());
        return new LeaveCalendarView(month, year, entries, entries.size());
    }

    private LeaveCalendarEntry toEntry(LeaveRequest request, Employee employee, LeaveType type) {
        return LeaveCalendarEntry.builder()
                .leaveRequestId(request.getId())
                .employeeId(request.getEmployeeId())
                .employeeName(employee != null ? employee.getDisplayName() : null)
                .departmentId(employee != null ? employee.getDepartmentId() : null)
                .leaveTypeId(request.getLeaveTypeId())
                .leaveTypeCode(type != null ? type.getCode() : null)
                .leaveTypeName(type != null ? type.getName() : null)
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .totalDays(request.getTotalDays())
                .status(request.getStatus())
                .dayDetails(request.getDayDetails())
                .build();
    }
}
