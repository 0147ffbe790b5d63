package sp.sistemaspalacios.api_hrcore.service.attendance;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_hrcore.dto.attendance.AttendanceRangeResponse;
import sp.sistemaspalacios.api_hrcore.dto.attendance.AttendanceRecordView;
import sp.sistemaspalacios.api_hrcore.dto.attendance.AttendanceSummary;
import sp.sistemaspalacios.api_hrcore.dto.attendance.ClockEntryView;
import sp.sistemaspalacios.api_hrcore.entity.attendance.ArrivalStatus;
import sp.sistemaspalacios.api_hrcore.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.api_hrcore.entity.employee.Employee;
import sp.sistemaspalacios.api_hrcore.entity.shift.ShiftPolicy;
import sp.sistemaspalacios.api_hrcore.exception.BusinessValidationException;
import sp.sistemaspalacios.api_hrcore.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_hrcore.exception.ResourceNotFoundException.ResourceType;
import sp.sistemaspalacios.api_hrcore.repository.attendance.AttendanceRecordRepository;
import sp.sistemaspalacios.api_hrcore.repository.attendance.ClockEntryRepository;
import sp.sistemaspalacios.api_hrcore.repository.employee.EmployeeRepository;
import sp.sistemaspalacios.api_hrcore.repository.shift.ShiftPolicyRepository;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class AttendanceQueryService {

    private static final BigDecimal SIXTY = new BigDecimal("60");

    private final AttendanceRecordRepository attendanceRecordRepository;
    private final ClockEntryRepository clockEntryRepository;
    private final ShiftPolicyRepository shiftPolicyRepository;
    private final EmployeeRepository employeeRepository;

    @Value("${hrcore.attendance.max-range-days:90}")
    private int maxRangeDays = 90;

    @Transactional(readOnly = true)
    public AttendanceRangeResponse getAttendance(Long employeeId, LocalDate fromDate, LocalDate toDate) {
        validateRange(fromDate, toDate);

        List<AttendanceRecord> records = attendanceRecordRepository
                .findByEmployeeIdAndAttendanceDateBetweenOrderByAttendanceDateDesc(employeeId, fromDate, toDate);
        return toRangeResponse(records);
    }

    /**
     * Attendance of the manager's active direct reports in the range, latest
     * day first, with a summary over all of them.
     */
    @Transactional(readOnly = true)
    public AttendanceRangeResponse getTeamAttendance(Long managerId, LocalDate fromDate, LocalDate toDate) {
        validateRange(fromDate, toDate);

        List<Long> reportIds = employeeRepository.findByReportingManagerIdAndIsActiveTrue(managerId).stream()
                .map(Employee::getId)
                .collect(Collectors.toList());
        if (reportIds.isEmpty()) {
            log.debug("Manager {} has no active direct reports", managerId);
            return new AttendanceRangeResponse(List.of(), summarize(List.of()));
        }

        List<AttendanceRecord> records = attendanceRecordRepository
                .findByEmployeeIdInAndAttendanceDateBetweenOrderByAttendanceDateDescEmployeeIdAsc(
                        reportIds, fromDate, toDate);
        log.info("👥 Team attendance - Manager: {}, Reports: {}, Records: {}",
                managerId, reportIds.size(), records.size());
        return toRangeResponse(records);
    }

    private AttendanceRangeResponse toRangeResponse(List<AttendanceRecord> records) {
        Map<Long, ShiftPolicy> shifts = shiftPolicyRepository.findAllById(records.stream()
                        .map(AttendanceRecord::getShiftPolicyId)
                        .filter(id -> id != null)
                        .collect(Collectors.toSet()))
                .stream()
                .collect(Collectors.toMap(ShiftPolicy::getId, Function.identity()));

        List<AttendanceRecordView> data = records.stream()
                .map(r -> toView(r, shifts.get(r.getShiftPolicyId())))
                .collect(Collectors.toList());

        return new AttendanceRangeResponse(data, summarize(records));
    }

    @Transactional(readOnly = true)
    public AttendanceRecordView getDay(Long employeeId, LocalDate date) {
        AttendanceRecord record = attendanceRecordRepository.findByEmployeeIdAndAttendanceDate(employeeId, date)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.ATTENDANCE_RECORD,
                        employeeId + "/" + date));

        ShiftPolicy shift = record.getShiftPolicyId() != null
                ? shiftPolicyRepository.findById(record.getShiftPolicyId()).orElse(null)
                : null;

        AttendanceRecordView view = toView(record, shift);
        view.setClockEntries(clockEntryRepository.findByAttendanceRecordIdOrderByClockInAsc(record.getId())
                .stream()
                .map(e -> new ClockEntryView(e.getId(), e.getClockIn(), e.getClockOut(),
                        e.getDurationMinutes(), e.getSource()))
                .collect(Collectors.toList()));
        return view;
    }

    public AttendanceSummary summarize(List<AttendanceRecord> records) {
        int present = 0;
        int absent = 0;
        int halfDay = 0;
        int late = 0;
        int veryLate = 0;
        long effectiveMinutes = 0;
        int withHours = 0;
        long overtimeMinutes = 0;

        for (AttendanceRecord r : records) {
            if (r.getStatus() != null) {
                switch (r.getStatus()) {
                    case PRESENT:
                        present++;
                        break;
                    case ABSENT:
                        absent++;
                        break;
                    case HALF_DAY:
                        halfDay++;
                        break;
                    default:
                        break;
                }
            }
            if (r.getArrivalStatus() == ArrivalStatus.LATE) {
                late++;
            } else if (r.getArrivalStatus() == ArrivalStatus.VERY_LATE) {
                veryLate++;
            }
            if (r.getEffectiveWorkMinutes() != null) {
                effectiveMinutes += r.getEffectiveWorkMinutes();
                withHours++;
            }
            if (r.getOvertimeMinutes() != null) {
                overtimeMinutes += r.getOvertimeMinutes();
            }
        }

        BigDecimal avgHours = withHours == 0
                ? BigDecimal.ZERO.setScale(2)
                : BigDecimal.valueOf(effectiveMinutes)
                        .divide(SIXTY.multiply(BigDecimal.valueOf(withHours)), 2, RoundingMode.HALF_UP);

        return AttendanceSummary.builder()
                .present(present)
                .absent(absent)
                .halfDay(halfDay)
                .late(late)
                .veryLate(veryLate)
                .avgHours(avgHours)
                .totalOvertime(toHours(overtimeMinutes))
                .build();
    }

    private void validateRange(LocalDate fromDate, LocalDate toDate) {
        if (fromDate.isAfter(toDate)) {
            throw new BusinessValidationException("date_range", "from_date must be before or equal to to_date.");
        }
        if (ChronoUnit.DAYS.between(fromDate, toDate) > maxRangeDays) {
            throw new BusinessValidationException("date_range",
                    "Date range cannot exceed " + maxRangeDays + " days.");
        }
    }

    private AttendanceRecordView toView(AttendanceRecord r, ShiftPolicy shift) {
        return AttendanceRecordView.builder()
                .id(r.getId())
                .employeeId(r.getEmployeeId())
                .date(r.getAttendanceDate())
                .firstClockIn(r.getFirstClockIn())
                .lastClockOut(r.getLastClockOut())
                .totalHours(r.getTotalWorkMinutes() != null ? toHours(r.getTotalWorkMinutes()) : null)
                .effectiveHours(r.getEffectiveWorkMinutes() != null ? toHours(r.getEffectiveWorkMinutes()) : null)
                .overtimeHours(r.getOvertimeMinutes() != null ? toHours(r.getOvertimeMinutes()) : BigDecimal.ZERO)
                .status(r.getStatus())
                .arrivalStatus(r.getArrivalStatus())
                .shiftPolicyId(r.getShiftPolicyId())
                .shiftName(shift != null ? shift.getName() : null)
                .isRegularized(r.getIsRegularized())
                .source(r.getSource())
                .remarks(r.getRemarks())
                .build();
    }

    private BigDecimal toHours(long minutes) {
        return BigDecimal.valueOf(minutes).divide(SIXTY, 2, RoundingMode.HALF_UP);
    }
}
