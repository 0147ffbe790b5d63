package sp.sistemaspalacios.api_hrcore.service.attendance;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_hrcore.dto.attendance.AttendanceEvent;
import sp.sistemaspalacios.api_hrcore.dto.attendance.HoursBreakdown;
import sp.sistemaspalacios.api_hrcore.entity.attendance.ArrivalStatus;
import sp.sistemaspalacios.api_hrcore.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.api_hrcore.entity.attendance.AttendanceStatus;
import sp.sistemaspalacios.api_hrcore.entity.attendance.ClockEntry;
import sp.sistemaspalacios.api_hrcore.entity.shift.ShiftPolicy;
import sp.sistemaspalacios.api_hrcore.exception.BusinessValidationException;
import sp.sistemaspalacios.api_hrcore.exception.ConflictException;
import sp.sistemaspalacios.api_hrcore.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_hrcore.exception.ResourceNotFoundException.ResourceType;
import sp.sistemaspalacios.api_hrcore.repository.attendance.AttendanceRecordRepository;
import sp.sistemaspalacios.api_hrcore.repository.attendance.ClockEntryRepository;
import sp.sistemaspalacios.api_hrcore.repository.shift.ShiftPolicyRepository;
import sp.sistemaspalacios.api_hrcore.service.shift.ShiftResolverService;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Clock-in / clock-out state machine for an employee day:
 * no activity, open clock-in, closed day. At most one open clock entry per
 * employee and day.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttendanceWorkflowService {

    private final AttendanceRecordRepository attendanceRecordRepository;
    private final ClockEntryRepository clockEntryRepository;
    private final ShiftPolicyRepository shiftPolicyRepository;
    private final ShiftResolverService shiftResolverService;
    private final ArrivalClassifier arrivalClassifier;
    private final HoursCalculator hoursCalculator;

    @Transactional
    public AttendanceEvent clockIn(Long employeeId, LocalDateTime now, String source) {
        LocalDate today = now.toLocalDate();
        log.info("🕐 Clock-in - Employee: {}, Time: {}, Source: {}", employeeId, now, source);

        // lock the day first: the open-entry check and the new entry must not interleave
        AttendanceRecord record = attendanceRecordRepository.findForUpdate(employeeId, today).orElse(null);

        if (!findOpenEntries(employeeId, today).isEmpty()) {
            throw new ConflictException("clock_in", "Already clocked in today without clocking out.");
        }

        ShiftPolicy shift = shiftResolverService.resolveShift(employeeId, today).getShiftPolicy();

        if (record == null) {
            record = new AttendanceRecord();
            record.setEmployeeId(employeeId);
            record.setAttendanceDate(today);
            record.setStatus(AttendanceStatus.PRESENT);
            record.setShiftPolicyId(shift != null ? shift.getId() : null);
            record.setFirstClockIn(now);
            record.setSource(source);
            record.touch(now);
            record = saveNewRecord(record);
        }

        ArrivalStatus arrival;
        if (record.getFirstClockIn() == null || record.getFirstClockIn().equals(now)) {
            // first clock-in of the day
            arrival = arrivalClassifier.classify(now, shift);
            record.setFirstClockIn(now);
            record.setArrivalStatus(arrival);
            record.setStatus(AttendanceStatus.PRESENT);

            if (arrivalClassifier.exceedsHalfDayPenalty(now, shift)) {
                log.warn("⚠️ Employee {} arrived more than two hours late, day marked half_day", employeeId);
                record.setStatus(AttendanceStatus.HALF_DAY);
            }
            record.touch(now);
            record = attendanceRecordRepository.save(record);
        } else {
            arrival = record.getArrivalStatus();
        }

        ClockEntry entry = new ClockEntry();
        entry.setEmployeeId(employeeId);
        entry.setAttendanceRecordId(record.getId());
        entry.setClockIn(now);
        entry.setSource(source);
        entry = clockEntryRepository.save(entry);

        log.info("✅ Clock-in registered - Record: {}, Arrival: {}, Status: {}",
                record.getId(), arrival, record.getStatus());

        return AttendanceEvent.builder()
                .clockEntryId(entry.getId())
                .attendanceId(record.getId())
                .timestamp(now)
                .status(record.getStatus())
                .arrivalStatus(arrival)
                .build();
    }

    @Transactional
    public AttendanceEvent clockOut(Long employeeId, LocalDateTime now, String source) {
        LocalDate today = now.toLocalDate();
        log.info("🕔 Clock-out - Employee: {}, Time: {}, Source: {}", employeeId, now, source);

        AttendanceRecord record = attendanceRecordRepository.findForUpdate(employeeId, today).orElse(null);

        List<ClockEntry> openEntries = findOpenEntries(employeeId, today);
        if (openEntries.isEmpty()) {
            throw new BusinessValidationException("clock_out",
                    "No open clock-in found for today. Please clock in first.");
        }
        if (record == null) {
            throw new ResourceNotFoundException(ResourceType.ATTENDANCE_RECORD, employeeId + "/" + today);
        }

        ClockEntry entry = openEntries.get(0);
        entry.setClockOut(now);
        entry.setDurationMinutes((int) Duration.between(entry.getClockIn(), now).toMinutes());
        clockEntryRepository.save(entry);

        record.setLastClockOut(now);

        ShiftPolicy shift = record.getShiftPolicyId() != null
                ? shiftPolicyRepository.findById(record.getShiftPolicyId()).orElse(null)
                : null;
        if (shift == null) {
            shift = shiftResolverService.resolveShift(employeeId, today).getShiftPolicy();
        }

        if (record.getFirstClockIn() != null) {
            HoursBreakdown hours = hoursCalculator.compute(record.getFirstClockIn(), now, shift);
            record.setTotalWorkMinutes(hoursCalculator.toMinutes(hours.getTotalHours()));
            record.setEffectiveWorkMinutes(hoursCalculator.toMinutes(hours.getEffectiveHours()));
            record.setOvertimeMinutes(hoursCalculator.toMinutes(hours.getOvertimeHours()));

            // a late-arrival half day is only overridden by an absent result
            if (record.getStatus() != AttendanceStatus.HALF_DAY || hours.getStatus() == AttendanceStatus.ABSENT) {
                record.setStatus(hours.getStatus());
            }
            log.info("📊 Hours - Total: {}, Effective: {}, Overtime: {}, Status: {}",
                    hours.getTotalHours(), hours.getEffectiveHours(), hours.getOvertimeHours(), record.getStatus());
        }

        record.touch(now);
        record = attendanceRecordRepository.save(record);

        return AttendanceEvent.builder()
                .clockEntryId(entry.getId())
                .attendanceId(record.getId())
                .timestamp(now)
                .status(record.getStatus())
                .arrivalStatus(record.getArrivalStatus())
                .build();
    }

    private List<ClockEntry> findOpenEntries(Long employeeId, LocalDate day) {
        return clockEntryRepository.findOpenEntriesForDay(employeeId,
                day.atStartOfDay(), day.plusDays(1).atStartOfDay());
    }

    // unique (employee, date) guards against a concurrent first clock-in
    private AttendanceRecord saveNewRecord(AttendanceRecord record) {
        try {
            return attendanceRecordRepository.saveAndFlush(record);
        } catch (DataIntegrityViolationException e) {
            log.warn("⚠️ Concurrent attendance insert for employee {} on {}: {}",
                    record.getEmployeeId(), record.getAttendanceDate(), e.getMostSpecificCause().getMessage());
            throw new ConflictException("clock_in",
                    "Attendance for " + record.getAttendanceDate() + " is being recorded concurrently.");
        }
    }
}
