package sp.sistemaspalacios.api_hrcore.service.attendance;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_hrcore.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.api_hrcore.entity.attendance.AttendanceRegularization;
import sp.sistemaspalacios.api_hrcore.entity.attendance.AttendanceStatus;
import sp.sistemaspalacios.api_hrcore.entity.attendance.RegularizationStatus;
import sp.sistemaspalacios.api_hrcore.entity.auth.Capability;
import sp.sistemaspalacios.api_hrcore.entity.employee.Employee;
import sp.sistemaspalacios.api_hrcore.entity.shift.ShiftPolicy;
import sp.sistemaspalacios.api_hrcore.exception.BusinessValidationException;
import sp.sistemaspalacios.api_hrcore.exception.ConflictException;
import sp.sistemaspalacios.api_hrcore.exception.ForbiddenException;
import sp.sistemaspalacios.api_hrcore.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_hrcore.exception.ResourceNotFoundException.ResourceType;
import sp.sistemaspalacios.api_hrcore.repository.attendance.AttendanceRecordRepository;
import sp.sistemaspalacios.api_hrcore.repository.attendance.AttendanceRegularizationRepository;
import sp.sistemaspalacios.api_hrcore.repository.employee.EmployeeRepository;
import sp.sistemaspalacios.api_hrcore.service.auth.ApprovalAuthorityService;
import sp.sistemaspalacios.api_hrcore.service.notification.NotificationKind;
import sp.sistemaspalacios.api_hrcore.service.notification.NotificationService;
import sp.sistemaspalacios.api_hrcore.service.shift.ShiftResolverService;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Retroactive corrections of past attendance days.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegularizationService {

    private final AttendanceRegularizationRepository regularizationRepository;
    private final AttendanceRecordRepository attendanceRecordRepository;
    private final EmployeeRepository employeeRepository;
    private final ShiftResolverService shiftResolverService;
    private final ApprovalAuthorityService approvalAuthorityService;
    private final NotificationService notificationService;
    private final Clock clock;

    @Transactional
    public AttendanceRegularization submit(Long employeeId, LocalDate date,
                                           AttendanceStatus requestedStatus, String reason) {
        LocalDate today = LocalDate.now(clock);
        if (!date.isBefore(today)) {
            throw new BusinessValidationException("date", "Regularization can only be submitted for past dates.");
        }

        AttendanceRecord record = attendanceRecordRepository.findByEmployeeIdAndAttendanceDate(employeeId, date)
                .orElseGet(() -> createAbsentRecord(employeeId, date));

        if (regularizationRepository.existsByAttendanceRecordIdAndEmployeeIdAndStatus(
                record.getId(), employeeId, RegularizationStatus.PENDING)) {
            throw new ConflictException("regularization", "Pending regularization already exists for " + date);
        }

        AttendanceRegularization regularization = new AttendanceRegularization();
        regularization.setAttendanceRecordId(record.getId());
        regularization.setEmployeeId(employeeId);
        regularization.setRequestedStatus(requestedStatus != null ? requestedStatus : AttendanceStatus.PRESENT);
        regularization.setReason(reason);
        regularization.setStatus(RegularizationStatus.PENDING);
        regularization.touch(LocalDateTime.now(clock));
        regularization = regularizationRepository.save(regularization);

        log.info("📝 Regularization {} submitted - Employee: {}, Date: {}, Requested: {}",
                regularization.getId(), employeeId, date, regularization.getRequestedStatus());

        Long managerId = employeeRepository.findById(employeeId)
                .map(Employee::getReportingManagerId)
                .orElse(null);
        notificationService.notify(managerId, NotificationKind.REGULARIZATION_REQUESTED,
                payload(regularization, date));
        return regularization;
    }

    @Transactional
    public AttendanceRegularization approve(Long regularizationId, Long actorId) {
        AttendanceRegularization regularization = findPending(regularizationId, actorId);
        LocalDateTime now = LocalDateTime.now(clock);

        regularization.setStatus(RegularizationStatus.APPROVED);
        regularization.setReviewedBy(actorId);
        regularization.setReviewedAt(now);
        regularization.touch(now);

        AttendanceRecord record = attendanceRecordRepository.findById(regularization.getAttendanceRecordId())
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.ATTENDANCE_RECORD,
                        regularization.getAttendanceRecordId()));
        record.setStatus(regularization.getRequestedStatus());
        record.setIsRegularized(true);
        record.touch(now);
        attendanceRecordRepository.save(record);

        AttendanceRegularization saved = regularizationRepository.save(regularization);
        log.info("✅ Regularization {} approved by {}; record {} is now {}",
                regularizationId, actorId, record.getId(), record.getStatus());

        notificationService.notify(saved.getEmployeeId(), NotificationKind.REGULARIZATION_DECIDED,
                payload(saved, record.getAttendanceDate()));
        return saved;
    }

    @Transactional
    public AttendanceRegularization reject(Long regularizationId, Long actorId, String remarks) {
        AttendanceRegularization regularization = findPending(regularizationId, actorId);
        LocalDateTime now = LocalDateTime.now(clock);

        regularization.setStatus(RegularizationStatus.REJECTED);
        regularization.setReviewedBy(actorId);
        regularization.setReviewedAt(now);
        regularization.touch(now);
        regularization.setReviewerRemarks(remarks);
        AttendanceRegularization saved = regularizationRepository.save(regularization);
        log.info("❌ Regularization {} rejected by {}", regularizationId, actorId);

        Map<String, Object> payload = payload(saved, null);
        payload.put("remarks", remarks);
        notificationService.notify(saved.getEmployeeId(), NotificationKind.REGULARIZATION_DECIDED, payload);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<AttendanceRegularization> list(Long employeeId, RegularizationStatus status) {
        return regularizationRepository.search(employeeId, status);
    }

    private AttendanceRecord createAbsentRecord(Long employeeId, LocalDate date) {
        ShiftPolicy shift = shiftResolverService.resolveShift(employeeId, date).getShiftPolicy();

        AttendanceRecord record = new AttendanceRecord();
        record.setEmployeeId(employeeId);
        record.setAttendanceDate(date);
        record.setStatus(AttendanceStatus.ABSENT);
        record.setShiftPolicyId(shift != null ? shift.getId() : null);
        record.setSource("regularization");
        record.touch(LocalDateTime.now(clock));
        return attendanceRecordRepository.save(record);
    }

    private void requireApprover(Long actorId) {
        if (!approvalAuthorityService.hasCapability(actorId, Capability.ATTENDANCE_REGULARIZE_APPROVE)) {
            throw new ForbiddenException("You are not authorized to review regularizations.");
        }
    }

    private AttendanceRegularization findPending(Long regularizationId, Long actorId) {
        AttendanceRegularization regularization = regularizationRepository.findById(regularizationId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.REGULARIZATION, regularizationId));
        requireApprover(actorId);
        if (regularization.getStatus() != RegularizationStatus.PENDING) {
            throw new BusinessValidationException("status",
                    "Regularization is already " + regularization.getStatus().getValue() + ".");
        }
        return regularization;
    }

    private Map<String, Object> payload(AttendanceRegularization regularization, LocalDate date) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("regularizationId", regularization.getId());
        payload.put("employeeId", regularization.getEmployeeId());
        if (date != null) {
            payload.put("date", date.toString());
        }
        payload.put("requestedStatus", regularization.getRequestedStatus().getValue());
        payload.put("status", regularization.getStatus().getValue());
        return payload;
    }
}
