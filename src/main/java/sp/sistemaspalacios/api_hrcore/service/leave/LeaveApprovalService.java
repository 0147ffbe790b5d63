package sp.sistemaspalacios.api_hrcore.service.leave;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_hrcore.dto.leave.ApplyLeaveRequest;
import sp.sistemaspalacios.api_hrcore.dto.leave.LeaveDayCount;
import sp.sistemaspalacios.api_hrcore.entity.employee.Employee;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveBalance;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveDayType;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveRequest;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveStatus;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveType;
import sp.sistemaspalacios.api_hrcore.exception.BusinessValidationException;
import sp.sistemaspalacios.api_hrcore.exception.ForbiddenException;
import sp.sistemaspalacios.api_hrcore.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_hrcore.exception.ResourceNotFoundException.ResourceType;
import sp.sistemaspalacios.api_hrcore.repository.employee.EmployeeRepository;
import sp.sistemaspalacios.api_hrcore.repository.leave.LeaveRequestRepository;
import sp.sistemaspalacios.api_hrcore.repository.leave.LeaveTypeRepository;
import sp.sistemaspalacios.api_hrcore.service.auth.ApprovalAuthorityService;
import sp.sistemaspalacios.api_hrcore.service.boundaries.holiday.HolidayLookupService;
import sp.sistemaspalacios.api_hrcore.service.notification.NotificationKind;
import sp.sistemaspalacios.api_hrcore.service.notification.NotificationService;
import sp.sistemaspalacios.api_hrcore.service.shift.ShiftResolverService;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Leave request lifecycle.
 * <pre>
 * pending  -> approved | rejected | cancelled
 * approved -> cancelled
 * </pre>
 * Every guard runs before any mutation; status and balance change in the same
 * transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeaveApprovalService {

    private static final Set<LeaveStatus> BLOCKING_STATUSES = EnumSet.of(LeaveStatus.PENDING, LeaveStatus.APPROVED);

    private final LeaveRequestRepository leaveRequestRepository;
    private final LeaveTypeRepository leaveTypeRepository;
    private final EmployeeRepository employeeRepository;
    private final ShiftResolverService shiftResolverService;
    private final HolidayLookupService holidayLookupService;
    private final LeaveDayCounter leaveDayCounter;
    private final LeaveLedgerService leaveLedgerService;
    private final ApprovalAuthorityService approvalAuthorityService;
    private final NotificationService notificationService;
    private final Clock clock;

    // ==========================================
    // Apply
    // ==========================================

    @Transactional
    public LeaveRequest apply(Long employeeId, ApplyLeaveRequest command) {
        LocalDate today = LocalDate.now(clock);
        LocalDate fromDate = command.getFromDate();
        LocalDate toDate = command.getToDate();

        log.info("📝 Leave application - Employee: {}, Type: {}, {} -> {}",
                employeeId, command.getLeaveTypeId(), fromDate, toDate);

        Employee employee = activeEmployee(employeeId);
        LeaveType leaveType = activeLeaveType(command.getLeaveTypeId());

        if (leaveType.getApplicableGender() != null && employee.getGender() != null
                && leaveType.getApplicableGender() != employee.getGender()) {
            throw new BusinessValidationException("leave_type_id",
                    leaveType.getName() + " is only applicable for "
                            + leaveType.getApplicableGender().getValue() + " employees.");
        }

        if (leaveType.getMinDaysNotice() != null && leaveType.getMinDaysNotice() > 0) {
            long daysAhead = ChronoUnit.DAYS.between(today, fromDate);
            if (daysAhead < leaveType.getMinDaysNotice()) {
                throw new BusinessValidationException("from_date",
                        leaveType.getName() + " requires at least "
                                + leaveType.getMinDaysNotice() + " days advance notice.");
            }
        }

        if (fromDate.isAfter(toDate)) {
            throw new BusinessValidationException("dates", "from_date must be before or equal to to_date.");
        }

        LeaveDayCount count = countDays(employeeId, leaveType, fromDate, toDate, command.getDayDetails());
        BigDecimal totalDays = count.getTotalDays();

        if (totalDays.signum() <= 0) {
            throw new BusinessValidationException("dates",
                    "No leave days found in the selected range (all days may be weekends or holidays).");
        }

        Integer maxConsecutive = leaveType.getMaxConsecutiveDays();
        if (maxConsecutive != null && maxConsecutive > 0 && totalDays.compareTo(BigDecimal.valueOf(maxConsecutive)) > 0) {
            throw new BusinessValidationException("dates",
                    leaveType.getName() + " allows a maximum of " + maxConsecutive + " consecutive days.");
        }

        if (leaveRequestRepository.countOverlapping(employeeId, BLOCKING_STATUSES, fromDate, toDate) > 0) {
            throw new BusinessValidationException("dates",
                    "You already have a pending or approved leave request overlapping with these dates.");
        }

        int year = fromDate.getYear();
        LeaveBalance balance = leaveLedgerService.findBalance(employeeId, leaveType.getId(), year)
                .orElseThrow(() -> new BusinessValidationException("leave_type_id",
                        "No leave balance found for " + leaveType.getName() + " in " + year + ". Please contact HR."));

        BigDecimal available = leaveLedgerService.available(balance);
        if (totalDays.compareTo(available) > 0) {
            throw new BusinessValidationException("balance",
                    "Insufficient " + leaveType.getName() + " balance. Available: "
                            + available + ", Requested: " + totalDays + ".");
        }

        LeaveRequest request = LeaveRequest.builder()
                .employeeId(employeeId)
                .leaveTypeId(leaveType.getId())
                .startDate(fromDate)
                .endDate(toDate)
                .dayDetails(count.toDayDetails())
                .totalDays(totalDays)
                .reason(command.getReason())
                .status(LeaveStatus.PENDING)
                .build();

        LocalDateTime now = LocalDateTime.now(clock);
        boolean autoApproved = !Boolean.TRUE.equals(leaveType.getRequiresApproval());
        if (autoApproved) {
            request.setStatus(LeaveStatus.APPROVED);
            request.setReviewedAt(now);
        }

        request.touch(now);
        request = leaveRequestRepository.save(request);

        if (autoApproved) {
            leaveLedgerService.deductOnApproval(request);
            log.info("✅ Leave request {} auto-approved ({} day(s))", request.getId(), totalDays);
        } else {
            log.info("✅ Leave request {} created as pending ({} day(s))", request.getId(), totalDays);
            notificationService.notify(employee.getReportingManagerId(), NotificationKind.LEAVE_REQUESTED,
                    payload(request, employee));
        }
        return request;
    }

    // ==========================================
    // Decisions
    // ==========================================

    @Transactional
    public LeaveRequest approve(Long requestId, Long actorId, String remarks) {
        LeaveRequest request = findRequest(requestId);
        requirePending(request);

        Employee employee = employeeOf(request);
        if (!approvalAuthorityService.canApproveLeave(actorId, employee)) {
            throw new ForbiddenException("You are not authorized to approve this leave request.");
        }

        request.setStatus(LeaveStatus.APPROVED);
        request.setReviewedBy(actorId);
        request.setReviewedAt(LocalDateTime.now(clock));
        request.setReviewerRemarks(remarks);
        request.touch(request.getReviewedAt());
        request = leaveRequestRepository.save(request);

        leaveLedgerService.deductOnApproval(request);
        log.info("✅ Leave request {} approved by {}", requestId, actorId);

        notificationService.notify(request.getEmployeeId(), NotificationKind.LEAVE_APPROVED,
                payload(request, employee));
        return request;
    }

    @Transactional
    public LeaveRequest reject(Long requestId, Long actorId, String reason) {
        LeaveRequest request = findRequest(requestId);
        requirePending(request);

        Employee employee = employeeOf(request);
        if (!approvalAuthorityService.canRejectLeave(actorId, employee)) {
            throw new ForbiddenException("You are not authorized to reject this leave request.");
        }

        request.setStatus(LeaveStatus.REJECTED);
        request.setReviewedBy(actorId);
        request.setReviewedAt(LocalDateTime.now(clock));
        request.setReviewerRemarks(reason);
        request.touch(request.getReviewedAt());
        request = leaveRequestRepository.save(request);
        log.info("❌ Leave request {} rejected by {}", requestId, actorId);

        Map<String, Object> payload = payload(request, employee);
        payload.put("reason", reason);
        notificationService.notify(request.getEmployeeId(), NotificationKind.LEAVE_REJECTED, payload);
        return request;
    }

    @Transactional
    public LeaveRequest cancel(Long requestId, Long actorId, String reason) {
        LeaveRequest request = findRequest(requestId);

        if (!request.getEmployeeId().equals(actorId)) {
            throw new ForbiddenException("You can only cancel your own leave requests.");
        }
        if (!BLOCKING_STATUSES.contains(request.getStatus())) {
            throw new BusinessValidationException("status",
                    "Cannot cancel a leave request with status '" + request.getStatus().getValue() + "'.");
        }

        boolean wasApproved = request.getStatus() == LeaveStatus.APPROVED;

        request.setStatus(LeaveStatus.CANCELLED);
        request.setCancelledAt(LocalDateTime.now(clock));
        request.setReviewerRemarks("Cancelled by employee: " + reason);
        request.touch(request.getCancelledAt());
        request = leaveRequestRepository.save(request);

        // pending requests were never deducted
        if (wasApproved) {
            leaveLedgerService.restoreOnCancellation(request);
        }
        log.info("🚫 Leave request {} cancelled by employee (was approved: {})", requestId, wasApproved);

        Employee employee = employeeRepository.findById(request.getEmployeeId()).orElse(null);
        if (employee != null) {
            Map<String, Object> payload = payload(request, employee);
            payload.put("reason", reason);
            notificationService.notify(employee.getReportingManagerId(), NotificationKind.LEAVE_CANCELLED, payload);
        }
        return request;
    }

    // ==========================================
    // Queries
    // ==========================================

    /**
     * Day ledger the request would get, without persisting anything.
     */
    @Transactional(readOnly = true)
    public LeaveDayCount previewDays(Long employeeId, Long leaveTypeId, LocalDate fromDate, LocalDate toDate,
                                     Map<LocalDate, LeaveDayType> overrides) {
        activeEmployee(employeeId);
        LeaveType leaveType = activeLeaveType(leaveTypeId);
        return countDays(employeeId, leaveType, fromDate, toDate, overrides);
    }

    @Transactional(readOnly = true)
    public List<LeaveRequest> listRequests(Long employeeId, LeaveStatus status) {
        return status != null
                ? leaveRequestRepository.findByEmployeeIdAndStatusOrderByCreatedAtDesc(employeeId, status)
                : leaveRequestRepository.findByEmployeeIdOrderByCreatedAtDesc(employeeId);
    }

    /**
     * Pending requests of the manager's active direct reports, oldest first.
     */
    @Transactional(readOnly = true)
    public List<LeaveRequest> pendingApprovals(Long managerId) {
        List<Long> reportIds = employeeRepository.findByReportingManagerIdAndIsActiveTrue(managerId).stream()
                .map(Employee::getId)
                .collect(Collectors.toList());
        if (reportIds.isEmpty()) {
            return List.of();
        }
        return leaveRequestRepository.findByEmployeeIdInAndStatusOrderByCreatedAtAsc(reportIds, LeaveStatus.PENDING);
    }

    // ==========================================
    // Helpers
    // ==========================================

    private LeaveDayCount countDays(Long employeeId, LeaveType leaveType, LocalDate fromDate, LocalDate toDate,
                                    Map<LocalDate, LeaveDayType> overrides) {
        // weekly offs as of the first day of the range
        Set<DayOfWeek> weeklyOffs = shiftResolverService.weeklyOffDays(employeeId, fromDate);
        Set<LocalDate> holidays = holidayLookupService.holidayDates(employeeId, fromDate, toDate);
        return leaveDayCounter.count(fromDate, toDate, overrides, weeklyOffs, holidays,
                Boolean.TRUE.equals(leaveType.getSandwichApplicable()));
    }

    private Employee activeEmployee(Long employeeId) {
        return employeeRepository.findByIdAndIsActiveTrue(employeeId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.EMPLOYEE, employeeId));
    }

    private LeaveType activeLeaveType(Long leaveTypeId) {
        return leaveTypeRepository.findByIdAndIsActiveTrue(leaveTypeId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.LEAVE_TYPE, leaveTypeId));
    }

    private LeaveRequest findRequest(Long requestId) {
        return leaveRequestRepository.findById(requestId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.LEAVE_REQUEST, requestId));
    }

    private Employee employeeOf(LeaveRequest request) {
        return employeeRepository.findById(request.getEmployeeId())
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.EMPLOYEE, request.getEmployeeId()));
    }

    private void requirePending(LeaveRequest request) {
        if (request.getStatus() != LeaveStatus.PENDING) {
            throw new BusinessValidationException("status",
                    "Leave request is already " + request.getStatus().getValue() + ".");
        }
    }

    private Map<String, Object> payload(LeaveRequest request, Employee employee) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("leaveRequestId", request.getId());
        payload.put("employeeId", employee.getId());
        payload.put("employeeName", employee.getDisplayName());
        payload.put("startDate", request.getStartDate().toString());
        payload.put("endDate", request.getEndDate().toString());
        payload.put("totalDays", request.getTotalDays());
        payload.put("status", request.getStatus().getValue());
        return payload;
    }
}
