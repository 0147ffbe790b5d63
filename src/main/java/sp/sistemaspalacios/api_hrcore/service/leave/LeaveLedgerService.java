package sp.sistemaspalacios.api_hrcore.service.leave;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_hrcore.dto.leave.LeaveBalanceView;
import sp.sistemaspalacios.api_hrcore.entity.employee.Employee;
import sp.sistemaspalacios.api_hrcore.entity.leave.DayClassification;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveBalance;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveRequest;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveStatus;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveType;
import sp.sistemaspalacios.api_hrcore.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_hrcore.exception.ResourceNotFoundException.ResourceType;
import sp.sistemaspalacios.api_hrcore.repository.employee.EmployeeRepository;
import sp.sistemaspalacios.api_hrcore.repository.leave.LeaveBalanceRepository;
import sp.sistemaspalacios.api_hrcore.repository.leave.LeaveRequestRepository;
import sp.sistemaspalacios.api_hrcore.repository.leave.LeaveTypeRepository;
import sp.sistemaspalacios.api_hrcore.service.notification.NotificationKind;
import sp.sistemaspalacios.api_hrcore.service.notification.NotificationService;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Leave balances per (employee, leave type, year).
 * <p>
 * available = current balance - pending days, where pending days are the
 * total days of pending requests starting in that year. Approved requests are
 * already reflected in {@code used}.
 */
@Slf4j
@Service
public class LeaveLedgerService {

    private final LeaveBalanceRepository leaveBalanceRepository;
    private final LeaveRequestRepository leaveRequestRepository;
    private final LeaveTypeRepository leaveTypeRepository;
    private final EmployeeRepository employeeRepository;
    private final NotificationService notificationService;
    private final Clock clock;
    private final String compOffCode;
    private final CrossYearRestoration crossYearRestoration;

    public LeaveLedgerService(LeaveBalanceRepository leaveBalanceRepository,
                              LeaveRequestRepository leaveRequestRepository,
                              LeaveTypeRepository leaveTypeRepository,
                              EmployeeRepository employeeRepository,
                              NotificationService notificationService,
                              Clock clock,
                              @Value("${hrcore.leave.comp-off-code:CO}") String compOffCode,
                              @Value("${hrcore.leave.cross-year-restoration:WEEKDAY_APPROXIMATION}")
                              CrossYearRestoration crossYearRestoration) {
        this.leaveBalanceRepository = leaveBalanceRepository;
        this.leaveRequestRepository = leaveRequestRepository;
        this.leaveTypeRepository = leaveTypeRepository;
        this.employeeRepository = employeeRepository;
        this.notificationService = notificationService;
        this.clock = clock;
        this.compOffCode = compOffCode;
        this.crossYearRestoration = crossYearRestoration;
    }

    // ==========================================
    // Derived values
    // ==========================================

    @Transactional(readOnly = true)
    public BigDecimal pendingDays(Long employeeId, Long leaveTypeId, int year) {
        BigDecimal pending = leaveRequestRepository.sumTotalDays(employeeId, leaveTypeId, LeaveStatus.PENDING,
                LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
        return pending != null ? pending : BigDecimal.ZERO;
    }

    @Transactional(readOnly = true)
    public BigDecimal available(LeaveBalance balance) {
        return balance.getCurrentBalance()
                .subtract(pendingDays(balance.getEmployeeId(), balance.getLeaveTypeId(), balance.getLeaveYear()));
    }

    @Transactional(readOnly = true)
    public Optional<LeaveBalance> findBalance(Long employeeId, Long leaveTypeId, int year) {
        return leaveBalanceRepository.findByEmployeeIdAndLeaveTypeIdAndLeaveYear(employeeId, leaveTypeId, year);
    }

    // ==========================================
    // Mutations tied to request transitions
    // ==========================================

    /**
     * used += total_days on the balance of the request's start year. A missing
     * balance row is tolerated.
     */
    @Transactional
    public void deductOnApproval(LeaveRequest request) {
        int year = request.getStartDate().getYear();
        Optional<LeaveBalance> balance = leaveBalanceRepository.findForUpdate(
                request.getEmployeeId(), request.getLeaveTypeId(), year);

        if (balance.isEmpty()) {
            log.warn("⚠️ No balance row for employee {} / leave type {} / {}; nothing deducted for request {}",
                    request.getEmployeeId(), request.getLeaveTypeId(), year, request.getId());
            return;
        }
        LeaveBalance row = balance.get();
        row.setUsed(row.getUsed().add(request.getTotalDays()));
        row.touch(LocalDateTime.now(clock));
        leaveBalanceRepository.save(row);
        log.info("➖ Deducted {} day(s) from balance {} (used = {})", request.getTotalDays(), row.getId(), row.getUsed());
    }

    /**
     * Gives back the days of a cancelled, previously approved request. A
     * single-year request restores its full total; a request spanning years
     * restores each year's slice per the configured strategy.
     */
    @Transactional
    public void restoreOnCancellation(LeaveRequest request) {
        int startYear = request.getStartDate().getYear();
        int endYear = request.getEndDate().getYear();

        if (startYear == endYear) {
            restore(request, startYear, request.getTotalDays());
            return;
        }

        for (int year = startYear; year <= endYear; year++) {
            LocalDate sliceStart = max(request.getStartDate(), LocalDate.of(year, 1, 1));
            LocalDate sliceEnd = min(request.getEndDate(), LocalDate.of(year, 12, 31));

            BigDecimal days = crossYearRestoration == CrossYearRestoration.DAY_DETAILS
                    ? ledgerDaysBetween(request.getDayDetails(), sliceStart, sliceEnd)
                    : weekdaysBetween(sliceStart, sliceEnd);

            if (days.signum() > 0) {
                restore(request, year, days);
            }
        }
    }

    // ==========================================
    // HR operations
    // ==========================================

    @Transactional(readOnly = true)
    public List<LeaveBalanceView> getBalances(Long employeeId, int year) {
        if (!employeeRepository.existsById(employeeId)) {
            throw new ResourceNotFoundException(ResourceType.EMPLOYEE, employeeId);
        }
        List<LeaveBalance> balances =
                leaveBalanceRepository.findByEmployeeIdAndLeaveYearOrderByLeaveTypeIdAsc(employeeId, year);

        Map<Long, LeaveType> types = leaveTypeRepository.findAllById(balances.stream()
                        .map(LeaveBalance::getLeaveTypeId)
                        .collect(Collectors.toSet()))
                .stream()
                .collect(Collectors.toMap(LeaveType::getId, Function.identity()));

        List<LeaveBalanceView> views = new ArrayList<>();
        for (LeaveBalance balance : balances) {
            views.add(toView(balance, types.get(balance.getLeaveTypeId())));
        }
        return views;
    }

    /**
     * Manual correction: adjusted += delta on the (employee, type, year) row,
     * creating it when missing. Year defaults to the current one.
     */
    @Transactional
    public LeaveBalanceView adjustBalance(Long employeeId, Long leaveTypeId, BigDecimal delta,
                                          String reason, Integer year, Long actorId) {
        if (!employeeRepository.existsById(employeeId)) {
            throw new ResourceNotFoundException(ResourceType.EMPLOYEE, employeeId);
        }
        LeaveType leaveType = leaveTypeRepository.findById(leaveTypeId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.LEAVE_TYPE, leaveTypeId));

        int targetYear = year != null ? year : LocalDate.now(clock).getYear();
        LeaveBalance balance = getOrCreate(employeeId, leaveTypeId, targetYear);
        BigDecimal previous = balance.getAdjusted();
        balance.setAdjusted(previous.add(delta));
        balance.touch(LocalDateTime.now(clock));
        balance = leaveBalanceRepository.save(balance);

        log.info("🛠️ Balance {} adjusted by {} (actor {}): {} -> {}. Reason: {}",
                balance.getId(), delta, actorId, previous, balance.getAdjusted(), reason);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("leaveType", leaveType.getCode());
        payload.put("year", targetYear);
        payload.put("delta", delta);
        payload.put("direction", delta.signum() > 0 ? "credited" : "debited");
        payload.put("reason", reason);
        notificationService.notify(employeeId, NotificationKind.BALANCE_ADJUSTED, payload);

        return toView(balance, leaveType);
    }

    /**
     * One comp-off day into the comp-off leave type's balance for the year.
     */
    @Transactional
    public LeaveBalance creditCompOff(Long employeeId, int year) {
        LeaveType compOffType = leaveTypeRepository.findByCode(compOffCode)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Comp-off leave type '" + compOffCode + "' is not configured.", ResourceType.LEAVE_TYPE));

        LeaveBalance balance = getOrCreate(employeeId, compOffType.getId(), year);
        balance.setAdjusted(balance.getAdjusted().add(BigDecimal.ONE));
        balance.touch(LocalDateTime.now(clock));
        balance = leaveBalanceRepository.save(balance);
        log.info("➕ Comp-off credited to employee {} for {} (adjusted = {})", employeeId, year, balance.getAdjusted());
        return balance;
    }

    /**
     * Seeds the year's balances: one row per active leave type applicable to
     * the employee that has none yet. Opening = default balance, carry forward
     * = previous year's positive current balance capped at max_carry_forward.
     */
    @Transactional
    public List<LeaveBalanceView> openYear(Long employeeId, int year) {
        Employee employee = employeeRepository.findById(employeeId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.EMPLOYEE, employeeId));

        List<LeaveBalanceView> created = new ArrayList<>();
        for (LeaveType type : leaveTypeRepository.findByIsActiveTrueOrderByNameAsc()) {
            if (!type.isApplicableTo(employee.getGender())) {
                continue;
            }
            if (findBalance(employeeId, type.getId(), year).isPresent()) {
                continue;
            }
            BigDecimal carry = findBalance(employeeId, type.getId(), year - 1)
                    .map(prev -> prev.getCurrentBalance().max(BigDecimal.ZERO).min(type.getMaxCarryForward()))
                    .orElse(BigDecimal.ZERO);

            LeaveBalance balance = LeaveBalance.builder()
                    .employeeId(employeeId)
                    .leaveTypeId(type.getId())
                    .leaveYear(year)
                    .openingBalance(type.getDefaultBalance())
                    .carryForwarded(carry)
                    .updatedAt(LocalDateTime.now(clock))
                    .build();
            created.add(toView(leaveBalanceRepository.save(balance), type));
        }
        log.info("📅 Opened {} balance(s) for employee {} in {}", created.size(), employeeId, year);
        return created;
    }

    // ==========================================
    // Helpers
    // ==========================================

    private void restore(LeaveRequest request, int year, BigDecimal days) {
        Optional<LeaveBalance> balance = leaveBalanceRepository.findForUpdate(
                request.getEmployeeId(), request.getLeaveTypeId(), year);
        if (balance.isEmpty()) {
            log.warn("⚠️ No balance row for employee {} / leave type {} / {}; {} day(s) not restored",
                    request.getEmployeeId(), request.getLeaveTypeId(), year, days);
            return;
        }
        LeaveBalance row = balance.get();
        row.setUsed(row.getUsed().subtract(days).max(BigDecimal.ZERO));
        row.touch(LocalDateTime.now(clock));
        leaveBalanceRepository.save(row);
        log.info("➕ Restored {} day(s) to balance {} (used = {})", days, row.getId(), row.getUsed());
    }

    private LeaveBalance getOrCreate(Long employeeId, Long leaveTypeId, int year) {
        return leaveBalanceRepository.findForUpdate(employeeId, leaveTypeId, year)
                .orElseGet(() -> LeaveBalance.builder()
                        .employeeId(employeeId)
                        .leaveTypeId(leaveTypeId)
                        .leaveYear(year)
                        .build());
    }

    private LeaveBalanceView toView(LeaveBalance balance, LeaveType type) {
        BigDecimal pending = pendingDays(balance.getEmployeeId(), balance.getLeaveTypeId(), balance.getLeaveYear());
        return LeaveBalanceView.builder()
                .id(balance.getId())
                .leaveTypeId(balance.getLeaveTypeId())
                .leaveTypeCode(type != null ? type.getCode() : null)
                .leaveTypeName(type != null ? type.getName() : null)
                .year(balance.getLeaveYear())
                .openingBalance(balance.getOpeningBalance())
                .accrued(balance.getAccrued())
                .used(balance.getUsed())
                .carryForwarded(balance.getCarryForwarded())
                .adjusted(balance.getAdjusted())
                .currentBalance(balance.getCurrentBalance())
                .pending(pending)
                .available(balance.getCurrentBalance().subtract(pending))
                .build();
    }

    static BigDecimal weekdaysBetween(LocalDate from, LocalDate to) {
        long count = 0;
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            if (d.getDayOfWeek() != DayOfWeek.SATURDAY && d.getDayOfWeek() != DayOfWeek.SUNDAY) {
                count++;
            }
        }
        return BigDecimal.valueOf(count);
    }

    static BigDecimal ledgerDaysBetween(Map<String, String> dayDetails, LocalDate from, LocalDate to) {
        BigDecimal total = BigDecimal.ZERO;
        if (dayDetails == null) {
            return total;
        }
        for (Map.Entry<String, String> entry : dayDetails.entrySet()) {
            LocalDate date = LocalDate.parse(entry.getKey());
            if (!date.isBefore(from) && !date.isAfter(to)) {
                total = total.add(DayClassification.fromValue(entry.getValue()).getContribution());
            }
        }
        return total;
    }

    private static LocalDate max(LocalDate a, LocalDate b) {
        return a.isAfter(b) ? a : b;
    }

    private static LocalDate min(LocalDate a, LocalDate b) {
        return a.isBefore(b) ? a : b;
    }
}
