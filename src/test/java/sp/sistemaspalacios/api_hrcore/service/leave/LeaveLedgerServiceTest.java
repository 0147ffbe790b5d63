package sp.sistemaspalacios.api_hrcore.service.leave;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import sp.sistemaspalacios.api_hrcore.dto.leave.LeaveBalanceView;
import sp.sistemaspalacios.api_hrcore.entity.employee.Employee;
import sp.sistemaspalacios.api_hrcore.entity.employee.Gender;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveBalance;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveRequest;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveStatus;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveType;
import sp.sistemaspalacios.api_hrcore.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_hrcore.repository.employee.EmployeeRepository;
import sp.sistemaspalacios.api_hrcore.repository.leave.LeaveBalanceRepository;
import sp.sistemaspalacios.api_hrcore.repository.leave.LeaveRequestRepository;
import sp.sistemaspalacios.api_hrcore.repository.leave.LeaveTypeRepository;
import sp.sistemaspalacios.api_hrcore.service.notification.NotificationKind;
import sp.sistemaspalacios.api_hrcore.service.notification.NotificationService;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("LeaveLedgerService")
class LeaveLedgerServiceTest {

    private static final Long EMPLOYEE_ID = 7L;
    private static final Long CASUAL_ID = 1L;
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T04:30:00Z"), ZoneId.of("Asia/Kolkata"));

    @Mock
    private LeaveBalanceRepository leaveBalanceRepository;

    @Mock
    private LeaveRequestRepository leaveRequestRepository;

    @Mock
    private LeaveTypeRepository leaveTypeRepository;

    @Mock
    private EmployeeRepository employeeRepository;

    @Mock
    private NotificationService notificationService;

    private LeaveLedgerService service;

    @BeforeEach
    void setUp() {
        service = ledger(CrossYearRestoration.WEEKDAY_APPROXIMATION);
        when(leaveBalanceRepository.save(any(LeaveBalance.class))).thenAnswer(inv -> inv.getArgument(0));
        when(leaveBalanceRepository.findByEmployeeIdAndLeaveTypeIdAndLeaveYear(anyLong(), anyLong(), anyInt()))
                .thenReturn(Optional.empty());
        when(leaveBalanceRepository.findForUpdate(anyLong(), anyLong(), anyInt())).thenReturn(Optional.empty());
        when(leaveRequestRepository.sumTotalDays(anyLong(), anyLong(), eq(LeaveStatus.PENDING), any(), any()))
                .thenReturn(BigDecimal.ZERO);
    }

    private LeaveLedgerService ledger(CrossYearRestoration restoration) {
        return new LeaveLedgerService(leaveBalanceRepository, leaveRequestRepository, leaveTypeRepository,
                employeeRepository, notificationService, CLOCK, "CO", restoration);
    }

    private LeaveBalance balance(int year, String opening, String used) {
        LeaveBalance balance = LeaveBalance.builder()
                .id((long) year)
                .employeeId(EMPLOYEE_ID)
                .leaveTypeId(CASUAL_ID)
                .leaveYear(year)
                .openingBalance(new BigDecimal(opening))
                .used(new BigDecimal(used))
                .build();
        when(leaveBalanceRepository.findByEmployeeIdAndLeaveTypeIdAndLeaveYear(EMPLOYEE_ID, CASUAL_ID, year))
                .thenReturn(Optional.of(balance));
        when(leaveBalanceRepository.findForUpdate(EMPLOYEE_ID, CASUAL_ID, year)).thenReturn(Optional.of(balance));
        return balance;
    }

    private LeaveRequest request(LocalDate from, LocalDate to, String total, Map<String, String> details) {
        return LeaveRequest.builder()
                .id(55L)
                .employeeId(EMPLOYEE_ID)
                .leaveTypeId(CASUAL_ID)
                .startDate(from)
                .endDate(to)
                .totalDays(new BigDecimal(total))
                .dayDetails(details)
                .status(LeaveStatus.APPROVED)
                .build();
    }

    @Test
    @DisplayName("Available subtracts pending days from the current balance")
    void availableSubtractsPending() {
        // Given
        LeaveBalance balance = balance(2026, "12", "2");
        when(leaveRequestRepository.sumTotalDays(EMPLOYEE_ID, CASUAL_ID, LeaveStatus.PENDING,
                LocalDate.of(2026, 1, 1), LocalDate.of(2026, 12, 31))).thenReturn(new BigDecimal("3.5"));

        // When / Then
        assertThat(balance.getCurrentBalance()).isEqualByComparingTo("10");
        assertThat(service.available(balance)).isEqualByComparingTo("6.5");
    }

    @Test
    @DisplayName("Approval deducts the request total from the start year")
    void deductOnApproval() {
        LeaveBalance balance = balance(2026, "12", "1");

        service.deductOnApproval(request(LocalDate.of(2026, 3, 9), LocalDate.of(2026, 3, 10), "2", Map.of()));

        assertThat(balance.getUsed()).isEqualByComparingTo("3");
        assertThat(balance.getUpdatedAt()).isEqualTo(LocalDateTime.of(2026, 3, 2, 10, 0));
        verify(leaveBalanceRepository).findForUpdate(EMPLOYEE_ID, CASUAL_ID, 2026);
        verify(leaveBalanceRepository).save(balance);
    }

    @Test
    @DisplayName("Approval without a balance row is tolerated")
    void deductWithoutRow() {
        service.deductOnApproval(request(LocalDate.of(2026, 3, 9), LocalDate.of(2026, 3, 10), "2", Map.of()));

        verify(leaveBalanceRepository, never()).save(any());
    }

    @Test
    @DisplayName("Cancelling a single-year request restores its total and never goes below zero")
    void restoreSameYear() {
        LeaveBalance balance = balance(2026, "12", "1.5");

        service.restoreOnCancellation(request(LocalDate.of(2026, 3, 9), LocalDate.of(2026, 3, 10), "2", Map.of()));

        assertThat(balance.getUsed()).isEqualByComparingTo("0");
    }

    @Nested
    @DisplayName("Cross-year cancellation")
    class CrossYear {

        // Mon 2025-12-29 .. Fri 2026-01-02, Jan 1 is a holiday
        private final Map<String, String> details = new LinkedHashMap<>();

        @BeforeEach
        void setUpDetails() {
            details.put("2025-12-29", "full_day");
            details.put("2025-12-30", "full_day");
            details.put("2025-12-31", "full_day");
            details.put("2026-01-01", "holiday");
            details.put("2026-01-02", "full_day");
        }

        @Test
        @DisplayName("Weekday approximation restores the Mon-Fri count of each slice")
        void weekdayApproximation() {
            LeaveBalance previous = balance(2025, "12", "5");
            LeaveBalance current = balance(2026, "12", "3");

            service.restoreOnCancellation(request(LocalDate.of(2025, 12, 29), LocalDate.of(2026, 1, 2), "4", details));

            assertThat(previous.getUsed()).isEqualByComparingTo("2");
            assertThat(current.getUsed()).isEqualByComparingTo("1");
        }

        @Test
        @DisplayName("Day-details strategy restores exactly what the ledger charged")
        void dayDetails() {
            LeaveBalance previous = balance(2025, "12", "5");
            LeaveBalance current = balance(2026, "12", "3");

            ledger(CrossYearRestoration.DAY_DETAILS)
                    .restoreOnCancellation(request(LocalDate.of(2025, 12, 29), LocalDate.of(2026, 1, 2), "4", details));

            assertThat(previous.getUsed()).isEqualByComparingTo("2");
            assertThat(current.getUsed()).isEqualByComparingTo("2");
        }
    }

    @Test
    @DisplayName("Adjustment creates the missing row and notifies the employee")
    void adjustCreatesRow() {
        // Given
        when(employeeRepository.existsById(EMPLOYEE_ID)).thenReturn(true);
        when(leaveTypeRepository.findById(CASUAL_ID))
                .thenReturn(Optional.of(LeaveType.builder().id(CASUAL_ID).code("CL").name("Casual").build()));

        // When
        LeaveBalanceView view = service.adjustBalance(EMPLOYEE_ID, CASUAL_ID, new BigDecimal("2.5"),
                "Carry-over fix", null, 1L);

        // Then
        assertThat(view.getYear()).isEqualTo(2026);
        assertThat(view.getAdjusted()).isEqualByComparingTo("2.5");
        assertThat(view.getAvailable()).isEqualByComparingTo("2.5");
        verify(notificationService).notify(eq(EMPLOYEE_ID), eq(NotificationKind.BALANCE_ADJUSTED), anyMap());
    }

    @Test
    @DisplayName("Adjustment of an unknown employee is not found")
    void adjustUnknownEmployee() {
        when(employeeRepository.existsById(EMPLOYEE_ID)).thenReturn(false);

        assertThatThrownBy(() -> service.adjustBalance(EMPLOYEE_ID, CASUAL_ID, BigDecimal.ONE, "x", 2026, 1L))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("Comp-off credit adds one day to the comp-off balance")
    void creditCompOff() {
        when(leaveTypeRepository.findByCode("CO"))
                .thenReturn(Optional.of(LeaveType.builder().id(9L).code("CO").name("Comp-off").build()));

        LeaveBalance credited = service.creditCompOff(EMPLOYEE_ID, 2026);

        assertThat(credited.getLeaveTypeId()).isEqualTo(9L);
        assertThat(credited.getAdjusted()).isEqualByComparingTo("1");
        assertThat(credited.getCurrentBalance()).isEqualByComparingTo("1");
    }

    @Test
    @DisplayName("Comp-off credit without a configured type is not found")
    void creditCompOffWithoutType() {
        when(leaveTypeRepository.findByCode("CO")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.creditCompOff(EMPLOYEE_ID, 2026))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Comp-off leave type 'CO' is not configured.");
    }

    @Test
    @DisplayName("Opening a year seeds applicable types and caps the carry forward")
    void openYear() {
        // Given
        Employee employee = new Employee();
        employee.setId(EMPLOYEE_ID);
        employee.setGender(Gender.MALE);
        when(employeeRepository.findById(EMPLOYEE_ID)).thenReturn(Optional.of(employee));

        LeaveType casual = LeaveType.builder().id(CASUAL_ID).code("CL").name("Casual")
                .defaultBalance(new BigDecimal("12")).maxCarryForward(new BigDecimal("5")).build();
        LeaveType maternity = LeaveType.builder().id(4L).code("ML").name("Maternity")
                .defaultBalance(new BigDecimal("180")).applicableGender(Gender.FEMALE).build();
        when(leaveTypeRepository.findByIsActiveTrueOrderByNameAsc()).thenReturn(List.of(casual, maternity));
        balance(2025, "12", "4");

        // When
        List<LeaveBalanceView> opened = service.openYear(EMPLOYEE_ID, 2026);

        // Then
        assertThat(opened).hasSize(1);
        assertThat(opened.get(0).getLeaveTypeCode()).isEqualTo("CL");
        assertThat(opened.get(0).getOpeningBalance()).isEqualByComparingTo("12");
        assertThat(opened.get(0).getCarryForwarded()).isEqualByComparingTo("5");
        assertThat(opened.get(0).getCurrentBalance()).isEqualByComparingTo("17");

        ArgumentCaptor<LeaveBalance> captor = ArgumentCaptor.forClass(LeaveBalance.class);
        verify(leaveBalanceRepository, times(1)).save(captor.capture());
        assertThat(captor.getValue().getLeaveYear()).isEqualTo(2026);
    }

    @Test
    @DisplayName("Weekday count ignores Saturdays and Sundays")
    void weekdaysBetween() {
        assertThat(LeaveLedgerService.weekdaysBetween(LocalDate.of(2026, 3, 6), LocalDate.of(2026, 3, 9)))
                .isEqualByComparingTo("2");
    }
}
