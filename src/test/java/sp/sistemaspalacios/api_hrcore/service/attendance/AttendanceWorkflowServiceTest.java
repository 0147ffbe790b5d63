package sp.sistemaspalacios.api_hrcore.service.attendance;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import sp.sistemaspalacios.api_hrcore.dto.attendance.AttendanceEvent;
import sp.sistemaspalacios.api_hrcore.dto.shift.ResolvedShift;
import sp.sistemaspalacios.api_hrcore.entity.attendance.ArrivalStatus;
import sp.sistemaspalacios.api_hrcore.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.api_hrcore.entity.attendance.AttendanceStatus;
import sp.sistemaspalacios.api_hrcore.entity.attendance.ClockEntry;
import sp.sistemaspalacios.api_hrcore.entity.shift.ShiftPolicy;
import sp.sistemaspalacios.api_hrcore.exception.BusinessValidationException;
import sp.sistemaspalacios.api_hrcore.exception.ConflictException;
import sp.sistemaspalacios.api_hrcore.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_hrcore.repository.attendance.AttendanceRecordRepository;
import sp.sistemaspalacios.api_hrcore.repository.attendance.ClockEntryRepository;
import sp.sistemaspalacios.api_hrcore.repository.shift.ShiftPolicyRepository;
import sp.sistemaspalacios.api_hrcore.service.shift.ShiftResolverService;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("AttendanceWorkflowService")
class AttendanceWorkflowServiceTest {

    private static final Long EMPLOYEE_ID = 7L;
    private static final LocalDate DAY = LocalDate.of(2026, 3, 10);

    @Mock
    private AttendanceRecordRepository attendanceRecordRepository;

    @Mock
    private ClockEntryRepository clockEntryRepository;

    @Mock
    private ShiftPolicyRepository shiftPolicyRepository;

    @Mock
    private ShiftResolverService shiftResolverService;

    private AttendanceWorkflowService service;
    private ShiftPolicy generalShift;

    @BeforeEach
    void setUp() {
        service = new AttendanceWorkflowService(attendanceRecordRepository, clockEntryRepository,
                shiftPolicyRepository, shiftResolverService, new ArrivalClassifier(), new HoursCalculator());

        generalShift = new ShiftPolicy();
        generalShift.setId(3L);
        generalShift.setName("General");
        generalShift.setStartTime(LocalTime.of(9, 0));
        generalShift.setEndTime(LocalTime.of(18, 0));
        generalShift.setGraceMinutes(15);
        generalShift.setHalfDayMinutes(240);
        generalShift.setFullDayMinutes(480);

        when(shiftResolverService.resolveShift(eq(EMPLOYEE_ID), any(LocalDate.class)))
                .thenReturn(new ResolvedShift(generalShift, null));
        when(shiftPolicyRepository.findById(3L)).thenReturn(Optional.of(generalShift));
        when(attendanceRecordRepository.saveAndFlush(any(AttendanceRecord.class))).thenAnswer(inv -> {
            AttendanceRecord record = inv.getArgument(0);
            record.setId(100L);
            return record;
        });
        when(attendanceRecordRepository.save(any(AttendanceRecord.class))).thenAnswer(inv -> inv.getArgument(0));
        when(clockEntryRepository.save(any(ClockEntry.class))).thenAnswer(inv -> {
            ClockEntry entry = inv.getArgument(0);
            if (entry.getId() == null) {
                entry.setId(500L);
            }
            return entry;
        });
    }

    private LocalDateTime at(int hour, int minute) {
        return DAY.atTime(hour, minute);
    }

    private void noOpenEntries() {
        when(clockEntryRepository.findOpenEntriesForDay(eq(EMPLOYEE_ID), any(), any())).thenReturn(List.of());
    }

    private void noRecordYet() {
        when(attendanceRecordRepository.findForUpdate(EMPLOYEE_ID, DAY))
                .thenReturn(Optional.empty());
    }

    private AttendanceRecord existingRecord(LocalDateTime firstClockIn, ArrivalStatus arrival, AttendanceStatus status) {
        AttendanceRecord record = new AttendanceRecord();
        record.setId(100L);
        record.setEmployeeId(EMPLOYEE_ID);
        record.setAttendanceDate(DAY);
        record.setShiftPolicyId(3L);
        record.setFirstClockIn(firstClockIn);
        record.setArrivalStatus(arrival);
        record.setStatus(status);
        when(attendanceRecordRepository.findForUpdate(EMPLOYEE_ID, DAY))
                .thenReturn(Optional.of(record));
        return record;
    }

    private ClockEntry openEntry(LocalDateTime clockIn) {
        ClockEntry entry = new ClockEntry();
        entry.setId(501L);
        entry.setEmployeeId(EMPLOYEE_ID);
        entry.setAttendanceRecordId(100L);
        entry.setClockIn(clockIn);
        when(clockEntryRepository.findOpenEntriesForDay(eq(EMPLOYEE_ID), any(), any())).thenReturn(List.of(entry));
        return entry;
    }

    @Test
    @DisplayName("First clock-in at 09:10 creates the day as present and on time")
    void clockInOnTime() {
        // Given
        noOpenEntries();
        noRecordYet();

        // When
        AttendanceEvent event = service.clockIn(EMPLOYEE_ID, at(9, 10), "web");

        // Then
        assertThat(event.getArrivalStatus()).isEqualTo(ArrivalStatus.ON_TIME);
        assertThat(event.getStatus()).isEqualTo(AttendanceStatus.PRESENT);
        assertThat(event.getAttendanceId()).isEqualTo(100L);
        assertThat(event.getClockEntryId()).isEqualTo(500L);

        ArgumentCaptor<AttendanceRecord> recordCaptor = ArgumentCaptor.forClass(AttendanceRecord.class);
        verify(attendanceRecordRepository).saveAndFlush(recordCaptor.capture());
        assertThat(recordCaptor.getValue().getFirstClockIn()).isEqualTo(at(9, 10));
        assertThat(recordCaptor.getValue().getShiftPolicyId()).isEqualTo(3L);
        assertThat(recordCaptor.getValue().getCreatedAt()).isEqualTo(at(9, 10));
        assertThat(recordCaptor.getValue().getUpdatedAt()).isEqualTo(at(9, 10));

        ArgumentCaptor<ClockEntry> entryCaptor = ArgumentCaptor.forClass(ClockEntry.class);
        verify(clockEntryRepository).save(entryCaptor.capture());
        assertThat(entryCaptor.getValue().getClockIn()).isEqualTo(at(9, 10));
        assertThat(entryCaptor.getValue().getAttendanceRecordId()).isEqualTo(100L);
        assertThat(entryCaptor.getValue().isOpen()).isTrue();
    }

    @Test
    @DisplayName("Clock-in at 09:25 is late")
    void clockInLate() {
        noOpenEntries();
        noRecordYet();

        AttendanceEvent event = service.clockIn(EMPLOYEE_ID, at(9, 25), "web");

        assertThat(event.getArrivalStatus()).isEqualTo(ArrivalStatus.LATE);
        assertThat(event.getStatus()).isEqualTo(AttendanceStatus.PRESENT);
    }

    @Test
    @DisplayName("Clock-in at 11:30 forces half day")
    void clockInHalfDayPenalty() {
        noOpenEntries();
        noRecordYet();

        AttendanceEvent event = service.clockIn(EMPLOYEE_ID, at(11, 30), "web");

        assertThat(event.getArrivalStatus()).isEqualTo(ArrivalStatus.VERY_LATE);
        assertThat(event.getStatus()).isEqualTo(AttendanceStatus.HALF_DAY);
    }

    @Test
    @DisplayName("Second clock-in while an entry is open is a conflict")
    void doubleClockInConflict() {
        openEntry(at(9, 0));

        assertThatThrownBy(() -> service.clockIn(EMPLOYEE_ID, at(9, 5), "web"))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("Already clocked in");

        verify(clockEntryRepository, never()).save(any());
        verify(attendanceRecordRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("Clock-in after a break keeps the first arrival classification")
    void secondClockInKeepsArrival() {
        noOpenEntries();
        AttendanceRecord record = existingRecord(at(9, 25), ArrivalStatus.LATE, AttendanceStatus.HALF_DAY);

        AttendanceEvent event = service.clockIn(EMPLOYEE_ID, at(14, 0), "web");

        assertThat(event.getArrivalStatus()).isEqualTo(ArrivalStatus.LATE);
        assertThat(event.getStatus()).isEqualTo(AttendanceStatus.HALF_DAY);
        assertThat(record.getFirstClockIn()).isEqualTo(at(9, 25));
        verify(clockEntryRepository).save(any(ClockEntry.class));
    }

    @Test
    @DisplayName("Clock-in on a regularization-created day classifies the arrival")
    void clockInOnRecordWithoutFirstClockIn() {
        noOpenEntries();
        existingRecord(null, null, AttendanceStatus.ABSENT);

        AttendanceEvent event = service.clockIn(EMPLOYEE_ID, at(9, 0), "web");

        assertThat(event.getArrivalStatus()).isEqualTo(ArrivalStatus.ON_TIME);
        assertThat(event.getStatus()).isEqualTo(AttendanceStatus.PRESENT);
    }

    @Test
    @DisplayName("Clock-out nine hours after 09:00: 9.0 total, 8.0 effective, no overtime, present")
    void clockOutFullDay() {
        // Given
        ClockEntry entry = openEntry(at(9, 0));
        AttendanceRecord record = existingRecord(at(9, 0), ArrivalStatus.ON_TIME, AttendanceStatus.PRESENT);

        // When
        AttendanceEvent event = service.clockOut(EMPLOYEE_ID, at(18, 0), "web");

        // Then
        assertThat(event.getStatus()).isEqualTo(AttendanceStatus.PRESENT);
        assertThat(event.getClockEntryId()).isEqualTo(501L);
        assertThat(entry.getClockOut()).isEqualTo(at(18, 0));
        assertThat(entry.getDurationMinutes()).isEqualTo(540);
        assertThat(record.getLastClockOut()).isEqualTo(at(18, 0));
        assertThat(record.getTotalWorkMinutes()).isEqualTo(540);
        assertThat(record.getEffectiveWorkMinutes()).isEqualTo(480);
        assertThat(record.getOvertimeMinutes()).isZero();
    }

    @Test
    @DisplayName("Late-arrival half day survives a full day of hours")
    void halfDayPenaltyPersists() {
        openEntry(at(11, 30));
        AttendanceRecord record = existingRecord(at(11, 30), ArrivalStatus.VERY_LATE, AttendanceStatus.HALF_DAY);

        AttendanceEvent event = service.clockOut(EMPLOYEE_ID, at(20, 30), "web");

        assertThat(event.getStatus()).isEqualTo(AttendanceStatus.HALF_DAY);
        assertThat(record.getEffectiveWorkMinutes()).isEqualTo(480);
    }

    @Test
    @DisplayName("Late-arrival half day becomes absent when hours fall below half day")
    void halfDayPenaltyOverriddenByAbsent() {
        openEntry(at(11, 30));
        existingRecord(at(11, 30), ArrivalStatus.VERY_LATE, AttendanceStatus.HALF_DAY);

        AttendanceEvent event = service.clockOut(EMPLOYEE_ID, at(13, 0), "web");

        assertThat(event.getStatus()).isEqualTo(AttendanceStatus.ABSENT);
    }

    @Test
    @DisplayName("Hours run from the first clock-in of the day, not the current entry")
    void hoursFromFirstClockIn() {
        openEntry(at(14, 0));
        AttendanceRecord record = existingRecord(at(9, 0), ArrivalStatus.ON_TIME, AttendanceStatus.PRESENT);

        service.clockOut(EMPLOYEE_ID, at(18, 30), "web");

        assertThat(record.getTotalWorkMinutes()).isEqualTo(570);
        assertThat(record.getOvertimeMinutes()).isEqualTo(30);
    }

    @Test
    @DisplayName("Clock-out without an open entry is a validation error")
    void clockOutWithoutEntry() {
        noOpenEntries();

        assertThatThrownBy(() -> service.clockOut(EMPLOYEE_ID, at(18, 0), "web"))
                .isInstanceOf(BusinessValidationException.class)
                .satisfies(ex -> assertThat(((BusinessValidationException) ex).getField()).isEqualTo("clock_out"));
    }

    @Test
    @DisplayName("Clock-out with an entry but no day record is not found")
    void clockOutWithoutRecord() {
        openEntry(at(9, 0));
        noRecordYet();

        assertThatThrownBy(() -> service.clockOut(EMPLOYEE_ID, at(18, 0), "web"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("Clock-in locks the employee's day before looking for an open entry")
    void clockInLocksDayBeforeOpenEntryCheck() {
        noOpenEntries();
        noRecordYet();

        service.clockIn(EMPLOYEE_ID, at(9, 10), "web");

        InOrder order = inOrder(attendanceRecordRepository, clockEntryRepository);
        order.verify(attendanceRecordRepository).findForUpdate(EMPLOYEE_ID, DAY);
        order.verify(clockEntryRepository).findOpenEntriesForDay(eq(EMPLOYEE_ID), any(), any());
        order.verify(clockEntryRepository).save(any(ClockEntry.class));
        verify(attendanceRecordRepository, never()).findByEmployeeIdAndAttendanceDate(any(), any());
    }

    @Test
    @DisplayName("Clock-out locks the employee's day before closing the open entry")
    void clockOutLocksDayBeforeOpenEntryCheck() {
        openEntry(at(9, 0));
        AttendanceRecord record = existingRecord(at(9, 0), ArrivalStatus.ON_TIME, AttendanceStatus.PRESENT);

        service.clockOut(EMPLOYEE_ID, at(18, 0), "web");

        InOrder order = inOrder(attendanceRecordRepository, clockEntryRepository);
        order.verify(attendanceRecordRepository).findForUpdate(EMPLOYEE_ID, DAY);
        order.verify(clockEntryRepository).findOpenEntriesForDay(eq(EMPLOYEE_ID), any(), any());
        order.verify(clockEntryRepository).save(any(ClockEntry.class));
        assertThat(record.getUpdatedAt()).isEqualTo(at(18, 0));
    }
}
