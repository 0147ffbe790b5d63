package sp.sistemaspalacios.api_hrcore.repository.attendance;

import jakarta.persistence.LockModeType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.jpa.repository.Lock;
import sp.sistemaspalacios.api_hrcore.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.api_hrcore.entity.attendance.AttendanceStatus;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@DisplayName("AttendanceRecordRepository")
class AttendanceRecordRepositoryTest {

    private static final LocalDate DAY = LocalDate.of(2026, 3, 2);

    @Autowired
    private AttendanceRecordRepository attendanceRecordRepository;

    @Autowired
    private TestEntityManager entityManager;

    private AttendanceRecord record(Long employeeId, LocalDate date) {
        AttendanceRecord record = new AttendanceRecord();
        record.setEmployeeId(employeeId);
        record.setAttendanceDate(date);
        record.setStatus(AttendanceStatus.PRESENT);
        return entityManager.persistAndFlush(record);
    }

    @Test
    @DisplayName("The day finder used by clock-in / clock-out takes a pessimistic write lock")
    void findForUpdateIsLocked() throws NoSuchMethodException {
        Lock lock = AttendanceRecordRepository.class
                .getMethod("findForUpdate", Long.class, LocalDate.class)
                .getAnnotation(Lock.class);

        assertThat(lock).isNotNull();
        assertThat(lock.value()).isEqualTo(LockModeType.PESSIMISTIC_WRITE);
    }

    @Test
    @DisplayName("Locked lookup returns the employee's day and holds the row lock")
    void findForUpdateLocksRow() {
        // Given
        AttendanceRecord saved = record(7L, DAY);
        record(8L, DAY);
        entityManager.clear();

        // When
        Optional<AttendanceRecord> found = attendanceRecordRepository.findForUpdate(7L, DAY);

        // Then
        assertThat(found).isPresent();
        assertThat(found.get().getId()).isEqualTo(saved.getId());
        assertThat(entityManager.getEntityManager().getLockMode(found.get()))
                .isEqualTo(LockModeType.PESSIMISTIC_WRITE);
        assertThat(attendanceRecordRepository.findForUpdate(7L, DAY.plusDays(1))).isEmpty();
    }

    @Test
    @DisplayName("Team lookup returns the listed employees' days in range, latest first")
    void teamRange() {
        record(7L, DAY);
        record(7L, DAY.plusDays(1));
        record(8L, DAY);
        record(9L, DAY);
        record(7L, DAY.plusDays(10));

        List<AttendanceRecord> team = attendanceRecordRepository
                .findByEmployeeIdInAndAttendanceDateBetweenOrderByAttendanceDateDescEmployeeIdAsc(
                        List.of(7L, 8L), DAY, DAY.plusDays(1));

        assertThat(team).extracting(AttendanceRecord::getEmployeeId).containsExactly(7L, 7L, 8L);
        assertThat(team).extracting(AttendanceRecord::getAttendanceDate)
                .containsExactly(DAY.plusDays(1), DAY, DAY);
    }
}
