package sp.sistemaspalacios.api_hrcore.repository.attendance;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_hrcore.entity.attendance.AttendanceRecord;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AttendanceRecordRepository extends JpaRepository<AttendanceRecord, Long> {

    Optional<AttendanceRecord> findByEmployeeIdAndAttendanceDate(Long employeeId, LocalDate attendanceDate);

    /**
     * Row lock on the employee's day; serializes clock-in / clock-out of the
     * same (employee, date).
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT ar FROM AttendanceRecord ar WHERE ar.employeeId = :employeeId AND ar.attendanceDate = :date")
    Optional<AttendanceRecord> findForUpdate(@Param("employeeId") Long employeeId, @Param("date") LocalDate date);

    List<AttendanceRecord> findByEmployeeIdAndAttendanceDateBetweenOrderByAttendanceDateDesc(
            Long employeeId, LocalDate fromDate, LocalDate toDate);

    List<AttendanceRecord> findByEmployeeIdInAndAttendanceDateBetweenOrderByAttendanceDateDescEmployeeIdAsc(
            Collection<Long> employeeIds, LocalDate fromDate, LocalDate toDate);
}
