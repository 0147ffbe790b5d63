package sp.sistemaspalacios.api_hrcore.repository.attendance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_hrcore.entity.attendance.ClockEntry;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface ClockEntryRepository extends JpaRepository<ClockEntry, Long> {

    /**
     * Open entries whose clock-in falls in [dayStart, nextDayStart), most recent first.
     */
    @Query("SELECT ce FROM ClockEntry ce " +
            "WHERE ce.employeeId = :employeeId " +
            "AND ce.clockOut IS NULL " +
            "AND ce.clockIn >= :dayStart AND ce.clockIn < :nextDayStart " +
            "ORDER BY ce.clockIn DESC")
    List<ClockEntry> findOpenEntriesForDay(@Param("employeeId") Long employeeId,
                                           @Param("dayStart") LocalDateTime dayStart,
                                           @Param("nextDayStart") LocalDateTime nextDayStart);

    List<ClockEntry> findByAttendanceRecordIdOrderByClockInAsc(Long attendanceRecordId);
}
