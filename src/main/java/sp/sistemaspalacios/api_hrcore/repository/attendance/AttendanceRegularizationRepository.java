package sp.sistemaspalacios.api_hrcore.repository.attendance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_hrcore.entity.attendance.AttendanceRegularization;
import sp.sistemaspalacios.api_hrcore.entity.attendance.RegularizationStatus;

import java.util.List;

@Repository
public interface AttendanceRegularizationRepository extends JpaRepository<AttendanceRegularization, Long> {

    boolean existsByAttendanceRecordIdAndEmployeeIdAndStatus(Long attendanceRecordId,
                                                            Long employeeId,
                                                            RegularizationStatus status);

    @Query("SELECT r FROM AttendanceRegularization r " +
            "WHERE (:employeeId IS NULL OR r.employeeId = :employeeId) " +
            "AND (:status IS NULL OR r.status = :status) " +
            "ORDER BY r.createdAt DESC")
    List<AttendanceRegularization> search(@Param("employeeId") Long employeeId,
                                          @Param("status") RegularizationStatus status);
}
