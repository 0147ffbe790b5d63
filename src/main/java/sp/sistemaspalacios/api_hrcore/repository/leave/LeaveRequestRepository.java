package sp.sistemaspalacios.api_hrcore.repository.leave;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveRequest;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

@Repository
public interface LeaveRequestRepository extends JpaRepository<LeaveRequest, Long> {

    /**
     * Sum of total_days for requests in the given status whose start date lies in [yearStart, yearEnd].
     */
    @Query("SELECT COALESCE(SUM(lr.totalDays), 0) FROM LeaveRequest lr " +
            "WHERE lr.employeeId = :employeeId " +
            "AND lr.leaveTypeId = :leaveTypeId " +
            "AND lr.status = :status " +
            "AND lr.startDate BETWEEN :yearStart AND :yearEnd")
    BigDecimal sumTotalDays(@Param("employeeId") Long employeeId,
                            @Param("leaveTypeId") Long leaveTypeId,
                            @Param("status") LeaveStatus status,
                            @Param("yearStart") LocalDate yearStart,
                            @Param("yearEnd") LocalDate yearEnd);

    @Query("SELECT COUNT(lr) FROM LeaveRequest lr " +
            "WHERE lr.employeeId = :employeeId " +
            "AND lr.status IN :statuses " +
            "AND lr.startDate <= :toDate " +
            "AND lr.endDate >= :fromDate")
    long countOverlapping(@Param("employeeId") Long employeeId,
                          @Param("statuses") Collection<LeaveStatus> statuses,
                          @Param("fromDate") LocalDate fromDate,
                          @Param("toDate") LocalDate toDate);

    @Query("SELECT lr FROM LeaveRequest lr " +
            "WHERE lr.employeeId IN :employeeIds " +
            "AND lr.status IN :statuses " +
            "AND lr.startDate <= :toDate " +
            "AND lr.endDate >= :fromDate " +
            "ORDER BY lr.startDate ASC, lr.employeeId ASC")
    List<LeaveRequest> findOverlappingForEmployees(@Param("employeeIds") Collection<Long> employeeIds,
                                                   @Param("statuses") Collection<LeaveStatus> statuses,
                                                   @Param("fromDate") LocalDate fromDate,
                                                   @Param("toDate") LocalDate toDate);

    List<LeaveRequest> findByEmployeeIdOrderByCreatedAtDesc(Long employeeId);

    List<LeaveRequest> findByEmployeeIdAndStatusOrderByCreatedAtDesc(Long employeeId, LeaveStatus status);

    List<LeaveRequest> findByEmployeeIdInAndStatusOrderByCreatedAtAsc(Collection<Long> employeeIds,
                                                                       LeaveStatus status);
}
