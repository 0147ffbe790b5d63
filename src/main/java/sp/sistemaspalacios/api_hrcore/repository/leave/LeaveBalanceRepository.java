package sp.sistemaspalacios.api_hrcore.repository.leave;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveBalance;

import java.util.List;
import java.util.Optional;

@Repository
public interface LeaveBalanceRepository extends JpaRepository<LeaveBalance, Long> {

    Optional<LeaveBalance> findByEmployeeIdAndLeaveTypeIdAndLeaveYear(Long employeeId,
                                                                      Long leaveTypeId,
                                                                      Integer leaveYear);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT lb FROM LeaveBalance lb WHERE lb.employeeId = :employeeId "
            + "AND lb.leaveTypeId = :leaveTypeId AND lb.leaveYear = :leaveYear")
    Optional<LeaveBalance> findForUpdate(@Param("employeeId") Long employeeId,
                                         @Param("leaveTypeId") Long leaveTypeId,
                                         @Param("leaveYear") Integer leaveYear);

    List<LeaveBalance> findByEmployeeIdAndLeaveYearOrderByLeaveTypeIdAsc(Long employeeId, Integer leaveYear);
}
