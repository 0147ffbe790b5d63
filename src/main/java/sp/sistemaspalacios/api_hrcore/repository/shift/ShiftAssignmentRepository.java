package sp.sistemaspalacios.api_hrcore.repository.shift;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_hrcore.entity.shift.ShiftAssignment;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface ShiftAssignmentRepository extends JpaRepository<ShiftAssignment, Long> {

    /**
     * Assignments covering the date, latest effective_from first.
     */
    @Query("SELECT sa FROM ShiftAssignment sa " +
            "WHERE sa.employeeId = :employeeId " +
            "AND sa.effectiveFrom <= :date " +
            "AND (sa.effectiveTo IS NULL OR sa.effectiveTo >= :date) " +
            "ORDER BY sa.effectiveFrom DESC")
    List<ShiftAssignment> findCoveringAssignments(@Param("employeeId") Long employeeId,
                                                  @Param("date") LocalDate date);
}
