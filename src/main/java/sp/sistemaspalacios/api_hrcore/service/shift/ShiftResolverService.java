package sp.sistemaspalacios.api_hrcore.service.shift;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_hrcore.dto.shift.ResolvedShift;
import sp.sistemaspalacios.api_hrcore.entity.shift.ShiftAssignment;
import sp.sistemaspalacios.api_hrcore.entity.shift.ShiftPolicy;
import sp.sistemaspalacios.api_hrcore.repository.shift.ShiftAssignmentRepository;
import sp.sistemaspalacios.api_hrcore.repository.shift.ShiftPolicyRepository;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class ShiftResolverService {

    private final ShiftAssignmentRepository shiftAssignmentRepository;
    private final ShiftPolicyRepository shiftPolicyRepository;
    private final WeeklyOffDaysParser weeklyOffDaysParser;

    /**
     * Assignment in force on the date. When several cover it, the one with the
     * latest effective_from wins. No assignment is not an error.
     */
    @Transactional(readOnly = true)
    public ResolvedShift resolveShift(Long employeeId, LocalDate date) {
        List<ShiftAssignment> assignments =
                shiftAssignmentRepository.findCoveringAssignments(employeeId, date);

        if (assignments.isEmpty()) {
            log.debug("No shift assignment for employee {} on {}", employeeId, date);
            return ResolvedShift.none();
        }

        ShiftAssignment current = assignments.get(0);
        return new ResolvedShift(current.getShiftPolicy(), current.getWeeklyOffPolicy());
    }

    @Transactional(readOnly = true)
    public Set<DayOfWeek> weeklyOffDays(Long employeeId, LocalDate date) {
        ResolvedShift resolved = resolveShift(employeeId, date);
        if (resolved.getWeeklyOffPolicy() == null) {
            return WeeklyOffDaysParser.DEFAULT_WEEKLY_OFFS;
        }
        return weeklyOffDaysParser.parse(resolved.getWeeklyOffPolicy().getDays());
    }

    @Transactional(readOnly = true)
    public List<ShiftPolicy> listShiftPolicies(boolean activeOnly) {
        return activeOnly
                ? shiftPolicyRepository.findByIsActiveTrueOrderByNameAsc()
                : shiftPolicyRepository.findAllByOrderByNameAsc();
    }
}
