package sp.sistemaspalacios.api_hrcore.repository.shift;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import sp.sistemaspalacios.api_hrcore.entity.shift.ShiftAssignment;
import sp.sistemaspalacios.api_hrcore.entity.shift.ShiftPolicy;
import sp.sistemaspalacios.api_hrcore.entity.shift.WeeklyOffPolicy;

import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@DisplayName("ShiftAssignmentRepository")
class ShiftAssignmentRepositoryTest {

    private static final Long EMPLOYEE_ID = 7L;

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private ShiftAssignmentRepository shiftAssignmentRepository;

    private ShiftPolicy general;
    private ShiftPolicy evening;
    private WeeklyOffPolicy weekend;

    @BeforeEach
    void setUp() {
        general = shift("General", LocalTime.of(9, 0), LocalTime.of(18, 0));
        evening = shift("Evening", LocalTime.of(14, 0), LocalTime.of(23, 0));

        weekend = new WeeklyOffPolicy();
        weekend.setName("Sat-Sun");
        weekend.setDays("[5, 6]");
        weekend = entityManager.persist(weekend);

        assign(general, LocalDate.of(2026, 1, 1), null);
        assign(evening, LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 31));
        entityManager.flush();
        entityManager.clear();
    }

    private ShiftPolicy shift(String name, LocalTime start, LocalTime end) {
        ShiftPolicy policy = new ShiftPolicy();
        policy.setName(name);
        policy.setStartTime(start);
        policy.setEndTime(end);
        return entityManager.persist(policy);
    }

    private void assign(ShiftPolicy policy, LocalDate from, LocalDate to) {
        ShiftAssignment assignment = new ShiftAssignment();
        assignment.setEmployeeId(EMPLOYEE_ID);
        assignment.setShiftPolicy(policy);
        assignment.setWeeklyOffPolicy(weekend);
        assignment.setEffectiveFrom(from);
        assignment.setEffectiveTo(to);
        entityManager.persist(assignment);
    }

    @Test
    @DisplayName("The most recent covering assignment comes first")
    void latestFirst() {
        assertThat(shiftAssignmentRepository.findCoveringAssignments(EMPLOYEE_ID, LocalDate.of(2026, 3, 31)))
                .extracting(a -> a.getShiftPolicy().getName())
                .containsExactly("Evening", "General");
    }

    @Test
    @DisplayName("Closed assignments stop covering after their end date")
    void closedAssignment() {
        assertThat(shiftAssignmentRepository.findCoveringAssignments(EMPLOYEE_ID, LocalDate.of(2026, 4, 1)))
                .extracting(a -> a.getShiftPolicy().getName())
                .containsExactly("General");
    }

    @Test
    @DisplayName("Nothing covers dates before the first assignment")
    void beforeFirst() {
        assertThat(shiftAssignmentRepository.findCoveringAssignments(EMPLOYEE_ID, LocalDate.of(2025, 12, 31)))
                .isEmpty();
    }
}
