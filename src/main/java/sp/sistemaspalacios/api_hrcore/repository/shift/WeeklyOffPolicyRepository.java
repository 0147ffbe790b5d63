package sp.sistemaspalacios.api_hrcore.repository.shift;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_hrcore.entity.shift.WeeklyOffPolicy;

@Repository
public interface WeeklyOffPolicyRepository extends JpaRepository<WeeklyOffPolicy, Long> {
}
