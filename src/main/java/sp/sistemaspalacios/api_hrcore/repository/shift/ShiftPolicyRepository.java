package sp.sistemaspalacios.api_hrcore.repository.shift;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_hrcore.entity.shift.ShiftPolicy;

import java.util.List;

@Repository
public interface ShiftPolicyRepository extends JpaRepository<ShiftPolicy, Long> {

    List<ShiftPolicy> findAllByOrderByNameAsc();

    List<ShiftPolicy> findByIsActiveTrueOrderByNameAsc();
}
