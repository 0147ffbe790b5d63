package sp.sistemaspalacios.api_hrcore.repository.leave;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveType;

import java.util.List;
import java.util.Optional;

@Repository
public interface LeaveTypeRepository extends JpaRepository<LeaveType, Long> {

    Optional<LeaveType> findByIdAndIsActiveTrue(Long id);

    Optional<LeaveType> findByCode(String code);

    List<LeaveType> findByIsActiveTrueOrderByNameAsc();
}
