package sp.sistemaspalacios.api_hrcore.repository.leave;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import sp.sistemaspalacios.api_hrcore.entity.leave.CompOffGrant;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface CompOffGrantRepository extends JpaRepository<CompOffGrant, Long> {

    boolean existsByEmployeeIdAndWorkDate(Long employeeId, LocalDate workDate);

    List<CompOffGrant> findByEmployeeIdOrderByWorkDateDesc(Long employeeId);
}
