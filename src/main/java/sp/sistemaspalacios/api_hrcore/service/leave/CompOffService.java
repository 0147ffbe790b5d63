package sp.sistemaspalacios.api_hrcore.service.leave;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import sp.sistemaspalacios.api_hrcore.entity.employee.Employee;
import sp.sistemaspalacios.api_hrcore.entity.leave.CompOffGrant;
import sp.sistemaspalacios.api_hrcore.exception.BusinessValidationException;
import sp.sistemaspalacios.api_hrcore.exception.ConflictException;
import sp.sistemaspalacios.api_hrcore.exception.ForbiddenException;
import sp.sistemaspalacios.api_hrcore.exception.ResourceNotFoundException;
import sp.sistemaspalacios.api_hrcore.exception.ResourceNotFoundException.ResourceType;
import sp.sistemaspalacios.api_hrcore.repository.employee.EmployeeRepository;
import sp.sistemaspalacios.api_hrcore.repository.leave.CompOffGrantRepository;
import sp.sistemaspalacios.api_hrcore.service.auth.ApprovalAuthorityService;
import sp.sistemaspalacios.api_hrcore.service.notification.NotificationKind;
import sp.sistemaspalacios.api_hrcore.service.notification.NotificationService;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class CompOffService {

    private final CompOffGrantRepository compOffGrantRepository;
    private final EmployeeRepository employeeRepository;
    private final LeaveLedgerService leaveLedgerService;
    private final ApprovalAuthorityService approvalAuthorityService;
    private final NotificationService notificationService;
    private final Clock clock;
    private final int validityDays;

    public CompOffService(CompOffGrantRepository compOffGrantRepository,
                          EmployeeRepository employeeRepository,
                          LeaveLedgerService leaveLedgerService,
                          ApprovalAuthorityService approvalAuthorityService,
                          NotificationService notificationService,
                          Clock clock,
                          @Value("${hrcore.leave.comp-off-validity-days:90}") int validityDays) {
        this.compOffGrantRepository = compOffGrantRepository;
        this.employeeRepository = employeeRepository;
        this.leaveLedgerService = leaveLedgerService;
        this.approvalAuthorityService = approvalAuthorityService;
        this.notificationService = notificationService;
        this.clock = clock;
        this.validityDays = validityDays;
    }

    @Transactional
    public CompOffGrant request(Long employeeId, LocalDate workDate, String reason) {
        Employee employee = employeeRepository.findByIdAndIsActiveTrue(employeeId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.EMPLOYEE, employeeId));

        if (workDate.isAfter(LocalDate.now(clock))) {
            throw new BusinessValidationException("work_date", "Comp-off can only be requested for a day already worked.");
        }
        if (compOffGrantRepository.existsByEmployeeIdAndWorkDate(employeeId, workDate)) {
            throw new ConflictException("work_date", "A comp-off request already exists for " + workDate + ".");
        }

        CompOffGrant grant = new CompOffGrant();
        grant.setEmployeeId(employeeId);
        grant.setWorkDate(workDate);
        grant.setReason(reason);
        grant.setExpiresAt(workDate.plusDays(validityDays));
        grant.touch(LocalDateTime.now(clock));
        grant = compOffGrantRepository.save(grant);

        log.info("📝 Comp-off {} requested - Employee: {}, Work date: {}", grant.getId(), employeeId, workDate);

        Map<String, Object> payload = payload(grant);
        payload.put("employeeName", employee.getDisplayName());
        notificationService.notify(employee.getReportingManagerId(), NotificationKind.COMP_OFF_REQUESTED, payload);
        return grant;
    }

    /**
     * Approval is one-way and credits exactly one day to the comp-off balance
     * of the work date's year.
     */
    @Transactional
    public CompOffGrant approve(Long grantId, Long actorId) {
        CompOffGrant grant = compOffGrantRepository.findById(grantId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.COMP_OFF_GRANT, grantId));

        if (grant.isApproved()) {
            throw new BusinessValidationException("status", "This comp-off has already been approved.");
        }

        Employee employee = employeeRepository.findById(grant.getEmployeeId())
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.EMPLOYEE, grant.getEmployeeId()));
        if (!approvalAuthorityService.canApproveLeave(actorId, employee)) {
            throw new ForbiddenException("You are not authorized to approve this comp-off.");
        }

        grant.setGrantedBy(actorId);
        CompOffGrant saved = compOffGrantRepository.save(grant);
        leaveLedgerService.creditCompOff(saved.getEmployeeId(), saved.getWorkDate().getYear());

        log.info("✅ Comp-off {} approved by {}", grantId, actorId);
        notificationService.notify(saved.getEmployeeId(), NotificationKind.COMP_OFF_APPROVED, payload(saved));
        return saved;
    }

    @Transactional(readOnly = true)
    public List<CompOffGrant> list(Long employeeId) {
        return compOffGrantRepository.findByEmployeeIdOrderByWorkDateDesc(employeeId);
    }

    private Map<String, Object> payload(CompOffGrant grant) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("compOffId", grant.getId());
        payload.put("employeeId", grant.getEmployeeId());
        payload.put("workDate", grant.getWorkDate().toString());
        payload.put("expiresAt", grant.getExpiresAt().toString());
        return payload;
    }
}
