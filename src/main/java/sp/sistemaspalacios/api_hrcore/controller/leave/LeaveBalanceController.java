package sp.sistemaspalacios.api_hrcore.controller.leave;

import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_hrcore.dto.leave.BalanceAdjustmentRequest;
import sp.sistemaspalacios.api_hrcore.dto.leave.LeaveBalanceView;
import sp.sistemaspalacios.api_hrcore.entity.auth.Capability;
import sp.sistemaspalacios.api_hrcore.exception.ForbiddenException;
import sp.sistemaspalacios.api_hrcore.service.auth.ApprovalAuthorityService;
import sp.sistemaspalacios.api_hrcore.service.leave.LeaveLedgerService;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/leave/balances")
public class LeaveBalanceController {

    private final LeaveLedgerService leaveLedgerService;
    private final ApprovalAuthorityService approvalAuthorityService;
    private final Clock clock;

    public LeaveBalanceController(LeaveLedgerService leaveLedgerService,
                                  ApprovalAuthorityService approvalAuthorityService,
                                  Clock clock) {
        this.leaveLedgerService = leaveLedgerService;
        this.approvalAuthorityService = approvalAuthorityService;
        this.clock = clock;
    }

    // Saldos propios del anio (por defecto el actual)
    @GetMapping
    public List<LeaveBalanceView> myBalances(@RequestHeader("X-Employee-Id") Long employeeId,
                                             @RequestParam(value = "year", required = false) Integer year) {
        return leaveLedgerService.getBalances(employeeId, year != null ? year : LocalDate.now(clock).getYear());
    }

    // Ajuste manual (RRHH)
    @PostMapping("/adjust")
    public ResponseEntity<LeaveBalanceView> adjust(@RequestHeader("X-Employee-Id") Long actorId,
                                                   @Valid @RequestBody BalanceAdjustmentRequest request) {
        requireConfigure(actorId);
        return ResponseEntity.ok(leaveLedgerService.adjustBalance(request.getEmployeeId(), request.getLeaveTypeId(),
                request.getAdjustment(), request.getReason(), request.getYear(), actorId));
    }

    // Apertura de saldos del anio con arrastre (RRHH)
    @PostMapping("/open-year")
    public List<LeaveBalanceView> openYear(@RequestHeader("X-Employee-Id") Long actorId,
                                           @RequestParam("employeeId") Long employeeId,
                                           @RequestParam("year") int year) {
        requireConfigure(actorId);
        return leaveLedgerService.openYear(employeeId, year);
    }

    private void requireConfigure(Long actorId) {
        if (!approvalAuthorityService.hasCapability(actorId, Capability.LEAVE_CONFIGURE)) {
            throw new ForbiddenException("Only HR can change leave balances.");
        }
    }
}
