package sp.sistemaspalacios.api_hrcore.controller.leave;

import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_hrcore.dto.leave.ApplyLeaveRequest;
import sp.sistemaspalacios.api_hrcore.dto.leave.LeaveDayCount;
import sp.sistemaspalacios.api_hrcore.dto.leave.LeaveDecisionRequest;
import sp.sistemaspalacios.api_hrcore.dto.leave.ReasonRequest;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveRequest;
import sp.sistemaspalacios.api_hrcore.entity.leave.LeaveStatus;
import sp.sistemaspalacios.api_hrcore.service.leave.LeaveApprovalService;

import java.util.List;

@RestController
@RequestMapping("/api/leave/requests")
public class LeaveController {

    private final LeaveApprovalService leaveApprovalService;

    public LeaveController(LeaveApprovalService leaveApprovalService) {
        this.leaveApprovalService = leaveApprovalService;
    }

    // Solicitar permiso
    @PostMapping
    public ResponseEntity<LeaveRequest> apply(@RequestHeader("X-Employee-Id") Long employeeId,
                                              @Valid @RequestBody ApplyLeaveRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(leaveApprovalService.apply(employeeId, request));
    }

    // Simular el conteo de dias sin crear la solicitud
    @PostMapping("/preview")
    public ResponseEntity<LeaveDayCount> preview(@RequestHeader("X-Employee-Id") Long employeeId,
                                                 @Valid @RequestBody ApplyLeaveRequest request) {
        return ResponseEntity.ok(leaveApprovalService.previewDays(employeeId, request.getLeaveTypeId(),
                request.getFromDate(), request.getToDate(), request.getDayDetails()));
    }

    @GetMapping
    public List<LeaveRequest> myRequests(@RequestHeader("X-Employee-Id") Long employeeId,
                                         @RequestParam(value = "status", required = false) String status) {
        return leaveApprovalService.listRequests(employeeId, status != null ? LeaveStatus.fromValue(status) : null);
    }

    // Pendientes de los subordinados directos
    @GetMapping("/pending-approvals")
    public List<LeaveRequest> pendingApprovals(@RequestHeader("X-Employee-Id") Long managerId) {
        return leaveApprovalService.pendingApprovals(managerId);
    }

    @PutMapping("/{id}/approve")
    public ResponseEntity<LeaveRequest> approve(@RequestHeader("X-Employee-Id") Long actorId,
                                                @PathVariable("id") Long id,
                                                @Valid @RequestBody(required = false) LeaveDecisionRequest request) {
        String remarks = request != null ? request.getRemarks() : null;
        return ResponseEntity.ok(leaveApprovalService.approve(id, actorId, remarks));
    }

    @PutMapping("/{id}/reject")
    public ResponseEntity<LeaveRequest> reject(@RequestHeader("X-Employee-Id") Long actorId,
                                               @PathVariable("id") Long id,
                                               @Valid @RequestBody ReasonRequest request) {
        return ResponseEntity.ok(leaveApprovalService.reject(id, actorId, request.getReason()));
    }

    @PutMapping("/{id}/cancel")
    public ResponseEntity<LeaveRequest> cancel(@RequestHeader("X-Employee-Id") Long actorId,
                                               @PathVariable("id") Long id,
                                               @Valid @RequestBody ReasonRequest request) {
        return ResponseEntity.ok(leaveApprovalService.cancel(id, actorId, request.getReason()));
    }
}
