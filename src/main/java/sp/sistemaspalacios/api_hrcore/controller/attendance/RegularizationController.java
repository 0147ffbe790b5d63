package sp.sistemaspalacios.api_hrcore.controller.attendance;

import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_hrcore.dto.attendance.RegularizationSubmitRequest;
import sp.sistemaspalacios.api_hrcore.dto.leave.ReasonRequest;
import sp.sistemaspalacios.api_hrcore.entity.attendance.AttendanceRegularization;
import sp.sistemaspalacios.api_hrcore.entity.attendance.RegularizationStatus;
import sp.sistemaspalacios.api_hrcore.service.attendance.RegularizationService;

import java.util.List;

@RestController
@RequestMapping("/api/attendance/regularizations")
public class RegularizationController {

    private final RegularizationService regularizationService;

    public RegularizationController(RegularizationService regularizationService) {
        this.regularizationService = regularizationService;
    }

    @PostMapping
    public ResponseEntity<AttendanceRegularization> submit(@RequestHeader("X-Employee-Id") Long employeeId,
                                                           @Valid @RequestBody RegularizationSubmitRequest request) {
        AttendanceRegularization created = regularizationService.submit(employeeId, request.getDate(),
                request.getRequestedStatus(), request.getReason());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping
    public List<AttendanceRegularization> list(@RequestParam(value = "employeeId", required = false) Long employeeId,
                                               @RequestParam(value = "status", required = false) String status) {
        return regularizationService.list(employeeId, status != null ? RegularizationStatus.fromValue(status) : null);
    }

    @PutMapping("/{id}/approve")
    public ResponseEntity<AttendanceRegularization> approve(@RequestHeader("X-Employee-Id") Long actorId,
                                                            @PathVariable("id") Long id) {
        return ResponseEntity.ok(regularizationService.approve(id, actorId));
    }

    @PutMapping("/{id}/reject")
    public ResponseEntity<AttendanceRegularization> reject(@RequestHeader("X-Employee-Id") Long actorId,
                                                           @PathVariable("id") Long id,
                                                           @Valid @RequestBody ReasonRequest request) {
        return ResponseEntity.ok(regularizationService.reject(id, actorId, request.getReason()));
    }
}
