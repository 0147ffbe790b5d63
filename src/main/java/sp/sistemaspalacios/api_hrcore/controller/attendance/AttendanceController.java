package sp.sistemaspalacios.api_hrcore.controller.attendance;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_hrcore.dto.attendance.AttendanceEvent;
import sp.sistemaspalacios.api_hrcore.dto.attendance.AttendanceRangeResponse;
import sp.sistemaspalacios.api_hrcore.dto.attendance.AttendanceRecordView;
import sp.sistemaspalacios.api_hrcore.dto.attendance.ClockRequest;
import sp.sistemaspalacios.api_hrcore.service.attendance.AttendanceQueryService;
import sp.sistemaspalacios.api_hrcore.service.attendance.AttendanceWorkflowService;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

@RestController
@RequestMapping("/api/attendance")
public class AttendanceController {

    private final AttendanceWorkflowService attendanceWorkflowService;
    private final AttendanceQueryService attendanceQueryService;
    private final Clock clock;

    public AttendanceController(AttendanceWorkflowService attendanceWorkflowService,
                                AttendanceQueryService attendanceQueryService,
                                Clock clock) {
        this.attendanceWorkflowService = attendanceWorkflowService;
        this.attendanceQueryService = attendanceQueryService;
        this.clock = clock;
    }

    // Marcar entrada
    @PostMapping("/clock-in")
    public ResponseEntity<AttendanceEvent> clockIn(@RequestHeader("X-Employee-Id") Long employeeId,
                                                   @RequestBody(required = false) ClockRequest request) {
        AttendanceEvent event = attendanceWorkflowService.clockIn(employeeId, LocalDateTime.now(clock), source(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(event);
    }

    // Marcar salida
    @PostMapping("/clock-out")
    public ResponseEntity<AttendanceEvent> clockOut(@RequestHeader("X-Employee-Id") Long employeeId,
                                                    @RequestBody(required = false) ClockRequest request) {
        return ResponseEntity.ok(attendanceWorkflowService.clockOut(employeeId, LocalDateTime.now(clock), source(request)));
    }

    // Asistencia propia en un rango (max 90 dias)
    @GetMapping("/me")
    public ResponseEntity<AttendanceRangeResponse> myAttendance(
            @RequestHeader("X-Employee-Id") Long employeeId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(attendanceQueryService.getAttendance(employeeId, from, to));
    }

    // Detalle de un dia con sus marcaciones
    @GetMapping("/me/{date}")
    public ResponseEntity<AttendanceRecordView> myDay(
            @RequestHeader("X-Employee-Id") Long employeeId,
            @PathVariable("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(attendanceQueryService.getDay(employeeId, date));
    }

    // Asistencia de los subordinados directos
    @GetMapping("/team")
    public ResponseEntity<AttendanceRangeResponse> teamAttendance(
            @RequestHeader("X-Employee-Id") Long managerId,
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(attendanceQueryService.getTeamAttendance(managerId, from, to));
    }

    private String source(ClockRequest request) {
        return request != null && request.getSource() != null ? request.getSource() : "web";
    }
}
