package sp.sistemaspalacios.api_hrcore.controller.leave;

import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import sp.sistemaspalacios.api_hrcore.dto.leave.CompOffRequest;
import sp.sistemaspalacios.api_hrcore.entity.leave.CompOffGrant;
import sp.sistemaspalacios.api_hrcore.service.leave.CompOffService;

import java.util.List;

@RestController
@RequestMapping("/api/leave/comp-off")
public class CompOffController {

    private final CompOffService compOffService;

    public CompOffController(CompOffService compOffService) {
        this.compOffService = compOffService;
    }

    @PostMapping
    public ResponseEntity<CompOffGrant> request(@RequestHeader("X-Employee-Id") Long employeeId,
                                                @Valid @RequestBody CompOffRequest request) {
        CompOffGrant grant = compOffService.request(employeeId, request.getWorkDate(), request.getReason());
        return ResponseEntity.status(HttpStatus.CREATED).body(grant);
    }

    @GetMapping
    public List<CompOffGrant> myCompOffs(@RequestHeader("X-Employee-Id") Long employeeId) {
        return compOffService.list(employeeId);
    }

    @PutMapping("/{id}/approve")
    public ResponseEntity<CompOffGrant> approve(@RequestHeader("X-Employee-Id") Long actorId,
                                                @PathVariable("id") Long id) {
        return ResponseEntity.ok(compOffService.approve(id, actorId));
    }
}
