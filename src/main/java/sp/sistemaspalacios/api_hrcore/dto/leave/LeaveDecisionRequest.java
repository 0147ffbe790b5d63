package sp.sistemaspalacios.api_hrcore.dto.leave;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of approve calls. Remarks are optional.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LeaveDecisionRequest {

    @Size(max = 1000)
    private String remarks;
}
