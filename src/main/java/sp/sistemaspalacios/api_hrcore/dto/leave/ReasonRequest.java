package sp.sistemaspalacios.api_hrcore.dto.leave;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of reject and cancel calls.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReasonRequest {

    @NotBlank
    @Size(max = 1000)
    private String reason;
}
