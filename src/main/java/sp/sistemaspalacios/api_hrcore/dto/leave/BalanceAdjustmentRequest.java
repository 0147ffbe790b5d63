package sp.sistemaspalacios.api_hrcore.dto.leave;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BalanceAdjustmentRequest {

    @NotNull
    private Long employeeId;

    @NotNull
    private Long leaveTypeId;

    // positive credits, negative debits
    @NotNull
    private BigDecimal adjustment;

    @NotBlank
    private String reason;

    private Integer year;
}
