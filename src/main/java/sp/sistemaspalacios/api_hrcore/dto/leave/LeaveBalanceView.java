package sp.sistemaspalacios.api_hrcore.dto.leave;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaveBalanceView {

    private Long id;
    private Long leaveTypeId;
    private String leaveTypeCode;
    private String leaveTypeName;
    private Integer year;
    private BigDecimal openingBalance;
    private BigDecimal accrued;
    private BigDecimal used;
    private BigDecimal carryForwarded;
    private BigDecimal adjusted;
    private BigDecimal currentBalance;
    private BigDecimal pending;
    private BigDecimal available;
}
