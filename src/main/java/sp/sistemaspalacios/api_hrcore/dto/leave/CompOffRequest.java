package sp.sistemaspalacios.api_hrcore.dto.leave;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CompOffRequest {

    @NotNull
    private LocalDate workDate;

    @NotBlank
    private String reason;
}
