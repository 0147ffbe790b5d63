package sp.sistemaspalacios.api_hrcore.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiErrorResponse {

    private String type;
    private String title;
    private int status;
    private String detail;
    private Map<String, List<String>> errors;

    public static ApiErrorResponse of(String type, String title, int status, String detail) {
        return ApiErrorResponse.builder()
                .type(type)
                .title(title)
                .status(status)
                .detail(detail)
                .build();
    }
}
