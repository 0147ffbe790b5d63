package sp.sistemaspalacios.api_hrcore.entity.leave;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Portion of a working day requested as leave.
 */
public enum LeaveDayType {
    FULL_DAY("full_day"),
    FIRST_HALF("first_half"),
    SECOND_HALF("second_half");

    private final String value;

    LeaveDayType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static LeaveDayType fromValue(String raw) {
        for (LeaveDayType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(raw) || candidate.name().equalsIgnoreCase(raw)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown LeaveDayType: " + raw);
    }
}
