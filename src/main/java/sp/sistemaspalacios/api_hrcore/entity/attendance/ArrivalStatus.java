package sp.sistemaspalacios.api_hrcore.entity.attendance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a first clock-in compares with the shift start. ABSENT is only assigned when no clock-in happened.
 */
public enum ArrivalStatus {
    ON_TIME("on_time"),
    LATE("late"),
    VERY_LATE("very_late"),
    ABSENT("absent");

    private final String value;

    ArrivalStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ArrivalStatus fromValue(String raw) {
        for (ArrivalStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(raw) || candidate.name().equalsIgnoreCase(raw)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ArrivalStatus: " + raw);
    }
}
