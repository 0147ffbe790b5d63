package sp.sistemaspalacios.api_hrcore.entity.attendance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AttendanceStatus {
    PRESENT("present"),
    ABSENT("absent"),
    HALF_DAY("half_day"),
    WEEKEND("weekend"),
    HOLIDAY("holiday"),
    ON_LEAVE("on_leave"),
    WORK_FROM_HOME("work_from_home"),
    ON_DUTY("on_duty");

    private final String value;

    AttendanceStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AttendanceStatus fromValue(String raw) {
        for (AttendanceStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(raw) || candidate.name().equalsIgnoreCase(raw)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown AttendanceStatus: " + raw);
    }
}
