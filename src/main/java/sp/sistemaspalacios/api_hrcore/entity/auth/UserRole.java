package sp.sistemaspalacios.api_hrcore.entity.auth;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum UserRole {
    EMPLOYEE("employee"),
    MANAGER("manager"),
    HR_ADMIN("hr_admin"),
    SYSTEM_ADMIN("system_admin");

    private final String value;

    UserRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static UserRole fromValue(String raw) {
        for (UserRole candidate : values()) {
            if (candidate.value.equalsIgnoreCase(raw) || candidate.name().equalsIgnoreCase(raw)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown UserRole: " + raw);
    }
}
