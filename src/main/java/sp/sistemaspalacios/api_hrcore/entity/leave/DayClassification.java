package sp.sistemaspalacios.api_hrcore.entity.leave;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;

/**
 * Per-date tag written into a leave request's day ledger.
 */
public enum DayClassification {
    FULL_DAY("full_day", BigDecimal.ONE),
    FIRST_HALF("first_half", new BigDecimal("0.5")),
    SECOND_HALF("second_half", new BigDecimal("0.5")),
    WEEKEND("weekend", BigDecimal.ZERO),   // leading/trailing weekly off, not charged
    HOLIDAY("holiday", BigDecimal.ZERO);

    private final String value;
    private final BigDecimal contribution;

    DayClassification(String value, BigDecimal contribution) {
        this.value = value;
        this.contribution = contribution;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public BigDecimal getContribution() {
        return contribution;
    }

    public static DayClassification of(LeaveDayType dayType) {
        switch (dayType) {
            case FIRST_HALF:
                return FIRST_HALF;
            case SECOND_HALF:
                return SECOND_HALF;
            default:
                return FULL_DAY;
        }
    }

    public static DayClassification fromValue(String raw) {
        for (DayClassification candidate : values()) {
            if (candidate.value.equalsIgnoreCase(raw)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown day classification: " + raw);
    }
}
