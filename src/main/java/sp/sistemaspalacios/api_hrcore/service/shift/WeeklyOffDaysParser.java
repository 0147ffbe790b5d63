package sp.sistemaspalacios.api_hrcore.service.shift;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Decodes the JSON day set stored on a weekly-off policy.
 * <p>
 * Accepted shapes: {@code [5, 6]} with 0 = Monday, or
 * {@code {"saturday": true, "sunday": true}}.
 */
@Slf4j
@Component
public class WeeklyOffDaysParser {

    public static final Set<DayOfWeek> DEFAULT_WEEKLY_OFFS =
            Collections.unmodifiableSet(EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY));

    private final ObjectMapper objectMapper;

    public WeeklyOffDaysParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Set<DayOfWeek> parse(String json) {
        if (json == null || json.isBlank()) {
            return DEFAULT_WEEKLY_OFFS;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("⚠️ Unreadable weekly-off days '{}', using Saturday/Sunday: {}", json, e.getOriginalMessage());
            return DEFAULT_WEEKLY_OFFS;
        }

        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        if (root.isArray()) {
            for (JsonNode node : root) {
                if (!node.canConvertToInt()) {
                    continue;
                }
                int index = node.asInt();
                // out of range indexes are ignored
                if (index >= 0 && index <= 6) {
                    days.add(DayOfWeek.of(index + 1));
                }
            }
            return days;
        }
        if (root.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getValue().asBoolean(false)) {
                    continue;
                }
                try {
                    days.add(DayOfWeek.valueOf(field.getKey().trim().toUpperCase(Locale.ROOT)));
                } catch (IllegalArgumentException e) {
                    log.debug("Ignoring unknown day name '{}'", field.getKey());
                }
            }
            return days;
        }
        log.warn("⚠️ Unexpected weekly-off payload '{}', using Saturday/Sunday", json);
        return DEFAULT_WEEKLY_OFFS;
    }
}
