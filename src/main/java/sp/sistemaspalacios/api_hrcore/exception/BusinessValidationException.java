package sp.sistemaspalacios.api_hrcore.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Business rule violation. Errors are keyed by the offending field.
 */
public class BusinessValidationException extends RuntimeException {

    private final Map<String, List<String>> errors;

    public BusinessValidationException(String field, String message) {
        super(message);
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put(field, List.of(message));
        this.errors = Collections.unmodifiableMap(map);
    }

    public Map<String, List<String>> getErrors() {
        return errors;
    }

    public String getField() {
        return errors.keySet().iterator().next();
    }
}
