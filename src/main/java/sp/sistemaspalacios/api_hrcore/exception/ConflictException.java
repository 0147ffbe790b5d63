package sp.sistemaspalacios.api_hrcore.exception;

/**
 * Duplicate state: an open clock-in, a pending regularization or a comp-off for the same day.
 */
public class ConflictException extends RuntimeException {

    private final String field;

    public ConflictException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
