package sp.sistemaspalacios.api_hrcore.exception;

public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String message) {
        super(message);
    }

    public ForbiddenException() {
        this("You do not have permission to perform this action.");
    }
}
