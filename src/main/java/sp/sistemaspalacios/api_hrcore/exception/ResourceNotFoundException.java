package sp.sistemaspalacios.api_hrcore.exception;

public class ResourceNotFoundException extends RuntimeException {

    public enum ResourceType {
        EMPLOYEE, LEAVE_TYPE, LEAVE_REQUEST, LEAVE_BALANCE, COMP_OFF_GRANT,
        ATTENDANCE_RECORD, REGULARIZATION, SHIFT_POLICY
    }

    private final ResourceType resourceType;

    public ResourceNotFoundException(ResourceType resourceType, Object id) {
        super(resourceType.name() + " with id '" + id + "' does not exist.");
        this.resourceType = resourceType;
    }

    public ResourceNotFoundException(String message, ResourceType resourceType) {
        super(message);
        this.resourceType = resourceType;
    }

    public ResourceType getResourceType() {
        return resourceType;
    }
}
