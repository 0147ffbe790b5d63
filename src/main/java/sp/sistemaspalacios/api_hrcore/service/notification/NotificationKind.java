package sp.sistemaspalacios.api_hrcore.service.notification;

public enum NotificationKind {
    LEAVE_REQUESTED("Leave request submitted"),
    LEAVE_APPROVED("Leave request approved"),
    LEAVE_REJECTED("Leave request rejected"),
    LEAVE_CANCELLED("Leave request cancelled"),
    COMP_OFF_REQUESTED("Comp-off requested"),
    COMP_OFF_APPROVED("Comp-off approved"),
    BALANCE_ADJUSTED("Leave balance adjusted"),
    REGULARIZATION_REQUESTED("Regularization requested"),
    REGULARIZATION_DECIDED("Regularization reviewed");

    private final String title;

    NotificationKind(String title) {
        this.title = title;
    }

    public String getTitle() {
        return title;
    }
}
