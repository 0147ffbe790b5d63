package sp.sistemaspalacios.api_hrcore.service.notification;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * A notification waiting for its originating transaction to commit.
 */
@Getter
@ToString
@AllArgsConstructor
public class NotificationEvent {

    private final Long recipientId;
    private final NotificationKind kind;
    private final Map<String, Object> payload;
}
