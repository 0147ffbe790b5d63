package sp.sistemaspalacios.api_hrcore.service.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts workflow notifications to the messaging service. Messages raised inside
 * a transaction leave only after it commits; a rolled back change sends
 * nothing. Delivery is best effort: a failure is logged and never undoes the
 * business change.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final RestTemplate restTemplate;
    private final ApplicationEventPublisher eventPublisher;

    @Value("${notification.service.url:http://localhost:3008}")
    private String notificationServiceUrl;

    @Value("${notification.service.endpoint:/v1/messages}")
    private String notificationEndpoint;

    public void notify(Long recipientId, NotificationKind kind, Map<String, Object> payload) {
        if (recipientId == null) {
            log.debug("No recipient for {}, skipping", kind);
            return;
        }
        log.debug("📨 Queued {} for employee {}", kind, recipientId);
        eventPublisher.publishEvent(new NotificationEvent(recipientId, kind, payload));
    }

    // fallbackExecution: callers outside a transaction deliver right away
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void deliver(NotificationEvent event) {
        NotificationKind kind = event.getKind();
        String url = notificationServiceUrl + notificationEndpoint;

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("recipientId", event.getRecipientId());
        body.put("type", kind.name());
        body.put("title", kind.getTitle());
        body.put("data", event.getPayload());

        log.info("📤 Sending {} to employee {} - URL: {}", kind, event.getRecipientId(), url);
        log.debug("📦 Payload: {}", body);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(body, headers);

        try {
            ResponseEntity<Map> response = restTemplate.exchange(url, HttpMethod.POST, request, Map.class);

            if (response.getStatusCode().is2xxSuccessful()) {
                log.info("✅ Notification {} delivered", kind);
            } else {
                log.warn("⚠️ Notification {} answered {}", kind, response.getStatusCode());
            }
        } catch (RestClientException e) {
            log.error("❌ Error sending notification {} to {}: {}", kind, event.getRecipientId(), e.getMessage(), e);
        }
    }
}
