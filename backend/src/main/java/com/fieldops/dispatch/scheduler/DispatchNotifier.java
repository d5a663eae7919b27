package com.fieldops.dispatch.scheduler;

import com.fieldops.dispatch.domain.Entities.WorkOrderEntity;
import com.fieldops.dispatch.domain.TechnicianProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pushes dispatch decisions to the outbound notification webhook. Delivery is fire-and-forget: failures are logged
 * and never affect the dispatch decision. Server errors and timeouts are retried with exponential backoff up to
 * {@code app.notifications.max-attempts}; 4xx answers are not.
 */
@Component
public class DispatchNotifier {
  private static final Logger log = LoggerFactory.getLogger(DispatchNotifier.class);

  private final NotificationProperties properties;
  private final WebClient webClient;

  public DispatchNotifier(NotificationProperties properties, WebClient.Builder builder) {
    this.properties = properties;
    this.webClient = builder.build();
  }

  public void assigned(WorkOrderEntity w, double score) {
    Map<String, Object> payload = base("WORK_ORDER_ASSIGNED", w);
    payload.put("score", score);
    send(payload);
  }

  public void reassigned(WorkOrderEntity w, Long previousTechnicianId, String reason) {
    Map<String, Object> payload = base("WORK_ORDER_REASSIGNED", w);
    payload.put("previousTechnicianId", previousTechnicianId);
    payload.put("reason", reason);
    send(payload);
  }

  public void cancelled(WorkOrderEntity w, Long technicianId, String reason) {
    Map<String, Object> payload = base("WORK_ORDER_CANCELLED", w);
    payload.put("technicianId", technicianId);
    payload.put("reason", reason);
    send(payload);
  }

  public void escalated(WorkOrderEntity w, List<TechnicianProfile> onCall, String reasoning) {
    Map<String, Object> payload = base("EMERGENCY_ESCALATED", w);
    payload.put("onCallTechnicianIds", onCall.stream().map(TechnicianProfile::id).toList());
    payload.put("reason", reasoning);
    log.warn("Emergency workOrder={} escalated to on-call technicians={}", w.id, payload.get("onCallTechnicianIds"));
    send(payload);
  }

  private Map<String, Object> base(String event, WorkOrderEntity w) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("event", event);
    payload.put("workOrderId", w.id);
    payload.put("customerId", w.customerId);
    payload.put("priority", w.priority);
    payload.put("status", w.status);
    payload.put("technicianId", w.technicianId);
    payload.put("eta", w.eta);
    return payload;
  }

  private void send(Map<String, Object> payload) {
    if (!StringUtils.hasText(properties.getWebhookUrl())) {
      log.info("Notification (no webhook configured) event={} workOrder={}", payload.get("event"), payload.get("workOrderId"));
      return;
    }
    webClient.post()
        .uri(properties.getWebhookUrl())
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(payload)
        .retrieve()
        .toBodilessEntity()
        .timeout(Duration.ofMillis(properties.getTimeoutMs()))
        .retryWhen(Retry.backoff(Math.max(0, properties.getMaxAttempts() - 1), Duration.ofMillis(properties.getInitialBackoffMs()))
            .filter(DispatchNotifier::retryable)
            .doBeforeRetry(signal -> log.debug("Retrying notification event={} workOrder={} attempt={}",
                payload.get("event"), payload.get("workOrderId"), signal.totalRetries() + 2))
            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
        .subscribe(
            ok -> log.debug("Notification delivered event={} workOrder={} status={}", payload.get("event"), payload.get("workOrderId"), ok.getStatusCode()),
            err -> log.warn("Notification failed event={} workOrder={}: {}", payload.get("event"), payload.get("workOrderId"), err.toString()));
  }

  private static boolean retryable(Throwable err) {
    return !(err instanceof WebClientResponseException response && response.getStatusCode().is4xxClientError());
  }
}
