/*
 * Where: delivery debug API
 * What: inbox listing, pending-delivery inspection and manual domain event injection
 * Why: lets an operator follow one notification from publish to persisted row
 */
package com.example.delivery.api;

import com.example.common.event.DomainEvent;
import com.example.delivery.bridge.DomainEventPublisher;
import com.example.delivery.model.NotificationRecord;
import com.example.delivery.pending.PendingDeliveryStore;
import com.example.delivery.repository.NotificationRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug/delivery")
@RequiredArgsConstructor
public class DeliveryDebugController {

  private static final int MAX_INBOX_LIMIT = 200;

  private final NotificationRepository notificationRepository;
  private final PendingDeliveryStore pendingDeliveryStore;
  private final DomainEventPublisher domainEventPublisher;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @GetMapping("/inbox/{userId}")
  public DeliveryInboxResponse inbox(
      @PathVariable("userId") String userId,
      @RequestParam(name = "limit", defaultValue = "50") int limit) {
    final int boundedLimit = Math.max(1, Math.min(limit, MAX_INBOX_LIMIT));
    final List<NotificationSummary> items =
        notificationRepository.findByRecipient(userId, boundedLimit).stream()
            .map(this::toSummary)
            .toList();
    return new DeliveryInboxResponse(userId, items);
  }

  @GetMapping("/pending")
  public PendingDeliveriesResponse pending() {
    return new PendingDeliveriesResponse(
        pendingDeliveryStore.pendingCount(), pendingDeliveryStore.listPending());
  }

  @PostMapping("/events")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public Map<String, String> publish(@Valid @RequestBody PublishEventRequest request) {
    final String id =
        request.id() == null || request.id().isBlank() ? UUID.randomUUID().toString() : request.id();
    domainEventPublisher.publish(
        new DomainEvent(id, request.name(), Instant.now(clock), request.payload()));
    return Map.of("event_id", id);
  }

  private NotificationSummary toSummary(NotificationRecord record) {
    try {
      final JsonNode payload = objectMapper.readTree(record.payloadJson());
      return new NotificationSummary(
          record.notificationId(),
          record.messageId(),
          record.eventName(),
          record.category(),
          record.deliveryMode(),
          record.createdAt(),
          record.readAt(),
          payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("notification payload parse failure", ex);
    }
  }
}
