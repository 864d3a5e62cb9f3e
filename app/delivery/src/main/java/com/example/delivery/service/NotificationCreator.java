/*
 * Where: delivery persistence boundary
 * What: turns a resolved realtime notification into a notifications row
 * Why: every delivery outcome persists through one idempotent insert keyed by message id
 */
package com.example.delivery.service;

import com.example.delivery.model.DeliveryMode;
import com.example.delivery.model.NotificationEventKind;
import com.example.delivery.model.NotificationRecord;
import com.example.delivery.repository.NotificationRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationCreator {

  private static final Logger logger = LoggerFactory.getLogger(NotificationCreator.class);

  private final NotificationRepository notificationRepository;
  private final ObjectMapper objectMapper;
  private final DeliveryMetrics metrics;
  private final Clock clock;

  /**
   * Persists one notification. Returns false when a row with the same message id already existed.
   *
   * @param recipientUserId null for notifications without a resolvable recipient
   */
  public boolean create(
      String messageId,
      String recipientUserId,
      NotificationEventKind kind,
      Map<String, Object> payload,
      DeliveryMode mode) {
    final Map<String, Object> body = new LinkedHashMap<>(payload);
    if (recipientUserId != null) {
      body.put("userId", recipientUserId);
      body.putIfAbsent("recipientUserId", recipientUserId);
    }
    final NotificationRecord record =
        new NotificationRecord(
            UUID.randomUUID(),
            messageId,
            recipientUserId,
            firstString(body, "senderUserId", "sender"),
            firstString(body, "companyId", "company"),
            kind.eventName(),
            kind.category(),
            toJson(body),
            mode,
            Instant.now(clock),
            null);
    final boolean inserted = notificationRepository.insertIfAbsent(record);
    if (inserted) {
      metrics.recordPersisted(mode);
      logger.info(
          "notification persisted messageId={} userId={} event={} mode={}",
          messageId,
          recipientUserId,
          kind.eventName(),
          mode);
    } else {
      logger.info("notification already persisted messageId={} mode={}", messageId, mode);
    }
    return inserted;
  }

  // "sender" and "company" may be nested objects carrying an id
  private String firstString(Map<String, Object> body, String flatKey, String nestedKey) {
    final Object flat = body.get(flatKey);
    if (flat != null && !String.valueOf(flat).isBlank()) {
      return String.valueOf(flat);
    }
    if (body.get(nestedKey) instanceof Map<?, ?> nested && nested.get("id") != null) {
      return String.valueOf(nested.get("id"));
    }
    return null;
  }

  private String toJson(Map<String, Object> body) {
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("notification payload is not serializable", ex);
    }
  }
}
