/*
 * Where: realtime gateway inbound events
 * What: handles notification.delivered and notification.delivery.failed from clients
 * Why: a client acknowledgment finalizes the pending delivery staged by the consumer
 */
package com.example.delivery.realtime;

import com.example.delivery.consumer.MessageIds;
import com.example.delivery.model.PendingDelivery;
import com.example.delivery.pending.PendingDeliveryStore;
import com.example.delivery.pending.StoreUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DeliveryAckHandler {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryAckHandler.class);

  private final PendingDeliveryStore pendingDeliveryStore;
  private final ConfirmationSignalRelay signalRelay;
  private final MessageIds messageIds;

  public void delivered(String userId, JsonNode data) {
    final String messageId = validMessageId(userId, data, RealtimeEvents.NOTIFICATION_DELIVERED);
    if (messageId == null) {
      return;
    }
    try {
      final Optional<PendingDelivery> confirmed = pendingDeliveryStore.confirmDelivery(messageId);
      if (confirmed.isEmpty()) {
        logger.info("delivery already confirmed or expired messageId={} userId={}", messageId, userId);
        return;
      }
      signalRelay.signal(messageId);
      logger.info("delivery confirmed messageId={} userId={}", messageId, userId);
    } catch (StoreUnavailableException ex) {
      logger.warn("failed to confirm delivery messageId={} userId={}", messageId, userId, ex);
    }
  }

  public void failed(String userId, JsonNode data) {
    final String messageId =
        validMessageId(userId, data, RealtimeEvents.NOTIFICATION_DELIVERY_FAILED);
    if (messageId == null) {
      return;
    }
    try {
      pendingDeliveryStore.removePendingDelivery(messageId);
      signalRelay.signal(messageId);
      logger.info(
          "client reported delivery failure messageId={} userId={} error={}",
          messageId,
          userId,
          data.path("error").asText(""));
    } catch (StoreUnavailableException ex) {
      logger.warn("failed to drop pending delivery messageId={} userId={}", messageId, userId, ex);
    }
  }

  // clients may only acknowledge messages addressed to themselves
  private String validMessageId(String userId, JsonNode data, String event) {
    final JsonNode node = data == null ? null : data.get("messageId");
    if (node == null || !node.isTextual() || node.asText().isBlank()) {
      logger.warn("invalid {} payload, messageId missing userId={}", event, userId);
      return null;
    }
    final String messageId = node.asText();
    if (!messageIds.belongsTo(messageId, userId)) {
      logger.warn("{} for a foreign message ignored messageId={} userId={}", event, messageId, userId);
      return null;
    }
    return messageId;
  }
}
