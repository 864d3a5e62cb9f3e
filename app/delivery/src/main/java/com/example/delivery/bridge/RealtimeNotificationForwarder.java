/*
 * Where: domain event bridge
 * What: enqueues a realtime notification body on the queue of the delivery-aware consumer
 * Why: invite and membership events reach users through the same acknowledged delivery path
 */
package com.example.delivery.bridge;

import com.example.delivery.config.ConsumerProperties;
import com.example.delivery.nats.JsonJetStreamPublisher;
import com.example.delivery.service.RealtimeNotificationHandler;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class RealtimeNotificationForwarder {

  private static final Logger logger = LoggerFactory.getLogger(RealtimeNotificationForwarder.class);

  private final JsonJetStreamPublisher publisher;
  private final String realtimeQueue;

  public RealtimeNotificationForwarder(
      JsonJetStreamPublisher publisher, ConsumerProperties consumerProperties) {
    this.publisher = publisher;
    this.realtimeQueue =
        consumerProperties.settings(RealtimeNotificationHandler.CONSUMER_NAME).queue();
  }

  /** The body must carry eventId, the name of a NotificationEventKind. */
  public void forward(String eventId, Map<String, Object> attributes, String msgId) {
    final Map<String, Object> body = new LinkedHashMap<>(attributes);
    body.put("eventId", eventId);
    publisher.publish(realtimeQueue, msgId, body);
    logger.info("realtime notification enqueued queue={} eventId={} msgId={}", realtimeQueue, eventId, msgId);
  }
}
