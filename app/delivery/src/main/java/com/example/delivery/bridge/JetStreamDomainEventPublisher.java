/*
 * Where: domain event bridge
 * What: routes domain events to their JetStream subjects by event name
 * Why: invites also feed the realtime queue while membership and generic events get their own consumers
 */
package com.example.delivery.bridge;

import com.example.common.event.DomainEvent;
import com.example.delivery.config.ConsumerProperties;
import com.example.delivery.model.NotificationEventKind;
import com.example.delivery.nats.JsonJetStreamPublisher;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class JetStreamDomainEventPublisher implements DurableEventPublisher {

  public static final String MEMBERS_CONSUMER_NAME = "members-events";
  public static final String GENERIC_CONSUMER_NAME = "generic-events";
  private static final Logger logger = LoggerFactory.getLogger(JetStreamDomainEventPublisher.class);

  private final JsonJetStreamPublisher publisher;
  private final RealtimeNotificationForwarder forwarder;
  private final BridgeProperties properties;
  private final String membersSubject;
  private final String genericSubject;

  public JetStreamDomainEventPublisher(
      JsonJetStreamPublisher publisher,
      RealtimeNotificationForwarder forwarder,
      BridgeProperties properties,
      ConsumerProperties consumerProperties) {
    this.publisher = publisher;
    this.forwarder = forwarder;
    this.properties = properties;
    this.membersSubject = consumerProperties.settings(MEMBERS_CONSUMER_NAME).queue();
    this.genericSubject = consumerProperties.settings(GENERIC_CONSUMER_NAME).queue();
  }

  @Override
  public void publish(DomainEvent event) {
    final Map<String, Object> body = body(event);
    if (DomainEventNames.isInvite(event.name())) {
      publisher.publish(properties.invitesSubject(), event.id(), body);
      final Optional<NotificationEventKind> kind = DomainEventNames.kindOf(event.name());
      if (kind.isPresent()) {
        forwarder.forward(kind.get().name(), body, event.id());
      }
    } else if (DomainEventNames.isMembership(event.name())) {
      publisher.publish(membersSubject, event.id(), body);
    } else {
      publisher.publish(genericSubject, event.id(), body);
    }
    logger.info("domain event published eventId={} name={}", event.id(), event.name());
  }

  static Map<String, Object> body(DomainEvent event) {
    final Map<String, Object> body = new LinkedHashMap<>(event.payload());
    body.put("eventName", event.name());
    body.put("domainEventId", event.id());
    body.put("occurredAt", event.occurredAt().toString());
    return body;
  }
}
