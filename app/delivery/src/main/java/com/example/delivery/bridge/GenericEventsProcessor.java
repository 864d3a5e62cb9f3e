/*
 * Where: domain event bridge
 * What: consumes events.generic and forwards friend and notification events to the realtime queue
 * Why: those events are stored and pushed through the acknowledged delivery path like invites
 */
package com.example.delivery.bridge;

import com.example.delivery.consumer.MessageProcessor;
import com.example.delivery.model.NotificationEventKind;
import com.example.delivery.model.RealtimeNotificationMessage;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GenericEventsProcessor implements MessageProcessor<RealtimeNotificationMessage> {

  private static final Logger logger = LoggerFactory.getLogger(GenericEventsProcessor.class);

  private final RealtimeNotificationForwarder forwarder;

  public GenericEventsProcessor(RealtimeNotificationForwarder forwarder) {
    this.forwarder = forwarder;
  }

  @Override
  public Class<RealtimeNotificationMessage> payloadType() {
    return RealtimeNotificationMessage.class;
  }

  @Override
  public String dedupKey(RealtimeNotificationMessage message) {
    final String domainEventId = message.string("domainEventId");
    return domainEventId == null ? null : "generic:" + domainEventId;
  }

  /** Events without a notification kind, such as companys.updated or notifications.read, are acked. */
  @Override
  public void process(RealtimeNotificationMessage message) {
    final String eventName = message.firstString("eventName", "name");
    final Optional<NotificationEventKind> kind = DomainEventNames.kindOf(eventName);
    if (kind.isEmpty()) {
      logger.debug("generic event has no realtime notification eventName={}", eventName);
      return;
    }
    final String domainEventId = message.string("domainEventId");
    logger.info("forwarding generic event eventName={} domainEventId={}", eventName, domainEventId);
    forwarder.forward(
        kind.get().name(),
        message.attributes(),
        domainEventId == null ? null : "generic:" + domainEventId);
  }
}
