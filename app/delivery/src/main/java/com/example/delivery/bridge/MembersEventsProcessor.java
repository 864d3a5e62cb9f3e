/*
 * Where: domain event bridge
 * What: consumes events.members and forwards each membership change to the realtime queue
 * Why: membership notifications then share the acknowledged delivery path of invites
 */
package com.example.delivery.bridge;

import com.example.delivery.consumer.MalformedMessageException;
import com.example.delivery.consumer.MessageProcessor;
import com.example.delivery.model.NotificationEventKind;
import com.example.delivery.model.RealtimeNotificationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MembersEventsProcessor implements MessageProcessor<RealtimeNotificationMessage> {

  private static final Logger logger = LoggerFactory.getLogger(MembersEventsProcessor.class);

  private final RealtimeNotificationForwarder forwarder;

  public MembersEventsProcessor(RealtimeNotificationForwarder forwarder) {
    this.forwarder = forwarder;
  }

  @Override
  public Class<RealtimeNotificationMessage> payloadType() {
    return RealtimeNotificationMessage.class;
  }

  @Override
  public String dedupKey(RealtimeNotificationMessage message) {
    final String domainEventId = message.string("domainEventId");
    return domainEventId == null ? null : "members:" + domainEventId;
  }

  @Override
  public void process(RealtimeNotificationMessage message) {
    final String eventId = resolveEventId(message);
    final String domainEventId = message.string("domainEventId");
    logger.info("forwarding member event eventId={} domainEventId={}", eventId, domainEventId);
    final String msgId = domainEventId == null ? null : "members:" + domainEventId;
    forwarder.forward(eventId, message.attributes(), msgId);
  }

  private String resolveEventId(RealtimeNotificationMessage message) {
    if (message.kind().isPresent()) {
      return message.eventId();
    }
    return DomainEventNames.kindOf(message.string("eventName"))
        .map(NotificationEventKind::name)
        .orElseThrow(
            () ->
                new MalformedMessageException(
                    "member event without a known eventId or eventName eventName="
                        + message.string("eventName")));
  }
}
