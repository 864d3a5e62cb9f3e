/*
 * Where: domain event bridge
 * What: durable publisher used when NATS is disabled
 * Why: local runs and tests start the service without a broker
 */
package com.example.delivery.bridge;

import com.example.common.event.DomainEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class NoopDurableEventPublisher implements DurableEventPublisher {

  private static final Logger logger = LoggerFactory.getLogger(NoopDurableEventPublisher.class);

  @Override
  public void publish(DomainEvent event) {
    logger.debug("nats disabled, durable publish skipped eventId={} name={}", event.id(), event.name());
  }
}
