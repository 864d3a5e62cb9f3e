package com.example.delivery.bridge;

import com.example.common.event.DomainEvent;

/** Hands a domain event to the broker; the live broadcast is layered on top of it. */
public interface DurableEventPublisher {

  void publish(DomainEvent event);
}
