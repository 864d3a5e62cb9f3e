package com.example.delivery.bridge;

import com.example.common.event.DomainEvent;

/** Entry point for application code that announces a domain event. */
public interface DomainEventPublisher {

  void publish(DomainEvent event);
}
