/*
 * Where: resilient consumer wiring
 * What: builds ResilientConsumer instances from the named consumer settings and shared collaborators
 * Why: each queue bean only supplies its name and its MessageProcessor
 */
package com.example.delivery.consumer;

import com.example.delivery.config.ConsumerProperties;
import com.example.delivery.nats.DeadLetterPublisher;
import com.example.delivery.nats.JetStreamStreamManager;
import com.example.delivery.service.DeliveryMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.Connection;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class ResilientConsumerFactory {

  private final ConsumerProperties consumerProperties;
  private final Connection connection;
  private final JetStreamStreamManager streamManager;
  private final DeadLetterPublisher deadLetterPublisher;
  private final DedupRepository dedupRepository;
  private final ObjectMapper objectMapper;
  private final DeliveryMetrics metrics;

  public ConsumerSettings settings(String name) {
    return consumerProperties.settings(name);
  }

  public <T> ResilientConsumer<T> create(ConsumerSettings settings, MessageProcessor<T> processor) {
    return new ResilientConsumer<>(
        settings,
        processor,
        connection,
        streamManager,
        deadLetterPublisher,
        dedupRepository,
        objectMapper,
        metrics);
  }
}
