package com.example.delivery.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.delivery.model.DeliveryMode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class DeliveryMetricsTest {

  @Test
  void recordsConsumerPersistenceAndPendingMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final DeliveryMetrics metrics = new DeliveryMetrics(registry);

    metrics.recordConsumerOutcome("notifications.realtimes", "acked");
    metrics.recordConsumerOutcome("notifications.realtimes", "acked");
    metrics.recordPersisted(DeliveryMode.TIMEOUT_FALLBACK);
    metrics.recordConfirmationLatency(Duration.ofMillis(120));
    metrics.recordConfirmationLatency(Duration.ofMillis(-1));
    metrics.updatePendingCurrent(-3);

    assertThat(
            registry.get("delivery.consumer.messages.total")
                .tag("queue", "notifications.realtimes")
                .tag("result", "acked")
                .counter()
                .count())
        .isEqualTo(2.0d);
    assertThat(
            registry.get("delivery.notifications.persisted.total")
                .tag("mode", "TIMEOUT_FALLBACK")
                .counter()
                .count())
        .isEqualTo(1.0d);
    assertThat(registry.get("delivery.confirmation.latency").timer().count()).isEqualTo(1L);
    assertThat(registry.get("delivery.pending.current").gauge().value()).isZero();
  }
}
