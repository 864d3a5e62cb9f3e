/*
 * Where: delivery service layer
 * What: consumer outcomes, persisted delivery modes, confirmation latency and the pending gauge
 * Why: retry/DLQ rates and fallback persistence are the health signals of the confirmation flow
 */
package com.example.delivery.service;

import com.example.delivery.model.DeliveryMode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class DeliveryMetrics {

  private static final String METRIC_CONSUMER_MESSAGES_TOTAL = "delivery.consumer.messages.total";
  private static final String METRIC_PERSISTED_TOTAL = "delivery.notifications.persisted.total";
  private static final String METRIC_CONFIRMATION_LATENCY = "delivery.confirmation.latency";
  private static final String METRIC_PENDING_CURRENT = "delivery.pending.current";

  private final MeterRegistry meterRegistry;
  private final AtomicLong pendingCurrent = new AtomicLong(0);
  private final ConcurrentMap<String, Counter> consumerCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<DeliveryMode, Counter> persistedCounters = new ConcurrentHashMap<>();
  private final Timer confirmationLatencyTimer;

  public DeliveryMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_PENDING_CURRENT, pendingCurrent, AtomicLong::get)
        .description("Pending deliveries awaiting a client acknowledgment")
        .register(meterRegistry);
    this.confirmationLatencyTimer =
        Timer.builder(METRIC_CONFIRMATION_LATENCY)
            .description("Time from push to observed client confirmation")
            .register(meterRegistry);
  }

  /** result is one of acked, duplicate, retried, dead_lettered. */
  public void recordConsumerOutcome(String queue, String result) {
    consumerCounters
        .computeIfAbsent(
            queue + '|' + result,
            ignored ->
                Counter.builder(METRIC_CONSUMER_MESSAGES_TOTAL)
                    .description("Queue message outcomes per consumer")
                    .tags(Tags.of("queue", queue, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordPersisted(DeliveryMode mode) {
    persistedCounters
        .computeIfAbsent(
            mode,
            ignored ->
                Counter.builder(METRIC_PERSISTED_TOTAL)
                    .description("Persisted notifications by delivery mode")
                    .tags(Tags.of("mode", mode.name()))
                    .register(meterRegistry))
        .increment();
  }

  public void recordConfirmationLatency(Duration latency) {
    if (latency == null || latency.isNegative()) {
      return;
    }
    confirmationLatencyTimer.record(latency);
  }

  public void updatePendingCurrent(long pending) {
    pendingCurrent.set(Math.max(pending, 0));
  }
}
