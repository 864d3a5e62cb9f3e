/*
 * Where: realtime gateway
 * What: connection gauge, emitted/rate-limited counters and the rate-usage distribution
 * Why: rate limit tuning relies on the usage ratio percentiles
 */
package com.example.delivery.realtime;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class GatewayMetrics {

  private static final String METRIC_CONNECTIONS_ACTIVE = "ws.connections.active";
  private static final String METRIC_EVENTS_EMITTED_TOTAL = "ws.events.emitted.total";
  private static final String METRIC_EVENTS_RATE_LIMITED_TOTAL = "ws.events.rate_limited.total";
  private static final String METRIC_RATE_USAGE_RATIO = "ws.events.rate_usage.ratio";
  private static final String METRIC_INBOUND_REJECTED_TOTAL = "ws.inbound.rejected.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger activeConnections = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> emittedCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> rateLimitedCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> inboundRejectedCounters = new ConcurrentHashMap<>();
  private final DistributionSummary rateUsage;

  public GatewayMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_CONNECTIONS_ACTIVE, activeConnections, AtomicInteger::get)
        .description("Open realtime connections on this instance")
        .register(meterRegistry);
    this.rateUsage =
        DistributionSummary.builder(METRIC_RATE_USAGE_RATIO)
            .description("Rate limit bucket usage (count / max) at emit time")
            .publishPercentiles(0.5, 0.9, 0.95, 0.99)
            .register(meterRegistry);
  }

  public void connectionOpened() {
    activeConnections.incrementAndGet();
  }

  public void connectionClosed() {
    activeConnections.updateAndGet(current -> Math.max(current - 1, 0));
  }

  public void recordEmitted(String event) {
    counter(emittedCounters, METRIC_EVENTS_EMITTED_TOTAL, "Realtime events emitted", event)
        .increment();
  }

  public void recordRateLimited(String event) {
    counter(rateLimitedCounters, METRIC_EVENTS_RATE_LIMITED_TOTAL,
            "Realtime events dropped by the outbound rate limit", event)
        .increment();
  }

  public void recordRateUsage(double ratio) {
    rateUsage.record(ratio);
  }

  public void recordInboundRejected(String reason) {
    inboundRejectedCounters
        .computeIfAbsent(
            reason,
            ignored ->
                Counter.builder(METRIC_INBOUND_REJECTED_TOTAL)
                    .description("Inbound realtime events ignored")
                    .tags(Tags.of("reason", reason))
                    .register(meterRegistry))
        .increment();
  }

  private Counter counter(
      ConcurrentMap<String, Counter> counters, String name, String description, String event) {
    return counters.computeIfAbsent(
        event,
        ignored ->
            Counter.builder(name)
                .description(description)
                .tags(Tags.of("event", event))
                .register(meterRegistry));
  }
}
