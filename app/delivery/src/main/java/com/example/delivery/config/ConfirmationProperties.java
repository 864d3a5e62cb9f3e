/*
 * Where: delivery configuration binding
 * What: how long a pushed notification waits for the client acknowledgment and how often it is polled
 * Why: the confirmation TTL bounds the worst-case latency of a persisted notification
 */
package com.example.delivery.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "delivery.confirmation")
@Validated
public record ConfirmationProperties(
    @NotNull @DurationUnit(ChronoUnit.SECONDS) Duration ttl,
    @NotNull Duration pollInterval,
    @NotNull Duration pollMaxInterval) {

  @AssertTrue(message = "delivery.confirmation.ttl must be positive")
  public boolean isTtlPositive() {
    return isPositiveDuration(ttl);
  }

  @AssertTrue(message = "delivery.confirmation.poll-interval must be positive")
  public boolean isPollIntervalPositive() {
    return isPositiveDuration(pollInterval);
  }

  @AssertTrue(
      message = "delivery.confirmation.poll-max-interval must not be shorter than poll-interval")
  public boolean isPollMaxIntervalConsistent() {
    // nulls are reported by @NotNull
    if (pollInterval == null || pollMaxInterval == null) {
      return true;
    }
    return pollMaxInterval.compareTo(pollInterval) >= 0;
  }

  /** Lifetime of a pending record: it outlives the wait so only the waiter decides a timeout. */
  public Duration pendingRecordTtl() {
    return ttl.plus(pollMaxInterval);
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
