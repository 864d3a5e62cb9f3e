/*
 * Where: domain event bridge configuration
 * What: subject of the publish-only invites stream and its duplicate window
 * Why: the queues with consumers take their subjects from delivery.consumers instead
 */
package com.example.delivery.bridge;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "delivery.bridge")
@Validated
public record BridgeProperties(
    @NotBlank String invitesSubject,
    @NotNull Duration duplicateWindow,
    @NotNull @Positive Integer clearAllBatchSize) {

  @AssertTrue(message = "duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return duplicateWindow == null || (!duplicateWindow.isZero() && !duplicateWindow.isNegative());
  }
}
