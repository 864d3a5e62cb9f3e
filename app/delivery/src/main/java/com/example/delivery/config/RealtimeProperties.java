/*
 * Where: delivery configuration binding
 * What: realtime gateway settings (handshake cookie, rate limits, cross-instance fan-out)
 * Why: limits and fan-out requirements differ between single-instance and production deployments
 */
package com.example.delivery.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "delivery.realtime")
@Validated
public record RealtimeProperties(
    @NotBlank String endpoint,
    @NotBlank String sessionCookie,
    @NotEmpty List<String> allowedOrigins,
    @NotNull @Valid RateLimit rateLimit,
    @NotNull @Valid RateLimit inboundRateLimit,
    @NotNull @Valid Fanout fanout,
    @NotBlank String confirmationChannel) {

  public RealtimeProperties {
    allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
  }

  public record RateLimit(
      @NotNull Duration window, @NotNull @Positive Integer max, Map<String, Integer> perEvent) {

    public RateLimit {
      perEvent = perEvent == null ? Map.of() : Map.copyOf(perEvent);
    }

    @AssertTrue(message = "rate limit window must be at least one second")
    public boolean isWindowValid() {
      // counters expire in whole seconds
      return window != null && window.getSeconds() >= 1;
    }
  }

  public record Fanout(boolean enabled, boolean required, @NotBlank String channel) {}
}
