/*
 * Where: realtime gateway rate limiting
 * What: resolves the per-window maximum for an event name
 * Why: hot events get their own budget without raising the global one
 */
package com.example.delivery.realtime;

import com.example.delivery.config.RealtimeProperties;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RateLimitPolicy {

  /** WS_RATE_LIMIT_MAX_NOTIFICATION_CREATED overrides the limit of notification.created. */
  public static final String ENV_OVERRIDE_PREFIX = "WS_RATE_LIMIT_MAX_";

  private static final Logger logger = LoggerFactory.getLogger(RateLimitPolicy.class);

  private final Duration window;
  private final int globalMax;
  private final Map<String, Integer> perEvent;

  public RateLimitPolicy(RealtimeProperties.RateLimit limits, Map<String, String> environment) {
    this.window = limits.window();
    this.globalMax = limits.max();
    final Map<String, Integer> merged = new HashMap<>(limits.perEvent());
    environment.forEach(
        (name, value) -> {
          if (!name.startsWith(ENV_OVERRIDE_PREFIX)) {
            return;
          }
          final String event =
              name.substring(ENV_OVERRIDE_PREFIX.length()).toLowerCase(Locale.ROOT).replace('_', '.');
          try {
            final int max = Integer.parseInt(value.trim());
            if (max > 0) {
              merged.put(event, max);
            }
          } catch (NumberFormatException ex) {
            logger.warn("ignoring rate limit override name={} value={}", name, value);
          }
        });
    this.perEvent = Map.copyOf(merged);
  }

  public static RateLimitPolicy fromConfiguration(RealtimeProperties.RateLimit limits) {
    return new RateLimitPolicy(limits, Map.of());
  }

  public int maxFor(String event) {
    return perEvent.getOrDefault(event, globalMax);
  }

  public Duration window() {
    return window;
  }
}
