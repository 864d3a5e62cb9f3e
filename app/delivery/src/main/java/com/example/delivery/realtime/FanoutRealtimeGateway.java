/*
 * Where: realtime gateway
 * What: rate-limits, renders and routes every outbound emit through the fan-out relay
 * Why: any instance can reach any connected client while one Redis counter bounds each room
 */
package com.example.delivery.realtime;

import com.example.delivery.config.RealtimeProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class FanoutRealtimeGateway implements RealtimeGateway {

  private static final Logger logger = LoggerFactory.getLogger(FanoutRealtimeGateway.class);
  static final String BUCKET_PREFIX = "ws:rate:";

  private final RealtimeRateLimiter rateLimiter;
  private final RateLimitPolicy policy;
  private final RedisFanoutRelay relay;
  private final LocalSessionRegistry sessionRegistry;
  private final GatewayMetrics metrics;
  private final ObjectMapper objectMapper;

  @Autowired
  public FanoutRealtimeGateway(
      RealtimeRateLimiter rateLimiter,
      RealtimeProperties properties,
      RedisFanoutRelay relay,
      LocalSessionRegistry sessionRegistry,
      GatewayMetrics metrics,
      ObjectMapper objectMapper) {
    this(
        rateLimiter,
        new RateLimitPolicy(properties.rateLimit(), System.getenv()),
        relay,
        sessionRegistry,
        metrics,
        objectMapper);
  }

  FanoutRealtimeGateway(
      RealtimeRateLimiter rateLimiter,
      RateLimitPolicy policy,
      RedisFanoutRelay relay,
      LocalSessionRegistry sessionRegistry,
      GatewayMetrics metrics,
      ObjectMapper objectMapper) {
    this.rateLimiter = rateLimiter;
    this.policy = policy;
    this.relay = relay;
    this.sessionRegistry = sessionRegistry;
    this.metrics = metrics;
    this.objectMapper = objectMapper;
  }

  @Override
  public boolean emitToUser(String userId, String event, Object data) {
    return emit(Rooms.user(userId), event, data);
  }

  @Override
  public boolean emitToTenant(String tenantId, String event, Object data) {
    return emit(Rooms.tenant(tenantId), event, data);
  }

  @Override
  public boolean broadcast(String event, Object data) {
    return emit(Rooms.BROADCAST, event, data);
  }

  private boolean emit(String room, String event, Object data) {
    final RealtimeRateLimiter.Decision decision =
        rateLimiter.tryAcquire(BUCKET_PREFIX + room + ":" + event, policy.maxFor(event), policy.window());
    metrics.recordRateUsage(decision.usageRatio());
    if (!decision.allowed()) {
      metrics.recordRateLimited(event);
      logger.warn(
          "realtime emit dropped by rate limit room={} event={} count={} max={}",
          room,
          event,
          decision.count(),
          decision.max());
      return false;
    }
    final FanoutEnvelope envelope = new FanoutEnvelope(room, render(event, data));
    if (relay.isActive()) {
      try {
        relay.publish(envelope);
        metrics.recordEmitted(event);
        return true;
      } catch (RuntimeException ex) {
        logger.warn("fan-out publish failed, delivering locally room={} event={}", room, event, ex);
      }
    }
    sessionRegistry.deliver(envelope.room(), envelope.frame());
    metrics.recordEmitted(event);
    return true;
  }

  private String render(String event, Object data) {
    final Map<String, Object> frame = new LinkedHashMap<>();
    frame.put("event", event);
    frame.put("data", data);
    try {
      return objectMapper.writeValueAsString(frame);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("realtime payload is not serializable event=" + event, ex);
    }
  }
}
