/*
 * Where: realtime gateway
 * What: joins authenticated sockets to their rooms and dispatches inbound frames
 * Why: inbound frames are rate-limited per user and event before they touch the pending store
 */
package com.example.delivery.realtime;

import com.example.delivery.config.RealtimeProperties;
import com.example.delivery.repository.MembershipDirectory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
public class RealtimeWebSocketHandler extends TextWebSocketHandler {

  private static final Logger logger = LoggerFactory.getLogger(RealtimeWebSocketHandler.class);
  static final String INBOUND_BUCKET_PREFIX = "ws:inbound:";

  private final LocalSessionRegistry sessionRegistry;
  private final MembershipDirectory membershipDirectory;
  private final DeliveryAckHandler ackHandler;
  private final RealtimeRateLimiter rateLimiter;
  private final RateLimitPolicy inboundPolicy;
  private final GatewayMetrics metrics;
  private final ObjectMapper objectMapper;

  public RealtimeWebSocketHandler(
      LocalSessionRegistry sessionRegistry,
      MembershipDirectory membershipDirectory,
      DeliveryAckHandler ackHandler,
      RealtimeRateLimiter rateLimiter,
      RealtimeProperties properties,
      GatewayMetrics metrics,
      ObjectMapper objectMapper) {
    this.sessionRegistry = sessionRegistry;
    this.membershipDirectory = membershipDirectory;
    this.ackHandler = ackHandler;
    this.rateLimiter = rateLimiter;
    this.inboundPolicy = RateLimitPolicy.fromConfiguration(properties.inboundRateLimit());
    this.metrics = metrics;
    this.objectMapper = objectMapper;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) throws Exception {
    final String userId = userId(session);
    if (userId == null) {
      session.close(CloseStatus.POLICY_VIOLATION);
      return;
    }
    final List<String> rooms = new ArrayList<>();
    rooms.add(Rooms.user(userId));
    try {
      for (String tenantId : membershipDirectory.tenantIdsOf(userId)) {
        rooms.add(Rooms.tenant(tenantId));
      }
    } catch (DataAccessException ex) {
      // the user room still works without tenant rooms
      logger.warn("failed to load memberships, joining user room only userId={}", userId, ex);
    }
    sessionRegistry.register(session, rooms);
    metrics.connectionOpened();
    logger.info("realtime connection opened userId={} sessionId={} rooms={}",
        userId, session.getId(), rooms.size());
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    final String userId = userId(session);
    if (userId == null) {
      metrics.recordInboundRejected("unauthenticated");
      logger.warn("inbound frame on unauthenticated socket ignored sessionId={}", session.getId());
      return;
    }
    final JsonNode frame;
    try {
      frame = objectMapper.readTree(message.getPayload());
    } catch (JsonProcessingException ex) {
      metrics.recordInboundRejected("malformed");
      logger.warn("malformed inbound frame ignored userId={}", userId);
      return;
    }
    final String event = frame.path("event").asText("");
    if (event.isEmpty()) {
      metrics.recordInboundRejected("malformed");
      logger.warn("inbound frame without event ignored userId={}", userId);
      return;
    }
    final RealtimeRateLimiter.Decision decision =
        rateLimiter.tryAcquire(
            INBOUND_BUCKET_PREFIX + userId + ":" + event,
            inboundPolicy.maxFor(event),
            inboundPolicy.window());
    if (!decision.allowed()) {
      metrics.recordInboundRejected("rate_limited");
      logger.warn("inbound frame over rate limit ignored userId={} event={} count={}",
          userId, event, decision.count());
      return;
    }
    try {
      dispatch(userId, event, frame.get("data"));
    } catch (RuntimeException ex) {
      logger.error("inbound frame handling failed userId={} event={}", userId, event, ex);
    }
  }

  private void dispatch(String userId, String event, JsonNode data) {
    switch (event) {
      case RealtimeEvents.NOTIFICATION_DELIVERED -> ackHandler.delivered(userId, data);
      case RealtimeEvents.NOTIFICATION_DELIVERY_FAILED -> ackHandler.failed(userId, data);
      default -> {
        metrics.recordInboundRejected("unknown_event");
        logger.debug("unknown inbound event ignored userId={} event={}", userId, event);
      }
    }
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    logger.warn("realtime transport error sessionId={}", session.getId(), exception);
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    if (userId(session) == null) {
      return;
    }
    sessionRegistry.unregister(session.getId());
    metrics.connectionClosed();
    logger.info("realtime connection closed sessionId={} status={}", session.getId(), status);
  }

  private String userId(WebSocketSession session) {
    final Object value = session.getAttributes().get(SessionHandshakeInterceptor.USER_ID_ATTRIBUTE);
    return value instanceof String userId && !userId.isBlank() ? userId : null;
  }
}
