package com.example.delivery.realtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.delivery.config.RealtimeProperties;
import com.example.delivery.repository.MembershipDirectory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

class RealtimeWebSocketHandlerTest {

  private LocalSessionRegistry sessionRegistry;
  private MembershipDirectory membershipDirectory;
  private DeliveryAckHandler ackHandler;
  private SimpleMeterRegistry meterRegistry;
  private RealtimeWebSocketHandler handler;

  @BeforeEach
  void setUp() {
    sessionRegistry = mock(LocalSessionRegistry.class);
    membershipDirectory = mock(MembershipDirectory.class);
    ackHandler = mock(DeliveryAckHandler.class);
    meterRegistry = new SimpleMeterRegistry();
    final RealtimeProperties.RateLimit outbound =
        new RealtimeProperties.RateLimit(Duration.ofSeconds(1), 50, Map.of());
    final RealtimeProperties.RateLimit inbound =
        new RealtimeProperties.RateLimit(Duration.ofSeconds(1), 2, Map.of());
    handler =
        new RealtimeWebSocketHandler(
            sessionRegistry,
            membershipDirectory,
            ackHandler,
            new RealtimeRateLimiter(new InMemoryCounters().template()),
            new RealtimeProperties(
                "/rt",
                "mt_session",
                List.of("http://localhost:3000"),
                outbound,
                inbound,
                new RealtimeProperties.Fanout(false, false, "ws:fanout"),
                "delivery:confirmations"),
            new GatewayMetrics(meterRegistry),
            new ObjectMapper());
  }

  @Test
  void connectionJoinsUserAndTenantRooms() throws Exception {
    when(membershipDirectory.tenantIdsOf("u1")).thenReturn(List.of("t1", "t2"));
    final WebSocketSession session = session("u1");

    handler.afterConnectionEstablished(session);

    verify(sessionRegistry).register(session, List.of("user:u1", "tenant:t1", "tenant:t2"));
    assertThat(meterRegistry.get("ws.connections.active").gauge().value()).isEqualTo(1.0d);
  }

  @Test
  void membershipLookupFailureStillJoinsUserRoom() throws Exception {
    when(membershipDirectory.tenantIdsOf("u1"))
        .thenThrow(new DataAccessResourceFailureException("db down"));
    final WebSocketSession session = session("u1");

    handler.afterConnectionEstablished(session);

    verify(sessionRegistry).register(session, List.of("user:u1"));
  }

  @Test
  void unauthenticatedConnectionIsClosed() throws Exception {
    final WebSocketSession session = session(null);

    handler.afterConnectionEstablished(session);

    verify(session).close(CloseStatus.POLICY_VIOLATION);
    verifyNoInteractions(sessionRegistry);
  }

  @Test
  void deliveredFrameReachesAckHandler() throws Exception {
    handler.handleTextMessage(
        session("u1"),
        new TextMessage("{\"event\":\"notification.delivered\",\"data\":{\"messageId\":\"m\"}}"));

    verify(ackHandler).delivered(eq("u1"), any(JsonNode.class));
  }

  @Test
  void inboundFramesOverLimitAreDropped() throws Exception {
    final WebSocketSession session = session("u1");
    final TextMessage frame =
        new TextMessage(
            "{\"event\":\"notification.delivery.failed\",\"data\":{\"messageId\":\"m\"}}");

    for (int i = 0; i < 3; i++) {
      handler.handleTextMessage(session, frame);
    }

    verify(ackHandler, times(2)).failed(eq("u1"), any(JsonNode.class));
    assertThat(
            meterRegistry.get("ws.inbound.rejected.total")
                .tag("reason", "rate_limited")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void malformedAndUnknownFramesAreIgnored() throws Exception {
    final WebSocketSession session = session("u1");

    handler.handleTextMessage(session, new TextMessage("not json"));
    handler.handleTextMessage(session, new TextMessage("{\"data\":{}}"));
    handler.handleTextMessage(session, new TextMessage("{\"event\":\"chat.message\"}"));

    verifyNoInteractions(ackHandler);
  }

  @Test
  void closeUnregistersSession() {
    final WebSocketSession session = session("u1");

    handler.afterConnectionClosed(session, CloseStatus.NORMAL);

    verify(sessionRegistry).unregister("s-u1");
  }

  @Test
  void closeOfUnauthenticatedSessionIsIgnored() {
    handler.afterConnectionClosed(session(null), CloseStatus.NORMAL);

    verify(sessionRegistry, never()).unregister(any());
  }

  private static WebSocketSession session(String userId) {
    final WebSocketSession session = mock(WebSocketSession.class);
    final Map<String, Object> attributes = new HashMap<>();
    if (userId != null) {
      attributes.put(SessionHandshakeInterceptor.USER_ID_ATTRIBUTE, userId);
    }
    when(session.getId()).thenReturn("s-" + userId);
    when(session.getAttributes()).thenReturn(attributes);
    return session;
  }
}
