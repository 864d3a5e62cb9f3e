/*
 * Where: realtime gateway
 * What: the sockets connected to this instance and the rooms they joined
 * Why: fan-out envelopes are delivered to whichever local sockets sit in the target room
 */
package com.example.delivery.realtime;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

@Component
public class LocalSessionRegistry {

  private static final Logger logger = LoggerFactory.getLogger(LocalSessionRegistry.class);
  private static final int SEND_TIME_LIMIT_MILLIS = 5_000;
  private static final int BUFFER_SIZE_LIMIT_BYTES = 512 * 1024;

  private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
  private final Map<String, Set<String>> rooms = new ConcurrentHashMap<>();
  private final Map<String, List<String>> roomsBySession = new ConcurrentHashMap<>();

  public void register(WebSocketSession session, List<String> joinedRooms) {
    // concurrent emits to one socket must be serialized
    sessions.put(
        session.getId(),
        new ConcurrentWebSocketSessionDecorator(
            session, SEND_TIME_LIMIT_MILLIS, BUFFER_SIZE_LIMIT_BYTES));
    roomsBySession.put(session.getId(), List.copyOf(joinedRooms));
    for (String room : joinedRooms) {
      rooms.computeIfAbsent(room, ignored -> ConcurrentHashMap.newKeySet()).add(session.getId());
    }
  }

  public void unregister(String sessionId) {
    sessions.remove(sessionId);
    final List<String> joined = roomsBySession.remove(sessionId);
    if (joined == null) {
      return;
    }
    for (String room : joined) {
      rooms.computeIfPresent(
          room,
          (ignored, members) -> {
            members.remove(sessionId);
            return members.isEmpty() ? null : members;
          });
    }
  }

  /** Sends the frame to every local socket in the room and returns how many received it. */
  public int deliver(String room, String frame) {
    final Set<String> targets =
        Rooms.BROADCAST.equals(room) ? sessions.keySet() : rooms.getOrDefault(room, Set.of());
    int delivered = 0;
    for (String sessionId : targets) {
      final WebSocketSession session = sessions.get(sessionId);
      if (session == null || !session.isOpen()) {
        continue;
      }
      try {
        session.sendMessage(new TextMessage(frame));
        delivered++;
      } catch (IOException | RuntimeException ex) {
        logger.warn("failed to send realtime frame sessionId={} room={}", sessionId, room, ex);
      }
    }
    return delivered;
  }

  public int connectionCount() {
    return sessions.size();
  }
}
