/*
 * Where: delivery web configuration
 * What: registers the realtime WebSocket endpoint behind the session handshake check
 * Why: only authenticated sockets may join rooms
 */
package com.example.delivery.config;

import com.example.delivery.realtime.RealtimeWebSocketHandler;
import com.example.delivery.realtime.SessionHandshakeInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

  private final RealtimeWebSocketHandler realtimeWebSocketHandler;
  private final SessionHandshakeInterceptor sessionHandshakeInterceptor;
  private final RealtimeProperties properties;

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry
        .addHandler(realtimeWebSocketHandler, properties.endpoint())
        .addInterceptors(sessionHandshakeInterceptor)
        .setAllowedOriginPatterns(properties.allowedOrigins().toArray(String[]::new));
  }
}
