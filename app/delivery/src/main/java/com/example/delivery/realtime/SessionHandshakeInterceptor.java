/*
 * Where: realtime gateway authentication
 * What: rejects WebSocket upgrades without a valid session token
 * Why: rooms are derived from the authenticated user, anonymous sockets have nowhere to go
 */
package com.example.delivery.realtime;

import com.example.delivery.config.RealtimeProperties;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class SessionHandshakeInterceptor implements HandshakeInterceptor {

  public static final String USER_ID_ATTRIBUTE = "userId";
  private static final String BEARER_PREFIX = "Bearer ";
  private static final String TOKEN_QUERY_PARAM = "token";
  private static final Logger logger = LoggerFactory.getLogger(SessionHandshakeInterceptor.class);

  private final SessionTokenVerifier tokenVerifier;
  private final String sessionCookie;

  public SessionHandshakeInterceptor(
      SessionTokenVerifier tokenVerifier, RealtimeProperties properties) {
    this.tokenVerifier = tokenVerifier;
    this.sessionCookie = properties.sessionCookie();
  }

  @Override
  public boolean beforeHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Map<String, Object> attributes) {
    final Optional<String> userId = resolveToken(request).flatMap(tokenVerifier::verify);
    if (userId.isEmpty()) {
      logger.info("realtime handshake rejected remote={}", request.getRemoteAddress());
      response.setStatusCode(HttpStatus.UNAUTHORIZED);
      return false;
    }
    attributes.put(USER_ID_ATTRIBUTE, userId.get());
    return true;
  }

  @Override
  public void afterHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Exception exception) {
    if (exception != null) {
      logger.warn("realtime handshake failed", exception);
    }
  }

  // cookie, then Authorization header, then the token query parameter
  Optional<String> resolveToken(ServerHttpRequest request) {
    if (request instanceof ServletServerHttpRequest servletRequest) {
      final Optional<String> fromCookie = cookieValue(servletRequest.getServletRequest());
      if (fromCookie.isPresent()) {
        return fromCookie;
      }
    }
    final String authorization = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
    if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
      final String token = authorization.substring(BEARER_PREFIX.length()).trim();
      if (!token.isEmpty()) {
        return Optional.of(token);
      }
    }
    final String fromQuery =
        UriComponentsBuilder.fromUri(request.getURI())
            .build()
            .getQueryParams()
            .getFirst(TOKEN_QUERY_PARAM);
    return fromQuery == null || fromQuery.isBlank() ? Optional.empty() : Optional.of(fromQuery);
  }

  private Optional<String> cookieValue(HttpServletRequest request) {
    final Cookie[] cookies = request.getCookies();
    if (cookies == null) {
      return Optional.empty();
    }
    for (Cookie cookie : cookies) {
      if (sessionCookie.equals(cookie.getName())
          && cookie.getValue() != null
          && !cookie.getValue().isBlank()) {
        return Optional.of(cookie.getValue());
      }
    }
    return Optional.empty();
  }
}
