/*
 * Where: realtime gateway authentication
 * What: resolves session:{token} to a user id in Redis
 * Why: sessions are issued by the HTTP edge and shared with the gateway through Redis
 */
package com.example.delivery.realtime;

import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RedisSessionTokenVerifier implements SessionTokenVerifier {

  private static final Logger logger = LoggerFactory.getLogger(RedisSessionTokenVerifier.class);
  static final String KEY_PREFIX = "session:";

  private final StringRedisTemplate redisTemplate;

  @Override
  public Optional<String> verify(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    try {
      final String userId = redisTemplate.opsForValue().get(KEY_PREFIX + token);
      return userId == null || userId.isBlank() ? Optional.empty() : Optional.of(userId);
    } catch (DataAccessException ex) {
      // no session store, no authentication
      logger.warn("session store unavailable, rejecting handshake", ex);
      return Optional.empty();
    }
  }
}
