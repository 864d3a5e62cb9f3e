/*
 * Where: resilient consumer dedup
 * What: TTL-bounded dedup:{key} markers in Redis
 * Why: broker redeliveries collapse into one side effect while the marker lives
 */
package com.example.delivery.consumer;

import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DedupRepository {

  static final String KEY_PREFIX = "dedup:";
  private static final String SENTINEL = "1";

  private final StringRedisTemplate redisTemplate;

  public boolean exists(String dedupKey) {
    return Boolean.TRUE.equals(redisTemplate.hasKey(KEY_PREFIX + dedupKey));
  }

  public void mark(String dedupKey, Duration ttl) {
    redisTemplate.opsForValue().set(KEY_PREFIX + dedupKey, SENTINEL, ttl);
  }
}
