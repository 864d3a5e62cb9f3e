/*
 * Where: realtime gateway rate limiting
 * What: fixed-window counters in Redis, INCR and the window expiry in one script
 * Why: every gateway instance shares one budget per bucket
 */
package com.example.delivery.realtime;

import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RealtimeRateLimiter {

  private static final Logger logger = LoggerFactory.getLogger(RealtimeRateLimiter.class);

  // a counter without expiry gets one on its next hit, so a bucket can never stay closed
  @VisibleForTesting
  static final RedisScript<Long> ACQUIRE_SCRIPT =
      new DefaultRedisScript<>(
          """
          local count = redis.call('INCR', KEYS[1])
          if redis.call('PTTL', KEYS[1]) < 0 then
            redis.call('PEXPIRE', KEYS[1], ARGV[1])
          end
          return count
          """,
          Long.class);

  private final StringRedisTemplate redisTemplate;

  /** A store failure allows the event; count is then reported as -1. */
  public Decision tryAcquire(String bucketKey, int max, Duration window) {
    final Long count;
    try {
      count =
          redisTemplate.execute(
              ACQUIRE_SCRIPT, List.of(bucketKey), String.valueOf(window.toMillis()));
    } catch (DataAccessException ex) {
      logger.warn("rate limit store unavailable, allowing event bucket={}", bucketKey, ex);
      return new Decision(true, -1, max);
    }
    final long current = count == null ? 0 : count;
    return new Decision(current <= max, current, max);
  }

  public record Decision(boolean allowed, long count, int max) {

    public double usageRatio() {
      return count < 0 ? 0.0 : (double) count / max;
    }
  }
}
