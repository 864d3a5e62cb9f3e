/*
 * Where: pending-delivery store (Redis)
 * What: keeps pending records under delivery:pending:{id} and confirmation markers under delivery:confirmed:{id}
 * Why: Redis expiry and Lua atomicity give first-confirmer-wins across every gateway instance
 */
package com.example.delivery.pending;

import com.example.delivery.config.ConfirmationProperties;
import com.example.delivery.model.PendingDelivery;
import com.example.delivery.model.PendingDeliveryMetadata;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

@Repository
public class RedisPendingDeliveryStore implements PendingDeliveryStore {

  private static final Logger logger = LoggerFactory.getLogger(RedisPendingDeliveryStore.class);

  static final String PENDING_PREFIX = "delivery:pending:";
  static final String CONFIRMED_PREFIX = "delivery:confirmed:";
  private static final long SCAN_COUNT = 200;
  private static final long NO_EXPIRY = -1L;

  // GET + DEL + SET in one script: a racing confirmer finds nothing to move
  @VisibleForTesting
  static final RedisScript<String> CONFIRM_SCRIPT =
      new DefaultRedisScript<>(
          """
          local value = redis.call('GET', KEYS[1])
          if not value then
            return false
          end
          redis.call('DEL', KEYS[1])
          redis.call('SET', KEYS[2], value, 'PX', ARGV[1])
          return value
          """,
          String.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final ConfirmationProperties confirmationProperties;

  public RedisPendingDeliveryStore(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      ConfirmationProperties confirmationProperties) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.confirmationProperties = confirmationProperties;
  }

  @Override
  public void storePendingDelivery(
      String messageId,
      Map<String, Object> payload,
      PendingDeliveryMetadata metadata,
      Duration ttl) {
    final String value = serialize(new PendingDelivery(messageId, payload, metadata));
    try {
      redisTemplate.opsForValue().set(pendingKey(messageId), value, ttl);
    } catch (DataAccessException ex) {
      throw new StoreUnavailableException("failed to store pending delivery " + messageId, ex);
    }
    logger.debug("pending delivery stored messageId={} ttl={}", messageId, ttl);
  }

  @Override
  public boolean isPending(String messageId) {
    try {
      return Boolean.TRUE.equals(redisTemplate.hasKey(pendingKey(messageId)));
    } catch (DataAccessException ex) {
      throw new StoreUnavailableException("failed to check pending delivery " + messageId, ex);
    }
  }

  @Override
  public Optional<PendingDelivery> confirmDelivery(String messageId) {
    final String value;
    try {
      value =
          redisTemplate.execute(
              CONFIRM_SCRIPT,
              List.of(pendingKey(messageId), confirmedKey(messageId)),
              String.valueOf(confirmationProperties.ttl().toMillis()));
    } catch (DataAccessException ex) {
      throw new StoreUnavailableException("failed to confirm delivery " + messageId, ex);
    }
    if (value == null) {
      logger.debug("confirmation found no pending record messageId={}", messageId);
      return Optional.empty();
    }
    return deserialize(messageId, value);
  }

  @Override
  public Optional<PendingDelivery> takeConfirmation(String messageId) {
    final String value;
    try {
      value = redisTemplate.opsForValue().getAndDelete(confirmedKey(messageId));
    } catch (DataAccessException ex) {
      throw new StoreUnavailableException("failed to take confirmation " + messageId, ex);
    }
    return value == null ? Optional.empty() : deserialize(messageId, value);
  }

  @Override
  public void removePendingDelivery(String messageId) {
    try {
      redisTemplate.delete(pendingKey(messageId));
    } catch (DataAccessException ex) {
      throw new StoreUnavailableException("failed to remove pending delivery " + messageId, ex);
    }
  }

  @Override
  public List<String> listPending() {
    final List<String> messageIds = new ArrayList<>();
    for (String key : scanPendingKeys()) {
      messageIds.add(key.substring(PENDING_PREFIX.length()));
    }
    return messageIds;
  }

  @Override
  public long pendingCount() {
    return scanPendingKeys().size();
  }

  @Override
  public int cleanupExpired() {
    int removed = 0;
    for (String key : scanPendingKeys()) {
      try {
        final Long expire = redisTemplate.getExpire(key);
        if (expire != null && expire == NO_EXPIRY && Boolean.TRUE.equals(redisTemplate.delete(key))) {
          removed++;
        }
      } catch (DataAccessException ex) {
        throw new StoreUnavailableException("failed to sweep pending delivery " + key, ex);
      }
    }
    return removed;
  }

  private List<String> scanPendingKeys() {
    final ScanOptions options =
        ScanOptions.scanOptions().match(PENDING_PREFIX + "*").count(SCAN_COUNT).build();
    final List<String> keys = new ArrayList<>();
    try (Cursor<String> cursor = redisTemplate.scan(options)) {
      cursor.forEachRemaining(keys::add);
    } catch (DataAccessException ex) {
      throw new StoreUnavailableException("failed to scan pending deliveries", ex);
    }
    return keys;
  }

  private String serialize(PendingDelivery delivery) {
    try {
      return objectMapper.writeValueAsString(delivery);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException(
          "pending delivery payload is not serializable " + delivery.messageId(), ex);
    }
  }

  private Optional<PendingDelivery> deserialize(String messageId, String value) {
    try {
      return Optional.of(objectMapper.readValue(value, PendingDelivery.class));
    } catch (JsonProcessingException ex) {
      logger.warn("unreadable pending delivery record messageId={}", messageId, ex);
      return Optional.empty();
    }
  }

  static String pendingKey(String messageId) {
    return PENDING_PREFIX + messageId;
  }

  static String confirmedKey(String messageId) {
    return CONFIRMED_PREFIX + messageId;
  }
}
