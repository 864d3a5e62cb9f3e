/*
 * Where: delivery-aware consumer
 * What: derives base and per-recipient message ids
 * Why: a redelivered message must map to the same ids so persistence stays idempotent
 */
package com.example.delivery.consumer;

import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import org.springframework.stereotype.Component;

@Component
public class MessageIds {

  private static final String PREFIX = "msg_";
  private static final int HASH_LENGTH = 16;

  /**
   * msg_ followed by the first 16 hex digits of SHA-256 over the broker identity. Two messages
   * with equal content still get distinct ids; a message without an origin gets a random one.
   */
  public String baseMessageId(MessageOrigin origin) {
    final String identity = origin != null ? origin.identity() : UUID.randomUUID().toString();
    final String hash = Hashing.sha256().hashString(identity, StandardCharsets.UTF_8).toString();
    return PREFIX + hash.substring(0, HASH_LENGTH);
  }

  public String perRecipient(String baseMessageId, String userId) {
    return baseMessageId + "_" + userId;
  }

  public boolean belongsTo(String messageId, String userId) {
    return messageId != null
        && userId != null
        && messageId.startsWith(PREFIX)
        && messageId.endsWith("_" + userId);
  }
}
