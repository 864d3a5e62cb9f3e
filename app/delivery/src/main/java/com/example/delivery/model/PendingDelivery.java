/*
 * Where: delivery model
 * What: a staged notification waiting for the client acknowledgment
 * Why: serialized as-is into delivery:pending:{messageId}
 */
package com.example.delivery.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record PendingDelivery(
    String messageId, Map<String, Object> payload, PendingDeliveryMetadata metadata) {

  public PendingDelivery {
    Objects.requireNonNull(messageId, "messageId");
    payload =
        payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }
}
