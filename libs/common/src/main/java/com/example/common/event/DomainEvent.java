/*
 * Where: shared event contract
 * What: a coarse-grained domain event handed to the event bridge
 * Why: producers and the realtime bridge agree on one envelope shape
 */
package com.example.common.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record DomainEvent(String id, String name, Instant occurredAt, Map<String, Object> payload) {

  public DomainEvent {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(occurredAt, "occurredAt");
    // null values are legal in event payloads, so Map.copyOf cannot be used
    payload =
        payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }

  public String stringValue(String key) {
    final Object value = payload.get(key);
    return value == null ? null : String.valueOf(value);
  }
}
