/*
 * Where: delivery model
 * What: the JSON body consumed from notifications.realtimes, kept as an open attribute map
 * Why: producers attach event-specific fields, only eventId is structurally required
 */
package com.example.delivery.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record RealtimeNotificationMessage(String eventId, Map<String, Object> attributes) {

  public RealtimeNotificationMessage {
    attributes =
        attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static RealtimeNotificationMessage fromJson(Map<String, Object> body) {
    final Object eventId = body == null ? null : body.get("eventId");
    return new RealtimeNotificationMessage(
        eventId instanceof String value ? value : null, body);
  }

  @JsonValue
  public Map<String, Object> attributes() {
    return attributes;
  }

  public Optional<NotificationEventKind> kind() {
    return NotificationEventKind.fromEventId(eventId);
  }

  /** Reads a scalar attribute; a dotted path walks nested objects ("receiver.id"). */
  public String string(String path) {
    Object current = attributes;
    for (String segment : path.split("\\.")) {
      if (!(current instanceof Map<?, ?> map)) {
        return null;
      }
      current = map.get(segment);
    }
    if (current == null || current instanceof Map<?, ?> || current instanceof List<?>) {
      return null;
    }
    final String value = String.valueOf(current);
    return value.isBlank() ? null : value;
  }

  public List<String> strings(String key) {
    if (!(attributes.get(key) instanceof List<?> values)) {
      return List.of();
    }
    final List<String> result = new ArrayList<>();
    for (Object value : values) {
      if (value != null && !String.valueOf(value).isBlank()) {
        result.add(String.valueOf(value));
      }
    }
    return result;
  }

  public String firstString(String... paths) {
    for (String path : paths) {
      final String value = string(path);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  public String tenantId() {
    return firstString("companyId", "company.id");
  }
}
