package com.example.delivery.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Per-user switches; a category that is absent or null is enabled. */
public record NotificationPreferences(boolean realtimeEnabled, Map<String, Boolean> categories) {

  public static final NotificationPreferences DEFAULTS = new NotificationPreferences(true, Map.of());

  public NotificationPreferences {
    categories =
        categories == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(categories));
  }

  public boolean allows(NotificationCategory category) {
    return !Boolean.FALSE.equals(categories.get(category.preferenceKey()));
  }
}
