package com.example.delivery.model;

import java.util.List;

/** An empty notificationIds list clears the whole inbox of the user. */
public record ClearAllNotificationsRequest(
    String userId, String requestId, List<String> notificationIds, String timestamp) {

  public ClearAllNotificationsRequest {
    notificationIds = notificationIds == null ? List.of() : List.copyOf(notificationIds);
  }
}
