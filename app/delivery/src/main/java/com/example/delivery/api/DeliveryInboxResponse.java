/*
 * Where: delivery debug API model
 * What: the persisted notifications of one user
 * Why: shows which delivery mode finalized each notification
 */
package com.example.delivery.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveryInboxResponse(String userId, List<NotificationSummary> notifications) {
  public DeliveryInboxResponse {
    // EI_EXPOSE_REP: keep an unmodifiable copy
    notifications =
        notifications == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(notifications));
  }
}
