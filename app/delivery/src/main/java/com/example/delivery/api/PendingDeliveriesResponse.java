package com.example.delivery.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PendingDeliveriesResponse(long pendingCount, List<String> messageIds) {
  public PendingDeliveriesResponse {
    messageIds = messageIds == null ? List.of() : List.copyOf(messageIds);
  }
}
