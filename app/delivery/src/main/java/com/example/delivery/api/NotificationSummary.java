package com.example.delivery.api;

import com.example.delivery.model.DeliveryMode;
import com.example.delivery.model.NotificationCategory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationSummary(
    UUID notificationId,
    String messageId,
    String eventName,
    NotificationCategory category,
    DeliveryMode deliveryMode,
    Instant createdAt,
    Instant readAt,
    JsonNode payload) {}
