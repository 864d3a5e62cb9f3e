package com.example.delivery.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationRecord(
    UUID notificationId,
    String messageId,
    String recipientUserId,
    String senderUserId,
    String tenantId,
    String eventName,
    NotificationCategory category,
    String payloadJson,
    DeliveryMode deliveryMode,
    Instant createdAt,
    Instant readAt) {}
