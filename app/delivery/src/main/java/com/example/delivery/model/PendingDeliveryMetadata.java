package com.example.delivery.model;

public record PendingDeliveryMetadata(
    String targetUserId, String tenantId, long createdAtMillis, String sourceQueue) {}
