package com.example.delivery.realtime;

/**
 * Emits events to connected clients on any gateway instance.
 *
 * <p>Every method returns false when the emit was dropped by the outbound rate limit.
 */
public interface RealtimeGateway {

  boolean emitToUser(String userId, String event, Object data);

  boolean emitToTenant(String tenantId, String event, Object data);

  boolean broadcast(String event, Object data);
}
