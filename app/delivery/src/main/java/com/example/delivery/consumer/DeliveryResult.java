package com.example.delivery.consumer;

/**
 * Outcome of one delivery round.
 *
 * @param confirmed every recipient was resolved (confirmed or persisted by fallback)
 * @param saved at least one notification was persisted
 * @param error reason when not every recipient resolved, otherwise null
 */
public record DeliveryResult(boolean confirmed, boolean saved, String error) {

  public static DeliveryResult resolved(boolean saved) {
    return new DeliveryResult(true, saved, null);
  }

  public static DeliveryResult skipped(String reason) {
    return new DeliveryResult(true, false, reason);
  }

  public static DeliveryResult unresolved(boolean saved, String error) {
    return new DeliveryResult(false, saved, error);
  }
}
