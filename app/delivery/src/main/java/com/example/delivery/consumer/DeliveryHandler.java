package com.example.delivery.consumer;

/** Delivery step of a queue whose messages are pushed live and persisted after acknowledgment. */
public interface DeliveryHandler<T> {

  Class<T> payloadType();

  default String dedupKey(T payload) {
    return null;
  }

  /**
   * Delivers one payload.
   *
   * @param messageId base id; per-recipient ids are derived from it
   */
  DeliveryResult processWithDelivery(T payload, String messageId);
}
