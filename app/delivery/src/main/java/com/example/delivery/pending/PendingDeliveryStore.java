/*
 * Where: pending-delivery store contract
 * What: stage, confirm and expire notifications that wait for a client acknowledgment
 * Why: the store is the single source of truth for "is this push still unacknowledged"
 */
package com.example.delivery.pending;

import com.example.delivery.model.PendingDelivery;
import com.example.delivery.model.PendingDeliveryMetadata;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface PendingDeliveryStore {

  /**
   * Stages a record, replacing any existing one with the same id.
   *
   * @throws StoreUnavailableException when the backing store cannot be reached
   */
  void storePendingDelivery(
      String messageId,
      Map<String, Object> payload,
      PendingDeliveryMetadata metadata,
      Duration ttl);

  boolean isPending(String messageId);

  /**
   * Atomically removes the pending record and returns it. Only the first of several racing callers
   * sees the record; on success a confirmation marker is left for {@link #takeConfirmation}.
   */
  Optional<PendingDelivery> confirmDelivery(String messageId);

  /** Atomically consumes the confirmation marker written by {@link #confirmDelivery}. */
  Optional<PendingDelivery> takeConfirmation(String messageId);

  void removePendingDelivery(String messageId);

  List<String> listPending();

  long pendingCount();

  /** Evicts pending records that carry no expiry and returns how many were removed. */
  int cleanupExpired();
}
