package com.example.delivery.service;

import com.example.delivery.model.PendingDelivery;
import com.example.delivery.model.PendingDeliveryMetadata;
import com.example.delivery.pending.PendingDeliveryStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** In-memory store whose pending records disappear once their TTL has passed, like Redis keys. */
class ExpiringPendingDeliveryStore implements PendingDeliveryStore {

  private final Clock clock;
  private final Map<String, Entry> pending = new ConcurrentHashMap<>();
  private final Map<String, PendingDelivery> confirmed = new ConcurrentHashMap<>();
  private final List<Duration> storedTtls = new ArrayList<>();

  ExpiringPendingDeliveryStore(Clock clock) {
    this.clock = clock;
  }

  List<Duration> storedTtls() {
    return storedTtls;
  }

  @Override
  public void storePendingDelivery(
      String messageId,
      Map<String, Object> payload,
      PendingDeliveryMetadata metadata,
      Duration ttl) {
    storedTtls.add(ttl);
    pending.put(
        messageId,
        new Entry(new PendingDelivery(messageId, payload, metadata), Instant.now(clock).plus(ttl)));
  }

  @Override
  public boolean isPending(String messageId) {
    return live(messageId).isPresent();
  }

  @Override
  public Optional<PendingDelivery> confirmDelivery(String messageId) {
    final Optional<PendingDelivery> record = live(messageId);
    record.ifPresent(
        delivery -> {
          pending.remove(messageId);
          confirmed.put(messageId, delivery);
        });
    return record;
  }

  @Override
  public Optional<PendingDelivery> takeConfirmation(String messageId) {
    return Optional.ofNullable(confirmed.remove(messageId));
  }

  @Override
  public void removePendingDelivery(String messageId) {
    pending.remove(messageId);
  }

  @Override
  public List<String> listPending() {
    return pending.keySet().stream().filter(this::isPending).toList();
  }

  @Override
  public long pendingCount() {
    return listPending().size();
  }

  @Override
  public int cleanupExpired() {
    return 0;
  }

  private Optional<PendingDelivery> live(String messageId) {
    final Entry entry = pending.get(messageId);
    if (entry == null) {
      return Optional.empty();
    }
    if (!Instant.now(clock).isBefore(entry.expiresAt())) {
      pending.remove(messageId);
      return Optional.empty();
    }
    return Optional.of(entry.delivery());
  }

  private record Entry(PendingDelivery delivery, Instant expiresAt) {}
}
