/*
 * Where: realtime notification delivery
 * What: stages, pushes and finalizes each recipient's notification after client acknowledgment or timeout
 * Why: the live push is a latency optimization, the persisted row is the source of truth
 */
package com.example.delivery.service;

import com.example.delivery.config.ConfirmationProperties;
import com.example.delivery.config.ConsumerProperties;
import com.example.delivery.consumer.DeliveryHandler;
import com.example.delivery.consumer.DeliveryResult;
import com.example.delivery.consumer.MalformedMessageException;
import com.example.delivery.consumer.MessageIds;
import com.example.delivery.model.DeliveryMode;
import com.example.delivery.model.NotificationEventKind;
import com.example.delivery.model.PendingDelivery;
import com.example.delivery.model.PendingDeliveryMetadata;
import com.example.delivery.model.RealtimeNotificationMessage;
import com.example.delivery.model.UserProfile;
import com.example.delivery.pending.PendingDeliveryStore;
import com.example.delivery.pending.StoreUnavailableException;
import com.example.delivery.realtime.RealtimeEvents;
import com.example.delivery.realtime.RealtimeGateway;
import com.example.delivery.repository.UserDirectory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class RealtimeNotificationHandler implements DeliveryHandler<RealtimeNotificationMessage> {

  public static final String CONSUMER_NAME = "realtime-notifications";
  private static final Logger logger = LoggerFactory.getLogger(RealtimeNotificationHandler.class);
  private static final double POLL_BACKOFF_MULTIPLIER = 1.5;

  private final RecipientResolver recipientResolver;
  private final UserDirectory userDirectory;
  private final PendingDeliveryStore pendingDeliveryStore;
  private final RealtimeGateway gateway;
  private final NotificationCreator notificationCreator;
  private final ConfirmationSignal confirmationSignal;
  private final MessageIds messageIds;
  private final ConfirmationProperties confirmationProperties;
  private final DeliveryMetrics metrics;
  private final Clock clock;
  private final String sourceQueue;

  public RealtimeNotificationHandler(
      RecipientResolver recipientResolver,
      UserDirectory userDirectory,
      PendingDeliveryStore pendingDeliveryStore,
      RealtimeGateway gateway,
      NotificationCreator notificationCreator,
      ConfirmationSignal confirmationSignal,
      MessageIds messageIds,
      ConfirmationProperties confirmationProperties,
      ConsumerProperties consumerProperties,
      DeliveryMetrics metrics,
      Clock clock) {
    this.recipientResolver = recipientResolver;
    this.userDirectory = userDirectory;
    this.pendingDeliveryStore = pendingDeliveryStore;
    this.gateway = gateway;
    this.notificationCreator = notificationCreator;
    this.confirmationSignal = confirmationSignal;
    this.messageIds = messageIds;
    this.confirmationProperties = confirmationProperties;
    this.metrics = metrics;
    this.clock = clock;
    this.sourceQueue = consumerProperties.settings(CONSUMER_NAME).queue();
  }

  @Override
  public Class<RealtimeNotificationMessage> payloadType() {
    return RealtimeNotificationMessage.class;
  }

  @Override
  public String dedupKey(RealtimeNotificationMessage message) {
    final String explicitId = message.firstString("messageId", "id");
    if (explicitId != null) {
      return "realtime:msg:" + explicitId;
    }
    final String inviteId = message.string("inviteId");
    final String timestamp = message.string("timestamp");
    if (message.eventId() != null && inviteId != null && timestamp != null) {
      return "realtime:evt:" + message.eventId() + ":invite:" + inviteId + ":ts:" + timestamp;
    }
    return null;
  }

  @Override
  public DeliveryResult processWithDelivery(RealtimeNotificationMessage message, String messageId) {
    if (message.eventId() == null) {
      throw new MalformedMessageException(
          "realtime notification without eventId");
    }
    final Optional<NotificationEventKind> maybeKind = message.kind();
    if (maybeKind.isEmpty()) {
      logger.info("unknown eventId skipped eventId={} messageId={}", message.eventId(), messageId);
      return DeliveryResult.skipped("unknown eventId " + message.eventId());
    }
    final NotificationEventKind kind = maybeKind.get();
    final List<String> recipients = recipientResolver.resolve(message, kind);
    if (recipients.isEmpty()) {
      notificationCreator.create(
          messageId, null, kind, message.attributes(), DeliveryMode.NO_RECIPIENT);
      return DeliveryResult.resolved(true);
    }

    final String tenantId = message.tenantId();
    final Map<String, StagedDelivery> outstanding = new LinkedHashMap<>();
    boolean saved = false;
    for (String userId : recipients) {
      final Optional<UserProfile> profile = userDirectory.findById(userId);
      if (profile.isEmpty()) {
        logger.info("recipient not found, skipped userId={} messageId={}", userId, messageId);
        continue;
      }
      final String recipientMessageId = messageIds.perRecipient(messageId, userId);
      if (!profile.get().preferences().realtimeEnabled()) {
        notificationCreator.create(
            recipientMessageId, userId, kind, message.attributes(), DeliveryMode.LIVE_DISABLED);
        saved = true;
        continue;
      }
      final Map<String, Object> payload = new LinkedHashMap<>(message.attributes());
      payload.put("messageId", recipientMessageId);
      payload.put("eventName", kind.eventName());
      payload.put("userId", userId);
      final Instant stagedAt = Instant.now(clock);
      // a store failure here propagates so the broker retries the whole message
      pendingDeliveryStore.storePendingDelivery(
          recipientMessageId,
          payload,
          new PendingDeliveryMetadata(userId, tenantId, stagedAt.toEpochMilli(), sourceQueue),
          confirmationProperties.pendingRecordTtl());
      outstanding.put(userId, new StagedDelivery(recipientMessageId, stagedAt));
      gateway.emitToUser(userId, RealtimeEvents.NOTIFICATION_CREATED, payload);
    }
    if (tenantId != null) {
      final Map<String, Object> tenantPayload = new LinkedHashMap<>(message.attributes());
      tenantPayload.put("messageId", messageId);
      gateway.emitToTenant(tenantId, RealtimeEvents.NOTIFICATION_CREATED, tenantPayload);
    }
    if (outstanding.isEmpty()) {
      return DeliveryResult.resolved(saved);
    }

    final int expected = outstanding.size();
    final int resolved = awaitConfirmations(message, kind, outstanding);
    saved = saved || resolved > 0;
    if (!outstanding.isEmpty()) {
      return DeliveryResult.unresolved(
          saved, "unresolved deliveries " + outstanding.size() + "/" + expected);
    }
    return DeliveryResult.resolved(saved);
  }

  private int awaitConfirmations(
      RealtimeNotificationMessage message,
      NotificationEventKind kind,
      Map<String, StagedDelivery> outstanding) {
    // measured from the first staging so the wait ends before any pending record expires
    final Instant deadline =
        outstanding.values().stream()
            .map(StagedDelivery::stagedAt)
            .min(Instant::compareTo)
            .orElseGet(() -> Instant.now(clock))
            .plus(confirmationProperties.ttl());
    int resolved = 0;
    Duration interval = confirmationProperties.pollInterval();
    try (ConfirmationSignal.Waiter waiter =
        confirmationSignal.register(
            outstanding.values().stream().map(StagedDelivery::messageId).toList())) {
      while (!outstanding.isEmpty()) {
        final int progressed = pollOnce(message, kind, outstanding);
        resolved += progressed;
        if (outstanding.isEmpty()) {
          break;
        }
        final Duration remaining = Duration.between(Instant.now(clock), deadline);
        if (remaining.isZero() || remaining.isNegative()) {
          break;
        }
        interval = progressed > 0 ? confirmationProperties.pollInterval() : backOff(interval);
        waiter.await(interval.compareTo(remaining) < 0 ? interval : remaining);
      }
    } catch (InterruptedException ex) {
      // shutdown: leave the rest to the broker redelivery
      Thread.currentThread().interrupt();
      logger.warn("confirmation wait interrupted outstanding={}", outstanding.size());
      return resolved;
    }
    if (!outstanding.isEmpty()) {
      resolved += finalizeTimedOut(message, kind, outstanding);
    }
    return resolved;
  }

  private int pollOnce(
      RealtimeNotificationMessage message,
      NotificationEventKind kind,
      Map<String, StagedDelivery> outstanding) {
    int progressed = 0;
    final Iterator<Map.Entry<String, StagedDelivery>> iterator = outstanding.entrySet().iterator();
    while (iterator.hasNext()) {
      final Map.Entry<String, StagedDelivery> entry = iterator.next();
      final String userId = entry.getKey();
      final StagedDelivery staged = entry.getValue();
      final Optional<PendingDelivery> confirmation;
      try {
        if (pendingDeliveryStore.isPending(staged.messageId())) {
          continue;
        }
        confirmation = pendingDeliveryStore.takeConfirmation(staged.messageId());
      } catch (StoreUnavailableException ex) {
        logger.warn("pending store unavailable while polling messageId={}", staged.messageId(), ex);
        continue;
      }
      final boolean persisted;
      if (confirmation.isPresent()) {
        metrics.recordConfirmationLatency(Duration.between(staged.stagedAt(), Instant.now(clock)));
        persisted =
            persist(staged.messageId(), userId, kind, confirmation.get().payload(),
                DeliveryMode.CONFIRMED);
      } else {
        // gone before the deadline: reported failed by the client or removed by the cleanup sweep
        logger.info("delivery expired without confirmation messageId={}", staged.messageId());
        persisted =
            persist(staged.messageId(), userId, kind, message.attributes(),
                DeliveryMode.EXPIRED_FALLBACK);
      }
      if (persisted) {
        iterator.remove();
        progressed++;
      }
    }
    return progressed;
  }

  private int finalizeTimedOut(
      RealtimeNotificationMessage message,
      NotificationEventKind kind,
      Map<String, StagedDelivery> outstanding) {
    int resolved = 0;
    final Iterator<Map.Entry<String, StagedDelivery>> iterator = outstanding.entrySet().iterator();
    while (iterator.hasNext()) {
      final Map.Entry<String, StagedDelivery> entry = iterator.next();
      final String recipientMessageId = entry.getValue().messageId();
      Optional<PendingDelivery> lateConfirmation = Optional.empty();
      try {
        pendingDeliveryStore.removePendingDelivery(recipientMessageId);
        lateConfirmation = pendingDeliveryStore.takeConfirmation(recipientMessageId);
      } catch (StoreUnavailableException ex) {
        logger.warn("pending store unavailable during timeout cleanup messageId={}",
            recipientMessageId, ex);
      }
      final boolean persisted;
      if (lateConfirmation.isPresent()) {
        persisted =
            persist(recipientMessageId, entry.getKey(), kind, lateConfirmation.get().payload(),
                DeliveryMode.CONFIRMED);
      } else {
        logger.warn(
            "delivery confirmation timed out, persisting without acknowledgment messageId={} timeout={}",
            recipientMessageId,
            confirmationProperties.ttl());
        persisted =
            persist(recipientMessageId, entry.getKey(), kind, message.attributes(),
                DeliveryMode.TIMEOUT_FALLBACK);
      }
      if (persisted) {
        iterator.remove();
        resolved++;
      }
    }
    return resolved;
  }

  private boolean persist(
      String recipientMessageId,
      String userId,
      NotificationEventKind kind,
      Map<String, Object> payload,
      DeliveryMode mode) {
    try {
      notificationCreator.create(recipientMessageId, userId, kind, payload, mode);
      return true;
    } catch (RuntimeException ex) {
      logger.error("failed to persist notification messageId={} mode={}", recipientMessageId, mode,
          ex);
      return false;
    }
  }

  private Duration backOff(Duration current) {
    final Duration next = Duration.ofMillis((long) (current.toMillis() * POLL_BACKOFF_MULTIPLIER));
    final Duration max = confirmationProperties.pollMaxInterval();
    return next.compareTo(max) > 0 ? max : next;
  }

  private record StagedDelivery(String messageId, Instant stagedAt) {}
}
