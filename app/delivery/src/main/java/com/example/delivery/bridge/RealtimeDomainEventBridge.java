/*
 * Where: domain event bridge
 * What: publishes a domain event durably, then mirrors it to the rooms of the affected users and tenant
 * Why: live clients see membership and friend changes without waiting for a queue round trip
 */
package com.example.delivery.bridge;

import com.example.common.event.DomainEvent;
import com.example.delivery.model.NotificationCategory;
import com.example.delivery.model.NotificationPreferences;
import com.example.delivery.model.UserProfile;
import com.example.delivery.realtime.RealtimeEvents;
import com.example.delivery.realtime.RealtimeGateway;
import com.example.delivery.repository.UserDirectory;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class RealtimeDomainEventBridge implements DomainEventPublisher {

  private static final Logger logger = LoggerFactory.getLogger(RealtimeDomainEventBridge.class);

  private final DurableEventPublisher durablePublisher;
  private final RealtimeGateway gateway;
  private final UserDirectory userDirectory;

  public RealtimeDomainEventBridge(
      DurableEventPublisher durablePublisher, RealtimeGateway gateway, UserDirectory userDirectory) {
    this.durablePublisher = durablePublisher;
    this.gateway = gateway;
    this.userDirectory = userDirectory;
  }

  /** A durable publish failure propagates; live broadcast failures are only logged. */
  @Override
  public void publish(DomainEvent event) {
    durablePublisher.publish(event);
    try {
      route(event);
    } catch (RuntimeException ex) {
      logger.warn("live broadcast failed eventId={} name={}", event.id(), event.name(), ex);
    }
  }

  private void route(DomainEvent event) {
    final Map<String, Object> payload = event.payload();
    final String name = event.name();
    switch (name) {
      case DomainEventNames.COMPANY_UPDATED ->
          emitToTenant(event.stringValue("id"), RealtimeEvents.COMPANY_UPDATED, payload);
      case DomainEventNames.MEMBERSHIP_JOINED -> {
        emitToUserIfAllowed(event.stringValue("userId"), RealtimeEvents.MEMBER_JOINED, event);
        emitToTenant(event.stringValue("companyId"), RealtimeEvents.MEMBER_JOINED, payload);
      }
      case DomainEventNames.MEMBERSHIP_LEFT,
          DomainEventNames.MEMBER_LEFT_LEGACY,
          DomainEventNames.MEMBERSHIP_REMOVED -> {
        final List<String> notified = notifiedUserIds(payload);
        if (!notified.isEmpty()) {
          notified.forEach(userId -> emitToUserIfAllowed(userId, RealtimeEvents.MEMBER_LEFT, event));
        } else {
          emitToUserIfAllowed(event.stringValue("userId"), RealtimeEvents.MEMBER_LEFT, event);
        }
        emitToTenant(event.stringValue("companyId"), RealtimeEvents.MEMBER_LEFT, payload);
      }
      case DomainEventNames.NOTIFICATION_CREATED,
          DomainEventNames.NOTIFICATION_SENT,
          DomainEventNames.NOTIFICATION_REPLIED,
          DomainEventNames.INVITE_CREATED -> {
        emitToUserIfAllowed(
            event.stringValue("recipientUserId"), RealtimeEvents.NOTIFICATION_CREATED, event);
        emitToTenant(event.stringValue("companyId"), RealtimeEvents.NOTIFICATION_CREATED, payload);
      }
      case DomainEventNames.INVITE_ACCEPTED -> {
        emitToUserIfAllowed(
            event.stringValue("inviterId"), RealtimeEvents.NOTIFICATION_CREATED, event);
        emitToTenant(event.stringValue("companyId"), RealtimeEvents.NOTIFICATION_CREATED, payload);
      }
      case DomainEventNames.INVITE_REJECTED -> {
        emitToUserIfAllowed(event.stringValue("inviterId"), RealtimeEvents.INVITE_REJECTED, event);
        emitToTenant(event.stringValue("companyId"), RealtimeEvents.INVITE_REJECTED, payload);
      }
      case DomainEventNames.NOTIFICATION_READ -> {
        emitToTenant(event.stringValue("companyId"), RealtimeEvents.NOTIFICATION_READ, payload);
        final String recipient = event.stringValue("recipientUserId");
        if (recipient != null) {
          gateway.emitToUser(recipient, RealtimeEvents.NOTIFICATION_READ, payload);
        }
      }
      case DomainEventNames.FRIEND_REQUEST_SENT ->
          emitToUserIfAllowed(
              event.stringValue("addresseeId"), RealtimeEvents.FRIEND_REQUEST_SENT, event);
      case DomainEventNames.FRIEND_REQUEST_ACCEPTED -> {
        emitToUserIfAllowed(
            event.stringValue("requesterId"), RealtimeEvents.FRIEND_REQUEST_ACCEPTED, event);
        emitToUserIfAllowed(
            event.stringValue("addresseeId"), RealtimeEvents.FRIEND_REQUEST_ACCEPTED, event);
      }
      case DomainEventNames.FRIEND_REQUEST_REJECTED, DomainEventNames.FRIEND_REMOVED -> {
        emitToUserIfAllowed(event.stringValue("requesterId"), RealtimeEvents.FRIEND_REMOVED, event);
        emitToUserIfAllowed(event.stringValue("addresseeId"), RealtimeEvents.FRIEND_REMOVED, event);
      }
      default -> logger.debug("no live route eventId={} name={}", event.id(), name);
    }
  }

  private void emitToTenant(String tenantId, String realtimeEvent, Map<String, Object> payload) {
    if (tenantId != null) {
      gateway.emitToTenant(tenantId, realtimeEvent, payload);
    }
  }

  private void emitToUserIfAllowed(String userId, String realtimeEvent, DomainEvent event) {
    if (userId == null) {
      return;
    }
    final Optional<NotificationCategory> category = categoryOf(event);
    if (category.isPresent() && !allows(userId, category.get())) {
      logger.debug(
          "live emit suppressed by preferences userId={} event={} category={}",
          userId,
          realtimeEvent,
          category.get());
      return;
    }
    gateway.emitToUser(userId, realtimeEvent, event.payload());
  }

  private boolean allows(String userId, NotificationCategory category) {
    final Optional<UserProfile> profile = userDirectory.findById(userId);
    if (profile.isEmpty()) {
      return false;
    }
    final NotificationPreferences preferences = profile.get().preferences();
    return preferences.realtimeEnabled() && preferences.allows(category);
  }

  private Optional<NotificationCategory> categoryOf(DomainEvent event) {
    final Optional<NotificationCategory> fromKind =
        DomainEventNames.categoryOfKindLabel(kindLabel(event.payload()));
    return fromKind.isPresent() ? fromKind : DomainEventNames.categoryOf(event.name());
  }

  private static String kindLabel(Map<String, Object> payload) {
    if (payload.get("meta") instanceof Map<?, ?> meta && meta.get("kind") instanceof String kind) {
      return kind;
    }
    return payload.get("kind") instanceof String kind ? kind : null;
  }

  private static List<String> notifiedUserIds(Map<String, Object> payload) {
    if (!(payload.get("notifiedUserIds") instanceof List<?> ids)) {
      return List.of();
    }
    return ids.stream().filter(Objects::nonNull).map(String::valueOf).toList();
  }
}
