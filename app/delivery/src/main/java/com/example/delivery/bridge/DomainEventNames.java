/*
 * Where: domain event bridge
 * What: the domain event names the bridge routes and their notification kinds and categories
 * Why: the durable router, the live bridge and the members forwarder must agree on one table
 */
package com.example.delivery.bridge;

import com.example.delivery.model.NotificationCategory;
import com.example.delivery.model.NotificationEventKind;
import java.util.Map;
import java.util.Optional;

public final class DomainEventNames {

  public static final String INVITES_PREFIX = "invites.";
  public static final String MEMBERSHIPS_PREFIX = "memberships.";

  public static final String COMPANY_UPDATED = "companys.updated";
  public static final String INVITE_CREATED = "invites.created";
  public static final String INVITE_ACCEPTED = "invites.accepted";
  public static final String INVITE_REJECTED = "invites.rejected";
  public static final String MEMBERSHIP_JOINED = "memberships.joined";
  public static final String MEMBERSHIP_LEFT = "memberships.left";
  public static final String MEMBERSHIP_REMOVED = "memberships.removed";
  public static final String MEMBERSHIP_ROLE_UPDATED = "memberships.role.updated";
  public static final String MEMBER_LEFT_LEGACY = "member.left";
  public static final String NOTIFICATION_CREATED = "notifications.created";
  public static final String NOTIFICATION_SENT = "notifications.sent";
  public static final String NOTIFICATION_REPLIED = "notifications.replied";
  public static final String NOTIFICATION_READ = "notifications.read";
  public static final String FRIEND_REQUEST_SENT = "friend.request.sent";
  public static final String FRIEND_REQUEST_ACCEPTED = "friend.request.accepted";
  public static final String FRIEND_REQUEST_REJECTED = "friend.request.rejected";
  public static final String FRIEND_REMOVED = "friend.removed";

  private static final Map<String, NotificationEventKind> KINDS =
      Map.ofEntries(
          Map.entry(INVITE_CREATED, NotificationEventKind.INVITE_CREATED),
          Map.entry(INVITE_ACCEPTED, NotificationEventKind.INVITE_ACCEPTED),
          Map.entry(INVITE_REJECTED, NotificationEventKind.INVITE_REJECTED),
          Map.entry(MEMBERSHIP_JOINED, NotificationEventKind.USER_JOINED),
          Map.entry(MEMBERSHIP_LEFT, NotificationEventKind.USER_REMOVED),
          Map.entry(MEMBERSHIP_REMOVED, NotificationEventKind.USER_REMOVED),
          Map.entry(MEMBER_LEFT_LEGACY, NotificationEventKind.USER_REMOVED),
          Map.entry(MEMBERSHIP_ROLE_UPDATED, NotificationEventKind.USER_STATUS_UPDATED),
          Map.entry(NOTIFICATION_CREATED, NotificationEventKind.NOTIFICATION_CREATED),
          Map.entry(NOTIFICATION_SENT, NotificationEventKind.NOTIFICATION_SENT),
          Map.entry(NOTIFICATION_REPLIED, NotificationEventKind.NOTIFICATION_REPLIED),
          Map.entry(FRIEND_REQUEST_SENT, NotificationEventKind.FRIEND_REQUEST_SENT),
          Map.entry(FRIEND_REQUEST_ACCEPTED, NotificationEventKind.FRIEND_REQUEST_ACCEPTED),
          Map.entry(FRIEND_REQUEST_REJECTED, NotificationEventKind.FRIEND_REQUEST_REJECTED),
          Map.entry(FRIEND_REMOVED, NotificationEventKind.FRIEND_REMOVED));

  private DomainEventNames() {}

  public static boolean isInvite(String eventName) {
    return eventName.startsWith(INVITES_PREFIX);
  }

  public static boolean isMembership(String eventName) {
    return eventName.startsWith(MEMBERSHIPS_PREFIX) || MEMBER_LEFT_LEGACY.equals(eventName);
  }

  public static Optional<NotificationEventKind> kindOf(String eventName) {
    return eventName == null ? Optional.empty() : Optional.ofNullable(KINDS.get(eventName));
  }

  public static Optional<NotificationCategory> categoryOf(String eventName) {
    return kindOf(eventName).map(NotificationEventKind::category);
  }

  /** Category of a notification kind label such as "invite.created" or "role.changed". */
  public static Optional<NotificationCategory> categoryOfKindLabel(String kind) {
    if (kind == null || kind.isBlank()) {
      return Optional.empty();
    }
    if (kind.contains("invite")) {
      return Optional.of(NotificationCategory.COMPANY_INVITATIONS);
    }
    if (kind.contains("friend")) {
      return Optional.of(NotificationCategory.FRIEND_REQUESTS);
    }
    return switch (kind) {
      case "notification.sent", "notifications.sent", "notification.reply", "notifications.replied" ->
          Optional.of(NotificationCategory.COMPANY_MESSAGES);
      case "member.added", "membership.joined", "member.removed", "membership.removed" ->
          Optional.of(NotificationCategory.MEMBERSHIP_CHANGES);
      case "role.changed", "membership.role.updated" ->
          Optional.of(NotificationCategory.ROLE_CHANGES);
      default -> Optional.empty();
    };
  }
}
