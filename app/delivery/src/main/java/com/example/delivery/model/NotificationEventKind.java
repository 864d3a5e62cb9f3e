/*
 * Where: delivery model
 * What: the closed set of eventId discriminators a realtime notification may carry
 * Why: payloads are validated against this table before any delivery work starts
 */
package com.example.delivery.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum NotificationEventKind {
  INVITE_CREATED("invite.created", NotificationCategory.COMPANY_INVITATIONS),
  INVITE_ACCEPTED("invite.accepted", NotificationCategory.COMPANY_INVITATIONS),
  INVITE_REJECTED("invite.rejected", NotificationCategory.COMPANY_INVITATIONS),
  USER_REMOVED("membership.removed", NotificationCategory.MEMBERSHIP_CHANGES),
  USER_JOINED("membership.joined", NotificationCategory.MEMBERSHIP_CHANGES),
  USER_STATUS_UPDATED("membership.role.updated", NotificationCategory.ROLE_CHANGES),
  FRIEND_REQUEST_SENT("friend.request.sent", NotificationCategory.FRIEND_REQUESTS),
  FRIEND_REQUEST_ACCEPTED("friend.request.accepted", NotificationCategory.FRIEND_REQUESTS),
  FRIEND_REQUEST_REJECTED("friend.request.rejected", NotificationCategory.FRIEND_REQUESTS),
  FRIEND_REMOVED("friend.removed", NotificationCategory.FRIEND_REQUESTS),
  NOTIFICATION_SENT("notification.sent", NotificationCategory.COMPANY_MESSAGES),
  NOTIFICATION_CREATED("notification.created", NotificationCategory.COMPANY_MESSAGES),
  NOTIFICATION_REPLIED("notification.reply", NotificationCategory.COMPANY_MESSAGES);

  private static final Map<String, NotificationEventKind> BY_EVENT_ID =
      Arrays.stream(values()).collect(Collectors.toMap(Enum::name, Function.identity()));

  private final String eventName;
  private final NotificationCategory category;

  NotificationEventKind(String eventName, NotificationCategory category) {
    this.eventName = eventName;
    this.category = category;
  }

  public String eventName() {
    return eventName;
  }

  public NotificationCategory category() {
    return category;
  }

  public static Optional<NotificationEventKind> fromEventId(String eventId) {
    if (eventId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_EVENT_ID.get(eventId));
  }
}
